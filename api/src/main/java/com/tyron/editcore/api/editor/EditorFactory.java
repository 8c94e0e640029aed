package com.tyron.editcore.api.editor;

import com.tyron.editcore.api.config.EditorSettings;
import org.jetbrains.annotations.NotNull;

/**
 * Service provider for {@link Editor} implementations, discovered through {@link java.util.ServiceLoader}.
 */
public interface EditorFactory {

    @NotNull
    Editor createEditor(@NotNull EditorSettings settings, @NotNull String initialText);

    /**
     * Creates an editor using whatever configuration the provider picks up from its environment.
     */
    @NotNull
    default Editor createEditor(@NotNull String initialText) {
        return createEditor(EditorSettings.DEFAULT, initialText);
    }
}
