package com.tyron.editcore.core.editor;

import com.tyron.editcore.api.config.EditorSettings;
import com.tyron.editcore.api.editor.Editor;
import com.tyron.editcore.api.editor.EditorFactory;
import com.tyron.editcore.core.config.EditorConfiguration;
import com.tyron.editcore.core.config.EditorSettingsLoader;
import org.jetbrains.annotations.NotNull;

/**
 * {@link EditorFactory} registered through {@code META-INF/services}.
 * <p>
 * Configuration is read once per factory with {@link EditorSettingsLoader#loadDefault()}; its key bindings are
 * applied to every editor, its settings only when the caller does not pass explicit ones.
 * </p>
 */
public final class CoreEditorFactory implements EditorFactory {

    private volatile EditorConfiguration configuration;

    @NotNull
    @Override
    public Editor createEditor(@NotNull EditorSettings settings, @NotNull String initialText) {
        EditorConfiguration config = getConfiguration();
        return new EditorImpl(settings, initialText, config.createShortcutTable());
    }

    @NotNull
    @Override
    public Editor createEditor(@NotNull String initialText) {
        return createEditor(getConfiguration().getSettings(), initialText);
    }

    @NotNull
    public EditorConfiguration getConfiguration() {
        EditorConfiguration c = configuration;
        if (c != null) return c;

        synchronized (this) {
            if (configuration == null) {
                configuration = EditorSettingsLoader.loadDefault();
            }
            return configuration;
        }
    }
}
