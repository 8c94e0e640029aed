package com.tyron.editcore.api.editor;

import com.tyron.editcore.api.config.EditorSettings;
import org.jetbrains.annotations.NotNull;

import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * Entry point for creating editors without depending on an implementation module.
 */
public final class Editors {

    private static volatile EditorFactory factory;

    private Editors() {
    }

    public static Editor create() {
        return create("");
    }

    /**
     * Creates an editor configured from the environment (see the provider's documentation).
     */
    public static Editor create(@NotNull String initialText) {
        return getFactory().createEditor(initialText);
    }

    public static Editor create(@NotNull EditorSettings settings, @NotNull String initialText) {
        return getFactory().createEditor(settings, initialText);
    }

    public static EditorFactory getFactory() {
        EditorFactory f = factory;
        if (f != null) return f;

        synchronized (Editors.class) {
            if (factory == null) {
                Iterator<EditorFactory> it = ServiceLoader.load(EditorFactory.class, Editors.class.getClassLoader()).iterator();
                if (!it.hasNext()) {
                    throw new EditorException("No " + EditorFactory.class.getName() + " registered; is editcore-core on the classpath?");
                }
                factory = it.next();
            }
            return factory;
        }
    }
}
