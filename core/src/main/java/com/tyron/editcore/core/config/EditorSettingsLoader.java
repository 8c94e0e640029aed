package com.tyron.editcore.core.config;

import com.tyron.editcore.api.config.EditorSettings;
import com.tyron.editcore.api.text.WordBoundaryClassifier;
import org.jetbrains.annotations.NotNull;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads editor configuration from YAML.
 * <pre>
 * maxUndoLevels: 100
 * tabWidth: 4
 * pageLines: 20
 * punctuation: ".,;:"
 * wordCharacters: "_-"
 * keybindings:
 *   - shortcut: ctrl+d
 *     command: delete-line
 *     description: Delete line
 *   - shortcut: ctrl+k
 *     command: none
 * </pre>
 * Every key is optional. Loading is best effort: values of the wrong type or out of range are logged and the
 * default is kept.
 */
public final class EditorSettingsLoader {

    private static final Logger LOG = Logger.getLogger(EditorSettingsLoader.class.getName());

    /**
     * System property naming a configuration file; takes precedence over the classpath resource.
     */
    public static final String CONFIG_PROPERTY = "editcore.config";

    public static final String DEFAULT_RESOURCE = "editcore.yaml";

    private EditorSettingsLoader() {
    }

    /**
     * Loads from the file named by {@value #CONFIG_PROPERTY}, else from the {@value #DEFAULT_RESOURCE} classpath
     * resource, else returns {@link EditorConfiguration#DEFAULT}. Unreadable sources are logged and skipped.
     */
    @NotNull
    public static EditorConfiguration loadDefault() {
        String path = System.getProperty(CONFIG_PROPERTY);
        if (path != null && !path.isBlank()) {
            try {
                return load(Path.of(path.trim()));
            } catch (IOException | YAMLException e) {
                LOG.log(Level.WARNING, "config unreadable path=" + path, e);
            }
        }

        ClassLoader loader = EditorSettingsLoader.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in != null) {
                return load(in);
            }
        } catch (IOException | YAMLException e) {
            LOG.log(Level.WARNING, "config unreadable resource=" + DEFAULT_RESOURCE, e);
        }
        return EditorConfiguration.DEFAULT;
    }

    @NotNull
    public static EditorConfiguration load(@NotNull Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return load(in);
        }
    }

    /**
     * @throws YAMLException if the stream is not well-formed YAML
     */
    @NotNull
    public static EditorConfiguration load(@NotNull InputStream in) {
        Objects.requireNonNull(in, "in");
        Object doc = new Yaml().load(in);
        if (!(doc instanceof Map<?, ?> map)) {
            if (doc != null) {
                warn("top level is not a map, using defaults");
            }
            return EditorConfiguration.DEFAULT;
        }

        EditorSettings.Builder builder = EditorSettings.builder();

        Integer maxUndoLevels = intValue(map, "maxUndoLevels");
        if (maxUndoLevels != null) {
            apply("maxUndoLevels", () -> builder.maxUndoLevels(maxUndoLevels));
        }
        Integer tabWidth = intValue(map, "tabWidth");
        if (tabWidth != null) {
            apply("tabWidth", () -> builder.tabWidth(tabWidth));
        }
        Integer pageLines = intValue(map, "pageLines");
        if (pageLines != null) {
            apply("pageLines", () -> builder.pageLines(pageLines));
        }

        Object punctuation = map.get("punctuation");
        Object wordCharacters = map.get("wordCharacters");
        if (punctuation != null || wordCharacters != null) {
            builder.wordBoundaries(new WordBoundaryClassifier(
                    punctuation != null ? String.valueOf(punctuation) : WordBoundaryClassifier.DEFAULT_PUNCTUATION,
                    wordCharacters != null ? String.valueOf(wordCharacters) : WordBoundaryClassifier.DEFAULT_WORD_CHARACTERS));
        }

        List<?> keybindings = List.of();
        Object bindings = map.get("keybindings");
        if (bindings instanceof List<?> list) {
            keybindings = list;
        } else if (bindings != null) {
            warn("keybindings is not a list, ignoring");
        }

        EditorSettings settings = builder.build();
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("config loaded settings=" + settings + " keybindings=" + keybindings.size());
        }
        return new EditorConfiguration(settings, keybindings);
    }

    private static Integer intValue(Map<?, ?> map, String key) {
        Object value = map.get(key);
        if (value == null) return null;
        if (value instanceof Integer i) return i;
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            warn(key + " is not an integer: " + value);
            return null;
        }
    }

    private static void apply(String key, Runnable setter) {
        try {
            setter.run();
        } catch (IllegalArgumentException e) {
            warn(key + " rejected: " + e.getMessage());
        }
    }

    private static void warn(String message) {
        if (LOG.isLoggable(Level.WARNING)) {
            LOG.warning("config " + message);
        }
    }
}
