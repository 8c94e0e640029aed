package com.tyron.editcore.core.config;

import com.tyron.editcore.api.config.EditorSettings;
import com.tyron.editcore.core.shortcuts.ShortcutTable;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Result of loading an editor configuration file: the settings plus the key binding overrides.
 */
public final class EditorConfiguration {

    public static final EditorConfiguration DEFAULT = new EditorConfiguration(EditorSettings.DEFAULT, List.of());

    private final EditorSettings settings;
    private final List<?> keybindings;

    public EditorConfiguration(@NotNull EditorSettings settings, @NotNull List<?> keybindings) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.keybindings = Collections.unmodifiableList(new ArrayList<>(keybindings));
    }

    @NotNull
    public EditorSettings getSettings() {
        return settings;
    }

    /**
     * Raw {@code keybindings} entries, in the form accepted by {@link ShortcutTable#loadFromConfig(List)}.
     */
    @NotNull
    public List<?> getKeybindings() {
        return keybindings;
    }

    /**
     * @return A new default table with this configuration's overrides applied. Each editor gets its own table.
     */
    @NotNull
    public ShortcutTable createShortcutTable() {
        ShortcutTable table = ShortcutTable.createDefault();
        table.loadFromConfig(keybindings);
        return table;
    }
}
