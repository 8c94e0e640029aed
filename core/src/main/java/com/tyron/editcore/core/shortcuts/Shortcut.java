package com.tyron.editcore.core.shortcuts;

import com.tyron.editcore.api.keys.Key;
import com.tyron.editcore.api.keys.KeyEvent;
import com.tyron.editcore.api.keys.Modifiers;
import com.tyron.editcore.api.keys.NamedKey;
import org.jetbrains.annotations.NotNull;

import java.util.Locale;
import java.util.Objects;

/**
 * A key plus the exact set of modifiers that must be held.
 */
public record Shortcut(@NotNull Key key, @NotNull Modifiers modifiers) {

    public Shortcut {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(modifiers, "modifiers");
    }

    public static Shortcut of(@NotNull KeyEvent event) {
        return new Shortcut(event.key(), event.modifiers());
    }

    public static Shortcut plain(@NotNull NamedKey key) {
        return new Shortcut(Key.named(key), Modifiers.NONE);
    }

    public static Shortcut shift(@NotNull NamedKey key) {
        return new Shortcut(Key.named(key), Modifiers.SHIFT);
    }

    public static Shortcut ctrl(@NotNull NamedKey key) {
        return new Shortcut(Key.named(key), Modifiers.CONTROL);
    }

    public static Shortcut ctrl(char c) {
        return new Shortcut(Key.character(c), Modifiers.CONTROL);
    }

    public static Shortcut ctrlShift(@NotNull NamedKey key) {
        return new Shortcut(Key.named(key), Modifiers.CONTROL_SHIFT);
    }

    public static Shortcut ctrlShift(char c) {
        return new Shortcut(Key.character(c), Modifiers.CONTROL_SHIFT);
    }

    /**
     * Parses a description such as {@code "ctrl+shift+z"}, {@code "shift+f3"} or {@code "cmd+left"}.
     * <p>
     * Modifier names are {@code ctrl}, {@code alt}, {@code shift} and {@code super} (alias {@code cmd}). The last
     * segment is a {@link NamedKey} id or a single character; a lone {@code "+"} names the plus key.
     * </p>
     *
     * @throws IllegalArgumentException if a modifier or the key is not recognized
     */
    public static Shortcut parse(@NotNull String description) {
        Objects.requireNonNull(description, "description");
        String text = description.trim();
        if (text.isEmpty()) {
            throw new IllegalArgumentException("Empty shortcut");
        }

        String keyPart;
        String modifierPart;
        if (text.endsWith("++") || text.equals("+")) {
            keyPart = "+";
            modifierPart = text.substring(0, Math.max(0, text.length() - 2));
        } else {
            int lastPlus = text.lastIndexOf('+');
            keyPart = text.substring(lastPlus + 1);
            modifierPart = lastPlus > 0 ? text.substring(0, lastPlus) : "";
        }

        Modifiers modifiers = Modifiers.NONE;
        if (!modifierPart.isEmpty()) {
            for (String raw : modifierPart.split("\\+")) {
                String part = raw.trim().toLowerCase(Locale.ROOT);
                switch (part) {
                    case "ctrl", "control" -> modifiers = modifiers.withControl();
                    case "alt" -> modifiers = modifiers.withAlt();
                    case "shift" -> modifiers = modifiers.withShift();
                    case "super", "cmd" -> modifiers = modifiers.withSuper();
                    default -> throw new IllegalArgumentException("Unknown modifier '" + raw + "' in shortcut: " + description);
                }
            }
        }

        return new Shortcut(parseKey(keyPart.trim(), description), modifiers);
    }

    private static Key parseKey(String keyPart, String description) {
        NamedKey named = NamedKey.fromId(keyPart);
        if (named != null) {
            return Key.named(named);
        }
        if (keyPart.codePointCount(0, keyPart.length()) == 1) {
            return Key.character(keyPart.toLowerCase(Locale.ROOT).codePointAt(0));
        }
        throw new IllegalArgumentException("Unknown key '" + keyPart + "' in shortcut: " + description);
    }

    /**
     * @return The canonical description, parseable by {@link #parse(String)}.
     */
    @Override
    public String toString() {
        if (modifiers.isEmpty()) {
            return key.getId();
        }
        return modifiers + "+" + key.getId();
    }
}
