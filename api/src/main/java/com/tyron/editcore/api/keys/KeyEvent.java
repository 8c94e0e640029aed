package com.tyron.editcore.api.keys;

import java.util.Objects;

/**
 * A key press translated from the host platform into the core's logical vocabulary.
 */
public record KeyEvent(Key key, Modifiers modifiers) {

    public KeyEvent {
        Objects.requireNonNull(key, "key");
        modifiers = modifiers != null ? modifiers : Modifiers.NONE;
    }

    public static KeyEvent character(int codePoint) {
        return new KeyEvent(Key.character(codePoint), Modifiers.NONE);
    }

    public static KeyEvent character(int codePoint, Modifiers modifiers) {
        return new KeyEvent(Key.character(codePoint), modifiers);
    }

    public static KeyEvent named(NamedKey key) {
        return new KeyEvent(Key.named(key), Modifiers.NONE);
    }

    public static KeyEvent named(NamedKey key, Modifiers modifiers) {
        return new KeyEvent(Key.named(key), modifiers);
    }

    @Override
    public String toString() {
        return modifiers.isEmpty() ? key.getId() : modifiers + "+" + key.getId();
    }
}
