package com.tyron.editcore.api.keys;

import org.jetbrains.annotations.Nullable;

import java.util.Locale;

/**
 * Keys that do not produce a character by themselves.
 */
public enum NamedKey {
    ARROW_LEFT("left"),
    ARROW_RIGHT("right"),
    ARROW_UP("up"),
    ARROW_DOWN("down"),

    F1("f1"),
    F2("f2"),
    F3("f3"),
    F4("f4"),
    F5("f5"),
    F6("f6"),
    F7("f7"),
    F8("f8"),
    F9("f9"),
    F10("f10"),
    F11("f11"),
    F12("f12"),

    BACKSPACE("backspace"),
    DELETE("delete"),
    ENTER("enter"),
    ESCAPE("escape"),
    TAB("tab"),
    SPACE("space"),
    HOME("home"),
    END("end"),
    PAGE_UP("pageup"),
    PAGE_DOWN("pagedown"),
    INSERT("insert");

    private final String id;

    NamedKey(String id) {
        this.id = id;
    }

    /**
     * Lower-case name used in shortcut strings such as {@code "ctrl+pageup"}.
     */
    public String getId() {
        return id;
    }

    @Nullable
    public static NamedKey fromId(String id) {
        if (id == null) return null;
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (NamedKey key : values()) {
            if (key.id.equals(normalized)) {
                return key;
            }
        }
        return null;
    }
}
