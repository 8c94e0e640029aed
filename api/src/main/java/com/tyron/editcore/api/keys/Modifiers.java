package com.tyron.editcore.api.keys;

/**
 * Modifier keys held while a key is pressed. {@code superKey} is the platform key (Cmd on macOS, Win elsewhere).
 */
public record Modifiers(boolean shift, boolean control, boolean alt, boolean superKey) {

    public static final Modifiers NONE = new Modifiers(false, false, false, false);
    public static final Modifiers SHIFT = NONE.withShift();
    public static final Modifiers CONTROL = NONE.withControl();
    public static final Modifiers ALT = NONE.withAlt();
    public static final Modifiers SUPER = NONE.withSuper();
    public static final Modifiers CONTROL_SHIFT = CONTROL.withShift();

    public Modifiers withShift() {
        return new Modifiers(true, control, alt, superKey);
    }

    public Modifiers withControl() {
        return new Modifiers(shift, true, alt, superKey);
    }

    public Modifiers withAlt() {
        return new Modifiers(shift, control, true, superKey);
    }

    public Modifiers withSuper() {
        return new Modifiers(shift, control, alt, true);
    }

    public boolean isEmpty() {
        return !shift && !control && !alt && !superKey;
    }

    public boolean isShiftOnly() {
        return shift && !control && !alt && !superKey;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (control) sb.append("ctrl+");
        if (alt) sb.append("alt+");
        if (shift) sb.append("shift+");
        if (superKey) sb.append("super+");
        return sb.length() == 0 ? "none" : sb.substring(0, sb.length() - 1);
    }
}
