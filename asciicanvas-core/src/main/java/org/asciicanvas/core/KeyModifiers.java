package org.asciicanvas.core;

/**
 * Modifier keys held during a key press.
 */
public record KeyModifiers(boolean ctrl, boolean shift, boolean alt) {

    public static final KeyModifiers NONE = new KeyModifiers(false, false, false);

    public static KeyModifiers ctrlOnly() {
        return new KeyModifiers(true, false, false);
    }

    public static KeyModifiers ctrlShift() {
        return new KeyModifiers(true, true, false);
    }

    public static KeyModifiers shiftOnly() {
        return new KeyModifiers(false, true, false);
    }
}
