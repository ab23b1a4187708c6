package org.asciicanvas.tools;

/**
 * A normalized key press delivered to a tool.
 */
public record KeyInput(Kind kind, int codePoint) {

    public enum Kind {
        CHARACTER,
        NEWLINE,
        BACKSPACE,
        DELETE,
        LEFT,
        RIGHT
    }

    /**
     * Classify a raw code point. Line breaks, BS and DEL map to their editing kinds.
     */
    public static KeyInput character(int codePoint) {
        return switch (codePoint) {
            case '\n', '\r' -> new KeyInput(Kind.NEWLINE, codePoint);
            case 0x08 -> new KeyInput(Kind.BACKSPACE, codePoint);
            case 0x7F -> new KeyInput(Kind.DELETE, codePoint);
            default -> new KeyInput(Kind.CHARACTER, codePoint);
        };
    }

    public static KeyInput of(Kind kind) {
        return new KeyInput(kind, 0);
    }
}
