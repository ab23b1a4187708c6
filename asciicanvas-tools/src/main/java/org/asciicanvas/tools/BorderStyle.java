package org.asciicanvas.tools;

import java.util.Locale;
import java.util.Optional;

/**
 * Glyph sets for rectangle borders.
 */
public enum BorderStyle {
    SINGLE('┌', '┐', '└', '┘', '─', '│'),
    DOUBLE('╔', '╗', '╚', '╝', '═', '║'),
    HEAVY('┏', '┓', '┗', '┛', '━', '┃'),
    ROUNDED('╭', '╮', '╰', '╯', '─', '│'),
    ASCII('+', '+', '+', '+', '-', '|'),
    DOTTED('*', '*', '*', '*', '*', '*');

    private final char topLeft;
    private final char topRight;
    private final char bottomLeft;
    private final char bottomRight;
    private final char horizontal;
    private final char vertical;

    BorderStyle(char topLeft, char topRight, char bottomLeft, char bottomRight, char horizontal, char vertical) {
        this.topLeft = topLeft;
        this.topRight = topRight;
        this.bottomLeft = bottomLeft;
        this.bottomRight = bottomRight;
        this.horizontal = horizontal;
        this.vertical = vertical;
    }

    public char topLeft() {
        return topLeft;
    }

    public char topRight() {
        return topRight;
    }

    public char bottomLeft() {
        return bottomLeft;
    }

    public char bottomRight() {
        return bottomRight;
    }

    public char horizontal() {
        return horizontal;
    }

    public char vertical() {
        return vertical;
    }

    public static Optional<BorderStyle> parse(String name) {
        if (name == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
