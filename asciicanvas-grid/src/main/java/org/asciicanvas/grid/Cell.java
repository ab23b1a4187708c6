package org.asciicanvas.grid;

/**
 * A single cell in the canvas grid: one character code point and a style bitmask.
 * <p>
 * Cells are immutable values; the grid stores them by reference and replaces them wholesale.
 */
public final class Cell {

    private static final Cell BLANK = new Cell(' ', CellStyle.NONE);

    private final int codePoint;
    private final int style;

    public Cell(int codePoint, int style) {
        if (!Character.isValidCodePoint(codePoint)) {
            throw new IllegalArgumentException("Invalid code point: " + codePoint);
        }
        this.codePoint = codePoint;
        this.style = style & CellStyle.ALL;
    }

    public static Cell blank() {
        return BLANK;
    }

    public static Cell of(int codePoint) {
        return codePoint == ' ' ? BLANK : new Cell(codePoint, CellStyle.NONE);
    }

    public Cell withStyle(int newStyle) {
        return new Cell(codePoint, newStyle);
    }

    public Cell withCodePoint(int newCodePoint) {
        return new Cell(newCodePoint, style);
    }

    public int getCodePoint() {
        return codePoint;
    }

    public int getStyle() {
        return style;
    }

    public boolean hasStyle(int flag) {
        return CellStyle.contains(style, flag);
    }

    /**
     * True only for the plain space character, regardless of style.
     */
    public boolean isEmpty() {
        return codePoint == ' ';
    }

    /**
     * A cell is visible when its character is not whitespace of any kind.
     */
    public boolean isVisible() {
        return !Character.isWhitespace(codePoint) && !Character.isSpaceChar(codePoint);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Cell other)) return false;
        return codePoint == other.codePoint && style == other.style;
    }

    @Override
    public int hashCode() {
        return 31 * codePoint + style;
    }

    @Override
    public String toString() {
        return "Cell{'" + new String(Character.toChars(codePoint)) + "', style=" + style + '}';
    }
}
