package org.asciicanvas.grid;

/**
 * Rectangular selection given by two corners in any order. All derived queries normalize.
 */
public final class Selection {

    private final int x1;
    private final int y1;
    private final int x2;
    private final int y2;

    public Selection(int x1, int y1, int x2, int y2) {
        this.x1 = x1;
        this.y1 = y1;
        this.x2 = x2;
        this.y2 = y2;
    }

    public int getX1() {
        return x1;
    }

    public int getY1() {
        return y1;
    }

    public int getX2() {
        return x2;
    }

    public int getY2() {
        return y2;
    }

    public int minX() {
        return Math.min(x1, x2);
    }

    public int minY() {
        return Math.min(y1, y2);
    }

    public int maxX() {
        return Math.max(x1, x2);
    }

    public int maxY() {
        return Math.max(y1, y2);
    }

    /**
     * Normalized bounds as {minX, minY, maxX, maxY}.
     */
    public int[] bounds() {
        return new int[] { minX(), minY(), maxX(), maxY() };
    }

    public int width() {
        return Math.abs(x2 - x1) + 1;
    }

    public int height() {
        return Math.abs(y2 - y1) + 1;
    }

    public int area() {
        return width() * height();
    }

    public boolean contains(int x, int y) {
        return x >= minX() && x <= maxX() && y >= minY() && y <= maxY();
    }

    /**
     * A selection covering a single cell.
     */
    public boolean isEmpty() {
        return x1 == x2 && y1 == y2;
    }

    public Selection translate(int dx, int dy) {
        return new Selection(x1 + dx, y1 + dy, x2 + dx, y2 + dy);
    }

    /**
     * Same extent as this selection, with its top-left corner placed at (x, y).
     */
    public Selection moveTo(int x, int y) {
        return translate(x - minX(), y - minY());
    }

    public boolean sameExtentAs(Selection other) {
        return other != null && width() == other.width() && height() == other.height();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Selection other)) return false;
        return x1 == other.x1 && y1 == other.y1 && x2 == other.x2 && y2 == other.y2;
    }

    @Override
    public int hashCode() {
        int h = x1;
        h = 31 * h + y1;
        h = 31 * h + x2;
        return 31 * h + y2;
    }

    @Override
    public String toString() {
        return "Selection{(" + x1 + "," + y1 + ")-(" + x2 + "," + y2 + ")}";
    }
}
