package org.asciicanvas.grid.render;

/**
 * Inclusive rectangle of cells awaiting redraw. The empty rectangle has min &gt; max.
 */
public final class DirtyRect {

    private static final DirtyRect EMPTY = new DirtyRect(Integer.MAX_VALUE, Integer.MAX_VALUE, Integer.MIN_VALUE, Integer.MIN_VALUE);

    private final int x1;
    private final int y1;
    private final int x2;
    private final int y2;

    private DirtyRect(int x1, int y1, int x2, int y2) {
        this.x1 = x1;
        this.y1 = y1;
        this.x2 = x2;
        this.y2 = y2;
    }

    public static DirtyRect empty() {
        return EMPTY;
    }

    public static DirtyRect single(int x, int y) {
        return new DirtyRect(x, y, x, y);
    }

    public static DirtyRect fromPoints(int x1, int y1, int x2, int y2) {
        return new DirtyRect(Math.min(x1, x2), Math.min(y1, y2), Math.max(x1, x2), Math.max(y1, y2));
    }

    public static DirtyRect full(int width, int height) {
        return new DirtyRect(0, 0, Math.max(0, width - 1), Math.max(0, height - 1));
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

    public boolean isEmpty() {
        return x1 > x2 || y1 > y2;
    }

    public boolean isFull(int width, int height) {
        return x1 == 0 && y1 == 0 && x2 == width - 1 && y2 == height - 1;
    }

    public int width() {
        return isEmpty() ? 0 : x2 - x1 + 1;
    }

    public int height() {
        return isEmpty() ? 0 : y2 - y1 + 1;
    }

    public int area() {
        return width() * height();
    }

    public boolean contains(int x, int y) {
        return x >= x1 && x <= x2 && y >= y1 && y <= y2;
    }

    public DirtyRect include(int x, int y) {
        return union(single(x, y));
    }

    /**
     * Bounding union. An empty operand leaves the other unchanged.
     */
    public DirtyRect union(DirtyRect other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        return new DirtyRect(Math.min(x1, other.x1), Math.min(y1, other.y1),
                Math.max(x2, other.x2), Math.max(y2, other.y2));
    }

    /**
     * Intersection with a width x height grid; empty when nothing overlaps.
     */
    public DirtyRect clamp(int width, int height) {
        if (isEmpty()) {
            return this;
        }
        int cx1 = Math.max(0, x1);
        int cy1 = Math.max(0, y1);
        int cx2 = Math.min(width - 1, x2);
        int cy2 = Math.min(height - 1, y2);
        if (cx1 > cx2 || cy1 > cy2) {
            return EMPTY;
        }
        return new DirtyRect(cx1, cy1, cx2, cy2);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DirtyRect other)) return false;
        if (isEmpty() && other.isEmpty()) return true;
        return x1 == other.x1 && y1 == other.y1 && x2 == other.x2 && y2 == other.y2;
    }

    @Override
    public int hashCode() {
        if (isEmpty()) return 0;
        return ((x1 * 31 + y1) * 31 + x2) * 31 + y2;
    }

    @Override
    public String toString() {
        return isEmpty() ? "DirtyRect{empty}" : "DirtyRect{(" + x1 + "," + y1 + ")-(" + x2 + "," + y2 + ")}";
    }
}
