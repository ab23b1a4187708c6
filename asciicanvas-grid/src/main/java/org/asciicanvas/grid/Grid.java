package org.asciicanvas.grid;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Character canvas: width x height cells stored flat in row-major order.
 * <p>
 * Every coordinate accessor is bounds-checked and reports failure through its return value
 * instead of throwing. The backing array always holds exactly {@code width * height} cells.
 */
public class Grid {

    /**
     * Largest width or height a grid takes; larger requests are clamped.
     */
    public static final int MAX_DIMENSION = 10_000;

    private int width;
    private int height;
    private Cell[] cells;

    public Grid(int width, int height) {
        this.width = clampDimension(width);
        this.height = clampDimension(height);
        this.cells = blankCells(this.width * this.height);
    }

    /**
     * Visitor for {@link #forEachCell(CellVisitor)}.
     */
    @FunctionalInterface
    public interface CellVisitor {
        void visit(int x, int y, Cell cell);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int size() {
        return cells.length;
    }

    public int indexOf(int x, int y) {
        return y * width + x;
    }

    /**
     * Inverse of {@link #indexOf(int, int)}: returns {x, y}.
     */
    public int[] coordsOf(int index) {
        return new int[] { index % width, index / width };
    }

    public boolean inBounds(int x, int y) {
        return x >= 0 && y >= 0 && x < width && y < height;
    }

    public Optional<Cell> get(int x, int y) {
        if (!inBounds(x, y)) {
            return Optional.empty();
        }
        return Optional.of(cells[indexOf(x, y)]);
    }

    /**
     * Cell at (x, y), or a blank cell when out of bounds.
     */
    public Cell getOrBlank(int x, int y) {
        return inBounds(x, y) ? cells[indexOf(x, y)] : Cell.blank();
    }

    public boolean set(int x, int y, Cell cell) {
        Objects.requireNonNull(cell, "cell");
        if (!inBounds(x, y)) {
            return false;
        }
        cells[indexOf(x, y)] = cell;
        return true;
    }

    /**
     * Replace the character at (x, y) keeping the cell's style.
     */
    public boolean setChar(int x, int y, int codePoint) {
        if (!inBounds(x, y)) {
            return false;
        }
        int idx = indexOf(x, y);
        cells[idx] = cells[idx].withCodePoint(codePoint);
        return true;
    }

    public boolean clearCell(int x, int y) {
        if (!inBounds(x, y)) {
            return false;
        }
        cells[indexOf(x, y)] = Cell.blank();
        return true;
    }

    public void clear() {
        Arrays.fill(cells, Cell.blank());
    }

    /**
     * Write a character into every cell of the normalized rectangle; out-of-range cells are skipped.
     */
    public void fillRect(int x1, int y1, int x2, int y2, int codePoint) {
        int minX = Math.min(x1, x2);
        int maxX = Math.max(x1, x2);
        int minY = Math.min(y1, y2);
        int maxY = Math.max(y1, y2);
        for (int y = minY; y <= maxY; y++) {
            for (int x = minX; x <= maxX; x++) {
                setChar(x, y, codePoint);
            }
        }
    }

    /**
     * Copy of the normalized rectangle clipped to the grid, row by row. Empty when the rectangle
     * lies entirely outside.
     */
    public List<Cell> getRegion(int x1, int y1, int x2, int y2) {
        int minX = Math.max(0, Math.min(x1, x2));
        int maxX = Math.min(width - 1, Math.max(x1, x2));
        int minY = Math.max(0, Math.min(y1, y2));
        int maxY = Math.min(height - 1, Math.max(y1, y2));
        if (minX > maxX || minY > maxY) {
            return List.of();
        }
        List<Cell> region = new ArrayList<>((maxX - minX + 1) * (maxY - minY + 1));
        for (int y = minY; y <= maxY; y++) {
            for (int x = minX; x <= maxX; x++) {
                region.add(cells[indexOf(x, y)]);
            }
        }
        return region;
    }

    public void forEachCell(CellVisitor visitor) {
        for (int i = 0; i < cells.length; i++) {
            visitor.visit(i % width, i / width, cells[i]);
        }
    }

    /**
     * Copy of the backing array in row-major order.
     */
    public Cell[] snapshot() {
        return cells.clone();
    }

    /**
     * Resize keeping the overlapping top-left sub-rectangle. Content outside the new bounds is lost.
     */
    public void resize(int newWidth, int newHeight) {
        newWidth = clampDimension(newWidth);
        newHeight = clampDimension(newHeight);
        if (newWidth == width && newHeight == height) return;
        Cell[] newCells = blankCells(newWidth * newHeight);
        int copyWidth = Math.min(width, newWidth);
        int copyHeight = Math.min(height, newHeight);
        for (int y = 0; y < copyHeight; y++) {
            System.arraycopy(cells, y * width, newCells, y * newWidth, copyWidth);
        }
        this.cells = newCells;
        this.width = newWidth;
        this.height = newHeight;
    }

    /**
     * Replace dimensions and content wholesale from a snapshot.
     *
     * @return false (and no change) when the snapshot length does not match the dimensions
     */
    public boolean restore(Cell[] snapshot, int snapshotWidth, int snapshotHeight) {
        Objects.requireNonNull(snapshot, "snapshot");
        if (snapshotWidth < 1 || snapshotHeight < 1 || snapshot.length != snapshotWidth * snapshotHeight) {
            return false;
        }
        for (Cell c : snapshot) {
            if (c == null) return false;
        }
        this.cells = snapshot.clone();
        this.width = snapshotWidth;
        this.height = snapshotHeight;
        return true;
    }

    /**
     * Clamp a requested width or height to {@code [1, MAX_DIMENSION]}.
     */
    public static int clampDimension(int value) {
        return Math.max(1, Math.min(MAX_DIMENSION, value));
    }

    private static Cell[] blankCells(int count) {
        Cell[] result = new Cell[count];
        Arrays.fill(result, Cell.blank());
        return result;
    }

    @Override
    public String toString() {
        return "Grid{" + width + "x" + height + '}';
    }
}
