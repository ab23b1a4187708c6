package org.asciicanvas.grid;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Cells captured from a selection, stored relative to the selection's top-left corner.
 */
public final class SelectionClipboard {

    private static final SelectionClipboard EMPTY = new SelectionClipboard(List.of(), 0, 0);

    private final List<Entry> cells;
    private final int width;
    private final int height;

    public record Entry(int relativeX, int relativeY, Cell cell) {
        public Entry {
            Objects.requireNonNull(cell, "cell");
        }
    }

    public SelectionClipboard(List<Entry> cells, int width, int height) {
        this.cells = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(cells, "cells")));
        this.width = Math.max(0, width);
        this.height = Math.max(0, height);
    }

    public static SelectionClipboard empty() {
        return EMPTY;
    }

    /**
     * Copy the cells of {@code selection} that lie inside the grid.
     */
    public static SelectionClipboard capture(Grid grid, Selection selection) {
        Objects.requireNonNull(grid, "grid");
        Objects.requireNonNull(selection, "selection");
        int minX = selection.minX();
        int minY = selection.minY();
        List<Entry> entries = new ArrayList<>();
        for (int y = minY; y <= selection.maxY(); y++) {
            for (int x = minX; x <= selection.maxX(); x++) {
                final int rx = x - minX;
                final int ry = y - minY;
                grid.get(x, y).ifPresent(cell -> entries.add(new Entry(rx, ry, cell)));
            }
        }
        return new SelectionClipboard(entries, selection.width(), selection.height());
    }

    /**
     * Build a clipboard from plain text (one row per line). Spaces are kept so pasting overwrites.
     */
    public static SelectionClipboard fromText(String text) {
        if (text == null || text.isEmpty()) {
            return EMPTY;
        }
        String[] lines = text.replace("\r\n", "\n").replace('\r', '\n').split("\n", -1);
        List<Entry> entries = new ArrayList<>();
        int maxWidth = 0;
        for (int row = 0; row < lines.length; row++) {
            int col = 0;
            String line = lines[row];
            for (int i = 0; i < line.length(); ) {
                int cp = line.codePointAt(i);
                i += Character.charCount(cp);
                if (cp == '\t') cp = ' ';
                if (Character.isISOControl(cp)) continue;
                entries.add(new Entry(col, row, Cell.of(cp)));
                col++;
            }
            maxWidth = Math.max(maxWidth, col);
        }
        return entries.isEmpty() ? EMPTY : new SelectionClipboard(entries, maxWidth, lines.length);
    }

    public List<Entry> getCells() {
        return cells;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public boolean isEmpty() {
        return cells.isEmpty();
    }

    /**
     * Draw operations placing the clipboard with its top-left at (originX, originY). Cells falling
     * outside a {@code gridWidth} x {@code gridHeight} grid are dropped.
     */
    public List<DrawOp> toOps(int originX, int originY, int gridWidth, int gridHeight) {
        List<DrawOp> ops = new ArrayList<>(cells.size());
        for (Entry e : cells) {
            int x = originX + e.relativeX();
            int y = originY + e.relativeY();
            if (x >= 0 && y >= 0 && x < gridWidth && y < gridHeight) {
                ops.add(new DrawOp(x, y, e.cell()));
            }
        }
        return ops;
    }

    /**
     * Plain-text rendering, rows joined by newlines, trailing spaces trimmed.
     */
    public String toText() {
        if (isEmpty()) {
            return "";
        }
        int[][] grid = new int[height][width];
        for (int[] row : grid) {
            Arrays.fill(row, ' ');
        }
        for (Entry e : cells) {
            if (e.relativeY() < height && e.relativeX() < width) {
                grid[e.relativeY()][e.relativeX()] = e.cell().getCodePoint();
            }
        }
        StringBuilder sb = new StringBuilder();
        for (int r = 0; r < height; r++) {
            StringBuilder line = new StringBuilder(width);
            for (int cp : grid[r]) {
                line.appendCodePoint(cp);
            }
            int end = line.length();
            while (end > 0 && line.charAt(end - 1) == ' ') end--;
            sb.append(line, 0, end);
            if (r < height - 1) sb.append('\n');
        }
        return sb.toString();
    }
}
