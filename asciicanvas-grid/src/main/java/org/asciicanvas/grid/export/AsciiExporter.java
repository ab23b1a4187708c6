package org.asciicanvas.grid.export;

import org.asciicanvas.grid.Cell;
import org.asciicanvas.grid.Grid;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Renders grid content to plain text.
 */
public final class AsciiExporter {

    /**
     * Tight bounding box of visible cells, inclusive.
     */
    public record ContentBounds(int minX, int minY, int maxX, int maxY) {
    }

    private AsciiExporter() {
    }

    public static String export(Grid grid) {
        return export(grid, ExportOptions.defaults());
    }

    public static String export(Grid grid, ExportOptions options) {
        Objects.requireNonNull(grid, "grid");
        Objects.requireNonNull(options, "options");
        if (!options.trimBorders()) {
            // verbatim: numbering and width limit apply to trimmed output only
            return String.join("\n", renderRows(grid, 0, 0, grid.getWidth() - 1, grid.getHeight() - 1, false, false));
        }
        Optional<ContentBounds> bounds = findContentBounds(grid);
        if (bounds.isEmpty()) {
            return "";
        }
        ContentBounds b = bounds.get();
        List<String> lines = renderRows(grid, b.minX(), b.minY(), b.maxX(), b.maxY(), options.lineNumbers(), true);
        if (options.maxWidth() > 0) {
            lines.replaceAll(line -> truncate(line, options.maxWidth()));
        }
        return String.join("\n", lines);
    }

    /**
     * Export a rectangle clipped to the grid, trailing spaces trimmed per row.
     */
    public static String exportRegion(Grid grid, int x1, int y1, int x2, int y2) {
        Objects.requireNonNull(grid, "grid");
        int minX = Math.max(0, Math.min(x1, x2));
        int minY = Math.max(0, Math.min(y1, y2));
        int maxX = Math.min(grid.getWidth() - 1, Math.max(x1, x2));
        int maxY = Math.min(grid.getHeight() - 1, Math.max(y1, y2));
        if (minX > maxX || minY > maxY) {
            return "";
        }
        return String.join("\n", renderRows(grid, minX, minY, maxX, maxY, false, true));
    }

    public static Optional<ContentBounds> findContentBounds(Grid grid) {
        int[] b = { Integer.MAX_VALUE, Integer.MAX_VALUE, -1, -1 };
        grid.forEachCell((x, y, cell) -> {
            if (cell.isVisible()) {
                b[0] = Math.min(b[0], x);
                b[1] = Math.min(b[1], y);
                b[2] = Math.max(b[2], x);
                b[3] = Math.max(b[3], y);
            }
        });
        if (b[2] < 0) {
            return Optional.empty();
        }
        return Optional.of(new ContentBounds(b[0], b[1], b[2], b[3]));
    }

    public static int countContent(Grid grid) {
        int[] count = { 0 };
        grid.forEachCell((x, y, cell) -> {
            if (cell.isVisible()) count[0]++;
        });
        return count[0];
    }

    private static List<String> renderRows(Grid grid, int minX, int minY, int maxX, int maxY,
                                           boolean lineNumbers, boolean trimTrailing) {
        List<String> lines = new ArrayList<>(maxY - minY + 1);
        for (int y = minY; y <= maxY; y++) {
            StringBuilder line = new StringBuilder(maxX - minX + 8);
            if (lineNumbers) {
                line.append(String.format("%4d | ", y + 1));
            }
            for (int x = minX; x <= maxX; x++) {
                Cell cell = grid.getOrBlank(x, y);
                line.appendCodePoint(cell.getCodePoint());
            }
            if (trimTrailing) {
                int end = line.length();
                while (end > 0 && line.charAt(end - 1) == ' ') end--;
                line.setLength(end);
            }
            lines.add(line.toString());
        }
        return lines;
    }

    private static String truncate(String line, int maxChars) {
        if (line.codePointCount(0, line.length()) <= maxChars) {
            return line;
        }
        return line.substring(0, line.offsetByCodePoints(0, maxChars));
    }
}
