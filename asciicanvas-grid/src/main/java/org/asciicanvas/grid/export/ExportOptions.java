package org.asciicanvas.grid.export;

/**
 * Options for {@link AsciiExporter}.
 *
 * @param trimBorders drop empty rows/columns around the content and trailing spaces per row
 * @param lineNumbers prefix each trimmed row with its 1-based grid row number
 * @param maxWidth    hard per-line limit for trimmed rows, counted after numbering; 0 means unlimited
 */
public record ExportOptions(boolean trimBorders, boolean lineNumbers, int maxWidth) {

    private static final ExportOptions DEFAULTS = new ExportOptions(true, false, 0);

    public ExportOptions {
        if (maxWidth < 0) {
            throw new IllegalArgumentException("maxWidth must be >= 0, got " + maxWidth);
        }
    }

    public static ExportOptions defaults() {
        return DEFAULTS;
    }

    public ExportOptions withTrimBorders(boolean trim) {
        return new ExportOptions(trim, lineNumbers, maxWidth);
    }

    public ExportOptions withLineNumbers(boolean numbers) {
        return new ExportOptions(trimBorders, numbers, maxWidth);
    }

    public ExportOptions withMaxWidth(int width) {
        return new ExportOptions(trimBorders, lineNumbers, width);
    }
}
