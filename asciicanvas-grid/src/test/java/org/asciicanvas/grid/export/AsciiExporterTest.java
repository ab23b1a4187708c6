package org.asciicanvas.grid.export;

import org.asciicanvas.grid.Grid;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AsciiExporterTest {

    private static void write(Grid grid, int x, int y, String text) {
        for (int i = 0; i < text.length(); i++) {
            grid.setChar(x + i, y, text.charAt(i));
        }
    }

    @Test
    void emptyGrid_exportsEmptyString() {
        assertEquals("", AsciiExporter.export(new Grid(10, 5)));
        assertTrue(AsciiExporter.findContentBounds(new Grid(3, 3)).isEmpty());
    }

    @Test
    void trimmed_toContentBounds() {
        Grid grid = new Grid(10, 5);
        write(grid, 3, 2, "Hi");
        assertEquals("Hi", AsciiExporter.export(grid));
    }

    @Test
    void trimmed_multipleRows() {
        Grid grid = new Grid(10, 5);
        grid.setChar(4, 1, 'A');
        grid.setChar(4, 2, 'B');
        assertEquals("A\nB", AsciiExporter.export(grid));
    }

    @Test
    void trimmed_keepsLeadingSpacesInsideBounds() {
        Grid grid = new Grid(10, 5);
        grid.setChar(1, 0, 'x');
        grid.setChar(3, 1, 'y');
        assertEquals("x\n  y", AsciiExporter.export(grid));
    }

    @Test
    void untrimmed_keepsFullGrid() {
        Grid grid = new Grid(3, 2);
        grid.setChar(0, 0, 'a');
        assertEquals("a  \n   ", AsciiExporter.export(grid, ExportOptions.defaults().withTrimBorders(false)));
    }

    @Test
    void untrimmed_ignoresLineNumbersAndMaxWidth() {
        Grid grid = new Grid(3, 2);
        grid.setChar(0, 0, 'A');
        assertEquals("A  \n   ", AsciiExporter.export(grid, new ExportOptions(false, true, 4)));
        assertEquals("A  \n   ", AsciiExporter.export(grid, new ExportOptions(false, false, 1)));
    }

    @Test
    void lineNumbers_useGridRows() {
        Grid grid = new Grid(5, 5);
        grid.setChar(0, 2, 'z');
        String out = AsciiExporter.export(grid, ExportOptions.defaults().withLineNumbers(true));
        assertEquals("   3 | z", out);
    }

    @Test
    void maxWidth_truncates() {
        Grid grid = new Grid(10, 1);
        write(grid, 0, 0, "abcdef");
        assertEquals("abc", AsciiExporter.export(grid, ExportOptions.defaults().withMaxWidth(3)));
    }

    @Test
    void negativeMaxWidth_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new ExportOptions(true, false, -1));
    }

    @Test
    void exportRegion_clipsAndTrims() {
        Grid grid = new Grid(5, 5);
        write(grid, 0, 0, "abc");
        write(grid, 0, 1, "de");
        assertEquals("bc\ne", AsciiExporter.exportRegion(grid, 1, 0, 9, 1));
        assertEquals("", AsciiExporter.exportRegion(grid, 7, 7, 9, 9));
    }

    @Test
    void countContent_ignoresWhitespace() {
        Grid grid = new Grid(5, 5);
        write(grid, 0, 0, "a b");
        assertEquals(2, AsciiExporter.countContent(grid));
    }
}
