package org.asciicanvas.grid;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SelectionClipboardTest {

    @Test
    void capture_recordsRelativeOffsets() {
        Grid grid = new Grid(5, 5);
        grid.setChar(2, 1, 'a');
        grid.setChar(3, 2, 'b');
        SelectionClipboard clip = SelectionClipboard.capture(grid, new Selection(3, 2, 2, 1));
        assertEquals(2, clip.getWidth());
        assertEquals(2, clip.getHeight());
        assertEquals(4, clip.getCells().size());
        assertEquals("a\n b", clip.toText());
    }

    @Test
    void capture_skipsCellsOutsideGrid() {
        Grid grid = new Grid(3, 3);
        SelectionClipboard clip = SelectionClipboard.capture(grid, new Selection(1, 1, 5, 5));
        assertEquals(4, clip.getCells().size());
        assertEquals(5, clip.getWidth());
    }

    @Test
    void toOps_dropsOutOfBounds() {
        Grid grid = new Grid(4, 4);
        grid.setChar(0, 0, 'x');
        grid.setChar(1, 0, 'y');
        SelectionClipboard clip = SelectionClipboard.capture(grid, new Selection(0, 0, 1, 0));
        List<DrawOp> ops = clip.toOps(3, 3, 4, 4);
        assertEquals(1, ops.size());
        assertEquals(new DrawOp(3, 3, Cell.of('x')), ops.get(0));
    }

    @Test
    void fromText_keepsSpacesAndRows() {
        SelectionClipboard clip = SelectionClipboard.fromText("ab\r\n c");
        assertEquals(2, clip.getWidth());
        assertEquals(2, clip.getHeight());
        assertEquals(4, clip.getCells().size());
        assertEquals("ab\n c", clip.toText());
    }

    @Test
    void empty_hasNoOps() {
        assertTrue(SelectionClipboard.empty().isEmpty());
        assertTrue(SelectionClipboard.fromText("").isEmpty());
        assertEquals("", SelectionClipboard.empty().toText());
        assertTrue(SelectionClipboard.empty().toOps(0, 0, 10, 10).isEmpty());
    }
}
