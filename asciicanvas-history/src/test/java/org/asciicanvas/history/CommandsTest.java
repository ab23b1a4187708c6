package org.asciicanvas.history;

import org.asciicanvas.grid.Cell;
import org.asciicanvas.grid.DrawOp;
import org.asciicanvas.grid.Grid;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommandsTest {

    private static Grid gridWithContent() {
        Grid grid = new Grid(5, 4);
        grid.setChar(0, 0, 'a');
        grid.setChar(2, 1, 'b');
        grid.setChar(4, 3, 'c');
        return grid;
    }

    private static void assertRoundTrip(Command command) {
        Grid grid = gridWithContent();
        Cell[] before = grid.snapshot();
        int width = grid.getWidth();
        int height = grid.getHeight();

        command.apply(grid);
        assertTrue(command.isApplied());
        command.undo(grid);
        assertFalse(command.isApplied());

        assertEquals(width, grid.getWidth());
        assertEquals(height, grid.getHeight());
        assertArrayEquals(before, grid.snapshot());
    }

    @Test
    void everyCommand_undoRestoresGrid() {
        assertRoundTrip(new SetCellCommand(2, 1, 'x'));
        assertRoundTrip(new ClearCellCommand(0, 0));
        assertRoundTrip(new ClearGridCommand());
        assertRoundTrip(new ResizeCommand(2, 2));
        assertRoundTrip(new ResizeCommand(8, 8));
        assertRoundTrip(new DrawCommand(List.of(DrawOp.of(1, 1, '#'), DrawOp.of(1, 1, '@'), DrawOp.blank(0, 0))));
        assertRoundTrip(new CompositeCommand("group", List.of(
                new SetCellCommand(3, 3, 'q'), new ClearGridCommand(), new SetCellCommand(3, 3, 'r'))));
    }

    @Test
    void setCell_outOfBounds_isHarmless() {
        Grid grid = gridWithContent();
        Cell[] before = grid.snapshot();
        SetCellCommand command = new SetCellCommand(10, 10, 'x');
        command.apply(grid);
        command.undo(grid);
        assertArrayEquals(before, grid.snapshot());
    }

    @Test
    void apply_isIdempotent() {
        Grid grid = new Grid(3, 3);
        SetCellCommand command = new SetCellCommand(1, 1, 'x');
        command.apply(grid);
        command.apply(grid);
        command.undo(grid);
        assertTrue(grid.get(1, 1).orElseThrow().isEmpty());
    }

    @Test
    void drawBatch_sameCellTwice_undoesToOriginal() {
        Grid grid = new Grid(3, 3);
        grid.setChar(1, 1, 'o');
        DrawCommand command = new DrawCommand(List.of(DrawOp.of(1, 1, 'a'), DrawOp.of(1, 1, 'b')));
        command.apply(grid);
        assertEquals('b', grid.get(1, 1).orElseThrow().getCodePoint());
        command.undo(grid);
        assertEquals('o', grid.get(1, 1).orElseThrow().getCodePoint());
    }

    @Test
    void drawBatch_descriptions() {
        assertEquals("Draw", new DrawCommand(List.of(DrawOp.of(0, 0, 'x'))).description());
        assertEquals("Draw 3 cells", new DrawCommand(List.of(DrawOp.of(0, 0, 'x'), DrawOp.of(1, 0, 'x'),
                DrawOp.of(2, 0, 'x'))).description());
        assertEquals("Paste", new DrawCommand(List.of(), "Paste").description());
    }

    @Test
    void merge_concatenatesUnappliedBatches() {
        DrawCommand first = new DrawCommand(List.of(DrawOp.of(0, 0, 'a')));
        DrawCommand second = new DrawCommand(List.of(DrawOp.of(1, 0, 'b'), DrawOp.of(2, 0, 'c')));
        assertTrue(first.merge(second));
        assertEquals(3, first.size());
        assertEquals("Draw 3 cells", first.description());

        Grid grid = new Grid(3, 1);
        first.apply(grid);
        assertEquals("abc", grid.getRegion(0, 0, 2, 0).stream()
                .map(c -> String.valueOf((char) c.getCodePoint())).reduce("", String::concat));
    }

    @Test
    void merge_refusedOnceApplied() {
        DrawCommand first = new DrawCommand(List.of(DrawOp.of(0, 0, 'a')));
        first.apply(new Grid(2, 2));
        assertFalse(first.canMerge(new DrawCommand(List.of(DrawOp.of(1, 1, 'b')))));
        assertFalse(first.merge(new DrawCommand(List.of(DrawOp.of(1, 1, 'b')))));
        assertEquals(1, first.size());
    }

    @Test
    void merge_capAtLimit() {
        DrawCommand big = new DrawCommand(ops(998));
        assertTrue(big.canMerge(new DrawCommand(ops(1))));
        assertFalse(big.canMerge(new DrawCommand(ops(2))));
        assertFalse(big.merge(new DrawCommand(ops(2))));
        assertEquals(998, big.size());
        assertTrue(big.merge(new DrawCommand(ops(1))));
        assertEquals(999, big.size());
    }

    private static List<DrawOp> ops(int n) {
        DrawOp[] result = new DrawOp[n];
        for (int i = 0; i < n; i++) {
            result[i] = DrawOp.of(i % 10, i / 10, 'x');
        }
        return List.of(result);
    }

    @Test
    void clearGrid_undoAfterResize_onlyMarksUnapplied() {
        Grid grid = gridWithContent();
        ClearGridCommand clear = new ClearGridCommand();
        clear.apply(grid);
        grid.resize(9, 9);
        clear.undo(grid);
        assertFalse(clear.isApplied());
        assertEquals(9, grid.getWidth());
        assertTrue(grid.get(0, 0).orElseThrow().isEmpty());
    }

    @Test
    void resize_clampsDimensions() {
        ResizeCommand small = new ResizeCommand(0, 5);
        assertEquals(1, small.getNewWidth());
        assertEquals("Resize to 1x5", small.description());
        assertEquals(Grid.MAX_DIMENSION, new ResizeCommand(5, Integer.MAX_VALUE).getNewHeight());

        Grid grid = new Grid(3, 3);
        small.apply(grid);
        assertEquals(1, grid.getWidth());
        assertEquals(5, grid.getHeight());
        small.undo(grid);
        assertEquals(3, grid.getWidth());
    }

    @Test
    void composite_undoesInReverse() {
        Grid grid = new Grid(2, 1);
        CompositeCommand composite = new CompositeCommand("write twice")
                .add(new SetCellCommand(0, 0, 'a'))
                .add(new SetCellCommand(0, 0, 'b'));
        composite.apply(grid);
        assertEquals('b', grid.get(0, 0).orElseThrow().getCodePoint());
        composite.undo(grid);
        assertTrue(grid.get(0, 0).orElseThrow().isEmpty());
        assertEquals(CommandKind.COMPOSITE, composite.kind());
    }

    @Test
    void composite_rejectsAddAfterApply() {
        CompositeCommand composite = new CompositeCommand("g");
        composite.apply(new Grid(1, 1));
        assertThrows(IllegalStateException.class, () -> composite.add(new ClearCellCommand(0, 0)));
    }
}
