package org.asciicanvas.grid.render;

import org.asciicanvas.grid.CellStyle;
import org.asciicanvas.grid.DrawOp;
import org.asciicanvas.grid.Grid;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GridRendererTest {

    @Test
    void firstRender_isFull() {
        Grid grid = new Grid(4, 2);
        grid.setChar(1, 1, 'x');
        DirtyTracker tracker = new DirtyTracker();
        RenderFrame frame = new GridRenderer().render(grid, tracker);

        assertTrue(frame.full());
        assertEquals(new RenderCommand.Clear(4, 2), frame.commands().get(0));
        assertEquals(List.of(new RenderCommand.Clear(4, 2), new RenderCommand.DrawCell(1, 1, 'x', CellStyle.NONE)),
                frame.commands());
        assertFalse(tracker.hasPendingChanges());
    }

    @Test
    void incrementalRender_coversDirtyRectOnly() {
        Grid grid = new Grid(10, 10);
        DirtyTracker tracker = new DirtyTracker();
        GridRenderer renderer = new GridRenderer();
        renderer.render(grid, tracker);

        grid.setChar(2, 3, 'a');
        grid.setChar(8, 8, 'b');
        tracker.markDirty(2, 3);
        RenderFrame frame = renderer.render(grid, tracker);

        assertFalse(frame.full());
        assertEquals(DirtyRect.single(2, 3), frame.region());
        assertEquals(List.of(new RenderCommand.ClearRect(2, 3, 2, 3), new RenderCommand.DrawCell(2, 3, 'a', 0)),
                frame.commands());
    }

    @Test
    void sizeChange_forcesFullRedraw() {
        Grid grid = new Grid(3, 3);
        DirtyTracker tracker = new DirtyTracker();
        GridRenderer renderer = new GridRenderer();
        renderer.render(grid, tracker);

        grid.resize(5, 5);
        tracker.markDirty(0, 0);
        assertTrue(renderer.render(grid, tracker).full());
    }

    @Test
    void overlay_isHighlighted() {
        Grid grid = new Grid(3, 3);
        DirtyTracker tracker = new DirtyTracker();
        GridRenderer renderer = new GridRenderer();
        renderer.render(grid, tracker);

        tracker.markDirty(1, 1);
        RenderFrame frame = renderer.render(grid, tracker, List.of(DrawOp.of(1, 1, '*'), DrawOp.of(7, 7, '*')));
        RenderCommand last = frame.commands().get(frame.commands().size() - 1);
        assertEquals(new RenderCommand.DrawCell(1, 1, '*', CellStyle.HIGHLIGHT), last);
        assertEquals(2, frame.commands().size());
    }

    @Test
    void nothingDirty_afterRender_yieldsFull() {
        Grid grid = new Grid(2, 2);
        DirtyTracker tracker = new DirtyTracker();
        GridRenderer renderer = new GridRenderer();
        renderer.render(grid, tracker);
        assertTrue(renderer.render(grid, tracker).full());
    }
}
