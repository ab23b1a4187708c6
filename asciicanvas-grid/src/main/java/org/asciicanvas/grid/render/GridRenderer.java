package org.asciicanvas.grid.render;

import org.asciicanvas.grid.Cell;
import org.asciicanvas.grid.CellStyle;
import org.asciicanvas.grid.DrawOp;
import org.asciicanvas.grid.Grid;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Stateful render-command builder for {@link Grid}.
 * <p>
 * It remembers the dimensions of the last frame. The first frame, any frame after a size change,
 * and any frame where the tracker asks for it repaints everything; later frames repaint only the
 * dirty rectangle. Rendering drains the tracker.
 */
public final class GridRenderer {

    private int lastWidth = -1;
    private int lastHeight = -1;
    private boolean initialized;

    public RenderFrame render(Grid grid, DirtyTracker tracker) {
        return render(grid, tracker, List.of());
    }

    /**
     * Build the next frame. {@code overlay} ops (a live preview) are painted on top, highlighted.
     */
    public RenderFrame render(Grid grid, DirtyTracker tracker, Collection<DrawOp> overlay) {
        if (grid == null || tracker == null) {
            return new RenderFrame(false, DirtyRect.empty(), List.of());
        }
        int width = grid.getWidth();
        int height = grid.getHeight();
        boolean fullRedraw = !initialized || width != lastWidth || height != lastHeight
                || tracker.needsFullRedraw();

        List<RenderCommand> out = new ArrayList<>();
        DirtyRect region;
        if (fullRedraw) {
            region = DirtyRect.full(width, height);
            out.add(new RenderCommand.Clear(width, height));
            grid.forEachCell((x, y, cell) -> appendCell(out, x, y, cell));
        } else {
            region = tracker.getDirtyRect().clamp(width, height);
            if (!region.isEmpty()) {
                out.add(new RenderCommand.ClearRect(region.getX1(), region.getY1(), region.getX2(), region.getY2()));
                for (int y = region.getY1(); y <= region.getY2(); y++) {
                    for (int x = region.getX1(); x <= region.getX2(); x++) {
                        appendCell(out, x, y, grid.getOrBlank(x, y));
                    }
                }
            }
        }

        if (overlay != null) {
            for (DrawOp op : overlay) {
                if (grid.inBounds(op.x(), op.y())) {
                    Cell c = op.cell();
                    out.add(new RenderCommand.DrawCell(op.x(), op.y(), c.getCodePoint(),
                            c.getStyle() | CellStyle.HIGHLIGHT));
                }
            }
        }

        lastWidth = width;
        lastHeight = height;
        initialized = true;
        tracker.clear();
        return new RenderFrame(fullRedraw, region, out);
    }

    /**
     * Reset renderer state. The next render() emits a full redraw.
     */
    public void reset() {
        lastWidth = -1;
        lastHeight = -1;
        initialized = false;
    }

    private static void appendCell(List<RenderCommand> out, int x, int y, Cell cell) {
        if (cell.isVisible()) {
            out.add(new RenderCommand.DrawCell(x, y, cell.getCodePoint(), cell.getStyle()));
        }
    }

    @Override
    public String toString() {
        return "GridRenderer{" +
                "lastWidth=" + lastWidth +
                ", lastHeight=" + lastHeight +
                ", initialized=" + initialized +
                '}';
    }
}
