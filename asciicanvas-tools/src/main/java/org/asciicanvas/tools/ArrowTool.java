package org.asciicanvas.tools;

import org.asciicanvas.grid.DrawOp;

import java.util.ArrayList;
import java.util.List;

/**
 * Lines ending in an arrowhead.
 * <p>
 * Body glyphs are picked per cell from the remaining offset to the target; the head glyph from the
 * whole drag vector, bucketed by {@code |dx| * 10 / |dy|}: below 3 diagonal heads, above 7 horizontal
 * heads, in between plain {@code <} / {@code >}.
 */
public class ArrowTool extends DragShapeTool {

    @Override
    public ToolId id() {
        return ToolId.ARROW;
    }

    @Override
    protected List<DrawOp> draw(int x1, int y1, int x2, int y2, ToolContext ctx) {
        List<Bresenham.Point> points = Bresenham.line(x1, y1, x2, y2);
        List<DrawOp> ops = new ArrayList<>(points.size() + 1);
        for (Bresenham.Point p : points) {
            ops.add(DrawOp.of(p.x(), p.y(), bodyChar(p.x(), p.y(), x2, y2)));
        }
        ops.add(DrawOp.of(x2, y2, arrowhead(x2 - x1, y2 - y1)));
        return ops;
    }

    static char arrowhead(int dx, int dy) {
        if (dx == 0 && dy == 0) {
            return '•';
        }
        int absDx = Math.abs(dx);
        int absDy = Math.abs(dy);
        if (absDx == 0) {
            return dy > 0 ? '▼' : '▲';
        }
        if (absDy == 0) {
            return dx > 0 ? '►' : '◄';
        }
        int ratio = absDx * 10 / Math.max(1, absDy);
        if (ratio < 3) {
            if (dx > 0) {
                return dy > 0 ? '╲' : '╱';
            }
            return dy > 0 ? '╱' : '╲';
        }
        if (ratio > 7) {
            return dx > 0 ? '►' : '◄';
        }
        return dx > 0 ? '>' : '<';
    }

    static char bodyChar(int x, int y, int targetX, int targetY) {
        int dx = targetX - x;
        int dy = targetY - y;
        if (dx == 0) {
            return '│';
        }
        if (dy == 0) {
            return '─';
        }
        int ratio = Math.abs(dx) * 10 / Math.max(1, Math.abs(dy));
        if (ratio < 3) {
            return '│';
        }
        if (ratio > 7) {
            return '─';
        }
        return (dx > 0) == (dy < 0) ? '/' : '\\';
    }
}
