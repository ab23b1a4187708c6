package org.asciicanvas.tools;

import org.asciicanvas.grid.DrawOp;

import java.util.ArrayList;
import java.util.List;

/**
 * Straight lines. One glyph for the whole segment, chosen by its direction.
 */
public class LineTool extends DragShapeTool {

    static final char HORIZONTAL = '─';
    static final char VERTICAL = '│';

    @Override
    public ToolId id() {
        return ToolId.LINE;
    }

    @Override
    protected List<DrawOp> draw(int x1, int y1, int x2, int y2, ToolContext ctx) {
        return drawLine(x1, y1, x2, y2);
    }

    static List<DrawOp> drawLine(int x1, int y1, int x2, int y2) {
        int sx = x1 < x2 ? 1 : -1;
        int sy = y1 < y2 ? 1 : -1;
        char ch = lineChar(sx, sy, Math.abs(x2 - x1), Math.abs(y2 - y1));
        List<Bresenham.Point> points = Bresenham.line(x1, y1, x2, y2);
        List<DrawOp> ops = new ArrayList<>(points.size());
        for (Bresenham.Point p : points) {
            ops.add(DrawOp.of(p.x(), p.y(), ch));
        }
        return ops;
    }

    /**
     * Down-right and up-left share '\', up-right and down-left share '/'.
     */
    static char lineChar(int sx, int sy, int dx, int dy) {
        if (dx == 0) {
            return VERTICAL;
        }
        if (dy == 0) {
            return HORIZONTAL;
        }
        return sx == sy ? '\\' : '/';
    }
}
