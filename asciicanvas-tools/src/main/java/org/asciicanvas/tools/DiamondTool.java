package org.asciicanvas.tools;

import org.asciicanvas.grid.DrawOp;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Diamonds in the drag box: four half-diagonals from the box centre to the midpoints of its sides.
 */
public class DiamondTool extends DragShapeTool {

    static final char FILLED = '◆';

    @Override
    public ToolId id() {
        return ToolId.DIAMOND;
    }

    @Override
    protected List<DrawOp> draw(int x1, int y1, int x2, int y2, ToolContext ctx) {
        return drawDiamond(x1, y1, x2, y2);
    }

    static List<DrawOp> drawDiamond(int x1, int y1, int x2, int y2) {
        int minX = Math.min(x1, x2);
        int minY = Math.min(y1, y2);
        int cx = (minX + Math.max(x1, x2)) / 2;
        int cy = (minY + Math.max(y1, y2)) / 2;
        int halfWidth = Math.abs(x2 - x1) / 2;
        int halfHeight = Math.abs(y2 - y1) / 2;

        List<DrawOp> ops = new ArrayList<>();
        if (halfWidth == 0 && halfHeight == 0) {
            ops.add(DrawOp.of(cx, cy, FILLED));
            return ops;
        }

        edge(ops, cx, cy, cx, cy - halfHeight);
        edge(ops, cx, cy, cx + halfWidth, cy);
        edge(ops, cx, cy, cx, cy + halfHeight);
        edge(ops, cx, cy, cx - halfWidth, cy);

        // stable sort: the first segment through a shared cell keeps its glyph

        ops.sort(Comparator.comparingInt(DrawOp::y).thenComparingInt(DrawOp::x));
        List<DrawOp> unique = new ArrayList<>(ops.size());
        DrawOp prev = null;
        for (DrawOp op : ops) {
            if (prev == null || prev.x() != op.x() || prev.y() != op.y()) {
                unique.add(op);
            }
            prev = op;
        }
        return unique;
    }

    private static void edge(List<DrawOp> ops, int x1, int y1, int x2, int y2) {
        int sx = x1 < x2 ? 1 : -1;
        int sy = y1 < y2 ? 1 : -1;
        char ch = LineTool.lineChar(sx, sy, Math.abs(x2 - x1), Math.abs(y2 - y1));
        for (Bresenham.Point p : Bresenham.line(x1, y1, x2, y2)) {
            ops.add(DrawOp.of(p.x(), p.y(), ch));
        }
    }
}
