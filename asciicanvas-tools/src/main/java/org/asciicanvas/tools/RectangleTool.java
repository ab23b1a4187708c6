package org.asciicanvas.tools;

import org.asciicanvas.grid.DrawOp;

import java.util.ArrayList;
import java.util.List;

/**
 * Boxes in the context's {@link BorderStyle}. Corners first, then border runs strictly between them.
 */
public class RectangleTool extends DragShapeTool {

    @Override
    public ToolId id() {
        return ToolId.RECTANGLE;
    }

    @Override
    protected List<DrawOp> draw(int x1, int y1, int x2, int y2, ToolContext ctx) {
        return drawRectangle(x1, y1, x2, y2, ctx.borderStyle());
    }

    static List<DrawOp> drawRectangle(int x1, int y1, int x2, int y2, BorderStyle style) {
        int minX = Math.min(x1, x2);
        int maxX = Math.max(x1, x2);
        int minY = Math.min(y1, y2);
        int maxY = Math.max(y1, y2);
        List<DrawOp> ops = new ArrayList<>();

        if (minX == maxX && minY == maxY) {
            ops.add(DrawOp.of(minX, minY, style.topLeft()));
            return ops;
        }
        if (minY == maxY) {
            for (int x = minX; x <= maxX; x++) {
                ops.add(DrawOp.of(x, minY, style.horizontal()));
            }
            return ops;
        }
        if (minX == maxX) {
            for (int y = minY; y <= maxY; y++) {
                ops.add(DrawOp.of(minX, y, style.vertical()));
            }
            return ops;
        }

        ops.add(DrawOp.of(minX, minY, style.topLeft()));
        ops.add(DrawOp.of(maxX, minY, style.topRight()));
        ops.add(DrawOp.of(minX, maxY, style.bottomLeft()));
        ops.add(DrawOp.of(maxX, maxY, style.bottomRight()));
        for (int x = minX + 1; x < maxX; x++) {
            ops.add(DrawOp.of(x, minY, style.horizontal()));
            ops.add(DrawOp.of(x, maxY, style.horizontal()));
        }
        for (int y = minY + 1; y < maxY; y++) {
            ops.add(DrawOp.of(minX, y, style.vertical()));
            ops.add(DrawOp.of(maxX, y, style.vertical()));
        }
        return ops;
    }
}
