package org.asciicanvas.tools;

import org.asciicanvas.grid.DrawOp;

import java.util.List;

/**
 * Base for anchor-and-drag shapes: pointer-down records the anchor, every move previews the whole
 * shape from anchor to pointer, pointer-up finishes it.
 */
public abstract class DragShapeTool implements Tool {

    private int startX;
    private int startY;
    private boolean dragging;

    /**
     * Rasterize the shape between two clamped grid points.
     */
    protected abstract List<DrawOp> draw(int x1, int y1, int x2, int y2, ToolContext ctx);

    @Override
    public ToolResult onPointerDown(int x, int y, ToolContext ctx) {
        startX = ctx.clampX(x);
        startY = ctx.clampY(y);
        dragging = true;
        return ToolResult.none();
    }

    @Override
    public ToolResult onPointerMove(int x, int y, ToolContext ctx) {
        if (!dragging) {
            return ToolResult.none();
        }
        return ToolResult.preview(draw(startX, startY, ctx.clampX(x), ctx.clampY(y), ctx));
    }

    @Override
    public ToolResult onPointerUp(int x, int y, ToolContext ctx) {
        if (!dragging) {
            return ToolResult.none();
        }
        List<DrawOp> ops = draw(startX, startY, ctx.clampX(x), ctx.clampY(y), ctx);
        dragging = false;
        return ToolResult.finished(ops);
    }

    @Override
    public void reset() {
        dragging = false;
    }

    @Override
    public boolean isActive() {
        return dragging;
    }
}
