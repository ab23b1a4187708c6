package org.asciicanvas.tools;

import org.asciicanvas.grid.DrawOp;

import java.util.ArrayList;
import java.util.List;

/**
 * Base for tools that follow the pointer and stamp every cell along its path.
 * <p>
 * Each pointer-move interpolates from the previous position, so fast moves leave no gaps. All stamped
 * ops are buffered and handed over as one finished batch on pointer-up.
 */
public abstract class StrokeTool implements Tool {

    private final List<DrawOp> buffer = new ArrayList<>();
    private boolean drawing;
    private int lastX;
    private int lastY;

    /**
     * Ops produced at one interpolated point.
     */
    protected abstract List<DrawOp> stamp(int x, int y, ToolContext ctx);

    @Override
    public ToolResult onPointerDown(int x, int y, ToolContext ctx) {
        int cx = ctx.clampX(x);
        int cy = ctx.clampY(y);
        drawing = true;
        lastX = cx;
        lastY = cy;
        buffer.clear();
        List<DrawOp> ops = stamp(cx, cy, ctx);
        buffer.addAll(ops);
        return ToolResult.stroke(ops);
    }

    @Override
    public ToolResult onPointerMove(int x, int y, ToolContext ctx) {
        if (!drawing) {
            return ToolResult.none();
        }
        int cx = ctx.clampX(x);
        int cy = ctx.clampY(y);
        if (cx == lastX && cy == lastY) {
            return ToolResult.none();
        }
        List<Bresenham.Point> path = Bresenham.line(lastX, lastY, cx, cy);
        List<DrawOp> ops = new ArrayList<>();
        // path starts at the previous position, which is already stamped
        for (Bresenham.Point p : path.subList(1, path.size())) {
            ops.addAll(stamp(p.x(), p.y(), ctx));
        }
        lastX = cx;
        lastY = cy;
        buffer.addAll(ops);
        return ToolResult.stroke(ops);
    }

    @Override
    public ToolResult onPointerUp(int x, int y, ToolContext ctx) {
        if (!drawing) {
            return ToolResult.none();
        }
        drawing = false;
        List<DrawOp> ops = new ArrayList<>(buffer);
        buffer.clear();
        return ToolResult.finished(ops);
    }

    @Override
    public void reset() {
        drawing = false;
        buffer.clear();
    }

    @Override
    public boolean isActive() {
        return drawing;
    }

    int bufferedOps() {
        return buffer.size();
    }
}
