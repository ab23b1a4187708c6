package org.asciicanvas.tools;

import org.asciicanvas.grid.DrawOp;

import java.util.ArrayList;
import java.util.List;

/**
 * Blanks a square of side {@code 2 * size - 1} centred on each point of the stroke, clipped to the grid.
 */
public class EraserTool extends StrokeTool {

    private int size = 1;

    public EraserTool() {
    }

    public EraserTool(int size) {
        setSize(size);
    }

    @Override
    public ToolId id() {
        return ToolId.ERASER;
    }

    public int getSize() {
        return size;
    }

    /**
     * Radius in cells; values below 1 are raised to 1.
     */
    public void setSize(int size) {
        this.size = Math.max(1, size);
    }

    @Override
    protected List<DrawOp> stamp(int x, int y, ToolContext ctx) {
        return eraseAt(x, y, ctx);
    }

    List<DrawOp> eraseAt(int x, int y, ToolContext ctx) {
        List<DrawOp> ops = new ArrayList<>((2 * size - 1) * (2 * size - 1));
        for (int dy = -size + 1; dy < size; dy++) {
            for (int dx = -size + 1; dx < size; dx++) {
                int ex = x + dx;
                int ey = y + dy;
                if (ctx.inBounds(ex, ey)) {
                    ops.add(DrawOp.blank(ex, ey));
                }
            }
        }
        return ops;
    }
}
