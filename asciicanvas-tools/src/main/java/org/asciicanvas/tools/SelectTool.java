package org.asciicanvas.tools;

import org.asciicanvas.grid.Selection;

import java.util.List;
import java.util.Optional;

/**
 * Rectangular selection. Dragging outside the current selection starts a new one, dragging inside
 * moves it. Moving only relocates the rectangle; carrying the cells along is up to the caller.
 */
public class SelectTool implements Tool {

    private enum State {
        IDLE,
        SELECTING,
        MOVING
    }

    private State state = State.IDLE;
    private Selection selection;
    private int offsetX;
    private int offsetY;

    @Override
    public ToolId id() {
        return ToolId.SELECT;
    }

    @Override
    public ToolResult onPointerDown(int x, int y, ToolContext ctx) {
        int cx = ctx.clampX(x);
        int cy = ctx.clampY(y);
        if (selection != null && selection.contains(cx, cy)) {
            state = State.MOVING;
            offsetX = cx - selection.minX();
            offsetY = cy - selection.minY();
        } else {
            state = State.SELECTING;
            selection = new Selection(cx, cy, cx, cy);
        }
        return ToolResult.none();
    }

    @Override
    public ToolResult onPointerMove(int x, int y, ToolContext ctx) {
        int cx = ctx.clampX(x);
        int cy = ctx.clampY(y);
        switch (state) {
            case SELECTING -> selection = new Selection(selection.getX1(), selection.getY1(), cx, cy);
            case MOVING -> selection = moveWithin(cx, cy, ctx);
            default -> {
            }
        }
        return ToolResult.none();
    }

    @Override
    public ToolResult onPointerUp(int x, int y, ToolContext ctx) {
        if (state == State.IDLE) {
            return ToolResult.none();
        }
        onPointerMove(x, y, ctx);
        state = State.IDLE;
        return ToolResult.finished(List.of());
    }

    private Selection moveWithin(int x, int y, ToolContext ctx) {
        int maxLeft = Math.max(0, ctx.gridWidth() - selection.width());
        int maxTop = Math.max(0, ctx.gridHeight() - selection.height());
        int left = Math.max(0, Math.min(x - offsetX, maxLeft));
        int top = Math.max(0, Math.min(y - offsetY, maxTop));
        return selection.moveTo(left, top);
    }

    @Override
    public Optional<Selection> getSelection() {
        return Optional.ofNullable(selection);
    }

    public void setSelection(Selection selection) {
        this.selection = selection;
        state = State.IDLE;
    }

    public boolean isMoving() {
        return state == State.MOVING;
    }

    public void clearSelection() {
        selection = null;
        state = State.IDLE;
    }

    @Override
    public void reset() {
        clearSelection();
    }

    @Override
    public boolean isActive() {
        return state != State.IDLE;
    }
}
