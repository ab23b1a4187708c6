package org.asciicanvas.history;

import org.asciicanvas.grid.Cell;
import org.asciicanvas.grid.Grid;

/**
 * Changes the grid dimensions. Cells outside the new bounds are lost on apply and come back on undo.
 * Requested dimensions are clamped the same way {@link Grid#resize(int, int)} clamps them.
 */
public final class ResizeCommand implements Command {

    private final int newWidth;
    private final int newHeight;
    private Cell[] snapshot;
    private int oldWidth;
    private int oldHeight;
    private boolean applied;

    public ResizeCommand(int newWidth, int newHeight) {
        this.newWidth = Grid.clampDimension(newWidth);
        this.newHeight = Grid.clampDimension(newHeight);
    }

    @Override
    public void apply(Grid grid) {
        if (applied) {
            return;
        }
        snapshot = grid.snapshot();
        oldWidth = grid.getWidth();
        oldHeight = grid.getHeight();
        grid.resize(newWidth, newHeight);
        applied = true;
    }

    @Override
    public void undo(Grid grid) {
        if (!applied) {
            return;
        }
        grid.restore(snapshot, oldWidth, oldHeight);
        snapshot = null;
        applied = false;
    }

    public int getNewWidth() {
        return newWidth;
    }

    public int getNewHeight() {
        return newHeight;
    }

    @Override
    public String description() {
        return "Resize to " + newWidth + "x" + newHeight;
    }

    @Override
    public CommandKind kind() {
        return CommandKind.RESIZE;
    }

    @Override
    public boolean isApplied() {
        return applied;
    }
}
