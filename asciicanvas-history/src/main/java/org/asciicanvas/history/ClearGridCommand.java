package org.asciicanvas.history;

import org.asciicanvas.grid.Cell;
import org.asciicanvas.grid.Grid;

/**
 * Blanks the whole grid. Undo restores the snapshot taken at apply time, provided the grid still
 * has the dimensions it had then; otherwise the command is only marked unapplied.
 */
public final class ClearGridCommand implements Command {

    private Cell[] snapshot;
    private int snapshotWidth;
    private int snapshotHeight;
    private boolean applied;

    @Override
    public void apply(Grid grid) {
        if (applied) {
            return;
        }
        snapshot = grid.snapshot();
        snapshotWidth = grid.getWidth();
        snapshotHeight = grid.getHeight();
        grid.clear();
        applied = true;
    }

    @Override
    public void undo(Grid grid) {
        if (!applied) {
            return;
        }
        if (grid.getWidth() == snapshotWidth && grid.getHeight() == snapshotHeight) {
            grid.restore(snapshot, snapshotWidth, snapshotHeight);
        }
        snapshot = null;
        applied = false;
    }

    @Override
    public String description() {
        return "Clear canvas";
    }

    @Override
    public CommandKind kind() {
        return CommandKind.CLEAR_GRID;
    }

    @Override
    public boolean isApplied() {
        return applied;
    }
}
