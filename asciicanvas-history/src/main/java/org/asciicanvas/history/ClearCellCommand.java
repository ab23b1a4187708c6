package org.asciicanvas.history;

import org.asciicanvas.grid.Cell;
import org.asciicanvas.grid.Grid;

/**
 * Blanks one cell, remembering its previous content for undo. Out-of-bounds targets change nothing.
 */
public final class ClearCellCommand implements Command {

    private final int x;
    private final int y;
    private Cell previous;
    private boolean applied;

    public ClearCellCommand(int x, int y) {
        this.x = x;
        this.y = y;
    }

    @Override
    public void apply(Grid grid) {
        if (applied) {
            return;
        }
        previous = grid.get(x, y).orElse(null);
        grid.clearCell(x, y);
        applied = true;
    }

    @Override
    public void undo(Grid grid) {
        if (!applied) {
            return;
        }
        if (previous != null) {
            grid.set(x, y, previous);
        }
        applied = false;
    }

    @Override
    public String description() {
        return "Clear cell";
    }

    @Override
    public CommandKind kind() {
        return CommandKind.CLEAR_CELL;
    }

    @Override
    public boolean isApplied() {
        return applied;
    }
}
