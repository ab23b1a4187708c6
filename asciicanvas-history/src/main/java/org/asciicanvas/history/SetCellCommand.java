package org.asciicanvas.history;

import org.asciicanvas.grid.Cell;
import org.asciicanvas.grid.Grid;

import java.util.Objects;

/**
 * Writes one cell, remembering its previous content for undo. Out-of-bounds targets change nothing.
 */
public final class SetCellCommand implements Command {

    private final int x;
    private final int y;
    private final Cell cell;
    private Cell previous;
    private boolean applied;

    public SetCellCommand(int x, int y, Cell cell) {
        this.x = x;
        this.y = y;
        this.cell = Objects.requireNonNull(cell, "cell");
    }

    public SetCellCommand(int x, int y, int codePoint) {
        this(x, y, Cell.of(codePoint));
    }

    @Override
    public void apply(Grid grid) {
        if (applied) {
            return;
        }
        previous = grid.get(x, y).orElse(null);
        grid.set(x, y, cell);
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
        return "Set cell";
    }

    @Override
    public CommandKind kind() {
        return CommandKind.SET_CELL;
    }

    @Override
    public boolean isApplied() {
        return applied;
    }
}
