package org.asciicanvas.history;

import org.asciicanvas.grid.Grid;

/**
 * A reversible grid edit.
 * <p>
 * A command captures whatever it needs to revert itself when it is applied. Applying an applied
 * command, or undoing an unapplied one, does nothing.
 */
public interface Command {

    void apply(Grid grid);

    void undo(Grid grid);

    String description();

    CommandKind kind();

    boolean isApplied();
}
