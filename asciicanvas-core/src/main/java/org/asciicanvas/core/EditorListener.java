package org.asciicanvas.core;

import org.asciicanvas.grid.Selection;
import org.asciicanvas.history.Command;
import org.asciicanvas.tools.ToolId;

/**
 * Callbacks for editor state changes. All methods default to no-ops.
 */
public interface EditorListener {

    default void commandCommitted(Command command) {
    }

    default void undone(String description) {
    }

    default void redone(String description) {
    }

    default void toolChanged(ToolId previous, ToolId current) {
    }

    /**
     * @param selection the new selection, or null when it was cleared
     */
    default void selectionChanged(Selection selection) {
    }

    default void gridResized(int width, int height) {
    }

    default void gridCleared() {
    }
}
