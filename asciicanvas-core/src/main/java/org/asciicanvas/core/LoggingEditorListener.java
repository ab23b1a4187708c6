package org.asciicanvas.core;

import org.asciicanvas.grid.Selection;
import org.asciicanvas.history.Command;
import org.asciicanvas.tools.ToolId;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes editor state changes to {@code java.util.logging} at FINE.
 */
public final class LoggingEditorListener implements EditorListener {
    private static final Logger LOG = Logger.getLogger(LoggingEditorListener.class.getName());

    @Override
    public void commandCommitted(Command command) {
        LOG.log(Level.FINE, "Committed {0} ({1})", new Object[]{command.description(), command.kind()});
    }

    @Override
    public void undone(String description) {
        LOG.log(Level.FINE, "Undo {0}", description);
    }

    @Override
    public void redone(String description) {
        LOG.log(Level.FINE, "Redo {0}", description);
    }

    @Override
    public void toolChanged(ToolId previous, ToolId current) {
        LOG.log(Level.FINE, "Tool {0} -> {1}", new Object[]{previous, current});
    }

    @Override
    public void selectionChanged(Selection selection) {
        if (selection == null) {
            LOG.fine("Selection cleared");
        } else {
            LOG.log(Level.FINE, "Selection {0}", selection);
        }
    }

    @Override
    public void gridResized(int width, int height) {
        LOG.log(Level.FINE, "Grid resized to {0}", width + "x" + height);
    }

    @Override
    public void gridCleared() {
        LOG.fine("Grid cleared");
    }
}
