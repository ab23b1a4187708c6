package org.asciicanvas.core;

import org.asciicanvas.tools.ToolId;

/**
 * Session state after handling one input.
 *
 * @param needsRedraw whether anything visible changed since the last render pull
 * @param tool        active tool
 * @param canUndo     undo stack is non-empty
 * @param canRedo     redo stack is non-empty
 * @param copiedText  text for the system clipboard, or null if the input copied nothing
 */
public record EditorEvent(boolean needsRedraw, ToolId tool, boolean canUndo, boolean canRedo, String copiedText) {

    public boolean hasCopiedText() {
        return copiedText != null;
    }
}
