package org.asciicanvas.tools;

import org.asciicanvas.grid.Selection;

import java.util.Optional;

/**
 * A drawing mode: turns pointer and key events into draw operations.
 * <p>
 * Coordinates are grid coordinates; implementations clamp them to the grid in {@link ToolContext}.
 */
public interface Tool {

    ToolId id();

    ToolResult onPointerDown(int x, int y, ToolContext ctx);

    ToolResult onPointerMove(int x, int y, ToolContext ctx);

    ToolResult onPointerUp(int x, int y, ToolContext ctx);

    default ToolResult onKey(KeyInput key, ToolContext ctx) {
        return ToolResult.none();
    }

    /**
     * Finish any staged work as a committable result without waiting for the next gesture.
     */
    default ToolResult commitPending(ToolContext ctx) {
        return ToolResult.none();
    }

    default Optional<Selection> getSelection() {
        return Optional.empty();
    }

    /**
     * Abandon the current gesture and any staged preview.
     */
    void reset();

    /**
     * True while a gesture is in progress (dragging, drawing or typing).
     */
    boolean isActive();
}
