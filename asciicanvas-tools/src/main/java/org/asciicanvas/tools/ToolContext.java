package org.asciicanvas.tools;

import java.util.Objects;

/**
 * Grid dimensions and drawing preferences handed to a tool with every event.
 */
public record ToolContext(int gridWidth, int gridHeight, BorderStyle borderStyle) {

    public ToolContext {
        Objects.requireNonNull(borderStyle, "borderStyle");
    }

    public ToolContext(int gridWidth, int gridHeight) {
        this(gridWidth, gridHeight, BorderStyle.SINGLE);
    }

    public int clampX(int x) {
        return Math.max(0, Math.min(x, gridWidth - 1));
    }

    public int clampY(int y) {
        return Math.max(0, Math.min(y, gridHeight - 1));
    }

    public boolean inBounds(int x, int y) {
        return x >= 0 && y >= 0 && x < gridWidth && y < gridHeight;
    }
}
