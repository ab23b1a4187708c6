package org.asciicanvas.grid.render;

/**
 * Instruction for the host painting surface, in grid coordinates.
 */
public interface RenderCommand {

    /** Clear the whole surface. */
    record Clear(int width, int height) implements RenderCommand {}

    /** Clear an inclusive rectangle of cells before repainting it. */
    record ClearRect(int x1, int y1, int x2, int y2) implements RenderCommand {}

    /** Paint one visible cell. */
    record DrawCell(int x, int y, int codePoint, int style) implements RenderCommand {}
}
