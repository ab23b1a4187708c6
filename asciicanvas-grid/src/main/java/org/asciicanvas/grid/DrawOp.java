package org.asciicanvas.grid;

import java.util.Objects;

/**
 * A pending write of one cell at a grid position. Produced by tools, consumed by commands.
 */
public record DrawOp(int x, int y, Cell cell) {

    public DrawOp {
        Objects.requireNonNull(cell, "cell");
    }

    public static DrawOp of(int x, int y, int codePoint) {
        return new DrawOp(x, y, Cell.of(codePoint));
    }

    public static DrawOp blank(int x, int y) {
        return new DrawOp(x, y, Cell.blank());
    }
}
