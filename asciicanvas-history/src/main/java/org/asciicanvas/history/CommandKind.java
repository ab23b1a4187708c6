package org.asciicanvas.history;

/**
 * Variant tag of a {@link Command}. Only commands of the same kind are candidates for merging.
 */
public enum CommandKind {
    SET_CELL,
    CLEAR_CELL,
    CLEAR_GRID,
    RESIZE,
    DRAW_BATCH,
    COMPOSITE
}
