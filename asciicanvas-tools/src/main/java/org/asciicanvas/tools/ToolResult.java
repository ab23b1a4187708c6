package org.asciicanvas.tools;

import org.asciicanvas.grid.DrawOp;

import java.util.List;

/**
 * Outcome of one tool event.
 *
 * @param ops         draw operations in application order
 * @param modified    whether the ops change anything
 * @param finished    true when the gesture concluded and the ops must be committed
 * @param incremental for unfinished results: true when the ops extend the current preview,
 *                    false when they replace it
 */
public record ToolResult(List<DrawOp> ops, boolean modified, boolean finished, boolean incremental) {

    private static final ToolResult NONE = new ToolResult(List.of(), false, false, false);

    public ToolResult {
        ops = List.copyOf(ops);
    }

    public static ToolResult none() {
        return NONE;
    }

    /**
     * A live preview that replaces whatever was shown before.
     */
    public static ToolResult preview(List<DrawOp> ops) {
        return new ToolResult(ops, !ops.isEmpty(), false, false);
    }

    /**
     * A live preview appended to what was shown before.
     */
    public static ToolResult stroke(List<DrawOp> ops) {
        return new ToolResult(ops, !ops.isEmpty(), false, true);
    }

    public static ToolResult finished(List<DrawOp> ops) {
        return new ToolResult(ops, !ops.isEmpty(), true, false);
    }
}
