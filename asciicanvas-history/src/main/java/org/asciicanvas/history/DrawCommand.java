package org.asciicanvas.history;

import org.asciicanvas.grid.Cell;
import org.asciicanvas.grid.DrawOp;
import org.asciicanvas.grid.Grid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A batch of draw operations applied as one step.
 * <p>
 * The cell each op overwrites is captured right before it is written, and undo restores those cells
 * in reverse order, so a batch that writes the same cell twice still reverts to the original value.
 */
public final class DrawCommand implements Command {

    /**
     * Merging stops once the combined batch would reach this many ops.
     */
    public static final int MERGE_LIMIT = 1000;

    private final List<DrawOp> ops;
    private final List<Cell> previous = new ArrayList<>();
    private String description;
    private final boolean customDescription;
    private boolean applied;

    public DrawCommand(List<DrawOp> ops) {
        this.ops = new ArrayList<>(Objects.requireNonNull(ops, "ops"));
        this.description = defaultDescription(this.ops.size());
        this.customDescription = false;
    }

    public DrawCommand(List<DrawOp> ops, String description) {
        this.ops = new ArrayList<>(Objects.requireNonNull(ops, "ops"));
        this.description = Objects.requireNonNull(description, "description");
        this.customDescription = true;
    }

    private static String defaultDescription(int count) {
        return count == 1 ? "Draw" : "Draw " + count + " cells";
    }

    @Override
    public void apply(Grid grid) {
        if (applied) {
            return;
        }
        previous.clear();
        for (DrawOp op : ops) {
            previous.add(grid.get(op.x(), op.y()).orElse(null));
            grid.set(op.x(), op.y(), op.cell());
        }
        applied = true;
    }

    @Override
    public void undo(Grid grid) {
        if (!applied) {
            return;
        }
        for (int i = ops.size() - 1; i >= 0; i--) {
            Cell old = previous.get(i);
            if (old != null) {
                DrawOp op = ops.get(i);
                grid.set(op.x(), op.y(), old);
            }
        }
        previous.clear();
        applied = false;
    }

    public boolean canMerge(DrawCommand other) {
        return other != null && other != this && !applied
                && ops.size() + other.ops.size() < MERGE_LIMIT;
    }

    /**
     * Append the other batch's ops to this one.
     *
     * @return false (and no change) if the batches cannot be merged
     */
    public boolean merge(DrawCommand other) {
        if (!canMerge(other)) {
            return false;
        }
        ops.addAll(other.ops);
        if (!customDescription) {
            description = "Draw " + ops.size() + " cells";
        }
        return true;
    }

    public List<DrawOp> getOps() {
        return Collections.unmodifiableList(ops);
    }

    public int size() {
        return ops.size();
    }

    public boolean isEmpty() {
        return ops.isEmpty();
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public CommandKind kind() {
        return CommandKind.DRAW_BATCH;
    }

    @Override
    public boolean isApplied() {
        return applied;
    }
}
