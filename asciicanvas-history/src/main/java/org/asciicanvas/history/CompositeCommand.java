package org.asciicanvas.history;

import org.asciicanvas.grid.Grid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Several commands treated as one history entry. Children apply in order and undo in reverse.
 */
public final class CompositeCommand implements Command {

    private final List<Command> children = new ArrayList<>();
    private final String description;
    private boolean applied;

    public CompositeCommand(String description) {
        this.description = Objects.requireNonNull(description, "description");
    }

    public CompositeCommand(String description, List<? extends Command> commands) {
        this(description);
        commands.forEach(this::add);
    }

    public CompositeCommand add(Command command) {
        if (applied) {
            throw new IllegalStateException("Cannot add to an applied composite");
        }
        children.add(Objects.requireNonNull(command, "command"));
        return this;
    }

    public List<Command> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    @Override
    public void apply(Grid grid) {
        if (applied) {
            return;
        }
        for (Command child : children) {
            child.apply(grid);
        }
        applied = true;
    }

    @Override
    public void undo(Grid grid) {
        if (!applied) {
            return;
        }
        for (int i = children.size() - 1; i >= 0; i--) {
            children.get(i).undo(grid);
        }
        applied = false;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public CommandKind kind() {
        return CommandKind.COMPOSITE;
    }

    @Override
    public boolean isApplied() {
        return applied;
    }
}
