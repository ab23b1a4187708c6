package org.asciicanvas.history;

import org.asciicanvas.grid.Grid;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;

/**
 * Bounded undo/redo stacks. Pushing a new command discards the redo stack; once the undo stack is
 * full the oldest entry is dropped.
 */
public class History {

    public static final int DEFAULT_CAPACITY = 100;

    private final Deque<Command> undoStack = new ArrayDeque<>();
    private final Deque<Command> redoStack = new ArrayDeque<>();
    private final int capacity;

    public History() {
        this(DEFAULT_CAPACITY);
    }

    public History(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("History capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Record an already applied command.
     */
    public void push(Command command) {
        Objects.requireNonNull(command, "command");
        redoStack.clear();
        if (undoStack.size() >= capacity) {
            undoStack.removeFirst();
        }
        undoStack.addLast(command);
    }

    /**
     * Apply the command to the grid and record it.
     */
    public void execute(Command command, Grid grid) {
        Objects.requireNonNull(command, "command");
        command.apply(grid);
        push(command);
    }

    public boolean undo(Grid grid) {
        Command command = undoStack.pollLast();
        if (command == null) {
            return false;
        }
        command.undo(grid);
        redoStack.addLast(command);
        return true;
    }

    public boolean redo(Grid grid) {
        Command command = redoStack.pollLast();
        if (command == null) {
            return false;
        }
        command.apply(grid);
        undoStack.addLast(command);
        return true;
    }

    public boolean canUndo() {
        return !undoStack.isEmpty();
    }

    public boolean canRedo() {
        return !redoStack.isEmpty();
    }

    public int undoCount() {
        return undoStack.size();
    }

    public int redoCount() {
        return redoStack.size();
    }

    public Optional<String> undoDescription() {
        return Optional.ofNullable(undoStack.peekLast()).map(Command::description);
    }

    public Optional<String> redoDescription() {
        return Optional.ofNullable(redoStack.peekLast()).map(Command::description);
    }

    public int capacity() {
        return capacity;
    }

    public void clear() {
        undoStack.clear();
        redoStack.clear();
    }
}
