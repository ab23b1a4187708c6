package org.asciicanvas.tools;

import org.asciicanvas.grid.DrawOp;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keyboard-driven text entry starting at the last clicked cell.
 * <p>
 * Every key produces an incremental preview. The staged ops are handed over as one finished batch
 * by the next pointer-down or by {@link #commitPending(ToolContext)}.
 */
public class TextTool implements Tool {

    private record Position(int x, int y) {
    }

    private final Map<Position, Integer> typed = new LinkedHashMap<>();
    private final List<DrawOp> staged = new ArrayList<>();
    private boolean editing;
    private int startX;
    private int cursorX;
    private int cursorY;

    @Override
    public ToolId id() {
        return ToolId.TEXT;
    }

    @Override
    public ToolResult onPointerDown(int x, int y, ToolContext ctx) {
        ToolResult flushed = commitPending(ctx);
        startX = ctx.clampX(x);
        cursorX = startX;
        cursorY = ctx.clampY(y);
        typed.clear();
        editing = true;
        return flushed;
    }

    @Override
    public ToolResult onPointerMove(int x, int y, ToolContext ctx) {
        return ToolResult.none();
    }

    @Override
    public ToolResult onPointerUp(int x, int y, ToolContext ctx) {
        return ToolResult.none();
    }

    @Override
    public ToolResult onKey(KeyInput key, ToolContext ctx) {
        if (!editing) {
            return ToolResult.none();
        }
        return switch (key.kind()) {
            case CHARACTER -> type(key.codePoint(), ctx);
            case NEWLINE -> newline(ctx);
            case BACKSPACE -> backspace();
            case DELETE -> delete();
            case LEFT -> left();
            case RIGHT -> right(ctx);
        };
    }

    private ToolResult type(int codePoint, ToolContext ctx) {
        if (Character.isISOControl(codePoint) || !Character.isValidCodePoint(codePoint)) {
            return ToolResult.none();
        }
        int lastColumn = ctx.gridWidth() - 1;
        if (cursorX >= lastColumn || startX >= lastColumn) {
            return ToolResult.none();
        }
        typed.put(new Position(cursorX, cursorY), codePoint);
        DrawOp op = DrawOp.of(cursorX, cursorY, codePoint);
        cursorX++;
        return emit(op);
    }

    private ToolResult newline(ToolContext ctx) {
        if (cursorY + 1 < ctx.gridHeight()) {
            cursorX = startX;
            cursorY++;
        }
        return ToolResult.none();
    }

    private ToolResult backspace() {
        if (cursorX <= startX) {
            return ToolResult.none();
        }
        cursorX--;
        typed.remove(new Position(cursorX, cursorY));
        return emit(DrawOp.blank(cursorX, cursorY));
    }

    private ToolResult delete() {
        if (typed.remove(new Position(cursorX, cursorY)) == null) {
            return ToolResult.none();
        }
        return emit(DrawOp.blank(cursorX, cursorY));
    }

    private ToolResult left() {
        if (cursorX > startX) {
            cursorX--;
        }
        return ToolResult.none();
    }

    private ToolResult right(ToolContext ctx) {
        if (cursorX < ctx.gridWidth() - 1 && typed.containsKey(new Position(cursorX, cursorY))) {
            cursorX++;
        }
        return ToolResult.none();
    }

    private ToolResult emit(DrawOp op) {
        staged.add(op);
        return ToolResult.stroke(List.of(op));
    }

    @Override
    public ToolResult commitPending(ToolContext ctx) {
        if (staged.isEmpty()) {
            return ToolResult.none();
        }
        List<DrawOp> ops = new ArrayList<>(staged);
        staged.clear();
        return ToolResult.finished(ops);
    }

    public boolean hasPendingText() {
        return !staged.isEmpty();
    }

    public int getCursorX() {
        return cursorX;
    }

    public int getCursorY() {
        return cursorY;
    }

    @Override
    public void reset() {
        editing = false;
        typed.clear();
        staged.clear();
    }

    @Override
    public boolean isActive() {
        return editing;
    }
}
