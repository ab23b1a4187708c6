package org.asciicanvas.core;

import org.asciicanvas.grid.DrawOp;
import org.asciicanvas.grid.Grid;
import org.asciicanvas.grid.Selection;
import org.asciicanvas.grid.SelectionClipboard;
import org.asciicanvas.grid.export.AsciiExporter;
import org.asciicanvas.grid.export.ExportOptions;
import org.asciicanvas.grid.render.DirtyTracker;
import org.asciicanvas.grid.render.GridRenderer;
import org.asciicanvas.grid.render.RenderFrame;
import org.asciicanvas.history.ClearGridCommand;
import org.asciicanvas.history.Command;
import org.asciicanvas.history.CompositeCommand;
import org.asciicanvas.history.DrawCommand;
import org.asciicanvas.history.History;
import org.asciicanvas.history.ResizeCommand;
import org.asciicanvas.tools.ArrowTool;
import org.asciicanvas.tools.BorderStyle;
import org.asciicanvas.tools.DiamondTool;
import org.asciicanvas.tools.EraserTool;
import org.asciicanvas.tools.FreehandTool;
import org.asciicanvas.tools.KeyInput;
import org.asciicanvas.tools.LineTool;
import org.asciicanvas.tools.RectangleTool;
import org.asciicanvas.tools.SelectTool;
import org.asciicanvas.tools.TextTool;
import org.asciicanvas.tools.Tool;
import org.asciicanvas.tools.ToolContext;
import org.asciicanvas.tools.ToolId;
import org.asciicanvas.tools.ToolResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Editing session: owns the grid, the active tool, the undo history and the dirty tracker, and routes
 * host pointer and keyboard events through them.
 * <p>
 * Unfinished tool output is kept as a preview overlay and never touches the grid. Finished output is
 * committed to the grid as one undoable command. Every input handler returns an {@link EditorEvent}
 * describing the state afterwards; the host pulls frames with {@link #renderFrame()}.
 * <p>
 * Not thread-safe; drive it from a single UI thread.
 */
public class EditorSession {
    private static final Logger LOG = Logger.getLogger(EditorSession.class.getName());

    private final EditorConfig config;
    private final Grid grid;
    private final History history;
    private final DirtyTracker dirtyTracker = new DirtyTracker();
    private final GridRenderer renderer = new GridRenderer();
    private final List<DrawOp> preview = new ArrayList<>();
    private final List<EditorListener> listeners = new CopyOnWriteArrayList<>();

    private Tool tool;
    private ToolId toolId;
    private BorderStyle borderStyle;
    private int freehandChar;
    private int eraserSize;
    private Selection selection;
    private SelectionClipboard clipboard = SelectionClipboard.empty();

    private Selection moveOrigin;
    private SelectionClipboard moveContent;

    public EditorSession() {
        this(EditorConfig.defaults());
    }

    public EditorSession(EditorConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.grid = new Grid(config.getWidth(), config.getHeight());
        this.history = new History(config.getHistoryDepth());
        this.borderStyle = config.getBorderStyle();
        this.freehandChar = config.getFreehandChar();
        this.eraserSize = config.getEraserSize();
        this.toolId = config.getInitialTool();
        this.tool = createTool(toolId);
        dirtyTracker.requestFullRedraw();
    }

    public void addListener(EditorListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(EditorListener listener) {
        listeners.remove(listener);
    }

    // --- pointer input ---

    public EditorEvent onPointerDown(int x, int y) {
        clearPreview();
        Selection before = tool.getSelection().orElse(null);
        ToolResult result = tool.onPointerDown(x, y, context());
        applyResult(result);
        if (tool instanceof SelectTool select && select.isMoving()) {
            moveOrigin = before;
            moveContent = SelectionClipboard.capture(grid, before);
        }
        syncSelection();
        return event(null);
    }

    public EditorEvent onPointerMove(int x, int y) {
        ToolResult result = tool.onPointerMove(x, y, context());
        applyResult(result);
        syncSelection();
        if (moveOrigin != null && selection != null) {
            replacePreview(moveContent.toOps(selection.minX(), selection.minY(), grid.getWidth(), grid.getHeight()));
        }
        return event(null);
    }

    public EditorEvent onPointerUp(int x, int y) {
        ToolResult result = tool.onPointerUp(x, y, context());
        applyResult(result);
        syncSelection();
        if (moveOrigin != null) {
            Selection from = moveOrigin;
            moveOrigin = null;
            moveContent = null;
            if (selection != null && !selection.equals(from)) {
                moveRegion(from, selection);
            }
        }
        return event(null);
    }

    // --- keyboard input ---

    /**
     * Handle a key press. {@code key} is a single character or a named key such as "Escape", "Enter",
     * "Delete", "Backspace", "ArrowLeft" or "ArrowRight".
     */
    public EditorEvent onKeyDown(String key, KeyModifiers modifiers) {
        Objects.requireNonNull(key, "key");
        KeyModifiers mods = modifiers == null ? KeyModifiers.NONE : modifiers;
        if ("Escape".equals(key)) {
            return cancel();
        }
        if (mods.ctrl()) {
            return switch (key.toLowerCase(Locale.ROOT)) {
                case "z" -> mods.shift() ? redo() : undo();
                case "y" -> redo();
                case "c" -> copy();
                case "x" -> cut();
                case "v" -> paste();
                default -> event(null);
            };
        }
        switch (key) {
            case "Delete", "Backspace" -> {
                if (toolId == ToolId.SELECT) {
                    return deleteSelection();
                }
                return sendKey(KeyInput.of("Delete".equals(key) ? KeyInput.Kind.DELETE : KeyInput.Kind.BACKSPACE));
            }
            case "Enter" -> {
                return sendKey(KeyInput.of(KeyInput.Kind.NEWLINE));
            }
            case "ArrowLeft" -> {
                return sendKey(KeyInput.of(KeyInput.Kind.LEFT));
            }
            case "ArrowRight" -> {
                return sendKey(KeyInput.of(KeyInput.Kind.RIGHT));
            }
            default -> {
            }
        }
        if (key.isEmpty() || key.codePointCount(0, key.length()) != 1) {
            return event(null);
        }
        int cp = key.codePointAt(0);
        if (!tool.isActive() && !mods.alt()) {
            Optional<ToolId> shortcut = ToolId.fromShortcut(cp);
            if (shortcut.isPresent()) {
                return setTool(shortcut.get());
            }
        }
        return sendKey(KeyInput.character(cp));
    }

    private EditorEvent sendKey(KeyInput input) {
        applyResult(tool.onKey(input, context()));
        return event(null);
    }

    /**
     * Abandon the current gesture, including staged text. An in-progress move snaps the selection back;
     * otherwise the selection is dropped.
     */
    public EditorEvent cancel() {
        Selection kept = moveOrigin;
        moveOrigin = null;
        moveContent = null;
        if (tool instanceof SelectTool select && kept != null) {
            select.setSelection(kept);
        } else {
            tool.reset();
        }
        clearPreview();
        syncSelection();
        return event(null);
    }

    // --- tools ---

    public EditorEvent setTool(ToolId id) {
        Objects.requireNonNull(id, "id");
        if (id == toolId) {
            return event(null);
        }
        commitPending();
        tool.reset();
        clearPreview();
        moveOrigin = null;
        moveContent = null;
        ToolId previous = toolId;
        toolId = id;
        tool = createTool(id);
        syncSelection();
        for (EditorListener l : listeners) {
            l.toolChanged(previous, id);
        }
        return event(null);
    }

    public ToolId getToolId() {
        return toolId;
    }

    public Tool getTool() {
        return tool;
    }

    public BorderStyle getBorderStyle() {
        return borderStyle;
    }

    public void setBorderStyle(BorderStyle style) {
        this.borderStyle = Objects.requireNonNull(style, "style");
    }

    public int getFreehandChar() {
        return freehandChar;
    }

    public void setFreehandChar(int codePoint) {
        if (tool instanceof FreehandTool freehand) {
            freehand.setChar(codePoint);
        }
        this.freehandChar = codePoint;
    }

    public int getEraserSize() {
        return eraserSize;
    }

    public void setEraserSize(int size) {
        this.eraserSize = Math.max(1, size);
        if (tool instanceof EraserTool eraser) {
            eraser.setSize(eraserSize);
        }
    }

    /**
     * Commit text staged by the text tool, if any.
     *
     * @return true if something was committed
     */
    public boolean commitPending() {
        ToolResult result = tool.commitPending(context());
        if (!result.finished()) {
            return false;
        }
        applyResult(result);
        return result.modified();
    }

    private Tool createTool(ToolId id) {
        return switch (id) {
            case RECTANGLE -> new RectangleTool();
            case LINE -> new LineTool();
            case ARROW -> new ArrowTool();
            case DIAMOND -> new DiamondTool();
            case TEXT -> new TextTool();
            case FREEHAND -> new FreehandTool(freehandChar);
            case SELECT -> new SelectTool();
            case ERASER -> new EraserTool(eraserSize);
        };
    }

    private ToolContext context() {
        return new ToolContext(grid.getWidth(), grid.getHeight(), borderStyle);
    }

    private void applyResult(ToolResult result) {
        if (result.finished()) {
            clearPreview();
            if (result.modified()) {
                commitDraw(new DrawCommand(result.ops()));
            }
        } else if (result.incremental()) {
            appendPreview(result.ops());
        } else if (result.modified()) {
            replacePreview(result.ops());
        }
    }

    // --- history ---

    public EditorEvent undo() {
        commitPending();
        clearPreview();
        Optional<String> description = history.undoDescription();
        if (history.undo(grid)) {
            dirtyTracker.requestFullRedraw();
            for (EditorListener l : listeners) {
                l.undone(description.orElse(""));
            }
        }
        return event(null);
    }

    public EditorEvent redo() {
        clearPreview();
        Optional<String> description = history.redoDescription();
        if (history.redo(grid)) {
            dirtyTracker.requestFullRedraw();
            for (EditorListener l : listeners) {
                l.redone(description.orElse(""));
            }
        }
        return event(null);
    }

    public boolean canUndo() {
        return history.canUndo();
    }

    public boolean canRedo() {
        return history.canRedo();
    }

    public History getHistory() {
        return history;
    }

    private void commitDraw(DrawCommand command) {
        history.execute(command, grid);
        for (DrawOp op : command.getOps()) {
            dirtyTracker.markDirty(op.x(), op.y());
        }
        fireCommitted(command);
    }

    private void commitFull(Command command) {
        history.execute(command, grid);
        dirtyTracker.requestFullRedraw();
        fireCommitted(command);
    }

    private void fireCommitted(Command command) {
        for (EditorListener l : listeners) {
            l.commandCommitted(command);
        }
    }

    // --- selection and clipboard ---

    public Optional<Selection> getSelection() {
        return Optional.ofNullable(selection);
    }

    public SelectionClipboard getClipboard() {
        return clipboard;
    }

    public EditorEvent deselect() {
        if (tool instanceof SelectTool select) {
            select.clearSelection();
        }
        syncSelection();
        return event(null);
    }

    /**
     * Copy the selection to the internal clipboard.
     *
     * @return event carrying the copied text: the selection, or the whole trimmed export without one
     */
    public EditorEvent copy() {
        if (selection == null) {
            return event(AsciiExporter.export(grid));
        }
        clipboard = SelectionClipboard.capture(grid, selection);
        return event(clipboard.toText());
    }

    public EditorEvent cut() {
        if (selection == null) {
            return event(null);
        }
        Selection cutRegion = selection;
        clipboard = SelectionClipboard.capture(grid, cutRegion);
        List<DrawOp> ops = blankOps(cutRegion);
        if (!ops.isEmpty()) {
            commitDraw(new DrawCommand(ops, "Cut"));
        }
        deselect();
        return event(clipboard.toText());
    }

    /**
     * Paste the clipboard at the grid origin.
     */
    public EditorEvent paste() {
        return pasteAt(0, 0);
    }

    public EditorEvent pasteAt(int x, int y) {
        List<DrawOp> ops = clipboard.toOps(x, y, grid.getWidth(), grid.getHeight());
        if (!ops.isEmpty()) {
            commitDraw(new DrawCommand(ops, "Paste"));
        }
        return event(null);
    }

    public EditorEvent deleteSelection() {
        if (selection == null) {
            return event(null);
        }
        List<DrawOp> ops = blankOps(selection);
        if (!ops.isEmpty()) {
            commitDraw(new DrawCommand(ops, "Delete"));
        }
        return event(null);
    }

    /**
     * Text for the system clipboard: the internal clipboard content, or empty if nothing was copied.
     */
    public String clipboardText() {
        return clipboard.toText();
    }

    /**
     * Load text from the system clipboard into the internal clipboard, one grid row per line.
     */
    public void pasteText(String text) {
        clipboard = SelectionClipboard.fromText(Objects.requireNonNull(text, "text"));
    }

    private List<DrawOp> blankOps(Selection region) {
        List<DrawOp> ops = new ArrayList<>();
        for (int y = region.minY(); y <= region.maxY(); y++) {
            for (int x = region.minX(); x <= region.maxX(); x++) {
                if (grid.inBounds(x, y)) {
                    ops.add(DrawOp.blank(x, y));
                }
            }
        }
        return ops;
    }

    private void moveRegion(Selection from, Selection to) {
        SelectionClipboard content = SelectionClipboard.capture(grid, from);
        DrawCommand move = new DrawCommand(blankOps(from), "Move selection");
        DrawCommand place = new DrawCommand(content.toOps(to.minX(), to.minY(), grid.getWidth(), grid.getHeight()));
        if (move.merge(place)) {
            commitDraw(move);
            return;
        }
        LOG.log(Level.FINE, "Selection move of {0} cells recorded as composite", from.area());
        commitFull(new CompositeCommand("Move selection", List.of(move, place)));
    }

    private void syncSelection() {
        Selection current = tool.getSelection().orElse(null);
        if (Objects.equals(current, selection)) {
            return;
        }
        if (selection != null) {
            dirtyTracker.markRegionDirty(selection.minX(), selection.minY(), selection.maxX(), selection.maxY());
        }
        if (current != null) {
            dirtyTracker.markRegionDirty(current.minX(), current.minY(), current.maxX(), current.maxY());
        }
        selection = current;
        for (EditorListener l : listeners) {
            l.selectionChanged(current);
        }
    }

    // --- preview ---

    public List<DrawOp> getPreview() {
        return Collections.unmodifiableList(preview);
    }

    private void replacePreview(List<DrawOp> ops) {
        clearPreview();
        appendPreview(ops);
    }

    private void appendPreview(List<DrawOp> ops) {
        for (DrawOp op : ops) {
            preview.add(op);
            dirtyTracker.markDirty(op.x(), op.y());
        }
    }

    private void clearPreview() {
        for (DrawOp op : preview) {
            dirtyTracker.markDirty(op.x(), op.y());
        }
        preview.clear();
    }

    // --- canvas ---

    public Grid getGrid() {
        return grid;
    }

    public DirtyTracker getDirtyTracker() {
        return dirtyTracker;
    }

    public EditorConfig getConfig() {
        return config;
    }

    public EditorEvent clear() {
        commitPending();
        clearPreview();
        commitFull(new ClearGridCommand());
        for (EditorListener l : listeners) {
            l.gridCleared();
        }
        return event(null);
    }

    /**
     * Resize the canvas as one undoable step. Dimensions are clamped to {@code [1, Grid.MAX_DIMENSION]}
     * before anything else changes, so a request that clamps to the current size is a no-op.
     */
    public EditorEvent resize(int width, int height) {
        width = Grid.clampDimension(width);
        height = Grid.clampDimension(height);
        if (width == grid.getWidth() && height == grid.getHeight()) {
            return event(null);
        }
        commitPending();
        tool.reset();
        clearPreview();
        syncSelection();
        commitFull(new ResizeCommand(width, height));
        for (EditorListener l : listeners) {
            l.gridResized(grid.getWidth(), grid.getHeight());
        }
        return event(null);
    }

    public String export() {
        return AsciiExporter.export(grid);
    }

    public String export(ExportOptions options) {
        return AsciiExporter.export(grid, options);
    }

    /**
     * Render commands for everything that changed since the previous frame, with the preview overlaid.
     * Drains the dirty tracker.
     */
    public RenderFrame renderFrame() {
        return renderer.render(grid, dirtyTracker, preview);
    }

    private EditorEvent event(String copiedText) {
        return new EditorEvent(dirtyTracker.hasPendingChanges(), toolId, history.canUndo(), history.canRedo(), copiedText);
    }
}
