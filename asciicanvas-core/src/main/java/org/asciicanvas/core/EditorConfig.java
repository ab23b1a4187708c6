package org.asciicanvas.core;

import org.asciicanvas.grid.Grid;
import org.asciicanvas.tools.BorderStyle;
import org.asciicanvas.tools.ToolId;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Editor settings.
 * <p>
 * Defaults can be overridden via env ASCIICANVAS_WIDTH, ASCIICANVAS_HEIGHT, ASCIICANVAS_HISTORY_DEPTH,
 * ASCIICANVAS_BORDER_STYLE, ASCIICANVAS_FREEHAND_CHAR, ASCIICANVAS_ERASER_SIZE and ASCIICANVAS_TOOL.
 * Malformed values are logged and replaced by the default.
 */
public final class EditorConfig {
    private static final Logger LOG = Logger.getLogger(EditorConfig.class.getName());

    public static final int DEFAULT_WIDTH = 80;
    public static final int DEFAULT_HEIGHT = 40;
    public static final int DEFAULT_HISTORY_DEPTH = 100;
    public static final int DEFAULT_FREEHAND_CHAR = '*';
    public static final int DEFAULT_ERASER_SIZE = 1;

    private static final int MAX_DIMENSION = Grid.MAX_DIMENSION;

    private final int width;
    private final int height;
    private final int historyDepth;
    private final BorderStyle borderStyle;
    private final int freehandChar;
    private final int eraserSize;
    private final ToolId initialTool;

    public EditorConfig(int width, int height, int historyDepth, BorderStyle borderStyle,
                        int freehandChar, int eraserSize, ToolId initialTool) {
        if (width < 1 || height < 1 || width > MAX_DIMENSION || height > MAX_DIMENSION) {
            throw new IllegalArgumentException("Grid dimensions out of range: " + width + "x" + height);
        }
        if (historyDepth < 1) {
            throw new IllegalArgumentException("History depth must be positive: " + historyDepth);
        }
        if (eraserSize < 1) {
            throw new IllegalArgumentException("Eraser size must be positive: " + eraserSize);
        }
        if (!Character.isValidCodePoint(freehandChar) || Character.isISOControl(freehandChar)) {
            throw new IllegalArgumentException("Freehand character is not printable: " + freehandChar);
        }
        this.width = width;
        this.height = height;
        this.historyDepth = historyDepth;
        this.borderStyle = Objects.requireNonNull(borderStyle, "borderStyle");
        this.freehandChar = freehandChar;
        this.eraserSize = eraserSize;
        this.initialTool = Objects.requireNonNull(initialTool, "initialTool");
    }

    public static EditorConfig defaults() {
        return new EditorConfig(DEFAULT_WIDTH, DEFAULT_HEIGHT, DEFAULT_HISTORY_DEPTH, BorderStyle.SINGLE,
                DEFAULT_FREEHAND_CHAR, DEFAULT_ERASER_SIZE, ToolId.RECTANGLE);
    }

    public static EditorConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static EditorConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        int width = intValue(env, "ASCIICANVAS_WIDTH", DEFAULT_WIDTH, 1, MAX_DIMENSION);
        int height = intValue(env, "ASCIICANVAS_HEIGHT", DEFAULT_HEIGHT, 1, MAX_DIMENSION);
        int depth = intValue(env, "ASCIICANVAS_HISTORY_DEPTH", DEFAULT_HISTORY_DEPTH, 1, Integer.MAX_VALUE);
        int eraser = intValue(env, "ASCIICANVAS_ERASER_SIZE", DEFAULT_ERASER_SIZE, 1, MAX_DIMENSION);
        BorderStyle style = enumValue(env, "ASCIICANVAS_BORDER_STYLE", BorderStyle.SINGLE, BorderStyle::parse);
        ToolId tool = enumValue(env, "ASCIICANVAS_TOOL", ToolId.RECTANGLE, ToolId::parse);
        int freehand = DEFAULT_FREEHAND_CHAR;
        String charEnv = env.get("ASCIICANVAS_FREEHAND_CHAR");
        if (charEnv != null && !charEnv.isEmpty()) {
            int cp = charEnv.codePointAt(0);
            if (charEnv.codePointCount(0, charEnv.length()) == 1 && !Character.isISOControl(cp)) {
                freehand = cp;
            } else {
                LOG.log(Level.WARNING, "Invalid ASCIICANVAS_FREEHAND_CHAR, using default: {0}", charEnv);
            }
        }
        return new EditorConfig(width, height, depth, style, freehand, eraser, tool);
    }

    private static int intValue(Map<String, String> env, String name, int fallback, int min, int max) {
        String raw = env.get(name);
        if (raw == null || raw.isEmpty()) {
            return fallback;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            if (value < min || value > max) {
                LOG.log(Level.WARNING, name + " out of range " + min + "-" + max + ", using default " + fallback);
                return fallback;
            }
            return value;
        } catch (NumberFormatException e) {
            LOG.log(Level.WARNING, "Invalid " + name + ", using default " + fallback + ": " + raw);
            return fallback;
        }
    }

    private static <T> T enumValue(Map<String, String> env, String name, T fallback, Function<String, Optional<T>> parser) {
        String raw = env.get(name);
        if (raw == null || raw.isEmpty()) {
            return fallback;
        }
        Optional<T> parsed = parser.apply(raw.trim());
        if (parsed.isEmpty()) {
            LOG.log(Level.WARNING, "Invalid " + name + ", using default " + fallback + ": " + raw);
        }
        return parsed.orElse(fallback);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getHistoryDepth() {
        return historyDepth;
    }

    public BorderStyle getBorderStyle() {
        return borderStyle;
    }

    public int getFreehandChar() {
        return freehandChar;
    }

    public int getEraserSize() {
        return eraserSize;
    }

    public ToolId getInitialTool() {
        return initialTool;
    }

    public EditorConfig withSize(int newWidth, int newHeight) {
        return new EditorConfig(newWidth, newHeight, historyDepth, borderStyle, freehandChar, eraserSize, initialTool);
    }

    public EditorConfig withHistoryDepth(int depth) {
        return new EditorConfig(width, height, depth, borderStyle, freehandChar, eraserSize, initialTool);
    }

    public EditorConfig withBorderStyle(BorderStyle style) {
        return new EditorConfig(width, height, historyDepth, style, freehandChar, eraserSize, initialTool);
    }

    public EditorConfig withFreehandChar(int codePoint) {
        return new EditorConfig(width, height, historyDepth, borderStyle, codePoint, eraserSize, initialTool);
    }

    public EditorConfig withEraserSize(int size) {
        return new EditorConfig(width, height, historyDepth, borderStyle, freehandChar, size, initialTool);
    }

    public EditorConfig withInitialTool(ToolId tool) {
        return new EditorConfig(width, height, historyDepth, borderStyle, freehandChar, eraserSize, tool);
    }

    @Override
    public String toString() {
        return "EditorConfig{" + width + "x" + height + ", historyDepth=" + historyDepth
                + ", borderStyle=" + borderStyle + ", eraserSize=" + eraserSize + ", initialTool=" + initialTool + '}';
    }
}
