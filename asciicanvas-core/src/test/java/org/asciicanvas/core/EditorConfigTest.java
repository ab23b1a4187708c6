package org.asciicanvas.core;

import org.asciicanvas.tools.BorderStyle;
import org.asciicanvas.tools.ToolId;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EditorConfigTest {

    @Test
    void defaults() {
        EditorConfig config = EditorConfig.defaults();
        assertEquals(80, config.getWidth());
        assertEquals(40, config.getHeight());
        assertEquals(100, config.getHistoryDepth());
        assertEquals(BorderStyle.SINGLE, config.getBorderStyle());
        assertEquals('*', config.getFreehandChar());
        assertEquals(1, config.getEraserSize());
        assertEquals(ToolId.RECTANGLE, config.getInitialTool());
    }

    @Test
    void fromEnvironment_readsValues() {
        EditorConfig config = EditorConfig.fromEnvironment(Map.of(
                "ASCIICANVAS_WIDTH", "120",
                "ASCIICANVAS_HEIGHT", " 30 ",
                "ASCIICANVAS_HISTORY_DEPTH", "5",
                "ASCIICANVAS_BORDER_STYLE", "double",
                "ASCIICANVAS_FREEHAND_CHAR", "#",
                "ASCIICANVAS_ERASER_SIZE", "3",
                "ASCIICANVAS_TOOL", "line"));
        assertEquals(120, config.getWidth());
        assertEquals(30, config.getHeight());
        assertEquals(5, config.getHistoryDepth());
        assertEquals(BorderStyle.DOUBLE, config.getBorderStyle());
        assertEquals('#', config.getFreehandChar());
        assertEquals(3, config.getEraserSize());
        assertEquals(ToolId.LINE, config.getInitialTool());
    }

    @Test
    void fromEnvironment_invalidValuesFallBack() {
        EditorConfig config = EditorConfig.fromEnvironment(Map.of(
                "ASCIICANVAS_WIDTH", "wide",
                "ASCIICANVAS_HEIGHT", "-4",
                "ASCIICANVAS_BORDER_STYLE", "wavy",
                "ASCIICANVAS_FREEHAND_CHAR", "ab",
                "ASCIICANVAS_ERASER_SIZE", "0"));
        assertEquals(EditorConfig.DEFAULT_WIDTH, config.getWidth());
        assertEquals(EditorConfig.DEFAULT_HEIGHT, config.getHeight());
        assertEquals(BorderStyle.SINGLE, config.getBorderStyle());
        assertEquals('*', config.getFreehandChar());
        assertEquals(1, config.getEraserSize());
    }

    @Test
    void fromEnvironment_emptyMap_isDefaults() {
        EditorConfig config = EditorConfig.fromEnvironment(Map.of());
        assertEquals(EditorConfig.defaults().toString(), config.toString());
    }

    @Test
    void withMethods_deriveCopies() {
        EditorConfig base = EditorConfig.defaults();
        EditorConfig changed = base.withSize(10, 5).withEraserSize(2).withInitialTool(ToolId.TEXT);
        assertEquals(80, base.getWidth());
        assertEquals(10, changed.getWidth());
        assertEquals(5, changed.getHeight());
        assertEquals(2, changed.getEraserSize());
        assertEquals(ToolId.TEXT, changed.getInitialTool());
    }

    @Test
    void invalidValues_rejected() {
        EditorConfig base = EditorConfig.defaults();
        assertThrows(IllegalArgumentException.class, () -> base.withSize(0, 5));
        assertThrows(IllegalArgumentException.class, () -> base.withHistoryDepth(0));
        assertThrows(IllegalArgumentException.class, () -> base.withEraserSize(0));
        assertThrows(IllegalArgumentException.class, () -> base.withFreehandChar('\t'));
        assertThrows(NullPointerException.class, () -> base.withBorderStyle(null));
    }
}
