package org.asciicanvas.tools;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ToolIdTest {

    @Test
    void shortcuts_caseInsensitive() {
        assertEquals(Optional.of(ToolId.RECTANGLE), ToolId.fromShortcut('r'));
        assertEquals(Optional.of(ToolId.SELECT), ToolId.fromShortcut('V'));
        assertEquals(Optional.of(ToolId.ERASER), ToolId.fromShortcut('e'));
        assertTrue(ToolId.fromShortcut('q').isEmpty());
    }

    @Test
    void parse_nameAliasOrShortcut() {
        assertEquals(Optional.of(ToolId.RECTANGLE), ToolId.parse("rect"));
        assertEquals(Optional.of(ToolId.DIAMOND), ToolId.parse(" Diamond "));
        assertEquals(Optional.of(ToolId.FREEHAND), ToolId.parse("f"));
        assertTrue(ToolId.parse("").isEmpty());
        assertTrue(ToolId.parse(null).isEmpty());
    }

    @Test
    void shortcuts_areUnique() {
        for (ToolId a : ToolId.values()) {
            for (ToolId b : ToolId.values()) {
                if (a != b) {
                    assertNotEquals(a.getShortcut(), b.getShortcut());
                }
            }
        }
    }

    @Test
    void borderStyle_parse() {
        assertEquals(Optional.of(BorderStyle.ROUNDED), BorderStyle.parse("rounded"));
        assertTrue(BorderStyle.parse("wavy").isEmpty());
        assertEquals('╭', BorderStyle.ROUNDED.topLeft());
        assertEquals('*', BorderStyle.DOTTED.horizontal());
    }
}
