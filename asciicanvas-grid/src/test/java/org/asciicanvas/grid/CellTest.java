package org.asciicanvas.grid;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CellTest {

    @Test
    void blank_isSpaceWithoutStyle() {
        Cell blank = Cell.blank();
        assertEquals(' ', blank.getCodePoint());
        assertEquals(CellStyle.NONE, blank.getStyle());
        assertTrue(blank.isEmpty());
        assertFalse(blank.isVisible());
        assertSame(blank, Cell.of(' '));
    }

    @Test
    void withStyle_keepsCharacter() {
        Cell c = Cell.of('x').withStyle(CellStyle.combine(CellStyle.BOLD, CellStyle.UNDERLINE));
        assertEquals('x', c.getCodePoint());
        assertTrue(c.hasStyle(CellStyle.BOLD));
        assertTrue(c.hasStyle(CellStyle.UNDERLINE));
        assertFalse(c.hasStyle(CellStyle.ITALIC));
        assertEquals("bold,underline", CellStyle.describe(c.getStyle()));
    }

    @Test
    void isVisible_rejectsAllWhitespace() {
        assertTrue(Cell.of('A').isVisible());
        assertTrue(Cell.of('┌').isVisible());
        assertFalse(Cell.of('\t').isVisible());
        assertFalse(Cell.of(' ').isVisible());
        assertFalse(Cell.of(' ').isEmpty());
    }

    @Test
    void equality_includesStyle() {
        assertEquals(Cell.of('a'), new Cell('a', CellStyle.NONE));
        assertNotEquals(Cell.of('a'), Cell.of('a').withStyle(CellStyle.BOLD));
        assertEquals(Cell.of('a').hashCode(), new Cell('a', 0).hashCode());
    }

    @Test
    void invalidCodePoint_rejected() {
        assertThrows(IllegalArgumentException.class, () -> Cell.of(-1));
        assertThrows(IllegalArgumentException.class, () -> Cell.of(0x110000));
    }

    @Test
    void unknownStyleBits_masked() {
        assertEquals(CellStyle.BOLD, new Cell('a', CellStyle.BOLD | 0x100).getStyle());
    }
}
