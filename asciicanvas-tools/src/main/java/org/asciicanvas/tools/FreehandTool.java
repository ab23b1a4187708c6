package org.asciicanvas.tools;

import org.asciicanvas.grid.DrawOp;

import java.util.List;

/**
 * Free-form drawing with a single configurable glyph.
 */
public class FreehandTool extends StrokeTool {

    public static final int DEFAULT_CHAR = '*';

    private int drawChar = DEFAULT_CHAR;

    public FreehandTool() {
    }

    public FreehandTool(int drawChar) {
        setChar(drawChar);
    }

    @Override
    public ToolId id() {
        return ToolId.FREEHAND;
    }

    public int getChar() {
        return drawChar;
    }

    public void setChar(int codePoint) {
        if (!Character.isValidCodePoint(codePoint) || Character.isISOControl(codePoint)) {
            throw new IllegalArgumentException("Not a printable code point: " + codePoint);
        }
        this.drawChar = codePoint;
    }

    @Override
    protected List<DrawOp> stamp(int x, int y, ToolContext ctx) {
        return List.of(DrawOp.of(x, y, drawChar));
    }
}
