package org.asciicanvas.grid;

/**
 * Style flags for {@link Cell}. Combine with bitwise OR.
 */
public final class CellStyle {

    public static final int NONE = 0;
    public static final int BOLD = 1;
    public static final int ITALIC = 1 << 1;
    public static final int UNDERLINE = 1 << 2;
    public static final int HIGHLIGHT = 1 << 3;

    static final int ALL = BOLD | ITALIC | UNDERLINE | HIGHLIGHT;

    private CellStyle() {
    }

    public static boolean contains(int style, int flag) {
        return flag != NONE && (style & flag) == flag;
    }

    public static int combine(int... flags) {
        int style = NONE;
        for (int f : flags) {
            style |= f;
        }
        return style & ALL;
    }

    public static String describe(int style) {
        if ((style & ALL) == NONE) {
            return "none";
        }
        StringBuilder sb = new StringBuilder();
        if (contains(style, BOLD)) sb.append("bold,");
        if (contains(style, ITALIC)) sb.append("italic,");
        if (contains(style, UNDERLINE)) sb.append("underline,");
        if (contains(style, HIGHLIGHT)) sb.append("highlight,");
        sb.setLength(sb.length() - 1);
        return sb.toString();
    }
}
