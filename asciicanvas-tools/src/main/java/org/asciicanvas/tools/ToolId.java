package org.asciicanvas.tools;

import java.util.Locale;
import java.util.Optional;

/**
 * Drawing modes, each with a one-letter keyboard shortcut.
 */
public enum ToolId {
    RECTANGLE('R', "Rectangle", "rect"),
    LINE('L', "Line"),
    ARROW('A', "Arrow"),
    DIAMOND('D', "Diamond"),
    TEXT('T', "Text"),
    FREEHAND('F', "Freehand"),
    SELECT('V', "Select"),
    ERASER('E', "Eraser");

    private final char shortcut;
    private final String displayName;
    private final String[] aliases;

    ToolId(char shortcut, String displayName, String... aliases) {
        this.shortcut = shortcut;
        this.displayName = displayName;
        this.aliases = aliases;
    }

    public char getShortcut() {
        return shortcut;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static Optional<ToolId> fromShortcut(int key) {
        int upper = Character.toUpperCase(key);
        for (ToolId id : values()) {
            if (id.shortcut == upper) {
                return Optional.of(id);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolve a display name, alias or shortcut letter, ignoring case.
     */
    public static Optional<ToolId> parse(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String s = name.trim().toLowerCase(Locale.ROOT);
        for (ToolId id : values()) {
            if (id.displayName.toLowerCase(Locale.ROOT).equals(s)) {
                return Optional.of(id);
            }
            for (String alias : id.aliases) {
                if (alias.equals(s)) {
                    return Optional.of(id);
                }
            }
        }
        if (s.length() == 1) {
            return fromShortcut(s.charAt(0));
        }
        return Optional.empty();
    }
}
