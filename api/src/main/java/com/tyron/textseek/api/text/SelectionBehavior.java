package com.tyron.textseek.api.text;

import java.util.Locale;

/**
 * How selections relate to characters in the calling editing mode.
 */
public enum SelectionBehavior {
    /**
     * Selections sit between characters and can be empty.
     */
    CARET,

    /**
     * Selections sit on characters and are never empty.
     */
    CHARACTER;

    /**
     * @return the last column a cursor may occupy on a line of the given length.
     */
    public int lastColumn(int lineLength) {
        return this == CARET ? lineLength : lineLength - 1;
    }

    /**
     * Parses a configuration value ("caret" / "character"), case-insensitively.
     */
    public static SelectionBehavior parse(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("selection behavior is null");
        }
        String v = raw.trim().toUpperCase(Locale.ROOT);
        try {
            return valueOf(v);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown selection behavior: " + raw, e);
        }
    }
}
