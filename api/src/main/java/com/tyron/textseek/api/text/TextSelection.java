package com.tyron.textseek.api.text;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A directional selection. The anchor is the fixed end, the active end is the one that moved.
 */
public record TextSelection(@NotNull TextPosition anchor, @NotNull TextPosition active) {

    public TextSelection {
        Objects.requireNonNull(anchor, "anchor");
        Objects.requireNonNull(active, "active");
    }

    public static TextSelection of(TextPosition anchor, TextPosition active) {
        return new TextSelection(anchor, active);
    }

    public TextPosition start() {
        return TextPosition.min(anchor, active);
    }

    public TextPosition end() {
        return TextPosition.max(anchor, active);
    }

    public boolean isEmpty() {
        return anchor.equals(active);
    }

    /**
     * @return true if the active end comes before the anchor.
     */
    public boolean isReversed() {
        return active.isBefore(anchor);
    }

    @Override
    public String toString() {
        return "[" + anchor + " -> " + active + "]";
    }
}
