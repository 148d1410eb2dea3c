package com.tyron.textseek.api.text;

import org.jetbrains.annotations.NotNull;

/**
 * A position in a {@link TextDocument}, in line/character coordinates.
 *
 * {@code character == lineLength} denotes the line-break slot of the line.
 * Ordering is lexicographic on (line, character).
 */
public record TextPosition(int line, int character) implements Comparable<TextPosition> {

    public TextPosition {
        if (line < 0) {
            throw new IllegalArgumentException("line < 0: " + line);
        }
        if (character < 0) {
            throw new IllegalArgumentException("character < 0: " + character);
        }
    }

    public static TextPosition of(int line, int character) {
        return new TextPosition(line, character);
    }

    public TextPosition withCharacter(int character) {
        return new TextPosition(line, character);
    }

    public boolean isBefore(@NotNull TextPosition other) {
        return compareTo(other) < 0;
    }

    public boolean isAfter(@NotNull TextPosition other) {
        return compareTo(other) > 0;
    }

    public static TextPosition min(@NotNull TextPosition a, @NotNull TextPosition b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public static TextPosition max(@NotNull TextPosition a, @NotNull TextPosition b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    @Override
    public int compareTo(@NotNull TextPosition other) {
        if (line != other.line) {
            return Integer.compare(line, other.line);
        }
        return Integer.compare(character, other.character);
    }

    @Override
    public String toString() {
        return line + ":" + character;
    }
}
