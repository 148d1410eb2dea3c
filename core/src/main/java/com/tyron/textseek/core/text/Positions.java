package com.tyron.textseek.core.text;

import com.tyron.textseek.api.text.TextDocument;
import com.tyron.textseek.api.text.TextPosition;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Position arithmetic that respects line boundaries.
 *
 * The line break of a line is addressed by {@code character == lineLength}; stepping past it
 * moves to the start of the next line.
 */
public final class Positions {

    private static final TextPosition ZERO = new TextPosition(0, 0);

    private Positions() {
    }

    public static TextPosition zero() {
        return ZERO;
    }

    /**
     * @return the end of the last line.
     */
    public static TextPosition last(@NotNull TextDocument document) {
        int line = document.getLineCount() - 1;
        return new TextPosition(line, document.getLineLength(line));
    }

    public static TextPosition lineStart(int line) {
        return new TextPosition(line, 0);
    }

    public static TextPosition lineEnd(int line, @NotNull TextDocument document) {
        return new TextPosition(line, document.getLineLength(line));
    }

    /**
     * @return the position right after the line break of {@code line}, or the end of the line
     * if it is the last one.
     */
    public static TextPosition lineBreak(int line, @NotNull TextDocument document) {
        return line + 1 < document.getLineCount() ? lineStart(line + 1) : lineEnd(line, document);
    }

    /**
     * @return the position one character after {@code position}, or {@code null} at the document end.
     */
    public static @Nullable TextPosition next(@NotNull TextPosition position, @NotNull TextDocument document) {
        if (position.character() < document.getLineLength(position.line())) {
            return position.withCharacter(position.character() + 1);
        }
        if (position.line() + 1 < document.getLineCount()) {
            return lineStart(position.line() + 1);
        }
        return null;
    }

    /**
     * @return the position one character before {@code position}, or {@code null} at the document start.
     */
    public static @Nullable TextPosition previous(@NotNull TextPosition position, @NotNull TextDocument document) {
        if (position.character() > 0) {
            return position.withCharacter(position.character() - 1);
        }
        if (position.line() > 0) {
            return lineEnd(position.line() - 1, document);
        }
        return null;
    }

    /**
     * Moves {@code delta} characters (line breaks count as one), or returns {@code null} if that
     * would leave the document.
     */
    public static @Nullable TextPosition offset(@NotNull TextPosition position, int delta,
                                                @NotNull TextDocument document) {
        TextPosition current = position;
        while (delta > 0 && current != null) {
            current = next(current, document);
            delta--;
        }
        while (delta < 0 && current != null) {
            current = previous(current, document);
            delta++;
        }
        return current;
    }

    public static boolean isValid(@NotNull TextPosition position, @NotNull TextDocument document) {
        return position.line() < document.getLineCount()
                && position.character() <= document.getLineLength(position.line());
    }

    public static TextPosition clamp(@NotNull TextPosition position, @NotNull TextDocument document) {
        if (position.line() >= document.getLineCount()) {
            return last(document);
        }
        int length = document.getLineLength(position.line());
        return position.character() > length ? position.withCharacter(length) : position;
    }

    public static TextPosition requireValid(@NotNull TextPosition position, @NotNull TextDocument document) {
        if (!isValid(position, document)) {
            throw new IllegalArgumentException("position " + position + " is out of bounds for lineCount="
                    + document.getLineCount());
        }
        return position;
    }
}
