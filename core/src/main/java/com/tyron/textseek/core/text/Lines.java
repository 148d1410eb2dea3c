package com.tyron.textseek.core.text;

import com.tyron.textseek.api.text.Direction;
import com.tyron.textseek.api.text.TextDocument;
import com.tyron.textseek.api.text.TextPosition;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Line-level helpers.
 */
public final class Lines {

    private Lines() {
    }

    /**
     * @return true if the line has no characters at all. Whitespace-only lines are not empty.
     */
    public static boolean isEmpty(int line, @NotNull TextDocument document) {
        return document.getLineLength(line) == 0;
    }

    /**
     * @return the column of the first non-whitespace character, or the line length if there is none.
     */
    public static int firstNonWhitespace(int line, @NotNull TextDocument document) {
        String text = document.getLineText(line);
        int col = 0;
        while (col < text.length() && Character.isWhitespace(text.charAt(col))) {
            col++;
        }
        return col;
    }

    /**
     * Starting at {@code line}, skips empty lines in {@code direction}.
     *
     * @return the start (forward) or end (backward) of the first non-empty line, or {@code null}
     * if a document edge was reached first.
     */
    public static @Nullable TextPosition skipEmptyLines(@NotNull Direction direction, int line,
                                                        @NotNull TextDocument document) {
        int lineCount = document.getLineCount();
        while (line >= 0 && line < lineCount) {
            int length = document.getLineLength(line);
            if (length > 0) {
                return new TextPosition(line, direction == Direction.BACKWARD ? length : 0);
            }
            line += direction.step();
        }
        return null;
    }
}
