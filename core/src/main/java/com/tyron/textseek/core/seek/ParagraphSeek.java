package com.tyron.textseek.core.seek;

import com.tyron.textseek.api.text.TextDocument;
import com.tyron.textseek.api.text.TextPosition;
import com.tyron.textseek.api.text.TextSelection;
import com.tyron.textseek.core.text.Lines;
import com.tyron.textseek.core.text.Positions;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Paragraph objects: maximal runs of non-empty lines.
 *
 * The inner paragraph ends after the line break of its last line; the outer one also takes
 * the empty lines that follow.
 */
public final class ParagraphSeek {

    /**
     * @return the paragraph that wraps {@code position}. On an empty line directly followed by a
     * non-empty one, this is the next paragraph.
     */
    public @NotNull TextSelection paragraph(@NotNull TextPosition position, boolean inner,
                                            @NotNull TextDocument document) {
        TextPosition start;

        if (position.line() + 1 < document.getLineCount()
                && Lines.isEmpty(position.line(), document) && !Lines.isEmpty(position.line() + 1, document)) {
            start = Positions.lineStart(position.line() + 1);
        } else {
            start = toParagraphStart(position, document);
        }

        TextPosition end = toParagraphEnd(start, inner, document);

        return new TextSelection(start, end);
    }

    public @NotNull TextPosition paragraphStart(@NotNull TextPosition position, boolean inner,
                                                @NotNull TextDocument document) {
        if (position.line() > 0 && Lines.isEmpty(position.line(), document)) {
            position = Positions.lineStart(position.line() - 1);
        }

        return toParagraphStart(position, document);
    }

    public @NotNull TextPosition paragraphEnd(@NotNull TextPosition position, boolean inner,
                                              @NotNull TextDocument document, @Nullable TextPosition start) {
        return toParagraphEnd(start != null ? start : position, inner, document);
    }

    private static TextPosition toParagraphStart(TextPosition position, TextDocument document) {
        int line = position.line();

        // Trailing empty lines.
        while (line >= 0 && Lines.isEmpty(line, document)) {
            line--;
        }

        if (line <= 0) {
            return Positions.zero();
        }

        while (line > 0 && !Lines.isEmpty(line - 1, document)) {
            line--;
        }

        return Positions.lineStart(line);
    }

    private static TextPosition toParagraphEnd(TextPosition position, boolean inner, TextDocument document) {
        int line = position.line();
        int lineCount = document.getLineCount();

        while (line < lineCount && !Lines.isEmpty(line, document)) {
            line++;
        }

        if (line >= lineCount) {
            return Positions.last(document);
        }

        if (inner) {
            if (line > 0) {
                line--;
            }
            return Positions.lineBreak(line, document);
        }

        // Trailing empty lines.
        while (line + 1 < lineCount && Lines.isEmpty(line + 1, document)) {
            line++;
        }

        return Positions.lineBreak(line, document);
    }
}
