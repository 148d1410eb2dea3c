package com.tyron.textseek.core.seek;

import com.tyron.textseek.api.text.Direction;
import com.tyron.textseek.api.text.TextDocument;
import com.tyron.textseek.api.text.TextPosition;
import com.tyron.textseek.api.text.TextSelection;
import com.tyron.textseek.core.text.Lines;
import com.tyron.textseek.core.text.Positions;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Indentation blocks: runs of lines indented at least as deep as a reference line.
 *
 * Empty lines inside a block do not end it. Whitespace-only lines are not empty and take part
 * in the indent comparison.
 */
public final class IndentSeek {

    /**
     * Both edges are measured from {@code position}, so a deeper whitespace-only line at the start
     * of the block cannot shrink the end.
     */
    public @NotNull TextSelection indent(@NotNull TextPosition position, boolean inner,
                                         @NotNull TextDocument document) {
        TextPosition start = indentStart(position, inner, document);
        TextPosition end = indentEnd(position, inner, document, start);

        return new TextSelection(start, end);
    }

    public @NotNull TextPosition indentStart(@NotNull TextPosition position, boolean inner,
                                             @NotNull TextDocument document) {
        return toIndentEdge(position, inner, Direction.BACKWARD, document);
    }

    /**
     * The known start is not needed: the reference indent comes from {@code position}.
     */
    public @NotNull TextPosition indentEnd(@NotNull TextPosition position, boolean inner,
                                           @NotNull TextDocument document, @Nullable TextPosition start) {
        return toIndentEdge(position, inner, Direction.FORWARD, document);
    }

    private static TextPosition toIndentEdge(TextPosition from, boolean inner, Direction direction,
                                             TextDocument document) {
        int step = direction.step();
        int lineCount = document.getLineCount();
        int line = from.line();

        while (Lines.isEmpty(line, document)) {
            line += step;

            if (line < 0) {
                return Positions.zero();
            }
            if (line >= lineCount) {
                return Positions.last(document);
            }
        }

        int indent = Lines.firstNonWhitespace(line, document);
        int lastNonBlankLine = line;

        for (;;) {
            line += step;

            if (line < 0) {
                return Positions.zero();
            }
            if (line >= lineCount) {
                return Positions.last(document);
            }

            if (Lines.isEmpty(line, document)) {
                continue;
            }

            if (Lines.firstNonWhitespace(line, document) < indent) {
                int resultLine = inner ? lastNonBlankLine : line - step;

                return direction == Direction.BACKWARD
                        ? Positions.lineStart(resultLine)
                        : Positions.lineBreak(resultLine, document);
            }

            lastNonBlankLine = line;
        }
    }
}
