package com.tyron.textseek.core.text;

import com.tyron.textseek.api.text.Direction;
import com.tyron.textseek.api.text.TextDocument;
import com.tyron.textseek.api.text.TextPosition;
import org.jetbrains.annotations.NotNull;

import java.util.function.IntPredicate;

/**
 * Character-by-character scans that may cross lines.
 *
 * Line breaks are presented to predicates as {@link #LF}. A forward scan stops ON the first
 * rejected character; a backward scan stops right AFTER it. Either way the rejected character
 * is the one "beyond" the returned position in scan direction, see {@link #charBeyond}.
 */
public final class CharScanner {

    public static final int LF = '\n';

    /**
     * Returned by {@link #charBeyond} when there is no character (document edge).
     */
    public static final int EDGE = -1;

    private CharScanner() {
    }

    public static ScanResult scan(@NotNull Direction direction, @NotNull IntPredicate predicate,
                                  @NotNull TextPosition from, @NotNull TextDocument document) {
        return direction == Direction.FORWARD
                ? forward(predicate, from, document)
                : backward(predicate, from, document);
    }

    public static ScanResult forward(@NotNull IntPredicate predicate, @NotNull TextPosition from,
                                     @NotNull TextDocument document) {
        int lineCount = document.getLineCount();
        int line = from.line();
        int ch = from.character();
        String text = document.getLineText(line);

        for (;;) {
            while (ch < text.length()) {
                if (!predicate.test(text.charAt(ch))) {
                    return new ScanResult(new TextPosition(line, ch), false);
                }
                ch++;
            }

            if (line + 1 >= lineCount) {
                return new ScanResult(new TextPosition(line, text.length()), true);
            }
            if (!predicate.test(LF)) {
                return new ScanResult(new TextPosition(line, ch), false);
            }

            line++;
            ch = 0;
            text = document.getLineText(line);
        }
    }

    public static ScanResult backward(@NotNull IntPredicate predicate, @NotNull TextPosition from,
                                      @NotNull TextDocument document) {
        int line = from.line();
        int ch = from.character();
        String text = document.getLineText(line);

        for (;;) {
            while (ch > 0) {
                if (!predicate.test(text.charAt(ch - 1))) {
                    return new ScanResult(new TextPosition(line, ch), false);
                }
                ch--;
            }

            if (line == 0) {
                return new ScanResult(Positions.zero(), true);
            }
            if (!predicate.test(LF)) {
                return new ScanResult(new TextPosition(line, 0), false);
            }

            line--;
            text = document.getLineText(line);
            ch = text.length();
        }
    }

    /**
     * @return the character at {@code position} ({@link #LF} in the line-break slot), or {@link #EDGE}
     * at the end of the last line.
     */
    public static int charAt(@NotNull TextPosition position, @NotNull TextDocument document) {
        String text = document.getLineText(position.line());
        if (position.character() < text.length()) {
            return text.charAt(position.character());
        }
        return position.line() + 1 < document.getLineCount() ? LF : EDGE;
    }

    /**
     * @return the character right before {@code position}, or {@link #EDGE} at the document start.
     */
    public static int charBefore(@NotNull TextPosition position, @NotNull TextDocument document) {
        TextPosition previous = Positions.previous(position, document);
        return previous == null ? EDGE : charAt(previous, document);
    }

    /**
     * @return the character a scan in {@code direction} would examine next from {@code position}.
     */
    public static int charBeyond(@NotNull TextPosition position, @NotNull Direction direction,
                                 @NotNull TextDocument document) {
        return direction == Direction.FORWARD ? charAt(position, document) : charBefore(position, document);
    }
}
