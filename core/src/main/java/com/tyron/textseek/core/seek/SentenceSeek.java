package com.tyron.textseek.core.seek;

import com.tyron.textseek.api.charset.CharClassifier;
import com.tyron.textseek.api.charset.CharSet;
import com.tyron.textseek.api.text.TextDocument;
import com.tyron.textseek.api.text.TextPosition;
import com.tyron.textseek.api.text.TextSelection;
import com.tyron.textseek.core.charset.CharCategories;
import com.tyron.textseek.core.text.CharScanner;
import com.tyron.textseek.core.text.Lines;
import com.tyron.textseek.core.text.Positions;
import com.tyron.textseek.core.text.ScanResult;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.function.IntPredicate;

/**
 * Sentence objects. A sentence ends at a terminator character or at a blank line.
 */
public final class SentenceSeek {

    /**
     * Sentence terminators. Includes the Greek (U+037E) and Armenian (U+055E) question marks.
     */
    static final String TERMINATORS = ".!?\u00A1\u00A7\u00B6\u00BF;\u037E\u055E\u059E\u3002";

    private final CharClassifier classifier;

    public SentenceSeek(@NotNull CharClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    public static boolean isTerminator(int charCode) {
        return charCode > 0 && TERMINATORS.indexOf(charCode) >= 0;
    }

    /**
     * @return the sentence that wraps {@code position}.
     */
    public @NotNull TextSelection sentence(@NotNull TextPosition position, boolean inner,
                                           @NotNull TextDocument document) {
        TextPosition beforeBlank = toBeforeBlank(position, document, false);
        TextPosition start = toSentenceStart(beforeBlank, document);
        TextPosition end = sentenceEnd(start, inner, document, null);

        return new TextSelection(start, end);
    }

    /**
     * @return the start of the sentence that wraps {@code position}. From the start of a sentence
     * or its leading blanks, this is the start of the previous sentence.
     */
    public @NotNull TextPosition sentenceStart(@NotNull TextPosition position, boolean inner,
                                               @NotNull TextDocument document) {
        TextPosition beforeBlank = toBeforeBlank(position, document, true);

        return toSentenceStart(beforeBlank, document);
    }

    /**
     * @return the end of the sentence that wraps {@code position}, or that begins at {@code start}
     * when given.
     */
    public @NotNull TextPosition sentenceEnd(@NotNull TextPosition position, boolean inner,
                                             @NotNull TextDocument document, @Nullable TextPosition start) {
        if (start != null) {
            // Blanks ahead could be leading, trailing or inside the sentence; only the start can tell.
            position = start;
        }

        if (Lines.isEmpty(position.line(), document)) {
            // An empty line between sentences belongs to neither.
            if (position.line() + 1 >= document.getLineCount() || Lines.isEmpty(position.line() + 1, document)) {
                return position;
            }
            position = Positions.lineStart(position.line() + 1);
        }

        EndScan scan = new EndScan();
        ScanResult result = CharScanner.forward(scan, position, document);
        TextPosition stop = result.position();

        if (result.reachedEdge()) {
            return stop;
        }

        if (scan.hadLf) {
            // Stopped on the second of two line breaks: the first one belongs to the outer sentence.
            if (inner) {
                return Objects.requireNonNull(Positions.previous(stop, document));
            }
            return stop;
        }

        TextPosition afterTerminator = stop.withCharacter(stop.character() + 1);

        if (inner) {
            return afterTerminator;
        }

        // Blanks after the terminator belong to the outer sentence, up to the line break.
        IntPredicate isBlank = CharCategories.predicate(classifier, CharSet.BLANK, document);
        String text = document.getLineText(stop.line());
        int col = afterTerminator.character();

        while (col < text.length() && isBlank.test(text.charAt(col))) {
            col++;
        }

        if (col >= text.length()) {
            return Positions.lineBreak(stop.line(), document);
        }
        return stop.withCharacter(col);
    }

    private TextPosition toBeforeBlank(TextPosition position, TextDocument document, boolean canSkipToPrevious) {
        IntPredicate isBlank = CharCategories.predicate(classifier, CharSet.BLANK, document);
        BlankRunScan scan = new BlankRunScan(isBlank, canSkipToPrevious);

        // The start motion looks strictly before the cursor; the whole object also counts the
        // character under it, so a cursor on a sentence's first character stays in that sentence.
        TextPosition scanFrom = position;
        if (!canSkipToPrevious) {
            TextPosition next = Positions.next(position, document);
            if (next != null) {
                scanFrom = next;
            }
        }

        ScanResult result = CharScanner.backward(scan, scanFrom, document);

        if (result.reachedEdge()) {
            return position;
        }

        TextPosition beforeBlank = result.position();
        boolean hitTerminator = isTerminator(CharScanner.charBefore(beforeBlank, document));

        if (scan.jumpedOverBlankLine && (!canSkipToPrevious || !hitTerminator)) {
            return position;
        }

        if (!hitTerminator || canSkipToPrevious || position.line() == beforeBlank.line()) {
            return beforeBlank;
        }

        // Started in the leading blanks of a sentence on a new line and reached the previous sentence:
        //     foo.
        //       |  bar
        return position;
    }

    private TextPosition toSentenceStart(TextPosition position, TextDocument document) {
        IntPredicate isBlank = CharCategories.predicate(classifier, CharSet.BLANK, document);
        String originLineText = document.getLineText(position.line());

        if (originLineText.isEmpty() && position.line() + 1 >= document.getLineCount()) {
            if (position.line() == 0) {
                return Positions.zero();
            }

            // Empty last line: search from the end of the previous line.
            position = Positions.lineEnd(position.line() - 1, document);
            originLineText = document.getLineText(position.line());
        }

        if (originLineText.isEmpty()) {
            String nextLineText = document.getLineText(position.line() + 1);
            int col = 0;

            while (col < nextLineText.length() && isBlank.test(nextLineText.charAt(col))) {
                col++;
            }
            return new TextPosition(position.line() + 1, col);
        }

        StartScan scan = new StartScan();
        ScanResult result = CharScanner.backward(scan, position, document);

        if (scan.hadLf || result.reachedEdge()) {
            // Sentence starts at the first non-blank after the blank line or document start.
            ScanResult start = CharScanner.forward(isBlank, result.position(), document);

            if (start.reachedEdge()) {
                return Positions.zero();
            }
            return start.position();
        }

        // Hit a terminator: the sentence starts at the first non-blank on the same line, or the line break.
        TextPosition afterTerminator = result.position();
        String text = document.getLineText(afterTerminator.line());
        int col = afterTerminator.character();

        while (col < text.length() && isBlank.test(text.charAt(col))) {
            col++;
        }
        return afterTerminator.withCharacter(col);
    }

    /**
     * Accepts a run of blanks backward, crossing at most one line break unless skipping is allowed.
     */
    private static final class BlankRunScan implements IntPredicate {

        private final IntPredicate isBlank;
        private final boolean canSkipToPrevious;

        private boolean hadLf = true;
        private boolean jumpedOverBlankLine;

        BlankRunScan(IntPredicate isBlank, boolean canSkipToPrevious) {
            this.isBlank = isBlank;
            this.canSkipToPrevious = canSkipToPrevious;
        }

        @Override
        public boolean test(int charCode) {
            if (charCode == CharScanner.LF) {
                if (hadLf) {
                    jumpedOverBlankLine = true;
                    return canSkipToPrevious;
                }
                hadLf = true;
                return true;
            }
            hadLf = false;
            return isBlank.test(charCode);
        }
    }

    /**
     * Accepts everything backward up to a terminator or two consecutive line breaks. The first
     * character is always accepted since it may be this sentence's own terminator.
     */
    private static final class StartScan implements IntPredicate {

        private boolean first = true;
        private boolean hadLf;

        @Override
        public boolean test(int charCode) {
            if (charCode == CharScanner.LF) {
                first = false;
                if (hadLf) {
                    return false;
                }
                hadLf = true;
                return true;
            }

            hadLf = false;

            if (first) {
                first = false;
                return true;
            }
            return !isTerminator(charCode);
        }
    }

    /**
     * Accepts everything forward up to a terminator or two consecutive line breaks.
     */
    private static final class EndScan implements IntPredicate {

        private boolean hadLf;

        @Override
        public boolean test(int charCode) {
            if (charCode == CharScanner.LF) {
                if (hadLf) {
                    return false;
                }
                hadLf = true;
                return true;
            }
            hadLf = false;
            return !isTerminator(charCode);
        }
    }
}
