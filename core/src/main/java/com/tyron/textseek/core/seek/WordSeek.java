package com.tyron.textseek.core.seek;

import com.tyron.textseek.api.charset.CharCategory;
import com.tyron.textseek.api.charset.CharSet;
import com.tyron.textseek.api.seek.SeekContext;
import com.tyron.textseek.api.text.Direction;
import com.tyron.textseek.api.text.SelectionBehavior;
import com.tyron.textseek.api.text.TextDocument;
import com.tyron.textseek.api.text.TextPosition;
import com.tyron.textseek.api.text.TextSelection;
import com.tyron.textseek.core.charset.CharCategories;
import com.tyron.textseek.core.text.Lines;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.function.IntPredicate;

/**
 * Next/previous word motion.
 */
public final class WordSeek {

    private WordSeek() {
    }

    /**
     * Starting at {@code origin}, seeks the next (or previous) word and returns a selection
     * wrapping it. Words never span lines.
     *
     * @param stopAtEnd   true to stop at the end of the word (like {@code e}), false to stop at the
     *                    start of the next one (like {@code w})
     * @param wordCharSet {@link CharSet#WORD} for words, {@link CharSet#NON_BLANK} for WORDs
     * @return the selection, or {@code null} if there is no further word in that direction
     */
    public static @Nullable TextSelection wordBoundary(@NotNull Direction direction, @NotNull TextPosition origin,
                                                       boolean stopAtEnd, @NotNull CharSet wordCharSet,
                                                       @NotNull SeekContext context) {
        TextDocument document = context.document();
        String text = document.getLineText(origin.line());
        int step = direction.step();
        int lineEndCol = context.selectionBehavior().lastColumn(text.length());

        IntPredicate isWord = CharCategories.predicate(context.classifier(), wordCharSet, document);
        IntPredicate isBlank = CharCategories.predicate(context.classifier(), CharSet.BLANK, document);
        IntPredicate isPunctuation = CharCategories.predicate(context.classifier(), CharSet.PUNCTUATION, document);

        boolean isAtLineBoundary = direction == Direction.FORWARD
                ? origin.character() >= lineEndCol
                : origin.character() == 0 || origin.character() == 1;

        TextPosition anchor;

        if (isAtLineBoundary) {
            anchor = Lines.skipEmptyLines(direction, origin.line() + step, document);
            if (anchor == null) {
                return null;
            }
        } else {
            boolean shouldSkip = false;

            if (context.selectionBehavior() == SelectionBehavior.CHARACTER) {
                // Skip the current character if it sits on a category boundary ("ab[c]  " + w).
                int col = origin.character() - (direction == Direction.BACKWARD ? 1 : 0);
                CharCategory category = CharCategories.classify(CharCategories.charAt(text, col), isBlank, isWord);
                CharCategory nextCategory = CharCategories.classify(CharCategories.charAt(text, col + step), isBlank,
                        isWord);

                shouldSkip = category != nextCategory;

                if (shouldSkip && stopAtEnd == (direction == Direction.FORWARD) && category == CharCategory.BLANK) {
                    shouldSkip = false;
                }
            }

            anchor = shouldSkip ? origin.withCharacter(origin.character() + step) : origin;
        }

        String lineText = document.getLineText(anchor.line());
        int length = lineText.length();
        int nextCol = anchor.character();

        if (direction == Direction.BACKWARD) {
            nextCol--;
        }

        if (stopAtEnd == (direction == Direction.FORWARD)) {
            // Blanks before the word.
            while (nextCol >= 0 && nextCol < length && isBlank.test(lineText.charAt(nextCol))) {
                nextCol += step;
            }
        }

        if (nextCol >= 0 && nextCol < length) {
            IntPredicate isSameCategory = isWord.test(lineText.charAt(nextCol)) ? isWord : isPunctuation;

            while (nextCol >= 0 && nextCol < length && isSameCategory.test(lineText.charAt(nextCol))) {
                nextCol += step;
            }
        }

        if (stopAtEnd == (direction == Direction.BACKWARD)) {
            // Blanks after the word.
            while (nextCol >= 0 && nextCol < length && isBlank.test(lineText.charAt(nextCol))) {
                nextCol += step;
            }
        }

        // Backward scans stop on the first character outside the word; exclude it.
        TextPosition active = anchor.withCharacter(direction == Direction.BACKWARD ? nextCol + 1 : nextCol);

        return new TextSelection(anchor, active);
    }
}
