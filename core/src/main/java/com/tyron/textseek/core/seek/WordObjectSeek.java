package com.tyron.textseek.core.seek;

import com.tyron.textseek.api.charset.CharCategory;
import com.tyron.textseek.api.charset.CharClassifier;
import com.tyron.textseek.api.charset.CharSet;
import com.tyron.textseek.api.text.SelectionBehavior;
import com.tyron.textseek.api.text.TextDocument;
import com.tyron.textseek.api.text.TextPosition;
import com.tyron.textseek.api.text.TextSelection;
import com.tyron.textseek.core.charset.CharCategories;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.function.IntPredicate;

/**
 * The word (or WORD) under a position, as a whole object.
 *
 * Inner is the run of same-category characters around the position. Outer adds the blanks that
 * follow it on the line, or the blanks before it when none follow.
 *
 * At a line-break slot the caret behavior gives an empty selection. The character behavior
 * selects the line's last character instead, or the line break itself on an empty line. Only an
 * empty last line, which has no character at all, still gives an empty selection.
 */
public final class WordObjectSeek {

    private final CharClassifier classifier;
    private final CharSet wordCharSet;
    private final SelectionBehavior selectionBehavior;

    public WordObjectSeek(@NotNull CharClassifier classifier, @NotNull CharSet wordCharSet) {
        this(classifier, wordCharSet, SelectionBehavior.CARET);
    }

    public WordObjectSeek(@NotNull CharClassifier classifier, @NotNull CharSet wordCharSet,
                          @NotNull SelectionBehavior selectionBehavior) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.wordCharSet = Objects.requireNonNull(wordCharSet, "wordCharSet");
        this.selectionBehavior = Objects.requireNonNull(selectionBehavior, "selectionBehavior");
    }

    public @NotNull TextSelection word(@NotNull TextPosition position, boolean inner,
                                       @NotNull TextDocument document) {
        String text = document.getLineText(position.line());
        int col = position.character();

        if (col >= text.length()) {
            if (selectionBehavior == SelectionBehavior.CARET) {
                return new TextSelection(position, position);
            }
            if (text.isEmpty()) {
                return position.line() + 1 < document.getLineCount()
                        ? new TextSelection(position, TextPosition.of(position.line() + 1, 0))
                        : new TextSelection(position, position);
            }
            col = text.length() - 1;
        }

        IntPredicate isWord = CharCategories.predicate(classifier, wordCharSet, document);
        IntPredicate isBlank = CharCategories.predicate(classifier, CharSet.BLANK, document);
        CharCategory category = CharCategories.classify(text.charAt(col), isBlank, isWord);

        int start = col;
        while (start > 0 && CharCategories.classify(text.charAt(start - 1), isBlank, isWord) == category) {
            start--;
        }

        int end = col + 1;
        while (end < text.length() && CharCategories.classify(text.charAt(end), isBlank, isWord) == category) {
            end++;
        }

        if (!inner && category != CharCategory.BLANK) {
            int trailingEnd = end;
            while (trailingEnd < text.length() && isBlank.test(text.charAt(trailingEnd))) {
                trailingEnd++;
            }

            if (trailingEnd > end) {
                end = trailingEnd;
            } else {
                while (start > 0 && isBlank.test(text.charAt(start - 1))) {
                    start--;
                }
            }
        }

        return new TextSelection(position.withCharacter(start), position.withCharacter(end));
    }

    public @NotNull TextPosition wordStart(@NotNull TextPosition position, boolean inner,
                                           @NotNull TextDocument document) {
        return word(position, inner, document).start();
    }

    public @NotNull TextPosition wordEnd(@NotNull TextPosition position, boolean inner,
                                         @NotNull TextDocument document, @Nullable TextPosition start) {
        return word(start != null ? start : position, inner, document).end();
    }
}
