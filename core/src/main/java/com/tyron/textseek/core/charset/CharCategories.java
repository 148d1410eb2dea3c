package com.tyron.textseek.core.charset;

import com.tyron.textseek.api.charset.CharCategory;
import com.tyron.textseek.api.charset.CharClassifier;
import com.tyron.textseek.api.charset.CharSet;
import com.tyron.textseek.api.text.TextDocument;
import org.jetbrains.annotations.NotNull;

import java.util.function.IntPredicate;

/**
 * Character categorization shared by all seeks.
 */
public final class CharCategories {

    /**
     * Code used for "no character here", e.g. past the end of a line. Always blank.
     */
    public static final int NONE = 0;

    private CharCategories() {
    }

    public static CharCategory classify(int charCode, @NotNull IntPredicate isBlank, @NotNull IntPredicate isWord) {
        if (isWord.test(charCode)) {
            return CharCategory.WORD;
        }
        if (charCode == NONE || isBlank.test(charCode)) {
            return CharCategory.BLANK;
        }
        return CharCategory.PUNCTUATION;
    }

    /**
     * Resolves a predicate through the classifier, rejecting classifiers that return none.
     */
    public static IntPredicate predicate(@NotNull CharClassifier classifier, @NotNull CharSet charSet,
                                         @NotNull TextDocument document) {
        IntPredicate predicate = classifier.predicate(charSet, document);
        if (predicate == null) {
            throw new CharClassifierContractException(
                    classifier.getClass().getName() + " returned no predicate for charSet=" + charSet
                            + " language=" + document.getLanguageId());
        }
        return predicate;
    }

    /**
     * @return the character at {@code index} of {@code text}, or {@link #NONE} when out of range.
     */
    public static int charAt(String text, int index) {
        return index >= 0 && index < text.length() ? text.charAt(index) : NONE;
    }
}
