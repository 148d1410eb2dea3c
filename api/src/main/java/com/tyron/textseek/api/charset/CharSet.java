package com.tyron.textseek.api.charset;

/**
 * Named character classes a {@link CharClassifier} knows how to test.
 */
public enum CharSet {
    /**
     * Characters that make up words (letters, digits, underscore by default).
     */
    WORD,

    /**
     * Whitespace, including line breaks.
     */
    BLANK,

    /**
     * Non-blank characters that are not word characters.
     */
    PUNCTUATION,

    /**
     * Anything that is not blank. Used for WORD motions.
     */
    NON_BLANK
}
