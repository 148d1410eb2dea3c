package com.tyron.textseek.api.charset;

/**
 * Category a single character falls into during word scanning.
 */
public enum CharCategory {
    WORD,
    BLANK,
    PUNCTUATION
}
