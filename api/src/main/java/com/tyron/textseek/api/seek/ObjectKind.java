package com.tyron.textseek.api.seek;

/**
 * Kinds of text objects the engine can compute.
 */
public enum ObjectKind {
    WORD,
    BIG_WORD,
    SENTENCE,
    PARAGRAPH,
    INDENT,
    ARGUMENT
}
