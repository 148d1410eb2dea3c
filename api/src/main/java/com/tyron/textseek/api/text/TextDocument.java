package com.tyron.textseek.api.text;

/**
 * Read-only, line-oriented view of a text buffer.
 *
 * Implementations must not change while a seek runs against them. Lines are given
 * without their terminators; a document always has at least one (possibly empty) line.
 */
public interface TextDocument {

    int getLineCount();

    /**
     * @return the text of the given line, without the line terminator.
     */
    String getLineText(int line);

    default int getLineLength(int line) {
        return getLineText(line).length();
    }

    /**
     * @return language identifier used to pick language-specific word characters.
     */
    default String getLanguageId() {
        return "plaintext";
    }
}
