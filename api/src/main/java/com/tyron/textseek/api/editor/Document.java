package com.tyron.textseek.api.editor;

/**
 * Abstract view of the host editor's text buffer, addressed by offsets.
 *
 * Seeks never read this directly; the host wraps it into a line view first.
 */
public interface Document {
    String getText();
    int getTextLength();

    /**
     * @return The text in the given range.
     */
    String getText(int start, int length);

    /**
     * @return a counter that changes on every edit.
     */
    long getModificationStamp();

    default String getLanguageId() {
        return "plaintext";
    }
}
