package com.tyron.textseek.testFramework;

import com.tyron.textseek.api.editor.Document;

import java.util.Objects;

/**
 * Mutable host {@link Document} for adapter tests.
 */
public final class TestHostDocument implements Document {

    private final StringBuilder text;
    private final String languageId;
    private long modificationStamp;

    public TestHostDocument(String initialText) {
        this(initialText, "plaintext");
    }

    public TestHostDocument(String initialText, String languageId) {
        this.text = new StringBuilder(initialText != null ? initialText : "");
        this.languageId = Objects.requireNonNull(languageId, "languageId");
    }

    @Override
    public String getText() {
        return text.toString();
    }

    @Override
    public int getTextLength() {
        return text.length();
    }

    @Override
    public String getText(int start, int length) {
        return text.substring(start, start + length);
    }

    @Override
    public long getModificationStamp() {
        return modificationStamp;
    }

    @Override
    public String getLanguageId() {
        return languageId;
    }

    public void replace(int start, int end, String newText) {
        text.replace(start, end, Objects.requireNonNull(newText, "text"));
        modificationStamp++;
    }
}
