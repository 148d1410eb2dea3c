package com.tyron.textseek.testFramework;

import com.tyron.textseek.api.text.TextDocument;
import com.tyron.textseek.api.text.TextPosition;
import com.tyron.textseek.api.text.TextSelection;

import java.util.ArrayList;
import java.util.List;

/**
 * Builders for line-based test documents.
 *
 * {@link #marked(String...)} accepts a single {@code |} in the lines to mark the cursor.
 */
public final class TestDocuments {

    public static final char CARET = '|';

    private TestDocuments() {
    }

    public static TextDocument lines(String... lines) {
        return new LinesDocument(List.of(lines), "plaintext");
    }

    public static TextDocument language(String languageId, String... lines) {
        return new LinesDocument(List.of(lines), languageId);
    }

    /**
     * @return the document with the caret marker removed, and the marked position.
     */
    public static Marked marked(String... lines) {
        List<String> clean = new ArrayList<>(lines.length);
        TextPosition caret = null;

        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            int idx = line.indexOf(CARET);
            if (idx >= 0) {
                if (caret != null || line.indexOf(CARET, idx + 1) >= 0) {
                    throw new IllegalArgumentException("more than one caret marker");
                }
                caret = new TextPosition(i, idx);
                line = line.substring(0, idx) + line.substring(idx + 1);
            }
            clean.add(line);
        }

        if (caret == null) {
            throw new IllegalArgumentException("no caret marker");
        }
        return new Marked(new LinesDocument(clean, "plaintext"), caret);
    }

    /**
     * @return the text between the start and end of {@code selection}, with lines joined by {@code \n}.
     */
    public static String text(TextDocument document, TextSelection selection) {
        TextPosition start = selection.start();
        TextPosition end = selection.end();

        StringBuilder sb = new StringBuilder();
        for (int line = start.line(); line <= end.line(); line++) {
            String text = document.getLineText(line);
            int from = line == start.line() ? start.character() : 0;
            int to = line == end.line() ? end.character() : text.length();
            sb.append(text, from, to);
            if (line < end.line()) {
                sb.append('\n');
            }
        }
        return sb.toString();
    }

    /**
     * Every valid position of the document, line breaks included.
     */
    public static List<TextPosition> allPositions(TextDocument document) {
        List<TextPosition> positions = new ArrayList<>();
        for (int line = 0; line < document.getLineCount(); line++) {
            for (int ch = 0; ch <= document.getLineLength(line); ch++) {
                positions.add(new TextPosition(line, ch));
            }
        }
        return positions;
    }

    public record Marked(TextDocument document, TextPosition caret) {
    }

    private record LinesDocument(List<String> lines, String languageId) implements TextDocument {

        LinesDocument {
            if (lines.isEmpty()) {
                throw new IllegalArgumentException("a document has at least one line");
            }
        }

        @Override
        public int getLineCount() {
            return lines.size();
        }

        @Override
        public String getLineText(int line) {
            return lines.get(line);
        }

        @Override
        public String getLanguageId() {
            return languageId;
        }
    }
}
