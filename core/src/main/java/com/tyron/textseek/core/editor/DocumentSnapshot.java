package com.tyron.textseek.core.editor;

import com.tyron.textseek.api.editor.Document;
import com.tyron.textseek.api.text.TextDocument;
import com.tyron.textseek.api.text.TextPosition;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable line view of a host {@link Document}, taken at one point in time.
 *
 * Lines are split on {@code \n}, {@code \r\n} and {@code \r}. Offsets map to positions
 * counting each terminator with its actual length.
 */
public final class DocumentSnapshot implements TextDocument {

    private final List<String> lines;
    private final int[] lineStartOffsets;
    private final int textLength;
    private final String languageId;
    private final long modificationStamp;
    private final @Nullable Document source;

    private DocumentSnapshot(String text, String languageId, long modificationStamp, @Nullable Document source) {
        List<String> split = new ArrayList<>();
        List<Integer> starts = new ArrayList<>();

        int lineStart = 0;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\n' || c == '\r') {
                split.add(text.substring(lineStart, i));
                starts.add(lineStart);
                i += (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') ? 2 : 1;
                lineStart = i;
            } else {
                i++;
            }
        }
        split.add(text.substring(lineStart));
        starts.add(lineStart);

        this.lines = Collections.unmodifiableList(split);
        this.lineStartOffsets = starts.stream().mapToInt(Integer::intValue).toArray();
        this.textLength = text.length();
        this.languageId = Objects.requireNonNull(languageId, "languageId");
        this.modificationStamp = modificationStamp;
        this.source = source;
    }

    /**
     * Copies the current content of a host document.
     */
    public static DocumentSnapshot of(@NotNull Document document) {
        Objects.requireNonNull(document, "document");
        long stamp = document.getModificationStamp();
        return new DocumentSnapshot(document.getText(), document.getLanguageId(), stamp, document);
    }

    public static DocumentSnapshot of(@NotNull String text) {
        return of(text, "plaintext");
    }

    public static DocumentSnapshot of(@NotNull String text, @NotNull String languageId) {
        return new DocumentSnapshot(Objects.requireNonNull(text, "text"), languageId, 0L, null);
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

    public long getModificationStamp() {
        return modificationStamp;
    }

    /**
     * @return true if the host document was edited after this snapshot was taken.
     */
    public boolean isStale() {
        return source != null && source.getModificationStamp() != modificationStamp;
    }

    public int toOffset(@NotNull TextPosition position) {
        if (position.line() >= lines.size() || position.character() > lines.get(position.line()).length()) {
            throw new IndexOutOfBoundsException("position " + position + " is out of bounds for lineCount="
                    + lines.size());
        }
        return lineStartOffsets[position.line()] + position.character();
    }

    /**
     * Offsets inside a two-character terminator map to the line-break slot of their line.
     */
    public TextPosition toPosition(int offset) {
        if (offset < 0 || offset > textLength) {
            throw new IndexOutOfBoundsException("offset=" + offset + " is out of bounds for length=" + textLength);
        }

        int low = 0;
        int high = lineStartOffsets.length - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (lineStartOffsets[mid] <= offset) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }

        int character = Math.min(offset - lineStartOffsets[low], lines.get(low).length());
        return new TextPosition(low, character);
    }
}
