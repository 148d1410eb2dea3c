package com.tyron.textseek.api.seek;

import com.tyron.textseek.api.text.TextDocument;
import com.tyron.textseek.api.text.TextPosition;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Given a position, returns the end of the object the position belongs to.
 *
 * When the whole object is being sought, the already computed start is passed as
 * {@code start}. Implementations may scan from it instead of from {@code position}.
 */
@FunctionalInterface
public interface SeekEnd {
    @NotNull
    TextPosition seek(@NotNull TextPosition position, boolean inner, @NotNull TextDocument document,
                      @Nullable TextPosition start);

    default TextPosition seek(@NotNull TextPosition position, boolean inner, @NotNull TextDocument document) {
        return seek(position, inner, document, null);
    }
}
