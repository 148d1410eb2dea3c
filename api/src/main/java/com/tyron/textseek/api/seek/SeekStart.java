package com.tyron.textseek.api.seek;

import com.tyron.textseek.api.text.TextDocument;
import com.tyron.textseek.api.text.TextPosition;
import org.jetbrains.annotations.NotNull;

/**
 * Given a position, returns the start of the object the position belongs to.
 */
@FunctionalInterface
public interface SeekStart {
    @NotNull
    TextPosition seek(@NotNull TextPosition position, boolean inner, @NotNull TextDocument document);
}
