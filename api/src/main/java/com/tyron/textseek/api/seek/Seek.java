package com.tyron.textseek.api.seek;

import com.tyron.textseek.api.text.TextDocument;
import com.tyron.textseek.api.text.TextPosition;
import com.tyron.textseek.api.text.TextSelection;
import org.jetbrains.annotations.NotNull;

/**
 * Given a position, returns the range of the object the position belongs to,
 * as a selection from the object start to the object end.
 */
@FunctionalInterface
public interface Seek {
    @NotNull
    TextSelection seek(@NotNull TextPosition position, boolean inner, @NotNull TextDocument document);
}
