package com.tyron.textseek.api.charset;

import com.tyron.textseek.api.text.TextDocument;
import org.jetbrains.annotations.NotNull;

import java.util.function.IntPredicate;

/**
 * Supplies membership tests for character classes.
 *
 * The result may depend on the document, e.g. on its language id. Implementations must
 * be stateless from the caller's point of view and must never return {@code null}.
 */
public interface CharClassifier {

    @NotNull
    IntPredicate predicate(@NotNull CharSet charSet, @NotNull TextDocument document);
}
