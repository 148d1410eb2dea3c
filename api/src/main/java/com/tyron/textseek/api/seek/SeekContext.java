package com.tyron.textseek.api.seek;

import com.tyron.textseek.api.charset.CharClassifier;
import com.tyron.textseek.api.text.SelectionBehavior;
import com.tyron.textseek.api.text.TextDocument;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Per-call inputs of word motions: the document, the caller's selection behavior
 * and the classifier used to resolve character sets.
 */
public record SeekContext(@NotNull TextDocument document, @NotNull SelectionBehavior selectionBehavior,
                          @NotNull CharClassifier classifier) {

    public SeekContext {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(selectionBehavior, "selectionBehavior");
        Objects.requireNonNull(classifier, "classifier");
    }
}
