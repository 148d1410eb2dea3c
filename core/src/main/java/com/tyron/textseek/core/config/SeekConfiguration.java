package com.tyron.textseek.core.config;

import com.tyron.textseek.api.text.SelectionBehavior;
import com.tyron.textseek.core.charset.DefaultCharClassifier;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable seek settings: the caller's selection behavior and the word separators,
 * globally and per language id.
 */
public final class SeekConfiguration {

    private static final SeekConfiguration DEFAULTS = builder().build();

    private final SelectionBehavior selectionBehavior;
    private final String wordSeparators;
    private final Map<String, String> languageWordSeparators;

    private SeekConfiguration(Builder builder) {
        this.selectionBehavior = builder.selectionBehavior;
        this.wordSeparators = builder.wordSeparators;
        this.languageWordSeparators = Collections.unmodifiableMap(new LinkedHashMap<>(builder.languageWordSeparators));
    }

    public static SeekConfiguration defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public SelectionBehavior getSelectionBehavior() {
        return selectionBehavior;
    }

    public String getWordSeparators() {
        return wordSeparators;
    }

    /**
     * @return word separators keyed by language id; languages not listed use {@link #getWordSeparators()}.
     */
    public Map<String, String> getLanguageWordSeparators() {
        return languageWordSeparators;
    }

    public String getWordSeparators(String languageId) {
        return languageWordSeparators.getOrDefault(languageId, wordSeparators);
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .selectionBehavior(selectionBehavior)
                .wordSeparators(wordSeparators);
        languageWordSeparators.forEach(builder::languageWordSeparators);
        return builder;
    }

    @Override
    public String toString() {
        return "SeekConfiguration{selectionBehavior=" + selectionBehavior
                + ", wordSeparators=" + wordSeparators
                + ", languages=" + languageWordSeparators.keySet() + '}';
    }

    public static final class Builder {

        private SelectionBehavior selectionBehavior = SelectionBehavior.CARET;
        private String wordSeparators = DefaultCharClassifier.DEFAULT_WORD_SEPARATORS;
        private final Map<String, String> languageWordSeparators = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder selectionBehavior(@NotNull SelectionBehavior selectionBehavior) {
            this.selectionBehavior = Objects.requireNonNull(selectionBehavior, "selectionBehavior");
            return this;
        }

        public Builder wordSeparators(@NotNull String wordSeparators) {
            this.wordSeparators = Objects.requireNonNull(wordSeparators, "wordSeparators");
            return this;
        }

        public Builder languageWordSeparators(@NotNull String languageId, @NotNull String wordSeparators) {
            if (languageId == null || languageId.isBlank()) {
                throw new IllegalArgumentException("languageId is blank");
            }
            languageWordSeparators.put(languageId.trim(), Objects.requireNonNull(wordSeparators, "wordSeparators"));
            return this;
        }

        public SeekConfiguration build() {
            return new SeekConfiguration(this);
        }
    }
}
