package com.tyron.textseek.core.charset;

import com.tyron.textseek.api.charset.CharClassifier;
import com.tyron.textseek.api.charset.CharSet;
import com.tyron.textseek.api.text.TextDocument;
import com.tyron.textseek.core.config.SeekConfiguration;
import org.jetbrains.annotations.NotNull;

import java.util.BitSet;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.IntPredicate;

/**
 * {@link CharClassifier} driven by word-separator strings, optionally per language.
 *
 * Blank is Unicode whitespace (line breaks included). Punctuation is any non-blank separator.
 * Everything else, except the {@link CharCategories#NONE} code, is a word character.
 *
 * Predicates are built once per language at construction; instances are immutable.
 */
public final class DefaultCharClassifier implements CharClassifier {

    public static final String DEFAULT_WORD_SEPARATORS = "`~!@#$%^&*()-=+[{]}\\|;:'\",.<>/?";

    private final Map<CharSet, IntPredicate> defaultPredicates;
    private final Map<String, Map<CharSet, IntPredicate>> languagePredicates;

    public DefaultCharClassifier(@NotNull String wordSeparators, @NotNull Map<String, String> languageWordSeparators) {
        Objects.requireNonNull(wordSeparators, "wordSeparators");
        Objects.requireNonNull(languageWordSeparators, "languageWordSeparators");

        this.defaultPredicates = buildPredicates(wordSeparators);

        Map<String, Map<CharSet, IntPredicate>> byLanguage = new HashMap<>();
        for (Map.Entry<String, String> e : languageWordSeparators.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) continue;
            byLanguage.put(e.getKey(), buildPredicates(e.getValue()));
        }
        this.languagePredicates = Collections.unmodifiableMap(byLanguage);
    }

    public static DefaultCharClassifier defaults() {
        return new DefaultCharClassifier(DEFAULT_WORD_SEPARATORS, Map.of());
    }

    public static DefaultCharClassifier fromConfiguration(@NotNull SeekConfiguration configuration) {
        return new DefaultCharClassifier(configuration.getWordSeparators(),
                configuration.getLanguageWordSeparators());
    }

    @Override
    public @NotNull IntPredicate predicate(@NotNull CharSet charSet, @NotNull TextDocument document) {
        Map<CharSet, IntPredicate> predicates = languagePredicates.getOrDefault(document.getLanguageId(),
                defaultPredicates);
        return predicates.get(charSet);
    }

    public static boolean isBlank(int charCode) {
        return Character.isWhitespace(charCode) || Character.isSpaceChar(charCode);
    }

    private static Map<CharSet, IntPredicate> buildPredicates(String wordSeparators) {
        BitSet separators = new BitSet();
        wordSeparators.codePoints().forEach(separators::set);

        Map<CharSet, IntPredicate> predicates = new EnumMap<>(CharSet.class);
        predicates.put(CharSet.BLANK, DefaultCharClassifier::isBlank);
        predicates.put(CharSet.PUNCTUATION, c -> c > 0 && separators.get(c) && !isBlank(c));
        predicates.put(CharSet.WORD, c -> c > 0 && !separators.get(c) && !isBlank(c));
        predicates.put(CharSet.NON_BLANK, c -> c > 0 && !isBlank(c));
        return Collections.unmodifiableMap(predicates);
    }
}
