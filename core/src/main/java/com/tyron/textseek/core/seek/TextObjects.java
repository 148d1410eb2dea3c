package com.tyron.textseek.core.seek;

import com.tyron.textseek.api.charset.CharClassifier;
import com.tyron.textseek.api.charset.CharSet;
import com.tyron.textseek.api.seek.ObjectKind;
import com.tyron.textseek.api.seek.TextObject;
import com.tyron.textseek.api.text.SelectionBehavior;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Table of the seek operations of every {@link ObjectKind}, bound to one classifier and one
 * selection behavior.
 */
public final class TextObjects {

    private final Map<ObjectKind, TextObject> objects;

    public TextObjects(@NotNull CharClassifier classifier) {
        this(classifier, SelectionBehavior.CARET);
    }

    public TextObjects(@NotNull CharClassifier classifier, @NotNull SelectionBehavior selectionBehavior) {
        Objects.requireNonNull(classifier, "classifier");
        Objects.requireNonNull(selectionBehavior, "selectionBehavior");

        Map<ObjectKind, TextObject> map = new EnumMap<>(ObjectKind.class);
        for (ObjectKind kind : ObjectKind.values()) {
            map.put(kind, create(kind, classifier, selectionBehavior));
        }
        this.objects = Collections.unmodifiableMap(map);
    }

    public @NotNull TextObject get(@NotNull ObjectKind kind) {
        return objects.get(Objects.requireNonNull(kind, "kind"));
    }

    public @NotNull Map<ObjectKind, TextObject> asMap() {
        return objects;
    }

    private static TextObject create(ObjectKind kind, CharClassifier classifier, SelectionBehavior behavior) {
        return switch (kind) {
            case WORD -> word(kind, new WordObjectSeek(classifier, CharSet.WORD, behavior));
            case BIG_WORD -> word(kind, new WordObjectSeek(classifier, CharSet.NON_BLANK, behavior));
            case SENTENCE -> {
                SentenceSeek seek = new SentenceSeek(classifier);
                yield new TextObject(kind, seek::sentence, seek::sentenceStart, seek::sentenceEnd);
            }
            case PARAGRAPH -> {
                ParagraphSeek seek = new ParagraphSeek();
                yield new TextObject(kind, seek::paragraph, seek::paragraphStart, seek::paragraphEnd);
            }
            case INDENT -> {
                IndentSeek seek = new IndentSeek();
                yield new TextObject(kind, seek::indent, seek::indentStart, seek::indentEnd);
            }
            case ARGUMENT -> {
                ArgumentSeek seek = new ArgumentSeek(classifier);
                yield new TextObject(kind, seek::argument, seek::argumentStart, seek::argumentEnd);
            }
        };
    }

    private static TextObject word(ObjectKind kind, WordObjectSeek seek) {
        return new TextObject(kind, seek::word, seek::wordStart, seek::wordEnd);
    }
}
