package com.tyron.textseek.core.seek;

import com.tyron.textseek.api.charset.CharClassifier;
import com.tyron.textseek.api.charset.CharSet;
import com.tyron.textseek.api.seek.ObjectKind;
import com.tyron.textseek.api.seek.SeekContext;
import com.tyron.textseek.api.text.Direction;
import com.tyron.textseek.api.text.TextDocument;
import com.tyron.textseek.api.text.TextPosition;
import com.tyron.textseek.api.text.TextSelection;
import com.tyron.textseek.core.charset.DefaultCharClassifier;
import com.tyron.textseek.core.config.SeekConfiguration;
import com.tyron.textseek.core.text.Positions;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for callers: text objects and word motions under one configuration.
 *
 * Instances are immutable and can be shared between threads. Documents must not change while
 * a call is running.
 */
public final class TextObjectSeeker {

    private static final Logger LOG = Logger.getLogger(TextObjectSeeker.class.getName());

    private final SeekConfiguration configuration;
    private final CharClassifier classifier;
    private final TextObjects objects;

    public TextObjectSeeker(@NotNull SeekConfiguration configuration) {
        this(configuration, DefaultCharClassifier.fromConfiguration(configuration));
    }

    public TextObjectSeeker(@NotNull SeekConfiguration configuration, @NotNull CharClassifier classifier) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.objects = new TextObjects(classifier, configuration.getSelectionBehavior());
    }

    public SeekConfiguration getConfiguration() {
        return configuration;
    }

    public TextObjects getObjects() {
        return objects;
    }

    public @NotNull TextSelection select(@NotNull ObjectKind kind, @NotNull TextPosition position, boolean inner,
                                         @NotNull TextDocument document) {
        Positions.requireValid(position, document);
        TextSelection result = objects.get(kind).whole().seek(position, inner, document);
        trace("select", kind, position, inner, result);
        return result;
    }

    public @NotNull TextPosition seekStart(@NotNull ObjectKind kind, @NotNull TextPosition position, boolean inner,
                                           @NotNull TextDocument document) {
        Positions.requireValid(position, document);
        TextPosition result = objects.get(kind).start().seek(position, inner, document);
        trace("start", kind, position, inner, result);
        return result;
    }

    public @NotNull TextPosition seekEnd(@NotNull ObjectKind kind, @NotNull TextPosition position, boolean inner,
                                         @NotNull TextDocument document) {
        Positions.requireValid(position, document);
        TextPosition result = objects.get(kind).end().seek(position, inner, document, null);
        trace("end", kind, position, inner, result);
        return result;
    }

    /**
     * @see WordSeek#wordBoundary
     */
    public @Nullable TextSelection wordBoundary(@NotNull Direction direction, @NotNull TextPosition origin,
                                                boolean stopAtEnd, @NotNull CharSet wordCharSet,
                                                @NotNull TextDocument document) {
        Positions.requireValid(origin, document);
        SeekContext context = new SeekContext(document, configuration.getSelectionBehavior(), classifier);
        TextSelection result = WordSeek.wordBoundary(direction, origin, stopAtEnd, wordCharSet, context);

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("seek op=wordBoundary direction=" + direction + " origin=" + origin + " stopAtEnd=" + stopAtEnd
                    + " charSet=" + wordCharSet + " result=" + (result != null ? result : "notFound"));
        }
        return result;
    }

    private static void trace(String op, ObjectKind kind, TextPosition position, boolean inner, Object result) {
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("seek op=" + op + " kind=" + kind + " position=" + position + " inner=" + inner
                    + " result=" + result);
        }
    }
}
