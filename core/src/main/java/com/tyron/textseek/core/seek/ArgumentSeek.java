package com.tyron.textseek.core.seek;

import com.tyron.textseek.api.charset.CharClassifier;
import com.tyron.textseek.api.charset.CharSet;
import com.tyron.textseek.api.text.Direction;
import com.tyron.textseek.api.text.TextDocument;
import com.tyron.textseek.api.text.TextPosition;
import com.tyron.textseek.api.text.TextSelection;
import com.tyron.textseek.core.charset.CharCategories;
import com.tyron.textseek.core.text.CharScanner;
import com.tyron.textseek.core.text.Positions;
import com.tyron.textseek.core.text.ScanResult;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.function.IntPredicate;

/**
 * Arguments: text between commas at the same nesting level, bounded by the enclosing
 * parentheses or brackets.
 *
 * The outer argument includes the comma that follows it, never the one before it.
 * The inner argument excludes blanks around it. A blank-only inner argument collapses onto the
 * position it was asked for.
 */
public final class ArgumentSeek {

    private final CharClassifier classifier;

    public ArgumentSeek(@NotNull CharClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    public @NotNull TextSelection argument(@NotNull TextPosition position, boolean inner,
                                           @NotNull TextDocument document) {
        TextPosition start = argumentStart(position, inner, document);
        TextPosition end = argumentEnd(position, inner, document, null);

        if (start.isAfter(end)) {
            return new TextSelection(position, position);
        }
        return new TextSelection(start, end);
    }

    public @NotNull TextPosition argumentStart(@NotNull TextPosition position, boolean inner,
                                               @NotNull TextDocument document) {
        return toArgumentEdge(position, inner, Direction.BACKWARD, document);
    }

    public @NotNull TextPosition argumentEnd(@NotNull TextPosition position, boolean inner,
                                             @NotNull TextDocument document, @Nullable TextPosition start) {
        return toArgumentEdge(position, inner, Direction.FORWARD, document);
    }

    private TextPosition toArgumentEdge(TextPosition from, boolean inner, Direction direction,
                                        TextDocument document) {
        ScanResult result = CharScanner.scan(direction, new NestingScan(direction), from, document);
        TextPosition edge = result.position();

        if (!result.reachedEdge() && !inner && direction == Direction.FORWARD
                && CharScanner.charAt(edge, document) == ',') {
            // TODO: the outer last argument could own the comma before it instead; needs a rule for
            //  who owns the surrounding whitespace first.
            edge = Objects.requireNonNull(Positions.next(edge, document));
        }

        if (!inner) {
            return edge;
        }

        IntPredicate isBlank = CharCategories.predicate(classifier, CharSet.BLANK, document);
        return CharScanner.scan(direction.opposite(), isBlank, edge, document).position();
    }

    /**
     * Tracks parenthesis and bracket balance relative to the scan direction. Stops, with both
     * balanced, on a comma or on the enclosing parenthesis or bracket.
     */
    private static final class NestingScan implements IntPredicate {

        private final int openParen;
        private final int closeParen;
        private final int openBracket;
        private final int closeBracket;

        private int parenBalance;
        private int bracketBalance;

        NestingScan(Direction direction) {
            boolean forward = direction == Direction.FORWARD;
            this.openParen = forward ? '(' : ')';
            this.closeParen = forward ? ')' : '(';
            this.openBracket = forward ? '[' : ']';
            this.closeBracket = forward ? ']' : '[';
        }

        @Override
        public boolean test(int charCode) {
            boolean balanced = parenBalance == 0 && bracketBalance == 0;

            if (balanced && (charCode == ',' || charCode == closeParen || charCode == closeBracket)) {
                return false;
            }

            if (charCode == openParen) {
                parenBalance++;
            } else if (charCode == closeParen) {
                parenBalance--;
            } else if (charCode == openBracket) {
                bracketBalance++;
            } else if (charCode == closeBracket) {
                bracketBalance--;
            }
            return true;
        }
    }
}
