package com.tyron.textseek.core.seek;

import com.tyron.textseek.api.text.TextDocument;
import com.tyron.textseek.api.text.TextPosition;
import com.tyron.textseek.api.text.TextSelection;
import com.tyron.textseek.core.charset.DefaultCharClassifier;
import com.tyron.textseek.testFramework.BaseSeekTest;
import com.tyron.textseek.testFramework.TestDocuments;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

public class ArgumentSeekTest extends BaseSeekTest {

    private static final String CALL = "f(a, [b,c], d)";

    private final ArgumentSeek seek = new ArgumentSeek(DefaultCharClassifier.defaults());

    @Test
    void firstArgument_outerTakesTrailingComma() {
        TextDocument doc = lines(CALL);

        assertSelectedText("a", doc, seek.argument(pos(0, 2), true, doc));
        assertSelectedText("a,", doc, seek.argument(pos(0, 2), false, doc));
    }

    @Test
    void arrayLiteralArgument_bracketsIncludedFromTheOpeningBracket() {
        TextDocument doc = lines(CALL);

        assertSelectedText("[b,c]", doc, seek.argument(pos(0, 5), true, doc));
        assertSelectedText(" [b,c],", doc, seek.argument(pos(0, 5), false, doc));
    }

    @Test
    void insideArrayLiteral_elementIsAnArgument() {
        TextDocument doc = lines(CALL);

        assertSelectedText("b", doc, seek.argument(pos(0, 6), true, doc));
        assertSelectedText("b,", doc, seek.argument(pos(0, 6), false, doc));
        assertSelectedText("c", doc, seek.argument(pos(0, 8), false, doc));
    }

    @Test
    void lastArgument_neverTakesLeadingComma() {
        TextDocument doc = lines(CALL);

        TextSelection inner = seek.argument(pos(0, 12), true, doc);
        TextSelection outer = seek.argument(pos(0, 12), false, doc);

        assertSelection(pos(0, 12), pos(0, 13), inner);
        assertSelection(pos(0, 11), pos(0, 13), outer);
        assertSelectedText(" d", doc, outer);
    }

    @Test
    void cursorOnBlankAfterComma_innerSkipsTheBlank() {
        TextDocument doc = lines(CALL);

        assertSelectedText("[b,c]", doc, seek.argument(pos(0, 4), true, doc));
        assertSelectedText("d", doc, seek.argument(pos(0, 11), true, doc));
        assertPosition(0, 5, seek.argumentStart(pos(0, 4), true, doc));
    }

    @Test
    void cursorOnLeadingIndent_innerStartsAtTheArgument() {
        TextDocument doc = lines("call(", "  first,", "  second", ")");

        assertSelection(pos(1, 2), pos(1, 7), seek.argument(pos(1, 0), true, doc));
    }

    @Test
    void nestedCall_isOneArgument() {
        TextDocument doc = lines("f(g(x, y), z)");

        assertSelectedText("g(x, y)", doc, seek.argument(pos(0, 2), true, doc));
    }

    @Test
    void innerCall_argumentsAreSeparate() {
        TestDocuments.Marked marked = TestDocuments.marked("foo(bar(|1, 2), 3)");

        assertSelectedText("1", marked.document(), seek.argument(marked.caret(), true, marked.document()));
    }

    @Test
    void blankOnlyArgument_innerCollapsesOnOrigin() {
        TextDocument doc = lines("f( )");

        TextSelection inner = seek.argument(pos(0, 2), true, doc);
        TextSelection outer = seek.argument(pos(0, 2), false, doc);

        assertSelection(pos(0, 2), pos(0, 2), inner);
        assertSelection(pos(0, 2), pos(0, 3), outer);
    }

    @Test
    void multiLineArguments() {
        TextDocument doc = lines("call(", "  first,", "  second", ")");

        TextSelection inner = seek.argument(pos(2, 2), true, doc);
        TextSelection outer = seek.argument(pos(2, 2), false, doc);

        assertSelection(pos(2, 2), pos(2, 8), inner);
        assertSelection(pos(1, 8), pos(3, 0), outer);
    }

    @Test
    void noEnclosingCall_documentEdgesBound() {
        TextDocument doc = lines("a b");

        assertSelection(pos(0, 0), pos(0, 3), seek.argument(pos(0, 1), false, doc));
    }

    @Test
    void everyPosition_innerNestedInOuter() {
        TextDocument doc = lines("f(a, [b, c],", "  g( ), [ ], d)", "x(,)");

        for (TextPosition position : TestDocuments.allPositions(doc)) {
            TextSelection inner = seek.argument(position, true, doc);
            TextSelection outer = seek.argument(position, false, doc);

            assertNested(inner, outer, "position=" + position);
            if (inner.isEmpty()) {
                assertEquals(position, inner.start(), "position=" + position);
            } else {
                String text = TestDocuments.text(doc, inner);
                assertFalse(Character.isWhitespace(text.charAt(0)), "position=" + position + " inner=" + text);
                assertFalse(Character.isWhitespace(text.charAt(text.length() - 1)),
                        "position=" + position + " inner=" + text);
            }
        }
    }
}
