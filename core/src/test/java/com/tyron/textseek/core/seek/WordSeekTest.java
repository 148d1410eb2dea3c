package com.tyron.textseek.core.seek;

import com.tyron.textseek.api.charset.CharSet;
import com.tyron.textseek.api.seek.SeekContext;
import com.tyron.textseek.api.text.Direction;
import com.tyron.textseek.api.text.SelectionBehavior;
import com.tyron.textseek.api.text.TextDocument;
import com.tyron.textseek.api.text.TextPosition;
import com.tyron.textseek.api.text.TextSelection;
import com.tyron.textseek.core.charset.DefaultCharClassifier;
import com.tyron.textseek.testFramework.BaseSeekTest;
import com.tyron.textseek.testFramework.TestDocuments;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class WordSeekTest extends BaseSeekTest {

    private static final DefaultCharClassifier CLASSIFIER = DefaultCharClassifier.defaults();

    private static SeekContext caret(TextDocument document) {
        return new SeekContext(document, SelectionBehavior.CARET, CLASSIFIER);
    }

    private static SeekContext character(TextDocument document) {
        return new SeekContext(document, SelectionBehavior.CHARACTER, CLASSIFIER);
    }

    @Test
    void emptyDocument_notFoundBothWays() {
        TextDocument doc = lines("");

        assertNull(WordSeek.wordBoundary(Direction.FORWARD, pos(0, 0), false, CharSet.WORD, caret(doc)));
        assertNull(WordSeek.wordBoundary(Direction.BACKWARD, pos(0, 0), false, CharSet.WORD, caret(doc)));
    }

    @Test
    void forward_onLastCharacterOfDocument_inCharacterMode_notFound() {
        TextDocument doc = lines("foo bar");

        assertNull(WordSeek.wordBoundary(Direction.FORWARD, pos(0, 6), false, CharSet.WORD, character(doc)));
    }

    @Test
    void forward_atEndOfDocument_inCaretMode_notFound() {
        TextDocument doc = lines("foo bar");

        assertNull(WordSeek.wordBoundary(Direction.FORWARD, pos(0, 7), false, CharSet.WORD, caret(doc)));
    }

    @Test
    void backward_nearDocumentStart_notFound() {
        TextDocument doc = lines("foo");

        assertNull(WordSeek.wordBoundary(Direction.BACKWARD, pos(0, 1), false, CharSet.WORD, caret(doc)));
    }

    @Test
    void nextWordStart_selectsWordAndTrailingBlanks() {
        TextDocument doc = lines("foo bar");

        TextSelection s = WordSeek.wordBoundary(Direction.FORWARD, pos(0, 0), false, CharSet.WORD, caret(doc));

        assertNotNull(s);
        assertEquals(pos(0, 0), s.anchor());
        assertEquals(pos(0, 4), s.active());
        assertSelectedText("foo ", doc, s);
    }

    @Test
    void nextWordEnd_selectsLeadingBlanksAndWord() {
        TextDocument doc = lines("foo bar");

        TextSelection s = WordSeek.wordBoundary(Direction.FORWARD, pos(0, 3), true, CharSet.WORD, caret(doc));

        assertNotNull(s);
        assertSelection(pos(0, 3), pos(0, 7), s);
        assertSelectedText(" bar", doc, s);
    }

    @Test
    void previousWordStart_isReversed() {
        TextDocument doc = lines("foo bar");

        TextSelection s = WordSeek.wordBoundary(Direction.BACKWARD, pos(0, 7), false, CharSet.WORD, caret(doc));

        assertNotNull(s);
        assertEquals(pos(0, 7), s.anchor());
        assertEquals(pos(0, 4), s.active());
        assertTrue(s.isReversed());
        assertSelectedText("bar", doc, s);
    }

    @Test
    void punctuationRun_isItsOwnWord() {
        TextDocument doc = lines("foo.bar");

        TextSelection s = WordSeek.wordBoundary(Direction.FORWARD, pos(0, 3), false, CharSet.WORD, caret(doc));

        assertNotNull(s);
        assertSelectedText(".", doc, s);
    }

    @Test
    void bigWord_spansPunctuation() {
        TextDocument doc = lines("foo.bar baz");

        TextSelection s = WordSeek.wordBoundary(Direction.FORWARD, pos(0, 0), false, CharSet.NON_BLANK, caret(doc));

        assertNotNull(s);
        assertSelectedText("foo.bar ", doc, s);
    }

    @Test
    void forward_atLineEnd_skipsEmptyLines() {
        TextDocument doc = lines("foo", "", "", "bar");

        TextSelection s = WordSeek.wordBoundary(Direction.FORWARD, pos(0, 3), false, CharSet.WORD, caret(doc));

        assertNotNull(s);
        assertEquals(pos(3, 0), s.anchor());
        assertEquals(pos(3, 3), s.active());
    }

    @Test
    void backward_atLineStart_skipsEmptyLines() {
        TextDocument doc = lines("foo", "", "bar");

        TextSelection s = WordSeek.wordBoundary(Direction.BACKWARD, pos(2, 0), false, CharSet.WORD, caret(doc));

        assertNotNull(s);
        assertEquals(pos(0, 3), s.anchor());
        assertEquals(pos(0, 0), s.active());
    }

    @Test
    void characterMode_skipsCurrentCharacterOnCategoryBoundary() {
        TextDocument doc = lines("abc  de");

        TextSelection w = WordSeek.wordBoundary(Direction.FORWARD, pos(0, 2), false, CharSet.WORD, character(doc));
        TextSelection e = WordSeek.wordBoundary(Direction.FORWARD, pos(0, 2), true, CharSet.WORD, character(doc));

        assertNotNull(w);
        assertSelection(pos(0, 3), pos(0, 5), w);
        assertNotNull(e);
        assertSelection(pos(0, 3), pos(0, 7), e);
        assertSelectedText("  de", doc, e);
    }

    @Test
    void characterMode_wordEndFromBlankBeforeWord_keepsBlank() {
        TextDocument doc = lines("abc  de");

        TextSelection e = WordSeek.wordBoundary(Direction.FORWARD, pos(0, 4), true, CharSet.WORD, character(doc));

        assertNotNull(e);
        assertSelectedText(" de", doc, e);
    }

    @ParameterizedTest
    @EnumSource(SelectionBehavior.class)
    void forwardThenBackward_neverPassesTheForwardAnchor(SelectionBehavior behavior) {
        TextDocument doc = lines("foo bar.baz", "  qux", "", "a-b  c", "x");
        SeekContext context = new SeekContext(doc, behavior, CLASSIFIER);

        for (TextPosition origin : TestDocuments.allPositions(doc)) {
            for (boolean stopAtEnd : new boolean[]{false, true}) {
                for (CharSet charSet : new CharSet[]{CharSet.WORD, CharSet.NON_BLANK}) {
                    TextSelection forward = WordSeek.wordBoundary(Direction.FORWARD, origin, stopAtEnd, charSet,
                            context);
                    if (forward == null) {
                        continue;
                    }

                    TextSelection backward = WordSeek.wordBoundary(Direction.BACKWARD, forward.active(), stopAtEnd,
                            charSet, context);
                    if (backward == null) {
                        continue;
                    }

                    assertFalse(backward.active().isAfter(forward.anchor()),
                            "behavior=" + behavior + " origin=" + origin + " stopAtEnd=" + stopAtEnd
                                    + " charSet=" + charSet + " forward=" + forward + " backward=" + backward);
                }
            }
        }
    }
}
