package com.tyron.textseek.core.seek;

import com.tyron.textseek.api.text.TextDocument;
import com.tyron.textseek.api.text.TextPosition;
import com.tyron.textseek.api.text.TextSelection;
import com.tyron.textseek.testFramework.BaseSeekTest;
import com.tyron.textseek.testFramework.TestDocuments;
import org.junit.jupiter.api.Test;

public class ParagraphSeekTest extends BaseSeekTest {

    private final ParagraphSeek seek = new ParagraphSeek();

    @Test
    void emptyLineBeforeParagraph_selectsNextParagraph() {
        TextDocument doc = lines("a", "", "b");

        TextSelection s = seek.paragraph(pos(1, 0), true, doc);

        assertSelection(pos(2, 0), pos(2, 1), s);
        assertSelectedText("b", doc, s);
    }

    @Test
    void firstParagraph_innerTakesLineBreak_outerTakesEmptyLines() {
        TextDocument doc = lines("p1", "p1b", "", "", "p2");

        TextSelection inner = seek.paragraph(pos(1, 1), true, doc);
        TextSelection outer = seek.paragraph(pos(1, 1), false, doc);

        assertSelectedText("p1\np1b\n", doc, inner);
        assertSelection(pos(0, 0), pos(4, 0), outer);
        assertSelectedText("p1\np1b\n\n\n", doc, outer);
    }

    @Test
    void lastParagraph_endsAtDocumentEnd() {
        TextDocument doc = lines("p1", "", "p2", "p2b");

        assertSelection(pos(2, 0), pos(3, 3), seek.paragraph(pos(3, 0), true, doc));
        assertSelection(pos(2, 0), pos(3, 3), seek.paragraph(pos(3, 0), false, doc));
    }

    @Test
    void trailingEmptyLines_belongToPreviousParagraph() {
        TextDocument doc = lines("a", "", "");

        assertSelection(pos(0, 0), pos(1, 0), seek.paragraph(pos(2, 0), true, doc));
    }

    @Test
    void paragraphStart_fromEmptyLine_goesToPreviousParagraph() {
        TextDocument doc = lines("p1", "p1b", "", "", "p2");

        assertPosition(0, 0, seek.paragraphStart(pos(2, 0), true, doc));
        assertPosition(0, 0, seek.paragraphStart(pos(3, 0), true, doc));
        assertPosition(4, 0, seek.paragraphStart(pos(4, 1), true, doc));
    }

    @Test
    void paragraphEnd_usesKnownStart() {
        TextDocument doc = lines("p1", "", "p2");

        assertPosition(1, 0, seek.paragraphEnd(pos(2, 1), true, doc, pos(0, 0)));
        assertPosition(2, 2, seek.paragraphEnd(pos(2, 1), true, doc, null));
    }

    @Test
    void singleEmptyLine() {
        TextDocument doc = lines("");

        assertSelection(pos(0, 0), pos(0, 0), seek.paragraph(pos(0, 0), false, doc));
    }

    @Test
    void everyPosition_innerNestedInOuter() {
        TextDocument doc = lines("", "", "a", "b", "", "c", "", "", "d", "");

        for (TextPosition position : TestDocuments.allPositions(doc)) {
            TextSelection inner = seek.paragraph(position, true, doc);
            TextSelection outer = seek.paragraph(position, false, doc);

            assertNested(inner, outer, "position=" + position);
        }
    }
}
