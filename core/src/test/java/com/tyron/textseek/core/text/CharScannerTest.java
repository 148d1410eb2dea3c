package com.tyron.textseek.core.text;

import com.tyron.textseek.api.text.Direction;
import com.tyron.textseek.api.text.TextDocument;
import com.tyron.textseek.testFramework.BaseSeekTest;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CharScannerTest extends BaseSeekTest {

    private final TextDocument doc = lines("ab c", "", "de");

    @Test
    void forward_stopsOnRejectedCharacter() {
        ScanResult r = CharScanner.forward(c -> c != ' ', pos(0, 0), doc);

        assertEquals(pos(0, 2), r.position());
        assertFalse(r.reachedEdge());
    }

    @Test
    void backward_stopsAfterRejectedCharacter() {
        ScanResult r = CharScanner.backward(c -> c != ' ', pos(0, 4), doc);

        assertEquals(pos(0, 3), r.position());
        assertFalse(r.reachedEdge());
    }

    @Test
    void lineBreaks_arePresentedAsLf() {
        List<Integer> seen = new ArrayList<>();

        ScanResult r = CharScanner.forward(c -> {
            seen.add(c);
            return true;
        }, pos(0, 3), doc);

        assertEquals(List.of((int) 'c', CharScanner.LF, CharScanner.LF, (int) 'd', (int) 'e'), seen);
        assertEquals(pos(2, 2), r.position());
        assertTrue(r.reachedEdge());
    }

    @Test
    void rejectedLineBreak_stopsAtItsSlot() {
        ScanResult forward = CharScanner.forward(c -> c != CharScanner.LF, pos(0, 0), doc);
        ScanResult backward = CharScanner.backward(c -> c != CharScanner.LF, pos(2, 2), doc);

        assertEquals(pos(0, 4), forward.position());
        assertEquals(pos(2, 0), backward.position());
    }

    @Test
    void backward_reachesDocumentStart() {
        ScanResult r = CharScanner.scan(Direction.BACKWARD, c -> true, pos(2, 1), doc);

        assertEquals(pos(0, 0), r.position());
        assertTrue(r.reachedEdge());
    }

    @Test
    void charAccessors() {
        assertEquals('a', CharScanner.charAt(pos(0, 0), doc));
        assertEquals(CharScanner.LF, CharScanner.charAt(pos(0, 4), doc));
        assertEquals(CharScanner.EDGE, CharScanner.charAt(pos(2, 2), doc));
        assertEquals(CharScanner.EDGE, CharScanner.charBefore(pos(0, 0), doc));
        assertEquals(CharScanner.LF, CharScanner.charBefore(pos(2, 0), doc));
        assertEquals('e', CharScanner.charBeyond(pos(2, 2), Direction.BACKWARD, doc));
        assertEquals('d', CharScanner.charBeyond(pos(2, 0), Direction.FORWARD, doc));
    }
}
