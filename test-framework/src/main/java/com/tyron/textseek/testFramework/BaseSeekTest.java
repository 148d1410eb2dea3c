package com.tyron.textseek.testFramework;

import com.tyron.textseek.api.text.TextDocument;
import com.tyron.textseek.api.text.TextPosition;
import com.tyron.textseek.api.text.TextSelection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Base class for seek tests.
 * <p>
 * - Configures logging once per JVM.
 * - Provides document builders and selection assertions.
 */
public abstract class BaseSeekTest {

    @BeforeEach
    public final void baseSetUp() throws Exception {
        TestLogging.configureOnce();
        beforeEach();
    }

    @AfterEach
    public final void baseTearDown() throws Exception {
        afterEach();
    }

    protected void beforeEach() throws Exception {
    }

    protected void afterEach() throws Exception {
    }

    protected static TextDocument lines(String... lines) {
        return TestDocuments.lines(lines);
    }

    protected static TextPosition pos(int line, int character) {
        return new TextPosition(line, character);
    }

    protected static void assertPosition(int line, int character, TextPosition actual) {
        assertEquals(new TextPosition(line, character), actual);
    }

    protected static void assertSelection(TextPosition start, TextPosition end, TextSelection actual) {
        assertEquals(start, actual.start(), () -> "start of " + actual);
        assertEquals(end, actual.end(), () -> "end of " + actual);
    }

    protected static void assertSelectedText(String expected, TextDocument document, TextSelection actual) {
        assertEquals(expected, TestDocuments.text(document, actual), () -> "text of " + actual);
    }

    /**
     * Checks {@code outer.start <= inner.start <= inner.end <= outer.end}.
     */
    protected static void assertNested(TextSelection inner, TextSelection outer, String message) {
        assertTrue(!inner.start().isBefore(outer.start()), () -> message + " innerStart<outerStart inner=" + inner
                + " outer=" + outer);
        assertTrue(!inner.end().isBefore(inner.start()), () -> message + " innerEnd<innerStart inner=" + inner);
        assertTrue(!outer.end().isBefore(inner.end()), () -> message + " outerEnd<innerEnd inner=" + inner
                + " outer=" + outer);
    }
}
