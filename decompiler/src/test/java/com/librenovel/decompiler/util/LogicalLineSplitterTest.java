package com.librenovel.decompiler.util;

import org.junit.jupiter.api.Test;

import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LogicalLineSplitterTest {

    @Test
    void testPhysicalLines() {
        assertEquals(List.of("a = 1", "b = 2"), LogicalLineSplitter.split("a = 1\nb = 2"));
    }

    @Test
    void testNewlineInsideBracketsContinuesLine() {
        assertEquals(List.of("x = (1,\n2)", "y = [\n{'a': 1}\n]", "z"),
            LogicalLineSplitter.split("x = (1,\n2)\ny = [\n{'a': 1}\n]\nz"));
    }

    @Test
    void testStringLiterals() {
        assertEquals(List.of("s = ')'", "t = \"\"\"a\nb\"\"\"", "u"),
            LogicalLineSplitter.split("s = ')'\nt = \"\"\"a\nb\"\"\"\nu"));
        assertEquals(List.of("s = 'it\\'s ('", "b"), LogicalLineSplitter.split("s = 'it\\'s ('\nb"));
        assertEquals(List.of("p = r'\\('", "b"), LogicalLineSplitter.split("p = r'\\('\nb"));
    }

    @Test
    void testBracketInCommentIsIgnored() {
        assertEquals(List.of("a # (", "b"), LogicalLineSplitter.split("a # (\nb"));
    }

    @Test
    void testBackslashEndingCommentDoesNotContinueLine() {
        assertEquals(List.of("a = 1  # path c:\\", "b = 2"), LogicalLineSplitter.split("a = 1  # path c:\\\nb = 2"));
        assertEquals(List.of("x = (1,  # c:\\\n2)", "y"), LogicalLineSplitter.split("x = (1,  # c:\\\n2)\ny"));
    }

    @Test
    void testBackslashContinuation() {
        assertEquals(List.of("a = 1 + \\\n2", "b"), LogicalLineSplitter.split("a = 1 + \\\n2\nb"));
    }

    @Test
    void testTrailingNewlineYieldsEmptyLastLine() {
        assertEquals(List.of("a", ""), LogicalLineSplitter.split("a\n"));
        assertEquals(List.of(""), LogicalLineSplitter.split(""));
    }

    @Test
    void testLinesAreProducedOnDemand() {
        Iterator<String> lines = LogicalLineSplitter.lines("first\nsecond").iterator();

        assertTrue(lines.hasNext());
        assertEquals("first", lines.next());
        assertTrue(lines.hasNext());
        assertEquals("second", lines.next());
        assertFalse(lines.hasNext());
    }
}
