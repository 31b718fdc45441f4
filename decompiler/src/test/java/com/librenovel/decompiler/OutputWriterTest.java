package com.librenovel.decompiler;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OutputWriterTest {

    private final StringBuilder sb = new StringBuilder();

    @Test
    void testIndentStartsNewLineAtCurrentDepth() {
        OutputWriter writer = new OutputWriter(sb, DecompilerOptions.defaults());
        writer.write("label start:");
        writer.increaseIndent(1);
        writer.indent();
        writer.write("pass");

        assertEquals("label start:\n    pass", sb.toString());
        assertEquals(2, writer.getLinenumber());
    }

    @Test
    void testSkipIndentKeepsNextStatementOnLine() {
        OutputWriter writer = new OutputWriter(sb, DecompilerOptions.defaults());
        writer.write("init 5 ");
        writer.skipIndentUntilWrite();
        assertTrue(writer.isSkippingIndent());

        writer.indent();
        writer.write("$ x = 1");
        assertFalse(writer.isSkippingIndent());
        writer.indent();

        assertEquals("init 5 $ x = 1\n", sb.toString());
    }

    @Test
    void testAdvanceToLineInsertsBlankLines() {
        OutputWriter writer = new OutputWriter(sb, DecompilerOptions.defaults());
        writer.write("a");
        writer.advanceToLine(4);
        writer.indent();
        writer.write("b");

        assertEquals("a\n\n\nb", sb.toString());
        assertEquals(4, writer.getLinenumber());
    }

    @Test
    void testAdvanceToLineClampsGap() {
        OutputWriter writer = new OutputWriter(sb, DecompilerOptions.builder().maxBlankLines(1).build());
        writer.write("a");
        writer.advanceToLine(100);
        writer.indent();
        writer.write("b");

        assertEquals("a\n\nb", sb.toString());
        assertEquals(100, writer.getLinenumber());
    }

    @Test
    void testAdvanceToEarlierLineIsNoOp() {
        OutputWriter writer = new OutputWriter(sb, DecompilerOptions.defaults());
        writer.write("a\nb\nc");
        writer.advanceToLine(2);

        assertEquals("a\nb\nc", sb.toString());
        assertEquals(3, writer.getLinenumber());
    }

    @Test
    void testComparableModeOnlyTracksHighestLine() {
        OutputWriter writer = new OutputWriter(sb, DecompilerOptions.comparableOutput());
        writer.write("a");
        writer.advanceToLine(10);
        writer.advanceToLine(3);

        assertEquals("a", sb.toString());
        assertEquals(1, writer.getLinenumber());
        assertEquals(10, writer.getHighestSourceLine());
    }

    @Test
    void testCustomIndentation() {
        OutputWriter writer = new OutputWriter(sb, DecompilerOptions.builder().indentation("\t").build());
        writer.increaseIndent(2);
        writer.indent();
        writer.decreaseIndent(2);

        assertEquals("\n\t\t", sb.toString());
        assertEquals(0, writer.getIndentLevel());
    }
}
