package com.librenovel.decompiler;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Line-tracking output sink shared by the statement, ATL and screen printers.
 * <p>
 * The line cursor follows the line numbers recorded in the source, so that
 * statements land on the line they came from as far as blank lines allow.
 */
public class OutputWriter {

    private final Appendable out;
    private final String indentation;
    private final boolean comparable;
    private final int maxBlankLines;

    private int linenumber = 1;
    private int indentLevel;
    private boolean skipIndentUntilWrite;
    private int highestSourceLine;

    public OutputWriter(Appendable out, DecompilerOptions options) {
        this.out = out;
        this.indentation = options.indentation();
        this.comparable = options.comparable();
        this.maxBlankLines = options.maxBlankLines();
    }

    /**
     * Append text as-is. Newlines in the text advance the line cursor.
     */
    public void write(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                linenumber++;
            }
        }
        skipIndentUntilWrite = false;
        try {
            out.append(text);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Start a new line at the current indentation, unless the previous
     * statement opened an inline construct with {@link #skipIndentUntilWrite()}.
     */
    public void indent() {
        if (!skipIndentUntilWrite) {
            write("\n" + indentation.repeat(indentLevel));
        }
    }

    /**
     * Keep the next statement on the current line.
     * Cleared by the next write.
     */
    public void skipIndentUntilWrite() {
        skipIndentUntilWrite = true;
    }

    public void clearSkipIndent() {
        skipIndentUntilWrite = false;
    }

    public boolean isSkippingIndent() {
        return skipIndentUntilWrite;
    }

    /**
     * Insert blank lines so that the next {@link #indent()} lands on the
     * given source line. The gap is clamped to the configured maximum.
     * In comparable mode nothing is written.
     */
    public void advanceToLine(int target) {
        if (target > highestSourceLine) {
            highestSourceLine = target;
        }
        if (comparable || linenumber >= target) {
            return;
        }

        int blankLines = Math.min(target - linenumber - 1, maxBlankLines);
        // Written even when empty so that a pending inline skip is cleared
        write("\n".repeat(blankLines));
        linenumber = target - 1;
    }

    public void increaseIndent(int amount) {
        indentLevel += amount;
    }

    public void decreaseIndent(int amount) {
        indentLevel -= amount;
    }

    public int getIndentLevel() {
        return indentLevel;
    }

    public int getLinenumber() {
        return linenumber;
    }

    /**
     * Take over the line cursor after another printer wrote to the same sink.
     */
    public void setLinenumber(int linenumber) {
        this.linenumber = linenumber;
    }

    /**
     * Highest source line seen so far, tracked in every mode.
     */
    public int getHighestSourceLine() {
        return highestSourceLine;
    }

    public boolean isComparable() {
        return comparable;
    }

    public String getIndentation() {
        return indentation;
    }

    /**
     * The underlying sink, for printers that write on their own.
     */
    public Appendable getOut() {
        return out;
    }
}
