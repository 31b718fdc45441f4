package com.librenovel.decompiler.screen;

import com.librenovel.ast.Node;

import java.io.IOException;

/**
 * Renders a screen declaration of one schema generation.
 * Implementations write to the same sink as the statement printer and
 * report back where they left the line cursor.
 */
@FunctionalInterface
public interface ScreenDecompiler {

    /**
     * Write the screen at the given indentation.
     *
     * @param out the shared output sink
     * @param screen the screen statement
     * @param indentLevel current indentation depth
     * @param linenumber current line cursor
     * @param options flags forwarded from the decompiler options
     * @return the line cursor after the screen
     */
    int decompile(Appendable out, Node.Screen screen, int indentLevel, int linenumber,
                  ScreenOptions options) throws IOException;
}
