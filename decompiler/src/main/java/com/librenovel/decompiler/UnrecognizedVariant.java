package com.librenovel.decompiler;

import com.librenovel.ast.Node.SourceLocation;

/**
 * A node that could not be rendered and was replaced by a placeholder.
 *
 * @param tag node kind as reported by the reader, or "screen:&lt;schema&gt;" for screens
 * @param location recorded location of the node, or null
 */
public record UnrecognizedVariant(String tag, SourceLocation location) {

    @Override
    public String toString() {
        if (location == null) return tag;
        return tag + " at " + location.filename() + ":" + location.line();
    }
}
