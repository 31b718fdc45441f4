package com.librenovel.decompiler;

import java.util.List;

/**
 * Outcome of rendering one unit.
 *
 * @param source rendered text, or null when it was written to a caller supplied sink
 * @param lineCount line cursor after the trailing newline
 * @param unrecognized nodes replaced by placeholders, in output order
 */
public record DecompileResult(String source, int lineCount, List<UnrecognizedVariant> unrecognized) {

    public DecompileResult {
        unrecognized = List.copyOf(unrecognized);
    }

    public boolean isComplete() {
        return unrecognized.isEmpty();
    }

    DecompileResult withSource(String text) {
        return new DecompileResult(text, lineCount, unrecognized);
    }
}
