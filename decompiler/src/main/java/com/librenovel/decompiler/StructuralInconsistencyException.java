package com.librenovel.decompiler;

import com.librenovel.ast.Node.SourceLocation;

/**
 * The node graph contradicts itself, e.g. a paired with statement whose
 * partner two positions later carries a different transition.
 */
public class StructuralInconsistencyException extends DecompilerException {

    private final String expected;
    private final String actual;
    private final SourceLocation location;

    public StructuralInconsistencyException(String message, String expected, String actual, SourceLocation location) {
        super(message + ": expected " + expected + ", got " + actual + describe(location));
        this.expected = expected;
        this.actual = actual;
        this.location = location;
    }

    public static StructuralInconsistencyException unmatchedPairedWith(String expected, String actual,
                                                                       SourceLocation location) {
        return new StructuralInconsistencyException("Unmatched paired with", expected, actual, location);
    }

    public static StructuralInconsistencyException unresolvedPairedWith(String expected, SourceLocation location) {
        return new StructuralInconsistencyException("Paired with left unresolved at end of block",
            expected, "<end of block>", location);
    }

    public String getExpected() {
        return expected;
    }

    public String getActual() {
        return actual;
    }

    /**
     * Location of the paired with statement, or null if it has none.
     */
    public SourceLocation getLocation() {
        return location;
    }

    private static String describe(SourceLocation location) {
        if (location == null) return "";
        return " at " + location.filename() + ":" + location.line();
    }
}
