package com.librenovel.decompiler;

/**
 * Rendering options for a decompilation run.
 *
 * @param forceMultilineKwargs passed to screen decompilers: one keyword argument per line
 * @param decompileScreencode passed to screen decompilers: render screen code instead of raw Python
 * @param decompilePython passed to screen decompilers: render embedded Python
 * @param comparable deterministic output for round-trip comparison: no banner,
 *                   no blank-line heuristics, no storage-order dependent iteration
 * @param indentation text of one indentation level
 * @param maxBlankLines upper bound of blank lines inserted to follow source line numbers
 */
public record DecompilerOptions(
    boolean forceMultilineKwargs,
    boolean decompileScreencode,
    boolean decompilePython,
    boolean comparable,
    String indentation,
    int maxBlankLines
) {

    public static final String DEFAULT_INDENTATION = "    ";
    public static final int DEFAULT_MAX_BLANK_LINES = 4;

    public DecompilerOptions {
        if (indentation == null) {
            indentation = DEFAULT_INDENTATION;
        }
        if (maxBlankLines < 0) {
            throw new IllegalArgumentException("maxBlankLines must not be negative: " + maxBlankLines);
        }
    }

    public static DecompilerOptions defaults() {
        return builder().build();
    }

    /**
     * Options for deterministic, diffable output.
     */
    public static DecompilerOptions comparableOutput() {
        return builder().comparable(true).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .forceMultilineKwargs(forceMultilineKwargs)
            .decompileScreencode(decompileScreencode)
            .decompilePython(decompilePython)
            .comparable(comparable)
            .indentation(indentation)
            .maxBlankLines(maxBlankLines);
    }

    /**
     * Builder for constructing options incrementally.
     */
    public static class Builder {
        private boolean forceMultilineKwargs = true;
        private boolean decompileScreencode = true;
        private boolean decompilePython = true;
        private boolean comparable = false;
        private String indentation = DEFAULT_INDENTATION;
        private int maxBlankLines = DEFAULT_MAX_BLANK_LINES;

        public Builder forceMultilineKwargs(boolean value) {
            this.forceMultilineKwargs = value;
            return this;
        }

        public Builder decompileScreencode(boolean value) {
            this.decompileScreencode = value;
            return this;
        }

        public Builder decompilePython(boolean value) {
            this.decompilePython = value;
            return this;
        }

        public Builder comparable(boolean value) {
            this.comparable = value;
            return this;
        }

        public Builder indentation(String value) {
            this.indentation = value;
            return this;
        }

        public Builder maxBlankLines(int value) {
            this.maxBlankLines = value;
            return this;
        }

        public DecompilerOptions build() {
            return new DecompilerOptions(forceMultilineKwargs, decompileScreencode, decompilePython,
                comparable, indentation, maxBlankLines);
        }
    }
}
