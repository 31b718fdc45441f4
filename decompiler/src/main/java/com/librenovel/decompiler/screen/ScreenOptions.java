package com.librenovel.decompiler.screen;

/**
 * Flags handed to a screen decompiler.
 *
 * @param forceMultilineKwargs one keyword argument per line
 * @param decompilePython render embedded Python
 * @param decompileScreencode render screen code instead of raw Python
 * @param comparable deterministic output
 * @param skipIndentUntilWrite the screen starts on the current line
 * @param indentation text of one indentation level
 */
public record ScreenOptions(
    boolean forceMultilineKwargs,
    boolean decompilePython,
    boolean decompileScreencode,
    boolean comparable,
    boolean skipIndentUntilWrite,
    String indentation
) {}
