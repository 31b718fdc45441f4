package com.librenovel.decompiler;

import com.librenovel.ast.Block;
import com.librenovel.decompiler.screen.ScreenDecompilerRegistry;

/**
 * Script decompiler.
 * Converts a deserialized statement tree back to script source text.
 * <p>
 * Instances are immutable and may be shared between threads; every call
 * renders with its own traversal state.
 */
public class ScriptDecompiler {

    public static final String BANNER = "# Decompiled by LibreNovel";

    private final DecompilerOptions options;
    private final ScreenDecompilerRegistry screens;

    public ScriptDecompiler() {
        this(DecompilerOptions.defaults());
    }

    public ScriptDecompiler(DecompilerOptions options) {
        this(options, new ScreenDecompilerRegistry());
    }

    public ScriptDecompiler(DecompilerOptions options, ScreenDecompilerRegistry screens) {
        this.options = options;
        this.screens = screens;
    }

    public DecompilerOptions getOptions() {
        return options;
    }

    /**
     * Decompile a script to source text.
     *
     * @throws StructuralInconsistencyException if the tree contradicts itself
     */
    public DecompileResult decompile(Block ast) {
        StringBuilder sb = new StringBuilder();
        DecompileResult result = pprint(sb, ast);
        return result.withSource(sb.toString());
    }

    /**
     * Write a decompiled script to the given sink.
     */
    public DecompileResult pprint(Appendable out, Block ast) {
        return pprint(out, ast, 0);
    }

    /**
     * Write a decompiled script to the given sink, starting at an indentation level.
     * Outside comparable mode the output starts with a one-line banner; it always
     * ends with exactly one newline.
     */
    public DecompileResult pprint(Appendable out, Block ast, int indentLevel) {
        OutputWriter writer = new OutputWriter(out, options);
        if (options.comparable()) {
            // No banner, so the first statement starts on the first line
            writer.skipIndentUntilWrite();
        } else {
            writer.write(BANNER);
        }

        StatementPrinter printer = new StatementPrinter(writer, options, screens);
        printer.printNodes(ast, indentLevel);
        writer.write("\n");

        return new DecompileResult(null, writer.getLinenumber(), printer.getUnrecognized());
    }
}
