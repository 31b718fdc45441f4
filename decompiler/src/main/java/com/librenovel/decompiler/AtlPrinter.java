package com.librenovel.decompiler;

import com.librenovel.ast.AtlNode;
import com.librenovel.ast.AtlVisitor;
import com.librenovel.ast.Node.SourceLocation;
import com.librenovel.decompiler.util.WordConcatenator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Writes ATL blocks attached to image, transform, show and scene statements.
 */
final class AtlPrinter implements AtlVisitor<Void> {

    private final OutputWriter out;
    private final StatementPrinter owner;

    AtlPrinter(OutputWriter out, StatementPrinter owner) {
        this.out = out;
        this.owner = owner;
    }

    /**
     * Write the statements of a block one level deeper than the current
     * indentation. The caller has already written the opening colon.
     */
    void printBlock(AtlNode.Block block) {
        if (block.loc() != null) {
            out.advanceToLine(block.loc().line());
        }
        out.increaseIndent(1);
        try {
            if (!block.statements().isEmpty()) {
                for (AtlNode statement : block.statements()) {
                    printNode(statement);
                }
            } else if (block.loc() == null || !block.loc().isEmptyBlock()) {
                out.indent();
                out.write("pass");
            }
        } finally {
            out.decreaseIndent(1);
        }
    }

    private void printNode(AtlNode node) {
        // "block:" has no line of its own, printBlock advances to its first statement
        if (!(node instanceof AtlNode.Block) && node.location() != null) {
            out.advanceToLine(node.location().line());
        }
        node.accept(this);
    }

    @Override
    public Void visitBlock(AtlNode.Block node) {
        out.indent();
        out.write("block:");
        printBlock(node);
        return null;
    }

    @Override
    public Void visitMultipurpose(AtlNode.Multipurpose node) {
        out.indent();
        WordConcatenator words = new WordConcatenator(false);

        if (node.warpFunction() != null) {
            words.append("warp", node.warpFunction(), node.duration());
        } else if (node.warper() != null) {
            words.append(node.warper(), node.duration());
        } else if (!"0".equals(node.duration())) {
            words.append("pause", node.duration());
        }

        words.append(node.revolution());

        if (!"0".equals(node.circles())) {
            words.append("circles", node.circles());
        }

        for (AtlNode.Multipurpose.Spline spline : node.splines()) {
            words.append(spline.name());
            for (String knot : spline.knots()) {
                words.append("knot", knot);
            }
        }

        for (AtlNode.Multipurpose.Property property : node.properties()) {
            words.append(property.key(), property.value());
        }

        for (AtlNode.Multipurpose.Expression expression : node.expressions()) {
            words.append(expression.expression());
            if (expression.withExpr() != null) {
                words.append("with", expression.withExpr());
            }
        }

        out.write(words.join());
        return null;
    }

    @Override
    public Void visitChild(AtlNode.Child node) {
        for (AtlNode.Block child : node.children()) {
            out.indent();
            out.write("contains:");
            printBlock(child);
        }
        return null;
    }

    @Override
    public Void visitChoice(AtlNode.Choice node) {
        for (AtlNode.Choice.WeightedBlock choice : node.choices()) {
            out.indent();
            out.write("choice");
            if (!AtlNode.Choice.DEFAULT_CHANCE.equals(choice.chance())) {
                out.write(" " + choice.chance());
            }
            out.write(":");
            printBlock(choice.block());
        }
        return null;
    }

    @Override
    public Void visitContainsExpr(AtlNode.ContainsExpr node) {
        out.indent();
        out.write("contains " + node.expression());
        return null;
    }

    @Override
    public Void visitEvent(AtlNode.Event node) {
        out.indent();
        out.write("event " + node.name());
        return null;
    }

    @Override
    public Void visitFunction(AtlNode.Function node) {
        out.indent();
        out.write("function " + node.expr());
        return null;
    }

    @Override
    public Void visitOn(AtlNode.On node) {
        List<Map.Entry<String, AtlNode.Block>> handlers = new ArrayList<>(node.handlers().entrySet());
        if (out.isComparable()) {
            // Source order instead of storage order
            handlers.sort(Comparator.comparingInt(entry -> lineOf(entry.getValue())));
        }

        for (Map.Entry<String, AtlNode.Block> handler : handlers) {
            out.indent();
            out.write("on " + handler.getKey() + ":");
            printBlock(handler.getValue());
        }
        return null;
    }

    @Override
    public Void visitParallel(AtlNode.Parallel node) {
        for (AtlNode.Block block : node.blocks()) {
            out.indent();
            out.write("parallel:");
            printBlock(block);
        }
        return null;
    }

    @Override
    public Void visitRepeat(AtlNode.Repeat node) {
        out.indent();
        out.write("repeat");
        if (node.repeats() != null) {
            out.write(" " + node.repeats());
        }
        return null;
    }

    @Override
    public Void visitTime(AtlNode.Time node) {
        out.indent();
        out.write("time " + node.time());
        return null;
    }

    @Override
    public Void visitUnknown(AtlNode.Unknown node) {
        owner.printUnknown("atl:" + node.tag(), node.loc());
        return null;
    }

    private static int lineOf(AtlNode.Block block) {
        SourceLocation loc = block.loc();
        return loc != null ? loc.line() : Integer.MAX_VALUE;
    }
}
