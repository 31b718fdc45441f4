package com.librenovel.decompiler;

import com.librenovel.ast.AtlNode;
import com.librenovel.ast.Block;
import com.librenovel.ast.ImageSpec;
import com.librenovel.ast.Node;
import com.librenovel.ast.NodeVisitor;
import com.librenovel.decompiler.screen.ScreenDecompiler;
import com.librenovel.decompiler.screen.ScreenDecompilerRegistry;
import com.librenovel.decompiler.screen.ScreenOptions;
import com.librenovel.decompiler.util.LogicalLineSplitter;
import com.librenovel.decompiler.util.ParameterFormatter;
import com.librenovel.decompiler.util.StringUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Writes statement nodes back as script source.
 * One instance renders one unit; all traversal state lives in its
 * {@link TraversalState}.
 */
final class StatementPrinter implements NodeVisitor<Void> {

    private static final String LOG_PREFIX = "[ScriptDecompiler] ";
    private static final String TRUE = "True";

    private final OutputWriter out;
    private final DecompilerOptions options;
    private final ScreenDecompilerRegistry screens;
    private final TraversalState state = new TraversalState();
    private final AtlPrinter atl;
    private final List<UnrecognizedVariant> unrecognized = new ArrayList<>();

    StatementPrinter(OutputWriter out, DecompilerOptions options, ScreenDecompilerRegistry screens) {
        this.out = out;
        this.options = options;
        this.screens = screens;
        this.atl = new AtlPrinter(out, this);
    }

    List<UnrecognizedVariant> getUnrecognized() {
        return unrecognized;
    }

    TraversalState getState() {
        return state;
    }

    /**
     * Write every statement of a block, indented by extraIndent more levels.
     */
    void printNodes(Block block, int extraIndent) {
        out.increaseIndent(extraIndent);
        try {
            BlockCursor cursor = state.enter(block);
            for (int i = 0; i < block.size(); i++) {
                cursor.moveTo(i);
                printNode(block.get(i));
            }
            state.leave();
        } finally {
            out.decreaseIndent(extraIndent);
        }
    }

    private void printNode(Node node) {
        if (node.location() != null && advancesOwnLine(node)) {
            out.advanceToLine(node.line());
        }
        node.accept(this);
    }

    /**
     * TranslateString advances after its group header, and the trailing
     * with of a pairing continues the line of the statement before it.
     */
    private boolean advancesOwnLine(Node node) {
        if (node instanceof Node.TranslateString) {
            return false;
        }
        if (node instanceof Node.With with && with.paired() == null) {
            return state.pendingWith().isAbsent();
        }
        return true;
    }

    void printUnknown(String tag, Node.SourceLocation loc) {
        UnrecognizedVariant variant = new UnrecognizedVariant(tag, loc);
        System.err.println(LOG_PREFIX + "Unknown AST node: " + variant);
        unrecognized.add(variant);
        out.indent();
        out.write("<<<UNKNOWN NODE " + tag + ">>>");
    }

    private void printAtl(AtlNode.Block block) {
        if (block != null) {
            out.write(":");
            atl.printBlock(block);
        }
    }

    // Displayables

    /**
     * Write an image spec. Returns true if the text ends with a space, which
     * older compilers left on the last "at" expression.
     */
    private boolean printImspec(ImageSpec imspec) {
        if (imspec.expression() != null) {
            out.write("expression " + imspec.expression());
        } else {
            out.write(String.join(" ", imspec.nameParts()));
        }

        if (imspec.alias() != null) {
            out.write(" as " + imspec.alias());
        }

        if (!imspec.behind().isEmpty()) {
            out.write(" behind " + StringUtils.joinList(imspec.behind()));
        }

        if (!ImageSpec.DEFAULT_LAYER.equals(imspec.layer())) {
            out.write(" onlayer " + imspec.layer());
        }

        if (imspec.zorder() != null) {
            out.write(" zorder " + imspec.zorder());
        }

        if (!imspec.atList().isEmpty()) {
            out.write(" at " + StringUtils.joinList(imspec.atList()));
            String last = imspec.atList().get(imspec.atList().size() - 1);
            return last.endsWith(" ");
        }
        return false;
    }

    /**
     * Take an armed paired with as this statement's with clause.
     */
    private void printPendingWith(boolean needsSpace) {
        PendingWith pending = state.pendingWith();
        if (pending.isArmed()) {
            if (needsSpace) {
                out.write(" ");
            }
            out.write("with " + pending.expression());
            state.consumePendingWith();
        }
    }

    @Override
    public Void visitImage(Node.Image node) {
        out.indent();
        out.write("image " + String.join(" ", node.imgName()));
        if (node.code() != null) {
            out.write(" = " + node.code());
        } else {
            printAtl(node.atl());
        }
        return null;
    }

    @Override
    public Void visitTransform(Node.Transform node) {
        out.indent();
        out.write("transform " + node.varName());
        out.write(ParameterFormatter.formatParameters(node.parameters()));
        printAtl(node.atl());
        return null;
    }

    @Override
    public Void visitShow(Node.Show node) {
        out.indent();
        out.write("show ");
        boolean needsSpace = !printImspec(node.imspec());
        printPendingWith(needsSpace);
        printAtl(node.atl());
        return null;
    }

    @Override
    public Void visitShowLayer(Node.ShowLayer node) {
        out.indent();
        out.write("show layer " + node.layer());
        if (node.atList() != null && !node.atList().isEmpty()) {
            out.write(" at " + StringUtils.joinList(node.atList()));
        }
        printPendingWith(true);
        printAtl(node.atl());
        return null;
    }

    @Override
    public Void visitScene(Node.Scene node) {
        out.indent();
        out.write("scene");

        boolean needsSpace;
        if (node.imspec() == null) {
            if (node.layer() != null && !ImageSpec.DEFAULT_LAYER.equals(node.layer())) {
                out.write(" onlayer " + node.layer());
            }
            needsSpace = true;
        } else {
            out.write(" ");
            needsSpace = !printImspec(node.imspec());
        }

        printPendingWith(needsSpace);
        printAtl(node.atl());
        return null;
    }

    @Override
    public Void visitHide(Node.Hide node) {
        out.indent();
        out.write("hide ");
        boolean needsSpace = !printImspec(node.imspec());
        printPendingWith(needsSpace);
        return null;
    }

    @Override
    public Void visitWith(Node.With node) {
        PendingWith pending = state.pendingWith();

        if (node.paired() != null) {
            // The with two statements further on must carry the same transition
            Node partner = state.cursor().peek(2);
            if (!(partner instanceof Node.With trailing) || !node.paired().equals(trailing.expr())) {
                throw StructuralInconsistencyException.unmatchedPairedWith(
                    node.paired(), describePartner(partner), node.location());
            }
            state.armPendingWith(node.paired(), node.location());
        } else if (!pending.isAbsent()) {
            if (pending.isArmed()) {
                // The statement in between had no room for the clause
                out.write(" with " + node.expr());
            }
            state.clearPendingWith();
        } else {
            out.indent();
            out.write("with " + node.expr());
        }
        return null;
    }

    private static String describePartner(Node partner) {
        if (partner == null) return "<end of block>";
        if (partner instanceof Node.With with) return with.expr();
        return partner.getClass().getSimpleName();
    }

    // Flow control

    @Override
    public Void visitLabel(Node.Label node) {
        if (state.cursor().previousIs(Node.Call.class)) {
            out.write(" from " + node.name());
            return null;
        }

        out.indent();
        out.write("label " + node.name() + ParameterFormatter.formatParameters(node.parameters()) + ":");
        printNodes(node.block(), 1);
        return null;
    }

    @Override
    public Void visitJump(Node.Jump node) {
        out.indent();
        out.write("jump ");
        if (node.expression()) {
            out.write("expression " + node.target());
        } else {
            out.write(node.target());
        }
        return null;
    }

    @Override
    public Void visitCall(Node.Call node) {
        out.indent();
        out.write("call ");
        if (node.expression()) {
            out.write("expression " + node.label());
        } else {
            out.write(node.label());
        }

        if (node.arguments() != null) {
            if (node.expression()) {
                out.write(" pass ");
            }
            out.write(ParameterFormatter.formatArguments(node.arguments()));
        }
        return null;
    }

    @Override
    public Void visitReturn(Node.Return node) {
        out.indent();
        out.write("return");
        if (node.expression() != null) {
            out.write(" " + node.expression());
        }
        return null;
    }

    @Override
    public Void visitPass(Node.Pass node) {
        // The compiler puts a pass after every call
        if (!state.cursor().previousIs(Node.Call.class)) {
            out.indent();
            out.write("pass");
        }
        return null;
    }

    @Override
    public Void visitWhile(Node.While node) {
        out.indent();
        out.write("while " + node.condition() + ":");
        printNodes(node.block(), 1);
        return null;
    }

    @Override
    public Void visitIf(Node.If node) {
        List<Node.If.IfEntry> entries = node.entries();
        for (int i = 0; i < entries.size(); i++) {
            Node.If.IfEntry entry = entries.get(i);
            out.indent();
            if (i > 0 && i == entries.size() - 1 && TRUE.equals(entry.condition().strip())) {
                out.write("else:");
            } else {
                out.write((i == 0 ? "if " : "elif ") + entry.condition() + ":");
            }
            printNodes(entry.block(), 1);
        }
        return null;
    }

    // Code and declarations

    @Override
    public Void visitPython(Node.Python node) {
        printPython(node.source(), node.hide(), false);
        return null;
    }

    @Override
    public Void visitEarlyPython(Node.EarlyPython node) {
        printPython(node.source(), node.hide(), true);
        return null;
    }

    private void printPython(String source, boolean hide, boolean early) {
        out.indent();

        if (!source.isEmpty() && source.charAt(0) == '\n') {
            out.write("python");
            if (early) {
                out.write(" early");
            }
            if (hide) {
                out.write(" hide");
            }
            out.write(":");

            out.increaseIndent(1);
            try {
                for (String line : LogicalLineSplitter.lines(source.substring(1))) {
                    out.indent();
                    out.write(line);
                }
            } finally {
                out.decreaseIndent(1);
            }
        } else {
            out.write("$ " + source);
        }
    }

    @Override
    public Void visitInit(Node.Init node) {
        switch (InitClassifier.classify(node, options.comparable())) {
            case COLLAPSED, TRANSLATE_STRINGS -> printNodes(node.block(), 0);
            case INLINE -> {
                printInitHeader(node);
                out.write(" ");
                out.skipIndentUntilWrite();
                printNodes(node.block(), 0);
            }
            case BLOCK -> {
                printInitHeader(node);
                out.write(":");
                printNodes(node.block(), 1);
            }
        }
        return null;
    }

    private void printInitHeader(Node.Init node) {
        out.indent();
        out.write("init");
        if (node.priority() != 0) {
            out.write(" " + node.priority());
        }
    }

    @Override
    public Void visitDefine(Node.Define node) {
        out.indent();
        if (node.store() == null || Node.Define.DEFAULT_STORE.equals(node.store())) {
            out.write("define " + node.varName() + " = " + node.code());
        } else {
            out.write("define " + node.store() + "." + node.varName() + " = " + node.code());
        }
        return null;
    }

    @Override
    public Void visitUserStatement(Node.UserStatement node) {
        out.indent();
        out.write(node.text());
        return null;
    }

    @Override
    public Void visitStyle(Node.Style node) {
        out.indent();
        out.write("style " + node.styleName());

        List<String> clauses = new ArrayList<>();
        if (node.parent() != null) {
            clauses.add("is " + node.parent());
        }
        if (node.clear()) {
            clauses.add("clear");
        }
        if (node.take() != null) {
            clauses.add("take " + node.take());
        }
        for (String name : node.delAttr()) {
            clauses.add("del " + name);
        }
        if (node.variant() != null) {
            clauses.add("variant " + node.variant());
        }
        for (Map.Entry<String, String> property : node.properties().entrySet()) {
            clauses.add(property.getKey() + " " + property.getValue());
        }

        if (clauses.isEmpty()) {
            return null;
        }

        if (options.comparable()) {
            out.write(" " + String.join(" ", clauses));
        } else {
            out.write(":");
            out.increaseIndent(1);
            try {
                for (String clause : clauses) {
                    out.indent();
                    out.write(clause);
                }
            } finally {
                out.decreaseIndent(1);
            }
        }
        return null;
    }

    // Dialogue

    @Override
    public Void visitSay(Node.Say node) {
        if (shouldDeferIntoMenu(node)) {
            state.deferSay(node);
            return null;
        }
        printSay(node, false);
        return null;
    }

    /**
     * A non-interacting say right before a menu is the menu's prompt, written
     * as the first line inside the menu.
     */
    private boolean shouldDeferIntoMenu(Node.Say say) {
        if (say.interact() || say.who() == null || say.withExpr() != null || say.attributes() != null) {
            return false;
        }
        if (!(state.cursor().peek(1) instanceof Node.Menu menu)) {
            return false;
        }
        return !menu.items().isEmpty()
            && menu.items().get(0).isChoice()
            && !InitClassifier.shouldComeBefore(say, menu, options.comparable());
    }

    private void printSay(Node.Say node, boolean inMenu) {
        out.indent();
        if (node.who() != null) {
            out.write(node.who() + " ");
        }
        if (node.attributes() != null && !node.attributes().isEmpty()) {
            out.write(String.join(" ", node.attributes()) + " ");
        }
        out.write(StringUtils.quote(node.what()));
        if (!node.interact() && !inMenu) {
            out.write(" nointeract");
        }
        if (node.withExpr() != null) {
            out.write(" with " + node.withExpr());
        }
    }

    @Override
    public Void visitMenu(Node.Menu node) {
        out.indent();
        out.write("menu:");
        out.increaseIndent(1);
        try {
            Node.Say prompt = state.takePendingSay();
            if (prompt != null) {
                printSay(prompt, true);
            }

            if (node.withExpr() != null) {
                out.indent();
                out.write("with " + node.withExpr());
            }

            if (node.set() != null) {
                out.indent();
                out.write("set " + node.set());
            }

            for (Node.Menu.MenuItem item : node.items()) {
                out.indent();
                out.write(StringUtils.quote(item.label()));

                if (item.isChoice()) {
                    if (item.condition() != null && !TRUE.equals(item.condition())) {
                        out.write(" if " + item.condition());
                    }
                    out.write(":");
                    printNodes(item.block(), 1);
                }
            }
        } finally {
            out.decreaseIndent(1);
        }
        return null;
    }

    // Translations

    @Override
    public Void visitTranslate(Node.Translate node) {
        out.indent();
        out.write("translate " + StringUtils.languageName(node.language()) + " " + node.identifier() + ":");
        printNodes(node.block(), 1);
        return null;
    }

    @Override
    public Void visitEndTranslate(Node.EndTranslate node) {
        // Injected by the compiler, nothing to write
        return null;
    }

    @Override
    public Void visitTranslateString(Node.TranslateString node) {
        boolean continuesGroup = state.cursor().peek(-1) instanceof Node.TranslateString previous
            && Objects.equals(previous.language(), node.language());
        if (!continuesGroup) {
            out.indent();
            out.write("translate " + StringUtils.languageName(node.language()) + " strings:");
        }

        // The recorded line is the "old" line, not the header
        if (node.location() != null) {
            out.advanceToLine(node.line());
        }

        out.increaseIndent(1);
        try {
            out.indent();
            out.write("old " + StringUtils.quote(node.oldText()));
            out.indent();
            out.write("new " + StringUtils.quote(node.newText()));
        } finally {
            out.decreaseIndent(1);
        }
        return null;
    }

    @Override
    public Void visitTranslateBlock(Node.TranslateBlock node) {
        out.indent();
        out.write("translate " + StringUtils.languageName(node.language()) + " ");
        out.skipIndentUntilWrite();
        printNodes(node.block(), 0);
        return null;
    }

    // Screens

    @Override
    public Void visitScreen(Node.Screen node) {
        ScreenDecompiler decompiler = screens.forSchema(node.schema());
        if (decompiler == null) {
            printUnknown("screen:" + node.schema(), node.location());
            return null;
        }

        ScreenOptions screenOptions = new ScreenOptions(
            options.forceMultilineKwargs(),
            options.decompilePython(),
            options.decompileScreencode(),
            options.comparable(),
            out.isSkippingIndent(),
            options.indentation());
        try {
            int linenumber = decompiler.decompile(out.getOut(), node, out.getIndentLevel(),
                out.getLinenumber(), screenOptions);
            out.setLinenumber(linenumber);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        out.clearSkipIndent();
        return null;
    }

    @Override
    public Void visitUnknown(Node.Unknown node) {
        printUnknown(node.tag(), node.location());
        return null;
    }
}
