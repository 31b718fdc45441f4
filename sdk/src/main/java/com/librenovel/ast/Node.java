package com.librenovel.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base sealed interface for all statement nodes of a deserialized script.
 * The node graph is produced once by the archive reader and is treated
 * as read-only by everything downstream.
 */
public sealed interface Node {

    /**
     * Accept a visitor for AST traversal.
     */
    <T> T accept(NodeVisitor<T> visitor);

    /**
     * Get the recorded source location, or null for compiler-injected nodes.
     */
    SourceLocation location();

    /**
     * Recorded source line, or -1 if the node has no location.
     */
    default int line() {
        SourceLocation loc = location();
        return loc != null ? loc.line() : -1;
    }

    /**
     * Source location in the original script file.
     */
    record SourceLocation(String filename, int line) {

        /**
         * Location the compiler assigns to a block opened by a colon with
         * nothing after it.
         */
        public static final SourceLocation EMPTY_BLOCK = new SourceLocation("", 0);

        public static SourceLocation of(String filename, int line) {
            return new SourceLocation(filename, line);
        }

        public static SourceLocation of(int line) {
            return new SourceLocation("script.rpy", line);
        }

        public boolean isEmptyBlock() {
            return EMPTY_BLOCK.equals(this);
        }
    }

    // Dialogue

    /**
     * Dialogue line: who "what".
     */
    record Say(String who, List<String> attributes, String what, String withExpr, boolean interact,
               SourceLocation loc) implements Node {
        public static Say of(String who, String what, SourceLocation loc) {
            return new Say(who, null, what, null, true, loc);
        }

        @Override
        public <T> T accept(NodeVisitor<T> visitor) {
            return visitor.visitSay(this);
        }

        @Override
        public SourceLocation location() {
            return loc;
        }
    }

    /**
     * Menu with optional with/set clauses and a list of items.
     * An item without a block is a caption.
     */
    record Menu(List<MenuItem> items, String set, String withExpr, SourceLocation loc) implements Node {
        public record MenuItem(String label, String condition, Block block) {
            public static MenuItem choice(String label, Block block) {
                return new MenuItem(label, "True", block);
            }

            public static MenuItem caption(String label) {
                return new MenuItem(label, "True", null);
            }

            public boolean isChoice() {
                return block != null;
            }
        }

        public static Menu of(List<MenuItem> items, SourceLocation loc) {
            return new Menu(items, null, null, loc);
        }

        @Override
        public <T> T accept(NodeVisitor<T> visitor) {
            return visitor.visitMenu(this);
        }

        @Override
        public SourceLocation location() {
            return loc;
        }
    }

    // Flow control

    /**
     * Label: label name(params): block.
     * A label directly after a call is the call's "from" clause.
     */
    record Label(String name, ParameterInfo parameters, Block block, SourceLocation loc) implements Node {
        public static Label of(String name, Block block, SourceLocation loc) {
            return new Label(name, null, block, loc);
        }

        @Override
        public <T> T accept(NodeVisitor<T> visitor) {
            return visitor.visitLabel(this);
        }

        @Override
        public SourceLocation location() {
            return loc;
        }
    }

    /**
     * Jump: jump target or jump expression target.
     */
    record Jump(String target, boolean expression, SourceLocation loc) implements Node {
        @Override
        public <T> T accept(NodeVisitor<T> visitor) {
            return visitor.visitJump(this);
        }

        @Override
        public SourceLocation location() {
            return loc;
        }
    }

    /**
     * Call: call label(args) or call expression expr pass (args).
     */
    record Call(String label, boolean expression, ArgumentInfo arguments, SourceLocation loc) implements Node {
        public static Call of(String label, SourceLocation loc) {
            return new Call(label, false, null, loc);
        }

        @Override
        public <T> T accept(NodeVisitor<T> visitor) {
            return visitor.visitCall(this);
        }

        @Override
        public SourceLocation location() {
            return loc;
        }
    }

    /**
     * Return with optional expression.
     */
    record Return(String expression, SourceLocation loc) implements Node {
        @Override
        public <T> T accept(NodeVisitor<T> visitor) {
            return visitor.visitReturn(this);
        }

        @Override
        public SourceLocation location() {
            return loc;
        }
    }

    record Pass(SourceLocation loc) implements Node {
        @Override
        public <T> T accept(NodeVisitor<T> visitor) {
            return visitor.visitPass(this);
        }

        @Override
        public SourceLocation location() {
            return loc;
        }
    }

    record While(String condition, Block block, SourceLocation loc) implements Node {
        @Override
        public <T> T accept(NodeVisitor<T> visitor) {
            return visitor.visitWhile(this);
        }

        @Override
        public SourceLocation location() {
            return loc;
        }
    }

    /**
     * Conditional chain. A trailing "True" entry is the else branch.
     */
    record If(List<IfEntry> entries, SourceLocation loc) implements Node {
        public record IfEntry(String condition, Block block) {}

        @Override
        public <T> T accept(NodeVisitor<T> visitor) {
            return visitor.visitIf(this);
        }

        @Override
        public SourceLocation location() {
            return loc;
        }
    }

    // Displayables

    /**
     * Image declaration, either image name = code or image name: ATL.
     */
    record Image(List<String> imgName, String code, AtlNode.Block atl, SourceLocation loc) implements Node {
        @Override
        public <T> T accept(NodeVisitor<T> visitor) {
            return visitor.visitImage(this);
        }

        @Override
        public SourceLocation location() {
            return loc;
        }
    }

    record Transform(String varName, ParameterInfo parameters, AtlNode.Block atl, SourceLocation loc) implements Node {
        @Override
        public <T> T accept(NodeVisitor<T> visitor) {
            return visitor.visitTransform(this);
        }

        @Override
        public SourceLocation location() {
            return loc;
        }
    }

    record Show(ImageSpec imspec, AtlNode.Block atl, SourceLocation loc) implements Node {
        public static Show of(ImageSpec imspec, SourceLocation loc) {
            return new Show(imspec, null, loc);
        }

        @Override
        public <T> T accept(NodeVisitor<T> visitor) {
            return visitor.visitShow(this);
        }

        @Override
        public SourceLocation location() {
            return loc;
        }
    }

    record ShowLayer(String layer, List<String> atList, AtlNode.Block atl, SourceLocation loc) implements Node {
        @Override
        public <T> T accept(NodeVisitor<T> visitor) {
            return visitor.visitShowLayer(this);
        }

        @Override
        public SourceLocation location() {
            return loc;
        }
    }

    /**
     * Scene statement. The image spec is null for a bare "scene".
     */
    record Scene(ImageSpec imspec, String layer, AtlNode.Block atl, SourceLocation loc) implements Node {
        public static Scene of(ImageSpec imspec, SourceLocation loc) {
            return new Scene(imspec, ImageSpec.DEFAULT_LAYER, null, loc);
        }

        @Override
        public <T> T accept(NodeVisitor<T> visitor) {
            return visitor.visitScene(this);
        }

        @Override
        public SourceLocation location() {
            return loc;
        }
    }

    record Hide(ImageSpec imspec, SourceLocation loc) implements Node {
        @Override
        public <T> T accept(NodeVisitor<T> visitor) {
            return visitor.visitHide(this);
        }

        @Override
        public SourceLocation location() {
            return loc;
        }
    }

    /**
     * Transition statement. When paired is set, this node and the With two
     * positions later form the postfix "with" clause of the statement between them.
     */
    record With(String expr, String paired, SourceLocation loc) implements Node {
        public static With of(String expr, SourceLocation loc) {
            return new With(expr, null, loc);
        }

        public static With paired(String paired, SourceLocation loc) {
            return new With("None", paired, loc);
        }

        @Override
        public <T> T accept(NodeVisitor<T> visitor) {
            return visitor.visitWith(this);
        }

        @Override
        public SourceLocation location() {
            return loc;
        }
    }

    // Code and declarations

    /**
     * Python block. Source starting with a newline came from a "python:" block,
     * anything else from a one-line "$" statement.
     */
    record Python(String source, boolean hide, SourceLocation loc) implements Node {
        @Override
        public <T> T accept(NodeVisitor<T> visitor) {
            return visitor.visitPython(this);
        }

        @Override
        public SourceLocation location() {
            return loc;
        }
    }

    record EarlyPython(String source, boolean hide, SourceLocation loc) implements Node {
        @Override
        public <T> T accept(NodeVisitor<T> visitor) {
            return visitor.visitEarlyPython(this);
        }

        @Override
        public SourceLocation location() {
            return loc;
        }
    }

    /**
     * Wrapper block run at init time with the given priority.
     */
    record Init(int priority, Block block, SourceLocation loc) implements Node {
        @Override
        public <T> T accept(NodeVisitor<T> visitor) {
            return visitor.visitInit(this);
        }

        @Override
        public SourceLocation location() {
            return loc;
        }
    }

    record Define(String store, String varName, String code, SourceLocation loc) implements Node {
        public static final String DEFAULT_STORE = "store";

        @Override
        public <T> T accept(NodeVisitor<T> visitor) {
            return visitor.visitDefine(this);
        }

        @Override
        public SourceLocation location() {
            return loc;
        }
    }

    /**
     * Statement registered by a creator-defined parser; only its text is kept.
     */
    record UserStatement(String text, SourceLocation loc) implements Node {
        @Override
        public <T> T accept(NodeVisitor<T> visitor) {
            return visitor.visitUserStatement(this);
        }

        @Override
        public SourceLocation location() {
            return loc;
        }
    }

    /**
     * Style statement. Properties keep their declaration order.
     */
    record Style(String styleName, String parent, boolean clear, String take, List<String> delAttr,
                 String variant, Map<String, String> properties, SourceLocation loc) implements Node {
        public Style {
            delAttr = delAttr != null ? List.copyOf(delAttr) : List.of();
            properties = properties != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(properties))
                : Map.of();
        }

        @Override
        public <T> T accept(NodeVisitor<T> visitor) {
            return visitor.visitStyle(this);
        }

        @Override
        public SourceLocation location() {
            return loc;
        }
    }

    // Translations

    record Translate(String identifier, String language, Block block, SourceLocation loc) implements Node {
        @Override
        public <T> T accept(NodeVisitor<T> visitor) {
            return visitor.visitTranslate(this);
        }

        @Override
        public SourceLocation location() {
            return loc;
        }
    }

    /**
     * Injected by the compiler after every translate block.
     */
    record EndTranslate(SourceLocation loc) implements Node {
        @Override
        public <T> T accept(NodeVisitor<T> visitor) {
            return visitor.visitEndTranslate(this);
        }

        @Override
        public SourceLocation location() {
            return loc;
        }
    }

    /**
     * One old/new pair of a "translate language strings:" block.
     * The location points at the "old" line.
     */
    record TranslateString(String language, String oldText, String newText, SourceLocation loc) implements Node {
        @Override
        public <T> T accept(NodeVisitor<T> visitor) {
            return visitor.visitTranslateString(this);
        }

        @Override
        public SourceLocation location() {
            return loc;
        }
    }

    /**
     * Translated style or python statement: translate language statement.
     */
    record TranslateBlock(String language, Block block, SourceLocation loc) implements Node {
        @Override
        public <T> T accept(NodeVisitor<T> visitor) {
            return visitor.visitTranslateBlock(this);
        }

        @Override
        public SourceLocation location() {
            return loc;
        }
    }

    // Screens

    /**
     * Screen declaration. The payload is opaque here and is rendered by the
     * screen decompiler registered for the schema tag.
     */
    record Screen(String name, String schema, Object screen, SourceLocation loc) implements Node {
        @Override
        public <T> T accept(NodeVisitor<T> visitor) {
            return visitor.visitScreen(this);
        }

        @Override
        public SourceLocation location() {
            return loc;
        }
    }

    // Fallback

    /**
     * Node kind the reader did not recognize, kept as tag plus raw fields.
     */
    record Unknown(String tag, Map<String, Object> payload, SourceLocation loc) implements Node {
        @Override
        public <T> T accept(NodeVisitor<T> visitor) {
            return visitor.visitUnknown(this);
        }

        @Override
        public SourceLocation location() {
            return loc;
        }
    }
}
