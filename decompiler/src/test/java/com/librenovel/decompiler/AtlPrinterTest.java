package com.librenovel.decompiler;

import com.librenovel.ast.AtlNode;
import com.librenovel.ast.Block;
import com.librenovel.ast.Node;
import com.librenovel.ast.Node.SourceLocation;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ATL blocks, rendered through transform statements.
 */
class AtlPrinterTest {

    private final ScriptDecompiler comparable = new ScriptDecompiler(DecompilerOptions.comparableOutput());

    private static SourceLocation at(int line) {
        return SourceLocation.of(line);
    }

    private String renderTransform(AtlNode.Block atl) {
        Node.Transform transform = new Node.Transform("t", null, atl, at(1));
        return comparable.decompile(Block.of(transform)).source();
    }

    private static AtlNode.Multipurpose pause(String duration, int line) {
        return new AtlNode.Multipurpose.Builder().duration(duration).build(at(line));
    }

    @Test
    void testWarperAndProperty() {
        AtlNode.Multipurpose statement = new AtlNode.Multipurpose.Builder()
            .warper("linear", "1.0")
            .property("xalign", "1.0")
            .build(at(2));

        assertEquals("transform t:\n    linear 1.0 xalign 1.0\n", renderTransform(AtlNode.Block.of(at(2), statement)));
    }

    @Test
    void testWarpFunction() {
        AtlNode.Multipurpose statement = new AtlNode.Multipurpose.Builder()
            .warpFunction("my_warp", "2.0")
            .property("alpha", "0.0")
            .build(at(2));

        assertEquals("transform t:\n    warp my_warp 2.0 alpha 0.0\n",
            renderTransform(AtlNode.Block.of(at(2), statement)));
    }

    @Test
    void testPause() {
        assertEquals("transform t:\n    pause 0.5\n", renderTransform(AtlNode.Block.of(at(2), pause("0.5", 2))));
    }

    @Test
    void testRevolutionCirclesAndSplines() {
        AtlNode.Multipurpose statement = new AtlNode.Multipurpose.Builder()
            .warper("ease", "3.0")
            .revolution("clockwise")
            .circles("2")
            .spline("xpos", "0", "100")
            .build(at(2));

        assertEquals("transform t:\n    ease 3.0 clockwise circles 2 xpos knot 0 knot 100\n",
            renderTransform(AtlNode.Block.of(at(2), statement)));
    }

    @Test
    void testDisplayableExpressionWithTransition() {
        AtlNode.Multipurpose statement = new AtlNode.Multipurpose.Builder()
            .expression("eileen happy", "dissolve")
            .build(at(2));

        assertEquals("transform t:\n    eileen happy with dissolve\n",
            renderTransform(AtlNode.Block.of(at(2), statement)));
    }

    @Test
    void testChoiceOmitsDefaultChance() {
        AtlNode.Choice choice = new AtlNode.Choice(List.of(
            new AtlNode.Choice.WeightedBlock("1.0", AtlNode.Block.of(at(3), pause("1.0", 3))),
            new AtlNode.Choice.WeightedBlock("2.0", AtlNode.Block.of(at(5), new AtlNode.Repeat("3", at(5))))
        ), at(2));

        assertEquals("transform t:\n    choice:\n        pause 1.0\n    choice 2.0:\n        repeat 3\n",
            renderTransform(AtlNode.Block.of(at(2), choice)));
    }

    @Test
    void testSimpleStatementsAndNestedBlocks() {
        AtlNode.Block atl = AtlNode.Block.of(at(2),
            new AtlNode.ContainsExpr("logo", at(2)),
            new AtlNode.Event("start", at(3)),
            new AtlNode.Function("update_fn", at(4)),
            new AtlNode.Time("2.0", at(5)),
            new AtlNode.Parallel(List.of(
                AtlNode.Block.of(at(7), pause("1.0", 7)),
                AtlNode.Block.of(at(9), pause("2.0", 9))), at(6)),
            new AtlNode.Child(List.of(
                AtlNode.Block.of(at(11), new AtlNode.Multipurpose.Builder().expression("eileen", null).build(at(11)))),
                at(10)),
            AtlNode.Block.of(at(13), new AtlNode.Repeat(null, at(13))));

        assertEquals("transform t:\n"
            + "    contains logo\n"
            + "    event start\n"
            + "    function update_fn\n"
            + "    time 2.0\n"
            + "    parallel:\n        pause 1.0\n"
            + "    parallel:\n        pause 2.0\n"
            + "    contains:\n        eileen\n"
            + "    block:\n        repeat\n", renderTransform(atl));
    }

    @Test
    void testOnHandlersAreSortedBySourceLineInComparableMode() {
        String expected = "transform t:\n    on show:\n        alpha 1.0\n    on hide:\n        alpha 0.0\n";

        assertEquals(expected, renderTransform(AtlNode.Block.of(at(2), onHandlers(true))));
        assertEquals(expected, renderTransform(AtlNode.Block.of(at(2), onHandlers(false))));
    }

    @Test
    void testOnHandlersKeepStorageOrderOutsideComparableMode() {
        Node.Transform transform = new Node.Transform("t", null, AtlNode.Block.of(at(2), onHandlers(true)), at(1));
        String out = new ScriptDecompiler().decompile(Block.of(transform)).source();

        assertTrue(out.indexOf("on hide:") < out.indexOf("on show:"));
    }

    private static AtlNode.On onHandlers(boolean hideFirst) {
        AtlNode.Block show = AtlNode.Block.of(at(3),
            new AtlNode.Multipurpose.Builder().property("alpha", "1.0").build(at(3)));
        AtlNode.Block hide = AtlNode.Block.of(at(5),
            new AtlNode.Multipurpose.Builder().property("alpha", "0.0").build(at(5)));

        LinkedHashMap<String, AtlNode.Block> handlers = new LinkedHashMap<>();
        if (hideFirst) {
            handlers.put("hide", hide);
            handlers.put("show", show);
        } else {
            handlers.put("show", show);
            handlers.put("hide", hide);
        }
        return new AtlNode.On(handlers, at(2));
    }

    @Test
    void testEmptyBlockRendersPass() {
        assertEquals("transform t:\n    pass\n", renderTransform(new AtlNode.Block(List.of(), at(2))));
    }

    @Test
    void testEmptyBlockMarkerRendersNothing() {
        assertEquals("transform t:\n", renderTransform(new AtlNode.Block(List.of(), SourceLocation.EMPTY_BLOCK)));
    }

    @Test
    void testUnknownAtlStatementIsRecorded() {
        DecompileResult result = comparable.decompile(Block.of(new Node.Transform("t", null,
            AtlNode.Block.of(at(2), new AtlNode.Unknown("RawFoo", Map.of(), at(2))), at(1))));

        assertEquals("transform t:\n    <<<UNKNOWN NODE atl:RawFoo>>>\n", result.source());
        assertEquals("atl:RawFoo", result.unrecognized().get(0).tag());
    }
}
