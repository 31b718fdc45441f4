package com.librenovel.decompiler.screen;

import com.librenovel.ast.Block;
import com.librenovel.ast.Node;
import com.librenovel.ast.Node.SourceLocation;
import com.librenovel.ast.ScreenGeneration;
import com.librenovel.decompiler.DecompileResult;
import com.librenovel.decompiler.DecompilerOptions;
import com.librenovel.decompiler.ScriptDecompiler;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScreenDecompilerRegistryTest {

    private final List<ScreenOptions> seenOptions = new ArrayList<>();

    /**
     * Writes a one-child screen and reports the line it ended on.
     */
    private final ScreenDecompiler fakeScreens = (out, screen, indentLevel, linenumber, options) -> {
        seenOptions.add(options);
        if (!options.skipIndentUntilWrite()) {
            out.append("\n").append(options.indentation().repeat(indentLevel));
            linenumber++;
        }
        out.append("screen ").append(screen.name()).append(":");
        out.append("\n").append(options.indentation().repeat(indentLevel + 1)).append("add \"bg.png\"");
        return linenumber + 1;
    };

    private static SourceLocation at(int line) {
        return SourceLocation.of(line);
    }

    @Test
    void testLookupBySchemaTag() {
        ScreenDecompilerRegistry registry = new ScreenDecompilerRegistry().register(ScreenGeneration.SL2, fakeScreens);

        assertSame(fakeScreens, registry.forSchema("sl2"));
        assertSame(fakeScreens, registry.get(ScreenGeneration.SL2));
        assertNull(registry.forSchema("screenlang"));
        assertNull(registry.forSchema("sl3"));
        assertTrue(registry.hasDecompiler(ScreenGeneration.SL2));
        assertFalse(registry.hasDecompiler(ScreenGeneration.SCREENLANG));
    }

    @Test
    void testScreenIsDelegated() {
        ScriptDecompiler decompiler = new ScriptDecompiler(DecompilerOptions.comparableOutput(),
            new ScreenDecompilerRegistry().register(ScreenGeneration.SL2, fakeScreens));

        Node.Init init = new Node.Init(-500, Block.of(new Node.Screen("main_menu", "sl2", new Object(), at(1))), at(1));
        String out = decompiler.decompile(Block.of(init, new Node.Return(null, at(5)))).source();

        assertEquals("screen main_menu:\n    add \"bg.png\"\nreturn\n", out);
        assertEquals(1, seenOptions.size());
        assertTrue(seenOptions.get(0).comparable());
        assertTrue(seenOptions.get(0).skipIndentUntilWrite());
        assertTrue(seenOptions.get(0).forceMultilineKwargs());
    }

    @Test
    void testDelegatedScreenMovesLineCursor() {
        ScriptDecompiler decompiler = new ScriptDecompiler(DecompilerOptions.defaults(),
            new ScreenDecompilerRegistry().register(ScreenGeneration.SL2, fakeScreens));

        Node.Init init = new Node.Init(-500, Block.of(new Node.Screen("main_menu", "sl2", new Object(), at(2))), at(2));
        DecompileResult result = decompiler.decompile(Block.of(init, new Node.Return(null, at(4))));

        assertEquals(ScriptDecompiler.BANNER + "\nscreen main_menu:\n    add \"bg.png\"\nreturn\n", result.source());
        assertEquals(5, result.lineCount());
        assertFalse(seenOptions.get(0).skipIndentUntilWrite());
    }

    @Test
    void testUnknownSchemaRendersPlaceholder() {
        ScriptDecompiler decompiler = new ScriptDecompiler(DecompilerOptions.comparableOutput());

        DecompileResult result = decompiler.decompile(Block.of(new Node.Screen("odd", "sl3", null, at(1))));
        assertEquals("<<<UNKNOWN NODE screen:sl3>>>\n", result.source());

        DecompileResult unregistered = decompiler.decompile(Block.of(new Node.Screen("odd", "sl2", null, at(1))));
        assertEquals("<<<UNKNOWN NODE screen:sl2>>>\n", unregistered.source());
        assertFalse(unregistered.isComplete());
    }
}
