package com.librenovel.decompiler;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DecompilerOptionsTest {

    @Test
    void testDefaults() {
        DecompilerOptions options = DecompilerOptions.defaults();

        assertTrue(options.forceMultilineKwargs());
        assertTrue(options.decompileScreencode());
        assertTrue(options.decompilePython());
        assertFalse(options.comparable());
        assertEquals("    ", options.indentation());
        assertEquals(4, options.maxBlankLines());
    }

    @Test
    void testToBuilderCopiesEverything() {
        DecompilerOptions options = DecompilerOptions.builder()
            .comparable(true)
            .decompilePython(false)
            .indentation("  ")
            .maxBlankLines(1)
            .build();

        assertEquals(options, options.toBuilder().build());
        assertFalse(options.toBuilder().comparable(false).build().comparable());
    }

    @Test
    void testRejectsNegativeBlankLineLimit() {
        assertThrows(IllegalArgumentException.class, () -> DecompilerOptions.builder().maxBlankLines(-1).build());
    }
}
