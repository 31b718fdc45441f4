package com.librenovel.decompiler.screen;

import com.librenovel.ast.ScreenGeneration;

import java.util.EnumMap;
import java.util.Map;

/**
 * Registry of screen decompilers.
 * Maps each screen schema generation to its decompiler.
 */
public class ScreenDecompilerRegistry {

    private final Map<ScreenGeneration, ScreenDecompiler> decompilers = new EnumMap<>(ScreenGeneration.class);

    /**
     * Get the decompiler for a generation.
     * @return The decompiler, or null if none is registered
     */
    public ScreenDecompiler get(ScreenGeneration generation) {
        return decompilers.get(generation);
    }

    /**
     * Resolve a schema tag to its decompiler.
     * @return The decompiler, or null if the tag is unknown or nothing is registered for it
     */
    public ScreenDecompiler forSchema(String schema) {
        ScreenGeneration generation = ScreenGeneration.fromTag(schema);
        return generation != null ? decompilers.get(generation) : null;
    }

    public boolean hasDecompiler(ScreenGeneration generation) {
        return decompilers.containsKey(generation);
    }

    /**
     * Register a decompiler for a generation, replacing any previous one.
     */
    public ScreenDecompilerRegistry register(ScreenGeneration generation, ScreenDecompiler decompiler) {
        decompilers.put(generation, decompiler);
        return this;
    }
}
