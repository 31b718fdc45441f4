package com.librenovel.ast;

/**
 * Schema generation of a screen declaration.
 * Each generation has its own screen decompiler.
 */
public enum ScreenGeneration {
    SCREENLANG("screenlang"),   // Original screen language
    SL2("sl2");                 // Screen language 2

    private final String tag;

    ScreenGeneration(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    /**
     * Resolve a schema tag, or null if it names no known generation.
     */
    public static ScreenGeneration fromTag(String tag) {
        for (ScreenGeneration generation : values()) {
            if (generation.tag.equals(tag)) {
                return generation;
            }
        }
        return null;
    }
}
