package com.librenovel.decompiler;

import com.librenovel.ast.Block;
import com.librenovel.ast.Node;

import java.util.Objects;

/**
 * Decides how an init statement is written back.
 * Several statements are wrapped in an implicit init block by the compiler:
 * define, transform and style at priority 0, screen at -500 and image at 990.
 * Such wrappers are dropped again.
 */
public final class InitClassifier {

    public static final int DEFAULT_PRIORITY = 0;
    public static final int SCREEN_PRIORITY = -500;
    public static final int IMAGE_PRIORITY = 990;

    /**
     * Form of an init statement in the output.
     */
    public enum InitForm {
        COLLAPSED,          // Implicit wrapper, only the child is written
        TRANSLATE_STRINGS,  // Split translate strings block, children are written
        INLINE,             // init [priority] statement
        BLOCK               // init [priority]: block
    }

    private InitClassifier() {}

    public static InitForm classify(Node.Init init, boolean comparable) {
        Block block = init.block();

        if (block.size() == 1 && isImplicitWrapper(init.priority(), block.first())
                && !shouldComeBefore(init, block.first(), comparable)) {
            return InitForm.COLLAPSED;
        }

        if (!block.isEmpty() && init.priority() == DEFAULT_PRIORITY && isSingleLanguageStrings(block)) {
            return InitForm.TRANSLATE_STRINGS;
        }

        if (block.size() == 1 && init.location() != null && block.first().location() != null
                && init.line() >= block.first().line()) {
            return InitForm.INLINE;
        }

        return InitForm.BLOCK;
    }

    /**
     * In comparable mode a node recorded on an earlier line than another
     * must be written before it.
     */
    public static boolean shouldComeBefore(Node first, Node second, boolean comparable) {
        return comparable && first.location() != null && second.location() != null
            && first.line() < second.line();
    }

    private static boolean isImplicitWrapper(int priority, Node child) {
        return switch (priority) {
            case SCREEN_PRIORITY -> child instanceof Node.Screen;
            case DEFAULT_PRIORITY -> child instanceof Node.Define
                || child instanceof Node.Transform
                || child instanceof Node.Style;
            case IMAGE_PRIORITY -> child instanceof Node.Image;
            default -> false;
        };
    }

    private static boolean isSingleLanguageStrings(Block block) {
        String language = null;
        boolean first = true;
        for (Node node : block) {
            if (!(node instanceof Node.TranslateString ts)) {
                return false;
            }
            if (first) {
                language = ts.language();
                first = false;
            } else if (!Objects.equals(language, ts.language())) {
                return false;
            }
        }
        return true;
    }
}
