package com.librenovel.decompiler;

import com.librenovel.ast.Block;
import com.librenovel.ast.Node;

/**
 * Position within a block, with access to neighbouring statements.
 */
public final class BlockCursor {

    private final Block block;
    private int index;

    public BlockCursor(Block block) {
        this.block = block;
    }

    void moveTo(int index) {
        this.index = index;
    }

    public Block block() {
        return block;
    }

    public int index() {
        return index;
    }

    public Node current() {
        return block.get(index);
    }

    /**
     * The statement at the given offset from the current one, or null
     * outside the block.
     */
    public Node peek(int offset) {
        int target = index + offset;
        if (target < 0 || target >= block.size()) {
            return null;
        }
        return block.get(target);
    }

    /**
     * Whether the statement right before the current one is of the given kind.
     */
    public boolean previousIs(Class<? extends Node> type) {
        return type.isInstance(peek(-1));
    }
}
