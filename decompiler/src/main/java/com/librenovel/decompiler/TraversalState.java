package com.librenovel.decompiler;

import com.librenovel.ast.Block;
import com.librenovel.ast.Node;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Mutable state of one rendering pass: the stack of block cursors and the
 * two registers that couple neighbouring statements.
 * Owned by a single render call and never shared.
 */
public final class TraversalState {

    private final Deque<BlockCursor> cursors = new ArrayDeque<>();
    private PendingWith pendingWith = PendingWith.absent();
    private Node.Say pendingSay;

    /**
     * Enter a block and return its cursor.
     */
    public BlockCursor enter(Block block) {
        BlockCursor cursor = new BlockCursor(block);
        cursors.push(cursor);
        return cursor;
    }

    /**
     * Leave the current block. A pairing armed in this block must have been
     * resolved by now.
     */
    public void leave() {
        if (!pendingWith.isAbsent() && pendingWith.ownerDepth() == cursors.size()) {
            throw StructuralInconsistencyException.unresolvedPairedWith(
                pendingWith.expression(), pendingWith.location());
        }
        cursors.pop();
    }

    public BlockCursor cursor() {
        return cursors.peek();
    }

    public int depth() {
        return cursors.size();
    }

    public PendingWith pendingWith() {
        return pendingWith;
    }

    public void armPendingWith(String expression, Node.SourceLocation location) {
        pendingWith = PendingWith.armed(expression, cursors.size(), location);
    }

    public void consumePendingWith() {
        pendingWith = pendingWith.consume();
    }

    public void clearPendingWith() {
        pendingWith = PendingWith.absent();
    }

    public Node.Say pendingSay() {
        return pendingSay;
    }

    public void deferSay(Node.Say say) {
        pendingSay = say;
    }

    /**
     * Return the deferred say, if any, and clear the register.
     */
    public Node.Say takePendingSay() {
        Node.Say say = pendingSay;
        pendingSay = null;
        return say;
    }
}
