package com.librenovel.ast;

import java.util.Iterator;
import java.util.List;

/**
 * Ordered sequence of statements at one nesting level.
 */
public record Block(List<Node> nodes) implements Iterable<Node> {

    public Block {
        nodes = List.copyOf(nodes);
    }

    public static Block of(Node... nodes) {
        return new Block(List.of(nodes));
    }

    public static Block empty() {
        return new Block(List.of());
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public Node get(int index) {
        return nodes.get(index);
    }

    /**
     * The first statement, or null for an empty block.
     */
    public Node first() {
        return nodes.isEmpty() ? null : nodes.get(0);
    }

    @Override
    public Iterator<Node> iterator() {
        return nodes.iterator();
    }
}
