package com.svparser.ast;

import java.util.List;

/**
 * Ordered run of block items bounded by a terminator keyword or by end of input.
 * A block is not a node of its own; it is the body of the node that owns it.
 */
public record Block(List<BlockItem> items) {
    public static Block empty() {
        return new Block(List.of());
    }

    public int size() {
        return items.size();
    }

    public BlockItem get(int index) {
        return items.get(index);
    }
}
