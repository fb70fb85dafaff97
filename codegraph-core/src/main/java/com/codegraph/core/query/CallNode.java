package com.codegraph.core.query;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Node of a call tree.
 *
 * @param entityId called entity, or null for an external callee
 * @param name qualified name of the entity, or the written name of an external callee
 * @param depth distance from the root
 * @param external true if the callee lies outside the project
 * @param children callees expanded from this node
 */
public record CallNode(
    String entityId,
    String name,
    int depth,
    boolean external,
    List<CallNode> children
) {
    public CallNode {
        children = children == null ? List.of() : List.copyOf(children);
    }

    /**
     * Counts this node and all its descendants.
     */
    public int size() {
        int size = 0;
        Deque<CallNode> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            CallNode node = pending.pop();
            size++;
            node.children.forEach(pending::push);
        }
        return size;
    }
}
