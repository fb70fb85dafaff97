package com.codegraph.core.query;

import java.util.List;

/**
 * Result of tracing the call chain from one entity.
 *
 * @param root call tree rooted at the start entity
 * @param paths root-to-leaf paths with their truncation reason
 * @param nodesVisited nodes placed in the tree, including the root
 * @param truncatedByDepth true if some path stopped at the depth limit
 * @param truncatedByNodes true if the node budget ran out
 * @param cycleDetected true if some path led back to one of its own ancestors
 */
public record CallChainResult(
    CallNode root,
    List<CallPath> paths,
    int nodesVisited,
    boolean truncatedByDepth,
    boolean truncatedByNodes,
    boolean cycleDetected
) {
    public CallChainResult {
        paths = paths == null ? List.of() : List.copyOf(paths);
    }

    public boolean isTruncated() {
        return truncatedByDepth || truncatedByNodes;
    }
}
