package com.updates.dtree.api;

/**
 * A reachability search went deeper than its configured bound.
 */
public class SearchDepthExceededException extends DecisionTreeException {
    private final int maxDepth;

    public SearchDepthExceededException(int maxDepth, NodeId at) {
        super("Search exceeded max depth " + maxDepth + " at node " + at);
        this.maxDepth = maxDepth;
    }

    public int maxDepth() {
        return maxDepth;
    }
}
