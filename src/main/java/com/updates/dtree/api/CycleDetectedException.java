package com.updates.dtree.api;

import java.util.List;

/**
 * A graph contains a cycle, so some traversal would never terminate.
 */
public class CycleDetectedException extends DecisionTreeException {
    private final List<NodeId> unresolved;

    public CycleDetectedException(List<NodeId> unresolved) {
        super("Cycle detected! Nodes on or behind a cycle: " + unresolved);
        this.unresolved = List.copyOf(unresolved);
    }

    public List<NodeId> unresolved() {
        return unresolved;
    }
}
