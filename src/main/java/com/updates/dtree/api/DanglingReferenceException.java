package com.updates.dtree.api;

/**
 * A graph refers to a node id it does not contain.
 */
public class DanglingReferenceException extends DecisionTreeException {
    private final NodeId source;
    private final NodeId missing;

    /**
     * @param source  node holding the reference, or {@code null} for the root
     *                designation
     * @param missing id that could not be resolved
     */
    public DanglingReferenceException(NodeId source, NodeId missing) {
        super(source == null
                ? "Root node " + missing + " does not exist"
                : "Node " + source + " references missing node " + missing);
        this.source = source;
        this.missing = missing;
    }

    public NodeId source() {
        return source;
    }

    public NodeId missing() {
        return missing;
    }
}
