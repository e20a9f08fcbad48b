package com.updates.dtree.api;

/**
 * A visited node reads a field the query does not carry.
 *
 * This is a caller bug; evaluation is not retried.
 */
public class MissingFieldException extends DecisionTreeException {
    private final String field;
    private final NodeId node;

    public MissingFieldException(String field, NodeId node) {
        super(message(field, node));
        this.field = field;
        this.node = node;
    }

    private MissingFieldException(String field, NodeId node, Throwable cause) {
        super(message(field, node), cause);
        this.field = field;
        this.node = node;
    }

    public String field() {
        return field;
    }

    /** The node that read the field, or {@code null} if not yet known. */
    public NodeId node() {
        return node;
    }

    /** Returns a copy attributed to {@code nodeId}. */
    public MissingFieldException atNode(NodeId nodeId) {
        return new MissingFieldException(field, nodeId, this);
    }

    private static String message(String field, NodeId node) {
        return node == null
                ? "Query is missing field '" + field + "'"
                : "Query is missing field '" + field + "' required by node " + node;
    }
}
