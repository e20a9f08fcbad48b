package com.updates.dtree.api;

/**
 * A persisted node record could not be turned back into a node: unknown
 * variant tag, malformed payload or malformed JSON.
 *
 * The caller decides whether to abort or skip the record.
 */
public class DecodingException extends DecisionTreeException {
    private final String nodeId;

    public DecodingException(String nodeId, String message) {
        super(prefix(nodeId) + message);
        this.nodeId = nodeId;
    }

    public DecodingException(String nodeId, String message, Throwable cause) {
        super(prefix(nodeId) + message, cause);
        this.nodeId = nodeId;
    }

    /** Raw id of the offending record, or {@code null} if unknown. */
    public String nodeId() {
        return nodeId;
    }

    private static String prefix(String nodeId) {
        return nodeId == null ? "" : "Node " + nodeId + ": ";
    }
}
