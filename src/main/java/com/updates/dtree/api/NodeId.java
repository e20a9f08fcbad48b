package com.updates.dtree.api;

import java.util.Objects;

/**
 * Identifier of a node within a decision graph.
 *
 * Only uniqueness matters; ids carry no ordering semantics. Numeric ids are
 * canonicalised to their decimal string so that {@code NodeId.of(7)} and
 * {@code NodeId.of("7")} name the same node.
 */
public record NodeId(String value) {

    /** Conventional start node of every graph. */
    public static final NodeId ROOT = new NodeId("0");

    public NodeId {
        Objects.requireNonNull(value, "value");
        if (value.isEmpty())
            throw new IllegalArgumentException("NodeId must not be empty");
    }

    public static NodeId of(String value) {
        return new NodeId(value);
    }

    public static NodeId of(long value) {
        return new NodeId(Long.toString(value));
    }

    @Override
    public String toString() {
        return value;
    }
}
