package com.updates.dtree.api;

import java.util.Objects;

/**
 * Result of asking one node to handle a query: either carry on at another
 * node or stop with an outcome value.
 */
public sealed interface Step permits Step.Continue, Step.Outcome {

    static Step next(NodeId nodeId) {
        return new Continue(nodeId);
    }

    static Step outcome(Object value) {
        return new Outcome(value);
    }

    /** Traversal continues at {@code next}. */
    record Continue(NodeId next) implements Step {
        public Continue {
            Objects.requireNonNull(next, "next");
        }
    }

    /** Traversal stops with {@code value}. */
    record Outcome(Object value) implements Step {
    }
}
