package com.updates.dtree.node;

import com.updates.dtree.api.NodeType;
import com.updates.dtree.api.Query;
import com.updates.dtree.api.RandomSource;
import com.updates.dtree.api.ScalarValues;
import com.updates.dtree.api.Step;

import java.util.List;

/**
 * Serves every query with a constant value.
 */
public record TerminalNode(Object value) implements DecisionNode {

    public TerminalNode {
        value = ScalarValues.normalize(value);
    }

    @Override
    public NodeType type() {
        return NodeType.TERMINAL;
    }

    @Override
    public Step decide(Query query, RandomSource random) {
        return Step.outcome(value);
    }

    @Override
    public List<Edge> edges() {
        return List.of();
    }

    @Override
    public String displayLabel() {
        return String.valueOf(value);
    }
}
