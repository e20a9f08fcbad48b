package com.updates.dtree.node;

import com.updates.dtree.api.NodeId;
import com.updates.dtree.api.NodeType;
import com.updates.dtree.api.Query;
import com.updates.dtree.api.RandomSource;
import com.updates.dtree.api.ScalarValues;
import com.updates.dtree.api.Step;
import com.updates.dtree.constraint.Constraint;

import java.util.List;
import java.util.Objects;

/**
 * Routes to {@code less} when the field sorts before {@code cutoff},
 * otherwise to {@code greaterOrEqual}.
 *
 * Ordering is {@link ScalarValues#ORDER}; version strings therefore compare
 * lexicographically ({@code "55.9" < "56" <= "56.0"}).
 */
public record OrderedCutoffNode(String field, Object cutoff, NodeId less, NodeId greaterOrEqual)
        implements DecisionNode {

    public OrderedCutoffNode {
        Objects.requireNonNull(field, "field");
        cutoff = ScalarValues.normalize(cutoff);
        Objects.requireNonNull(less, "less");
        Objects.requireNonNull(greaterOrEqual, "greaterOrEqual");
    }

    @Override
    public NodeType type() {
        return NodeType.ORDERED_CUTOFF;
    }

    @Override
    public Step decide(Query query, RandomSource random) {
        Object v = query.require(field);
        return Step.next(ScalarValues.compare(v, cutoff) < 0 ? less : greaterOrEqual);
    }

    @Override
    public List<Edge> edges() {
        return List.of(
                new Edge(field, Constraint.lessThan(cutoff), less, "less"),
                new Edge(field, Constraint.atLeast(cutoff), greaterOrEqual, "gte"));
    }

    @Override
    public String displayLabel() {
        return field + " < " + ScalarValues.describe(cutoff);
    }
}
