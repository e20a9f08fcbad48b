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
 * Routes to {@code success} when {@code field == value}, otherwise to
 * {@code failure}.
 *
 * Covers product matching, exact version matching, architecture checks and
 * one-off flags (see {@link Nodes}).
 */
public record EqualsBranchNode(String field, Object value, NodeId success, NodeId failure)
        implements DecisionNode {

    public EqualsBranchNode {
        Objects.requireNonNull(field, "field");
        value = ScalarValues.normalize(value);
        Objects.requireNonNull(success, "success");
        Objects.requireNonNull(failure, "failure");
    }

    @Override
    public NodeType type() {
        return NodeType.EQUALS_BRANCH;
    }

    @Override
    public Step decide(Query query, RandomSource random) {
        return Step.next(value.equals(query.require(field)) ? success : failure);
    }

    @Override
    public List<Edge> edges() {
        return List.of(
                new Edge(field, Constraint.equalTo(value), success, "success"),
                new Edge(field, Constraint.notEqualTo(value), failure, "failure"));
    }

    @Override
    public String displayLabel() {
        return field + " == " + ScalarValues.describe(value);
    }
}
