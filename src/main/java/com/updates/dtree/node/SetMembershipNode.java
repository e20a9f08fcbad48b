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
import java.util.Set;

/**
 * Routes to {@code in} when the field is one of {@code values}, otherwise to
 * {@code notIn}. The set may be empty, in which case every query goes to
 * {@code notIn}.
 */
public record SetMembershipNode(String field, Set<Object> values, NodeId in, NodeId notIn)
        implements DecisionNode {

    public SetMembershipNode {
        Objects.requireNonNull(field, "field");
        values = ScalarValues.sortedSet(values);
        Objects.requireNonNull(in, "in");
        Objects.requireNonNull(notIn, "notIn");
    }

    @Override
    public NodeType type() {
        return NodeType.SET_MEMBERSHIP;
    }

    @Override
    public Step decide(Query query, RandomSource random) {
        return Step.next(values.contains(query.require(field)) ? in : notIn);
    }

    @Override
    public List<Edge> edges() {
        return List.of(
                new Edge(field, Constraint.in(values), in, "in"),
                new Edge(field, Constraint.notIn(values), notIn, "not in"));
    }

    @Override
    public String displayLabel() {
        return field + " in " + values.size() + " values";
    }
}
