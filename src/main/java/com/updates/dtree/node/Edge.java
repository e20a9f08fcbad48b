package com.updates.dtree.node;

import com.updates.dtree.api.NodeId;
import com.updates.dtree.constraint.Constraint;
import com.updates.dtree.constraint.ConstraintQuery;

import java.util.Objects;
import java.util.Optional;

/**
 * A labelled out-edge: queries satisfying {@code constraint} on
 * {@code field} continue at {@code target}.
 *
 * @param field      field the constraint applies to; {@code null} for
 *                   unconditioned edges
 * @param constraint constraint on that field
 * @param target     successor node
 * @param label      display label, e.g. {@code "less"} or {@code "default"}
 */
public record Edge(String field, Constraint constraint, NodeId target, String label) {

    public Edge {
        Objects.requireNonNull(constraint, "constraint");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(label, "label");
        if (field == null && !(constraint instanceof Constraint.Any))
            throw new IllegalArgumentException("Only unconditioned edges may omit the field");
    }

    public static Edge unconditioned(NodeId target, String label) {
        return new Edge(null, Constraint.ANY, target, label);
    }

    /** Narrows {@code accumulated} by this edge; empty if nothing gets through. */
    public Optional<ConstraintQuery> narrow(ConstraintQuery accumulated) {
        return field == null ? Optional.of(accumulated) : accumulated.and(field, constraint);
    }
}
