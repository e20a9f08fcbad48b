package com.updates.dtree.node;

import com.updates.dtree.api.NodeId;
import com.updates.dtree.api.NodeType;
import com.updates.dtree.api.Query;
import com.updates.dtree.api.RandomSource;
import com.updates.dtree.api.ScalarValues;
import com.updates.dtree.api.Step;
import com.updates.dtree.constraint.Constraint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Routes by exact match against a small fixed enumeration; unmatched values
 * go to {@code fallback}. Several cases may share a target.
 *
 * @param field    field to match
 * @param cases    enumerated value to target, in declaration order
 * @param fallback target for values not in {@code cases}
 */
public record EnumeratedNode(String field, Map<Object, NodeId> cases, NodeId fallback)
        implements DecisionNode {

    public EnumeratedNode {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(fallback, "fallback");
        Map<Object, NodeId> copy = new LinkedHashMap<>();
        for (Map.Entry<Object, NodeId> e : cases.entrySet()) {
            Object key = ScalarValues.normalize(e.getKey());
            if (copy.put(key, Objects.requireNonNull(e.getValue(), "case target")) != null)
                throw new IllegalArgumentException("Duplicate case " + key + " on field " + field);
        }
        cases = Collections.unmodifiableMap(copy);
    }

    @Override
    public NodeType type() {
        return NodeType.ENUMERATED;
    }

    @Override
    public Step decide(Query query, RandomSource random) {
        NodeId target = cases.get(query.require(field));
        return Step.next(target != null ? target : fallback);
    }

    @Override
    public List<Edge> edges() {
        List<Edge> edges = new ArrayList<>(cases.size() + 1);
        for (Map.Entry<Object, NodeId> e : cases.entrySet())
            edges.add(new Edge(field, Constraint.equalTo(e.getKey()), e.getValue(), String.valueOf(e.getKey())));
        edges.add(new Edge(field, Constraint.notIn(cases.keySet()), fallback, "default"));
        return edges;
    }

    @Override
    public String displayLabel() {
        return field + " one of " + cases.size();
    }
}
