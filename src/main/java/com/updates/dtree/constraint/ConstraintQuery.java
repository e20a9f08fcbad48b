package com.updates.dtree.constraint;

import com.updates.dtree.api.Query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A region of the query space: one constraint per field, conjoined.
 *
 * <p>
 * Fields not mentioned are unconstrained. Every held constraint is
 * satisfiable and none is {@link Constraint.Any}, so two regions describing
 * the same per-field constraints are equal. Fields are kept in name order.
 *
 * <p>
 * Instances are immutable.
 */
public final class ConstraintQuery {

    /** The whole query space; identity element of {@link #intersect}. */
    public static final ConstraintQuery ANY = new ConstraintQuery(new TreeMap<>());

    private final SortedMap<String, Constraint> constraints;

    private ConstraintQuery(SortedMap<String, Constraint> constraints) {
        this.constraints = Collections.unmodifiableSortedMap(constraints);
    }

    /**
     * Builds a region from explicit per-field constraints.
     *
     * @throws IllegalArgumentException if any constraint is unsatisfiable
     */
    public static ConstraintQuery of(Map<String, Constraint> constraints) {
        ConstraintQuery q = ANY;
        for (Map.Entry<String, Constraint> e : constraints.entrySet()) {
            q = q.and(e.getKey(), e.getValue()).orElseThrow(
                    () -> new IllegalArgumentException("Unsatisfiable constraint on " + e.getKey()));
        }
        return q;
    }

    public static ConstraintQuery of(String field, Constraint constraint) {
        return of(Map.of(field, constraint));
    }

    /** The constraint on {@code field}; {@link Constraint#ANY} if unconstrained. */
    public Constraint get(String field) {
        return constraints.getOrDefault(field, Constraint.ANY);
    }

    public Set<String> fields() {
        return constraints.keySet();
    }

    public SortedMap<String, Constraint> asMap() {
        return constraints;
    }

    public boolean isUnconstrained() {
        return constraints.isEmpty();
    }

    /**
     * Narrows one field. Empty if the combined constraint on that field is
     * unsatisfiable.
     */
    public Optional<ConstraintQuery> and(String field, Constraint constraint) {
        Optional<Constraint> merged = Constraints.intersect(get(field), constraint);
        if (merged.isEmpty())
            return Optional.empty();
        return Optional.of(replace(field, merged.get()));
    }

    /** Field-wise intersection. Empty if any field becomes unsatisfiable. */
    public Optional<ConstraintQuery> intersect(ConstraintQuery other) {
        ConstraintQuery acc = this;
        for (Map.Entry<String, Constraint> e : other.constraints.entrySet()) {
            Optional<ConstraintQuery> next = acc.and(e.getKey(), e.getValue());
            if (next.isEmpty())
                return Optional.empty();
            acc = next.get();
        }
        return Optional.of(acc);
    }

    /**
     * Axis-aligned difference {@code this - other} as disjoint fragments.
     *
     * <p>
     * Walks the fields {@code other} constrains. For each one, the part of the
     * remaining region lying outside {@code other} on that field is split off
     * as a fragment; the remainder is then narrowed to {@code other}'s
     * constraint and the walk continues. Whatever remains at the end lies
     * inside {@code other} and is discarded.
     */
    public List<ConstraintQuery> minus(ConstraintQuery other) {
        if (intersect(other).isEmpty())
            return List.of(this);
        List<ConstraintQuery> fragments = new ArrayList<>();
        ConstraintQuery remaining = this;
        for (Map.Entry<String, Constraint> e : other.constraints.entrySet()) {
            String field = e.getKey();
            for (Constraint outside : e.getValue().complement()) {
                remaining.and(field, outside).ifPresent(fragments::add);
            }
            Optional<ConstraintQuery> inside = remaining.and(field, e.getValue());
            if (inside.isEmpty())
                break;
            remaining = inside.get();
        }
        return fragments;
    }

    /** Whether a concrete query lies in this region. Missing fields never match. */
    public boolean matches(Query query) {
        for (Map.Entry<String, Constraint> e : constraints.entrySet()) {
            Object v = query.get(e.getKey());
            if (v == null || !e.getValue().test(v))
                return false;
        }
        return true;
    }

    private ConstraintQuery replace(String field, Constraint constraint) {
        TreeMap<String, Constraint> copy = new TreeMap<>(constraints);
        if (constraint instanceof Constraint.Any)
            copy.remove(field);
        else
            copy.put(field, constraint);
        return new ConstraintQuery(copy);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ConstraintQuery q && constraints.equals(q.constraints);
    }

    @Override
    public int hashCode() {
        return constraints.hashCode();
    }

    @Override
    public String toString() {
        if (constraints.isEmpty())
            return "{*}";
        StringBuilder sb = new StringBuilder("{");
        int i = 0;
        for (Map.Entry<String, Constraint> e : constraints.entrySet()) {
            if (i++ > 0)
                sb.append(", ");
            sb.append(e.getKey()).append(' ').append(e.getValue());
        }
        return sb.append('}').toString();
    }
}
