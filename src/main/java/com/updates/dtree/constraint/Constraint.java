package com.updates.dtree.constraint;

import com.updates.dtree.api.ScalarValues;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The acceptable values of a single query field.
 *
 * <p>
 * The variant set is closed. Intersecting two constraints on the same field
 * always yields one of these variants or "unsatisfiable" (see
 * {@link Constraints#intersect(Constraint, Constraint)}); the complement of
 * any constraint is a list of disjoint variants.
 *
 * <p>
 * Values held by constraints are normalized scalars (see
 * {@link ScalarValues}).
 */
public sealed interface Constraint permits Constraint.Any, Constraint.Equals, Constraint.NotEquals,
        Constraint.Interval, Constraint.InSet, Constraint.NotInSet {

    Any ANY = new Any();

    /** Whether a normalized scalar satisfies this constraint. */
    boolean test(Object value);

    /** False only for constraints that no value can satisfy. */
    default boolean isSatisfiable() {
        return true;
    }

    /**
     * Disjoint constraints that together accept exactly the values this one
     * rejects. Empty for {@link Any}.
     */
    List<Constraint> complement();

    // ── Factories ──────────────────────────────────────────────────────

    static Constraint any() {
        return ANY;
    }

    static Constraint equalTo(Object value) {
        return new Equals(value);
    }

    static Constraint notEqualTo(Object value) {
        return new NotEquals(value);
    }

    static Constraint lessThan(Object high) {
        return new Interval(null, high, Set.of());
    }

    static Constraint atLeast(Object low) {
        return new Interval(low, null, Set.of());
    }

    static Constraint between(Object low, Object high) {
        return new Interval(low, high, Set.of());
    }

    static Constraint in(Collection<?> values) {
        return new InSet(ScalarValues.sortedSet(values));
    }

    static Constraint notIn(Collection<?> values) {
        return new NotInSet(ScalarValues.sortedSet(values));
    }

    // ── Variants ───────────────────────────────────────────────────────

    /** Every value. */
    record Any() implements Constraint {
        @Override
        public boolean test(Object value) {
            return true;
        }

        @Override
        public List<Constraint> complement() {
            return List.of();
        }

        @Override
        public String toString() {
            return "*";
        }
    }

    record Equals(Object value) implements Constraint {
        public Equals {
            value = ScalarValues.normalize(value);
        }

        @Override
        public boolean test(Object v) {
            return value.equals(v);
        }

        @Override
        public List<Constraint> complement() {
            return List.of(new NotEquals(value));
        }

        @Override
        public String toString() {
            return "== " + ScalarValues.describe(value);
        }
    }

    record NotEquals(Object value) implements Constraint {
        public NotEquals {
            value = ScalarValues.normalize(value);
        }

        @Override
        public boolean test(Object v) {
            return !value.equals(v);
        }

        @Override
        public List<Constraint> complement() {
            return List.of(new Equals(value));
        }

        @Override
        public String toString() {
            return "!= " + ScalarValues.describe(value);
        }
    }

    /**
     * Values in {@code [low, high)} under {@link ScalarValues#ORDER}, minus the
     * {@code excluded} points. A {@code null} bound is unbounded. Excluded
     * points outside the range are dropped on construction.
     */
    record Interval(Object low, Object high, Set<Object> excluded) implements Constraint {
        public Interval {
            low = low == null ? null : ScalarValues.normalize(low);
            high = high == null ? null : ScalarValues.normalize(high);
            List<Object> kept = new ArrayList<>();
            for (Object e : Objects.requireNonNull(excluded, "excluded")) {
                Object v = ScalarValues.normalize(e);
                if (inRange(low, high, v))
                    kept.add(v);
            }
            excluded = ScalarValues.sortedSet(kept);
        }

        @Override
        public boolean test(Object v) {
            return inRange(low, high, v) && !excluded.contains(v);
        }

        /**
         * False when the range is empty or when the excluded points cover all
         * of it, which can only happen below the first string.
         */
        @Override
        public boolean isSatisfiable() {
            if (low != null && high != null && ScalarValues.compare(low, high) >= 0)
                return false;
            return size() > excluded.size();
        }

        /**
         * Number of values in {@code [low, high)}, saturating at
         * {@link Long#MAX_VALUE}. Unbounded once strings are in range.
         */
        long size() {
            if (high == null || high instanceof String)
                return Long.MAX_VALUE;
            long n = 0;
            if (inRange(low, high, Boolean.FALSE))
                n++;
            if (inRange(low, high, Boolean.TRUE))
                n++;
            if (high instanceof Long h) {
                long l = low instanceof Long x ? x : Long.MIN_VALUE;
                if (l < h) {
                    long span = h - l;
                    // overflowed spans wrap to negative
                    if (span < 0 || span > Long.MAX_VALUE - n)
                        return Long.MAX_VALUE;
                    n += span;
                }
            }
            return n;
        }

        @Override
        public List<Constraint> complement() {
            List<Constraint> out = new ArrayList<>(3);
            if (low != null)
                out.add(new Interval(null, low, Set.of()));
            if (high != null)
                out.add(new Interval(high, null, Set.of()));
            if (!excluded.isEmpty())
                out.add(new InSet(excluded));
            return out;
        }

        static boolean inRange(Object low, Object high, Object v) {
            return (low == null || ScalarValues.compare(v, low) >= 0)
                    && (high == null || ScalarValues.compare(v, high) < 0);
        }

        @Override
        public String toString() {
            String s = "[" + (low == null ? "-inf" : ScalarValues.describe(low)) + ", "
                    + (high == null ? "+inf" : ScalarValues.describe(high)) + ")";
            return excluded.isEmpty() ? s : s + " except " + ScalarValues.describe(excluded);
        }
    }

    record InSet(Set<Object> values) implements Constraint {
        public InSet {
            values = ScalarValues.sortedSet(values);
        }

        @Override
        public boolean test(Object v) {
            return values.contains(v);
        }

        @Override
        public boolean isSatisfiable() {
            return !values.isEmpty();
        }

        @Override
        public List<Constraint> complement() {
            return values.isEmpty() ? List.of(ANY) : List.of(new NotInSet(values));
        }

        @Override
        public String toString() {
            return "in " + ScalarValues.describe(values);
        }
    }

    record NotInSet(Set<Object> values) implements Constraint {
        public NotInSet {
            values = ScalarValues.sortedSet(values);
        }

        @Override
        public boolean test(Object v) {
            return !values.contains(v);
        }

        @Override
        public List<Constraint> complement() {
            return values.isEmpty() ? List.of() : List.of(new InSet(values));
        }

        @Override
        public String toString() {
            return "not in " + ScalarValues.describe(values);
        }
    }
}
