package com.updates.dtree.constraint;

import com.updates.dtree.api.ScalarValues;
import com.updates.dtree.constraint.Constraint.Any;
import com.updates.dtree.constraint.Constraint.Equals;
import com.updates.dtree.constraint.Constraint.InSet;
import com.updates.dtree.constraint.Constraint.Interval;
import com.updates.dtree.constraint.Constraint.NotEquals;
import com.updates.dtree.constraint.Constraint.NotInSet;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Intersection of single-field constraints.
 *
 * <p>
 * The operation is total over the variant set and symmetric: each unordered
 * pair of variants is handled once, with the operands swapped into rank order
 * first. The result is empty when no value satisfies both constraints.
 *
 * <table>
 * <caption>Pairs (after ordering)</caption>
 * <tr><td>Any ∩ X</td><td>X</td></tr>
 * <tr><td>Equals(a) ∩ X</td><td>Equals(a) if X accepts a</td></tr>
 * <tr><td>NotEquals(a) ∩ NotEquals(b)</td><td>NotEquals(a) or NotInSet{a, b}</td></tr>
 * <tr><td>NotEquals(a) ∩ Interval</td><td>Interval excluding a</td></tr>
 * <tr><td>NotEquals(a) ∩ InSet(s)</td><td>InSet(s - a)</td></tr>
 * <tr><td>NotEquals(a) ∩ NotInSet(s)</td><td>NotInSet(s + a)</td></tr>
 * <tr><td>Interval ∩ Interval</td><td>[max low, min high), exclusions merged</td></tr>
 * <tr><td>Interval ∩ InSet(s)</td><td>InSet(members of s inside the interval)</td></tr>
 * <tr><td>Interval ∩ NotInSet(s)</td><td>Interval excluding s</td></tr>
 * <tr><td>InSet(a) ∩ InSet(b)</td><td>InSet(a ∩ b)</td></tr>
 * <tr><td>InSet(a) ∩ NotInSet(b)</td><td>InSet(a - b)</td></tr>
 * <tr><td>NotInSet(a) ∩ NotInSet(b)</td><td>NotInSet(a ∪ b)</td></tr>
 * </table>
 */
public final class Constraints {
    private Constraints() {
        // Utility class
    }

    public static Optional<Constraint> intersect(Constraint a, Constraint b) {
        if (!a.isSatisfiable() || !b.isSatisfiable())
            return Optional.empty();
        if (rank(a) > rank(b)) {
            Constraint t = a;
            a = b;
            b = t;
        }
        Constraint result = combine(a, b);
        return result != null && result.isSatisfiable() ? Optional.of(result) : Optional.empty();
    }

    // Returns null for unsatisfiable. rank(a) <= rank(b).
    private static Constraint combine(Constraint a, Constraint b) {
        if (a instanceof Any)
            return b;
        if (a instanceof Equals eq)
            return b.test(eq.value()) ? eq : null;

        if (a instanceof NotEquals ne) {
            Object v = ne.value();
            if (b instanceof NotEquals other)
                return v.equals(other.value()) ? ne : new NotInSet(Set.of(v, other.value()));
            if (b instanceof Interval iv)
                return new Interval(iv.low(), iv.high(), plus(iv.excluded(), v));
            if (b instanceof InSet in)
                return new InSet(minus(in.values(), Set.of(v)));
            if (b instanceof NotInSet nin)
                return new NotInSet(plus(nin.values(), v));
        }

        if (a instanceof Interval iv) {
            if (b instanceof Interval other) {
                Set<Object> excluded = new HashSet<>(iv.excluded());
                excluded.addAll(other.excluded());
                return new Interval(maxLow(iv.low(), other.low()), minHigh(iv.high(), other.high()), excluded);
            }
            if (b instanceof InSet in) {
                List<Object> kept = new ArrayList<>();
                for (Object v : in.values())
                    if (iv.test(v))
                        kept.add(v);
                return new InSet(ScalarValues.sortedSet(kept));
            }
            if (b instanceof NotInSet nin) {
                Set<Object> excluded = new HashSet<>(iv.excluded());
                excluded.addAll(nin.values());
                return new Interval(iv.low(), iv.high(), excluded);
            }
        }

        if (a instanceof InSet in) {
            if (b instanceof InSet other) {
                List<Object> kept = new ArrayList<>();
                for (Object v : in.values())
                    if (other.values().contains(v))
                        kept.add(v);
                return new InSet(ScalarValues.sortedSet(kept));
            }
            if (b instanceof NotInSet nin)
                return new InSet(minus(in.values(), nin.values()));
        }

        if (a instanceof NotInSet nin && b instanceof NotInSet other) {
            Set<Object> union = new HashSet<>(nin.values());
            union.addAll(other.values());
            return new NotInSet(union);
        }

        throw new IllegalStateException("Unhandled constraint pair: " + a + " / " + b);
    }

    private static int rank(Constraint c) {
        if (c instanceof Any)
            return 0;
        if (c instanceof Equals)
            return 1;
        if (c instanceof NotEquals)
            return 2;
        if (c instanceof Interval)
            return 3;
        if (c instanceof InSet)
            return 4;
        return 5;
    }

    private static Object maxLow(Object a, Object b) {
        if (a == null)
            return b;
        if (b == null)
            return a;
        return ScalarValues.compare(a, b) >= 0 ? a : b;
    }

    private static Object minHigh(Object a, Object b) {
        if (a == null)
            return b;
        if (b == null)
            return a;
        return ScalarValues.compare(a, b) <= 0 ? a : b;
    }

    private static Set<Object> plus(Set<Object> values, Object v) {
        Set<Object> out = new HashSet<>(values);
        out.add(v);
        return out;
    }

    private static Set<Object> minus(Set<Object> values, Set<Object> removed) {
        List<Object> kept = new ArrayList<>();
        for (Object v : values)
            if (!removed.contains(v))
                kept.add(v);
        return ScalarValues.sortedSet(kept);
    }
}
