package com.updates.dtree.api;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Helpers for the scalar values that queries and constraints carry.
 *
 * <p>
 * A scalar is a {@link String}, a {@link Long} or a {@link Boolean}. Other
 * integral boxes are widened to {@code Long} so that {@code 32} and
 * {@code 32L} compare equal.
 *
 * <p>
 * {@link #ORDER} is total across kinds: booleans sort before integers, which
 * sort before strings. Within a kind the natural order applies; strings
 * compare lexicographically, which is how version cutoffs are evaluated.
 */
public final class ScalarValues {
    private ScalarValues() {
        // Utility class
    }

    public static final Comparator<Object> ORDER = ScalarValues::compare;

    /** Returns the canonical form of a scalar, or throws if it is not one. */
    public static Object normalize(Object value) {
        Objects.requireNonNull(value, "scalar value");
        if (value instanceof String || value instanceof Long || value instanceof Boolean)
            return value;
        if (value instanceof Integer || value instanceof Short || value instanceof Byte)
            return ((Number) value).longValue();
        throw new IllegalArgumentException(
                "Unsupported scalar " + value + " of type " + value.getClass().getSimpleName());
    }

    public static int compare(Object a, Object b) {
        int ka = kind(a), kb = kind(b);
        if (ka != kb)
            return Integer.compare(ka, kb);
        return switch (ka) {
            case 0 -> Boolean.compare((Boolean) a, (Boolean) b);
            case 1 -> Long.compare((Long) a, (Long) b);
            default -> ((String) a).compareTo((String) b);
        };
    }

    /** Copies values into an immutable set sorted by {@link #ORDER}. */
    public static Set<Object> sortedSet(Collection<?> values) {
        TreeSet<Object> set = new TreeSet<>(ORDER);
        for (Object v : values)
            set.add(normalize(v));
        return Collections.unmodifiableSet(set);
    }

    /** Renders a scalar for humans; strings are quoted. */
    public static String describe(Object value) {
        return value instanceof String s ? '"' + s + '"' : String.valueOf(value);
    }

    public static String describe(Collection<?> values) {
        StringBuilder sb = new StringBuilder("{");
        int i = 0;
        for (Object v : values) {
            if (i++ > 0)
                sb.append(", ");
            sb.append(describe(v));
        }
        return sb.append('}').toString();
    }

    private static int kind(Object value) {
        if (value instanceof Boolean)
            return 0;
        if (value instanceof Long)
            return 1;
        if (value instanceof String)
            return 2;
        throw new IllegalArgumentException("Not a normalized scalar: " + value);
    }
}
