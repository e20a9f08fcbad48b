package com.updates.dtree.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A concrete client query: field name to scalar value.
 *
 * Instances are immutable; values are normalized on construction (see
 * {@link ScalarValues#normalize(Object)}).
 */
public final class Query {
    private final Map<String, Object> fields;

    private Query(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static Query of(Map<String, ?> values) {
        Map<String, Object> copy = new LinkedHashMap<>(values.size() * 2);
        for (Map.Entry<String, ?> e : values.entrySet())
            copy.put(e.getKey(), ScalarValues.normalize(e.getValue()));
        return new Query(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns the value of a field, or {@code null} if the query omits it. */
    public Object get(String field) {
        return fields.get(field);
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    /**
     * Returns the value of a field a node needs.
     *
     * @throws MissingFieldException if the query omits it
     */
    public Object require(String field) {
        Object v = fields.get(field);
        if (v == null)
            throw new MissingFieldException(field, null);
        return v;
    }

    public Map<String, Object> asMap() {
        return fields;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Query q && fields.equals(q.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "Query" + fields;
    }

    /** Fluent builder, mostly for tests and callers assembling queries by hand. */
    public static final class Builder {
        private final Map<String, Object> values = new LinkedHashMap<>();

        public Builder with(String field, Object value) {
            values.put(field, value);
            return this;
        }

        public Query build() {
            return Query.of(values);
        }
    }
}
