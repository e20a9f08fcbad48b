package com.updates.dtree.constraint;

import com.updates.dtree.api.Query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * A union of regions: a query belongs to the set if any member region
 * matches it. Members may overlap and are kept in the order they were
 * produced.
 */
public final class QueryRegions implements Iterable<ConstraintQuery> {

    public static final QueryRegions EMPTY = new QueryRegions(List.of());

    private final List<ConstraintQuery> regions;

    private QueryRegions(List<ConstraintQuery> regions) {
        this.regions = regions;
    }

    public static QueryRegions of(List<ConstraintQuery> regions) {
        return regions.isEmpty() ? EMPTY : new QueryRegions(Collections.unmodifiableList(new ArrayList<>(regions)));
    }

    public static QueryRegions of(ConstraintQuery... regions) {
        return of(List.of(regions));
    }

    public List<ConstraintQuery> regions() {
        return regions;
    }

    public int size() {
        return regions.size();
    }

    public boolean isEmpty() {
        return regions.isEmpty();
    }

    public boolean matches(Query query) {
        for (ConstraintQuery r : regions)
            if (r.matches(query))
                return true;
        return false;
    }

    public QueryRegions union(QueryRegions other) {
        if (other.isEmpty())
            return this;
        if (isEmpty())
            return other;
        List<ConstraintQuery> all = new ArrayList<>(regions);
        all.addAll(other.regions);
        return of(all);
    }

    /** Queries matched by some region here and by no region of {@code other}. */
    public QueryRegions subtract(QueryRegions other) {
        return subtract(this, other);
    }

    public static QueryRegions subtract(QueryRegions a, QueryRegions b) {
        List<ConstraintQuery> current = a.regions;
        for (ConstraintQuery cut : b.regions) {
            if (current.isEmpty())
                break;
            List<ConstraintQuery> next = new ArrayList<>();
            for (ConstraintQuery region : current)
                next.addAll(region.minus(cut));
            current = next;
        }
        return of(current);
    }

    @Override
    public Iterator<ConstraintQuery> iterator() {
        return regions.iterator();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof QueryRegions q && regions.equals(q.regions);
    }

    @Override
    public int hashCode() {
        return regions.hashCode();
    }

    @Override
    public String toString() {
        if (regions.isEmpty())
            return "(none)";
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < regions.size(); i++) {
            if (i > 0)
                sb.append(" OR ");
            sb.append(regions.get(i));
        }
        return sb.toString();
    }
}
