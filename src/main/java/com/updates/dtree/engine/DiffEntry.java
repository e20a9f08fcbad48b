package com.updates.dtree.engine;

import com.updates.dtree.constraint.QueryRegions;

/**
 * One change between two graph versions: the population in {@code regions}
 * either lost {@code oldValue} (then {@code newValue} is null) or gained
 * {@code newValue} (then {@code oldValue} is null).
 */
public record DiffEntry(QueryRegions regions, Object oldValue, Object newValue) {

    public static DiffEntry lost(QueryRegions regions, Object oldValue) {
        return new DiffEntry(regions, oldValue, null);
    }

    public static DiffEntry gained(QueryRegions regions, Object newValue) {
        return new DiffEntry(regions, null, newValue);
    }

    public boolean isLoss() {
        return oldValue != null;
    }

    public boolean isGain() {
        return newValue != null;
    }

    @Override
    public String toString() {
        return isLoss() ? "lost " + oldValue + ": " + regions : "gained " + newValue + ": " + regions;
    }
}
