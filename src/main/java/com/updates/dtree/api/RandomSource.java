package com.updates.dtree.api;

/**
 * Source of draws for probabilistic nodes.
 *
 * Implementations are passed explicitly to evaluation so that tests can force
 * a sequence and concurrent evaluations need not share generator state.
 * See {@code RandomSources} for the standard implementations.
 */
@FunctionalInterface
public interface RandomSource {

    /**
     * Returns the next draw.
     *
     * @return a value in {@code [0, 1)}
     */
    double nextDouble();
}
