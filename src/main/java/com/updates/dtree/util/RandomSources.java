package com.updates.dtree.util;

import com.updates.dtree.api.RandomSource;

import java.util.SplittableRandom;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Standard implementations of {@link RandomSource}.
 */
public final class RandomSources {
    private RandomSources() {
        // Utility class
    }

    /**
     * Draws from the calling thread's generator. Safe to share; concurrent
     * evaluations never contend on one generator.
     */
    public static RandomSource threadLocal() {
        return () -> ThreadLocalRandom.current().nextDouble();
    }

    /**
     * Reproducible draws from a seeded generator. Not thread-safe: give each
     * evaluating thread its own instance.
     */
    public static RandomSource seeded(long seed) {
        SplittableRandom rng = new SplittableRandom(seed);
        return rng::nextDouble;
    }

    /** Always returns {@code value}. Useful to pin every rollout one way. */
    public static RandomSource constant(double value) {
        checkDraw(value);
        return () -> value;
    }

    /**
     * Replays {@code draws} in order, then fails. Lets a test force each
     * probabilistic decision explicitly.
     */
    public static RandomSource sequence(double... draws) {
        double[] copy = draws.clone();
        for (double d : copy)
            checkDraw(d);
        return new RandomSource() {
            private int next;

            @Override
            public double nextDouble() {
                if (next >= copy.length)
                    throw new IllegalStateException("Forced random sequence exhausted after " + copy.length + " draws");
                return copy[next++];
            }
        };
    }

    private static void checkDraw(double d) {
        if (!(d >= 0.0 && d < 1.0))
            throw new IllegalArgumentException("Draw must be within [0, 1): " + d);
    }
}
