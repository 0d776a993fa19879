package com.evertz.featured.core.selection;

/**
 * Supplies uniformly distributed integers to the selection algorithm.
 * Production code plugs in a non-deterministic source, tests a seeded one.
 */
public interface RandomSource {

    /**
     * Returns a uniformly distributed value in {@code [0, bound)}.
     *
     * @param bound the exclusive upper bound, must be positive
     * @return the next random value
     */
    int nextInt(int bound);
}
