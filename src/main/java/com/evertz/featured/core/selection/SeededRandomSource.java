package com.evertz.featured.core.selection;

import java.util.Random;

/**
 * Deterministic source: the same seed always produces the same sequence of draws.
 */
public class SeededRandomSource implements RandomSource {

    private final Random random;

    public SeededRandomSource(long seed) {
        this.random = new Random(seed);
    }

    @Override
    public int nextInt(int bound) {
        return random.nextInt(bound);
    }
}
