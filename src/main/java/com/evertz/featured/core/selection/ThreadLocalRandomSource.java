package com.evertz.featured.core.selection;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Non-deterministic source, safe to share between concurrent requests.
 */
public class ThreadLocalRandomSource implements RandomSource {

    @Override
    public int nextInt(int bound) {
        return ThreadLocalRandom.current().nextInt(bound);
    }
}
