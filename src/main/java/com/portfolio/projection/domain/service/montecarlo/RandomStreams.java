package com.portfolio.projection.domain.service.montecarlo;

import java.util.SplittableRandom;

/**
 * Seeds the random streams a batch draws from. Streams are handed to the simulator explicitly,
 * the engine keeps no random state of its own.
 */
public final class RandomStreams {

    private static final long GOLDEN_GAMMA = 0x9e3779b97f4a7c15L;

    private RandomStreams() {
    }

    public static SplittableRandom batchStream(long seed) {
        return new SplittableRandom(seed);
    }

    public static SplittableRandom pathStream(long seed, int pathIndex) {
        return new SplittableRandom(mix64(seed + GOLDEN_GAMMA * (pathIndex + 1L)));
    }

    // Stafford variant 13 finalizer, spreads neighbouring path indices across the seed space
    static long mix64(long z) {
        z = (z ^ (z >>> 30)) * 0xbf58476d1ce4e5b9L;
        z = (z ^ (z >>> 27)) * 0x94d049bb133111ebL;
        return z ^ (z >>> 31);
    }
}
