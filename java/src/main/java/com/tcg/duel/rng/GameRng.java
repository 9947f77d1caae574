package com.tcg.duel.rng;

import java.security.SecureRandom;
import java.util.Collections;
import java.util.List;

/**
 * Seeded Mulberry32 generator. Deck shuffles and simulated play are reproducible per seed,
 * and shuffles agree bit-for-bit with other Mulberry32 ports fed the same 32-bit seed.
 */
public class GameRng {
    private static final int GOLDEN_GAMMA = 0x6D2B79F5;
    private static final double TWO_POW_32 = 4294967296.0;

    private int state;

    /**
     * Only the lower 32 bits of the seed are used.
     */
    public GameRng(long seed) {
        this.state = (int) seed;
    }

    public GameRng() {
        this(new SecureRandom().nextLong());
    }

    /**
     * Next value in [0, 1). Java int arithmetic wraps exactly like the 32-bit reference.
     */
    public double next() {
        state += GOLDEN_GAMMA;
        int t = state;
        t = (t ^ (t >>> 15)) * (t | 1);
        t ^= t + (t ^ (t >>> 7)) * (t | 61);
        return Integer.toUnsignedLong(t ^ (t >>> 14)) / TWO_POW_32;
    }

    /**
     * Uniform integer in [0, bound).
     */
    public int nextInt(int bound) {
        if (bound <= 0) {
            throw new IllegalArgumentException("bound must be positive: " + bound);
        }
        return (int) Math.floor(next() * bound);
    }

    /**
     * Uniformly chosen element of a non-empty list.
     */
    public <T> T pick(List<T> options) {
        if (options.isEmpty()) {
            throw new IllegalArgumentException("cannot pick from an empty list");
        }
        return options.get(nextInt(options.size()));
    }

    /**
     * In-place Fisher-Yates shuffle, walking from the last index down to 1.
     */
    public <T> void shuffle(List<T> list) {
        for (int i = list.size() - 1; i >= 1; i--) {
            int j = (int) Math.floor(next() * (i + 1));
            Collections.swap(list, i, j);
        }
    }

    /**
     * Current internal state as an unsigned 32-bit value.
     */
    public long getState() {
        return Integer.toUnsignedLong(state);
    }
}
