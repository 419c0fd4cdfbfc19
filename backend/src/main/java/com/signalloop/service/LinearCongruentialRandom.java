package com.signalloop.service;

/**
 * 48-bit linear congruential generator with the same constants as
 * {@link java.util.Random}. Given a seed, the sequence is fixed across JVMs and
 * releases, which makes selection runs reproducible. Not thread-safe.
 */
public final class LinearCongruentialRandom {

    private static final long MULTIPLIER = 0x5DEECE66DL;
    private static final long INCREMENT = 0xBL;
    private static final long MASK = (1L << 48) - 1;

    private long state;

    public LinearCongruentialRandom(long seed) {
        this.state = (seed ^ MULTIPLIER) & MASK;
    }

    /**
     * @return Uniform value in [0, 1)
     */
    public double nextDouble() {
        return ((long) next(26) << 27 | next(27)) * 0x1.0p-53;
    }

    private int next(int bits) {
        state = (state * MULTIPLIER + INCREMENT) & MASK;
        return (int) (state >>> (48 - bits));
    }
}
