package io.github.manjago.evolver.core;

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;

/**
 * Random number source shared by every genetic operator.
 *
 * Uses Apache Commons RNG XO_RO_SHI_RO_128_PP algorithm:
 * - Fast and high quality
 * - State is just 2 longs (128 bits)
 *
 * The underlying provider is not thread-safe, so every draw is synchronized
 * on this instance. Several engines may share one source and interleave
 * their draws in any order.
 */
public final class EvoRng {

    private static final RandomSource ALGORITHM = RandomSource.XO_RO_SHI_RO_128_PP;

    private final long initialSeed;
    private final UniformRandomProvider rng;

    /**
     * Create new RNG with given seed.
     */
    public EvoRng(long seed) {
        this.initialSeed = seed;
        this.rng = ALGORITHM.create(seed);
    }

    /**
     * Process-wide source, seeded from entropy on first use.
     */
    public static EvoRng shared() {
        return SharedHolder.INSTANCE;
    }

    private static final class SharedHolder {
        private static final EvoRng INSTANCE = new EvoRng(RandomSource.createLong());
    }

    // ========== Integer Ranges ==========

    /**
     * Returns uniformly distributed int in [0, bound).
     */
    public synchronized int nextInt(int bound) {
        return rng.nextInt(bound);
    }

    /**
     * Returns uniformly distributed int in [min, max], both inclusive.
     *
     * @throws IllegalArgumentException if min > max
     */
    public synchronized int nextInt(int min, int max) {
        if (min > max) {
            throw new IllegalArgumentException("min (" + min + ") > max (" + max + ")");
        }
        return min + rng.nextInt(max - min + 1);
    }

    // ========== Real Ranges ==========

    /**
     * Returns uniformly distributed double in [0, 1).
     */
    public synchronized double nextDouble() {
        return rng.nextDouble();
    }

    /**
     * Returns uniformly distributed double between min and max.
     * A reversed range (max < min) is sampled the same way and yields
     * values in (max, min].
     */
    public synchronized double nextDouble(double min, double max) {
        return min + (max - min) * rng.nextDouble();
    }

    /**
     * Returns true with probability p.
     */
    public synchronized boolean nextBoolean(double probability) {
        return rng.nextDouble() < probability;
    }

    /**
     * Get initial seed (for logging/debugging).
     */
    public long getInitialSeed() {
        return initialSeed;
    }

    @Override
    public String toString() {
        return "EvoRng[" + ALGORITHM + ", seed=" + initialSeed + "]";
    }
}
