package com.useless.script.chaos;

import java.security.SecureRandom;
import java.util.Random;

import com.useless.debug.Debug;

/**
 * {@link RandomSource} backed by a seeded {@link Random}. The same seed replays the same
 * chaos decisions in the same order.
 */
public class DeterministicRandomSource implements RandomSource {
    private static final Debug.Tagged LOG = Debug.tag("random");

    private final long seed;
    private final Random random;

    public DeterministicRandomSource(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    /** Picks a fresh seed from the system's entropy and logs it so the run can be replayed. */
    public static DeterministicRandomSource fromEntropy() {
        long seed = new SecureRandom().nextLong();
        LOG.i("no seed given, using %d", seed);
        return new DeterministicRandomSource(seed);
    }

    @Override
    public Random getRandom() {
        return random;
    }

    @Override
    public long getSeed() {
        return seed;
    }

    @Override
    public String toString() {
        return "DeterministicRandomSource{seed=" + seed + "}";
    }
}
