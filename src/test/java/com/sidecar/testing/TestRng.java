package com.sidecar.testing;

import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Seeded random source for tests. The seed comes from the {@code sidecar.test.seed} system
 * property when set, so a failing run can be replayed; {@link #toString()} reports it.
 */
public class TestRng extends Random {

    public static final String SEED_PROPERTY = "sidecar.test.seed";

    private final long seed;

    public TestRng() {
        this(seedFromEnvironment());
    }

    public TestRng(long seed) {
        super(seed);
        this.seed = seed;
    }

    public long seed() {
        return seed;
    }

    public byte[] nextBytes(int length) {
        byte[] bytes = new byte[length];
        nextBytes(bytes);
        return bytes;
    }

    public <T> T pick(T[] values) {
        return values[nextInt(values.length)];
    }

    private static long seedFromEnvironment() {
        String configured = System.getProperty(SEED_PROPERTY);
        if (configured != null && !configured.isBlank()) {
            return Long.parseLong(configured.trim());
        }
        return ThreadLocalRandom.current().nextLong();
    }

    @Override
    public String toString() {
        return "TestRng[seed=" + seed + "]";
    }
}
