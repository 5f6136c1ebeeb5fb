package com.sidecar.core.model;

/**
 * Monotonically increasing era counter.
 */
public record EraId(long value) {

    public EraId {
        if (value < 0) {
            throw new IllegalArgumentException("Era id must not be negative: " + value);
        }
    }

    public EraId successor() {
        return new EraId(value + 1);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
