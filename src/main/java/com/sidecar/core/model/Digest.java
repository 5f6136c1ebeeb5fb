package com.sidecar.core.model;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * A 32-byte hash value.
 * <p>
 * The raw bytes are the only stored form. {@link #toHex()} derives the lowercase hex
 * representation on every call.
 */
public final class Digest {

    public static final int LENGTH = 32;

    private final byte[] bytes;

    public Digest(byte[] bytes) {
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException(
                    "Digest must be " + LENGTH + " bytes, got " + bytes.length);
        }
        this.bytes = bytes.clone();
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    public String toHex() {
        return HexFormat.of().formatHex(bytes);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Digest other && Arrays.equals(bytes, other.bytes));
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
