package com.sidecar.core.model;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * Opaque byte string of arbitrary length (module bytes, serialized CL values).
 */
public final class HexBytes {

    private static final HexBytes EMPTY = new HexBytes(new byte[0]);

    private final byte[] bytes;

    public HexBytes(byte[] bytes) {
        this.bytes = bytes.clone();
    }

    public static HexBytes empty() {
        return EMPTY;
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    public int length() {
        return bytes.length;
    }

    public String toHex() {
        return HexFormat.of().formatHex(bytes);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof HexBytes other && Arrays.equals(bytes, other.bytes));
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
