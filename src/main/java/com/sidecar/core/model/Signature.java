package com.sidecar.core.model;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * A cryptographic signature, serialized as the algorithm tag byte followed by the raw bytes.
 */
public final class Signature {

    private final KeyAlgorithm algorithm;
    private final byte[] raw;

    public Signature(KeyAlgorithm algorithm, byte[] raw) {
        if (raw.length != algorithm.signatureLength()) {
            throw new IllegalArgumentException(algorithm + " signature must be "
                    + algorithm.signatureLength() + " bytes, got " + raw.length);
        }
        this.algorithm = algorithm;
        this.raw = raw.clone();
    }

    public static Signature fromTaggedBytes(byte[] tagged) {
        if (tagged.length == 0) {
            throw new IllegalArgumentException("Signature bytes are empty");
        }
        KeyAlgorithm algorithm = KeyAlgorithm.fromTag(tagged[0]);
        return new Signature(algorithm, Arrays.copyOfRange(tagged, 1, tagged.length));
    }

    public KeyAlgorithm algorithm() {
        return algorithm;
    }

    public byte[] toTaggedBytes() {
        byte[] tagged = new byte[raw.length + 1];
        tagged[0] = algorithm.tag();
        System.arraycopy(raw, 0, tagged, 1, raw.length);
        return tagged;
    }

    public String toHex() {
        return HexFormat.of().formatHex(toTaggedBytes());
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Signature other
                && algorithm == other.algorithm && Arrays.equals(raw, other.raw));
    }

    @Override
    public int hashCode() {
        return 31 * algorithm.hashCode() + Arrays.hashCode(raw);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
