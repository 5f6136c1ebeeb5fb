package com.sidecar.core.model;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * A validator or account public key. The serialized form is the algorithm tag byte
 * followed by the raw key bytes.
 */
public final class PublicKey {

    private final KeyAlgorithm algorithm;
    private final byte[] raw;

    public PublicKey(KeyAlgorithm algorithm, byte[] raw) {
        if (raw.length != algorithm.publicKeyLength()) {
            throw new IllegalArgumentException(algorithm + " public key must be "
                    + algorithm.publicKeyLength() + " bytes, got " + raw.length);
        }
        this.algorithm = algorithm;
        this.raw = raw.clone();
    }

    /**
     * Rebuilds a key from its tagged serialized form.
     */
    public static PublicKey fromTaggedBytes(byte[] tagged) {
        if (tagged.length == 0) {
            throw new IllegalArgumentException("Public key bytes are empty");
        }
        KeyAlgorithm algorithm = KeyAlgorithm.fromTag(tagged[0]);
        return new PublicKey(algorithm, Arrays.copyOfRange(tagged, 1, tagged.length));
    }

    public KeyAlgorithm algorithm() {
        return algorithm;
    }

    public byte[] rawBytes() {
        return raw.clone();
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
        return this == o || (o instanceof PublicKey other
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
