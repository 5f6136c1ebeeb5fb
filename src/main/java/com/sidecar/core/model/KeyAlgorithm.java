package com.sidecar.core.model;

/**
 * Asymmetric key schemes understood by the node. The tag is the leading byte of every
 * serialized public key and signature.
 */
public enum KeyAlgorithm {
    ED25519((byte) 0x01, 32, 64),
    SECP256K1((byte) 0x02, 33, 64);

    private final byte tag;
    private final int publicKeyLength;
    private final int signatureLength;

    KeyAlgorithm(byte tag, int publicKeyLength, int signatureLength) {
        this.tag = tag;
        this.publicKeyLength = publicKeyLength;
        this.signatureLength = signatureLength;
    }

    public byte tag() {
        return tag;
    }

    public int publicKeyLength() {
        return publicKeyLength;
    }

    public int signatureLength() {
        return signatureLength;
    }

    public static KeyAlgorithm fromTag(byte tag) {
        for (KeyAlgorithm algorithm : values()) {
            if (algorithm.tag == tag) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException(String.format("Unknown key algorithm tag 0x%02x", tag));
    }
}
