package com.sidecar.core.events;

import java.util.Objects;

/**
 * A new finality signature was received.
 */
public record FinalitySignature(com.sidecar.core.model.FinalitySignature signature) implements SseData {

    public FinalitySignature {
        Objects.requireNonNull(signature, "signature");
    }

    public com.sidecar.core.model.FinalitySignature inner() {
        return signature;
    }

    public String hexEncodedBlockHash() {
        return signature.blockHash().toHex();
    }

    public String hexEncodedPublicKey() {
        return signature.publicKey().toHex();
    }

    @Override
    public SseEventType type() {
        return SseEventType.FINALITY_SIGNATURE;
    }

    @Override
    public <R> R accept(SseDataVisitor<R> visitor) {
        return visitor.visitFinalitySignature(this);
    }
}
