package com.sidecar.core.events;

import com.sidecar.core.model.EraId;
import com.sidecar.core.model.PublicKey;
import com.sidecar.core.model.Timestamp;

import java.util.Objects;

/**
 * A validator fault observed during an era.
 */
public record Fault(EraId eraId, PublicKey publicKey, Timestamp timestamp) implements SseData {

    public Fault {
        Objects.requireNonNull(eraId, "eraId");
        Objects.requireNonNull(publicKey, "publicKey");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    @Override
    public SseEventType type() {
        return SseEventType.FAULT;
    }

    @Override
    public <R> R accept(SseDataVisitor<R> visitor) {
        return visitor.visitFault(this);
    }

    /**
     * Multi-line rendering for diagnostic output.
     */
    @Override
    public String toString() {
        return "Fault {\n"
                + "    era_id: " + eraId + ",\n"
                + "    public_key: " + publicKey.toHex() + ",\n"
                + "    timestamp: " + timestamp + ",\n"
                + "}";
    }
}
