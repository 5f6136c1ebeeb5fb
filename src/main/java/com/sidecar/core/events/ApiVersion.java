package com.sidecar.core.events;

import com.sidecar.core.model.ProtocolVersion;

import java.util.Objects;

/**
 * The version of this node's API server. Always the first event sent to a new client, and
 * never carries an event id.
 */
public record ApiVersion(ProtocolVersion version) implements SseData {

    public ApiVersion {
        Objects.requireNonNull(version, "version");
    }

    @Override
    public SseEventType type() {
        return SseEventType.API_VERSION;
    }

    @Override
    public <R> R accept(SseDataVisitor<R> visitor) {
        return visitor.visitApiVersion(this);
    }
}
