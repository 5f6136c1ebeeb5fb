package com.sidecar.core.events;

import java.util.Optional;

/**
 * Discriminator of every {@link SseData} variant. The wire name is the single top-level key
 * of an encoded event and the SSE event name.
 */
public enum SseEventType {
    API_VERSION("ApiVersion"),
    BLOCK_ADDED("BlockAdded"),
    DEPLOY_ACCEPTED("DeployAccepted"),
    DEPLOY_PROCESSED("DeployProcessed"),
    DEPLOY_EXPIRED("DeployExpired"),
    FAULT("Fault"),
    FINALITY_SIGNATURE("FinalitySignature"),
    STEP("Step");

    private final String wireName;

    SseEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<SseEventType> fromWireName(String name) {
        for (SseEventType type : values()) {
            if (type.wireName.equals(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
