package com.sidecar.core.events;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Named subsets of the event stream a client can subscribe to. {@link SseEventType#API_VERSION}
 * belongs to no filter; it is sent once per subscription by the stream itself.
 */
public enum EventFilter {
    ALL("", EnumSet.complementOf(EnumSet.of(SseEventType.API_VERSION))),
    MAIN("main", EnumSet.of(SseEventType.BLOCK_ADDED, SseEventType.DEPLOY_PROCESSED,
            SseEventType.DEPLOY_EXPIRED, SseEventType.FAULT, SseEventType.STEP)),
    DEPLOYS("deploys", EnumSet.of(SseEventType.DEPLOY_ACCEPTED)),
    SIGNATURES("sigs", EnumSet.of(SseEventType.FINALITY_SIGNATURE));

    private final String path;
    private final Set<SseEventType> types;

    EventFilter(String path, Set<SseEventType> types) {
        this.path = path;
        this.types = types;
    }

    public String path() {
        return path;
    }

    public boolean accepts(SseEventType type) {
        return types.contains(type);
    }

    public static Optional<EventFilter> fromPath(String path) {
        for (EventFilter filter : values()) {
            if (filter.path.equals(path)) {
                return Optional.of(filter);
            }
        }
        return Optional.empty();
    }
}
