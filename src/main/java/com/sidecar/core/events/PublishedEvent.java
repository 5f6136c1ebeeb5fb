package com.sidecar.core.events;

import java.util.Objects;

/**
 * An event as delivered to subscribers, paired with the id the bus assigned when it was
 * published. The id is delivery metadata and is not part of the event itself.
 *
 * @param id   process-wide, strictly increasing publish sequence number
 * @param data the event
 */
public record PublishedEvent(long id, SseData data) {

    public PublishedEvent {
        Objects.requireNonNull(data, "data");
    }
}
