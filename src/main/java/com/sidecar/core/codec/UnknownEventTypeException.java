package com.sidecar.core.codec;

/**
 * Thrown when a wire record is keyed by an event type this build does not know. Consumers
 * may skip such records to stay compatible with newer emitters.
 */
public class UnknownEventTypeException extends EventDecodeException {

    private final String eventType;

    public UnknownEventTypeException(String eventType) {
        super("Unknown event type: " + eventType);
        this.eventType = eventType;
    }

    public String getEventType() {
        return eventType;
    }
}
