package com.sidecar.core.codec;

/**
 * Thrown when a wire record cannot be decoded into an event.
 */
public class EventDecodeException extends RuntimeException {
    public EventDecodeException(String message) {
        super(message);
    }

    public EventDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
