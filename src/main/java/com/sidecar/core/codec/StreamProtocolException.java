package com.sidecar.core.codec;

/**
 * Thrown when a subscription stream breaks the handshake rules: it does not open with
 * {@code ApiVersion}, or repeats it later.
 */
public class StreamProtocolException extends RuntimeException {
    public StreamProtocolException(String message) {
        super(message);
    }

    public StreamProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
