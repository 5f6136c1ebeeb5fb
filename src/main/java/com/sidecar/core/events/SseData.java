package com.sidecar.core.events;

/**
 * An event streamed to subscribers. The set of variants is closed; handle them through
 * {@link #accept(SseDataVisitor)} so that a new variant fails compilation wherever it is
 * not handled.
 * <p>
 * Every variant is immutable. {@link ApiVersion} is the handshake sent first on each
 * subscription and never appears later in a stream.
 */
public sealed interface SseData
        permits ApiVersion, BlockAdded, DeployAccepted, DeployProcessed, DeployExpired,
                Fault, FinalitySignature, Step {

    SseEventType type();

    <R> R accept(SseDataVisitor<R> visitor);
}
