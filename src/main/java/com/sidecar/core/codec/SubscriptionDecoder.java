package com.sidecar.core.codec;

import com.sidecar.core.events.ApiVersion;
import com.sidecar.core.events.SseData;
import com.sidecar.core.model.ProtocolVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Decodes the records of one subscription in arrival order and enforces the handshake:
 * the first record must be {@link ApiVersion} and no later record may be.
 * <p>
 * Not thread-safe; use one instance per subscription.
 */
public class SubscriptionDecoder {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionDecoder.class);

    private final SseDataCodec codec;
    private final boolean skipUnknownTypes;

    private ProtocolVersion apiVersion;
    private long decodedCount;
    private long skippedCount;

    /**
     * @param codec            codec used for every record
     * @param skipUnknownTypes when true, records of unknown event types after the handshake
     *                         are counted and dropped instead of failing the stream
     */
    public SubscriptionDecoder(SseDataCodec codec, boolean skipUnknownTypes) {
        this.codec = codec;
        this.skipUnknownTypes = skipUnknownTypes;
    }

    /**
     * Decodes the next record.
     *
     * @return the event, or empty if the record had an unknown type and was skipped
     * @throws StreamProtocolException if the handshake rules are broken
     * @throws EventDecodeException    if the record is malformed
     */
    public Optional<SseData> next(String record) {
        if (apiVersion == null) {
            return Optional.of(handshake(record));
        }

        SseData event;
        try {
            event = codec.decode(record);
        } catch (UnknownEventTypeException e) {
            if (!skipUnknownTypes) {
                throw e;
            }
            skippedCount++;
            log.debug("Skipping event of unknown type {}", e.getEventType());
            return Optional.empty();
        }

        if (event instanceof ApiVersion) {
            throw new StreamProtocolException("ApiVersion repeated after the handshake at record " + (decodedCount + 1));
        }
        decodedCount++;
        return Optional.of(event);
    }

    private SseData handshake(String record) {
        SseData first;
        try {
            first = codec.decode(record);
        } catch (UnknownEventTypeException e) {
            throw new StreamProtocolException("Stream must open with ApiVersion, got " + e.getEventType(), e);
        }
        if (!(first instanceof ApiVersion version)) {
            throw new StreamProtocolException("Stream must open with ApiVersion, got " + first.type().wireName());
        }
        apiVersion = version.version();
        decodedCount++;
        log.debug("Subscription handshake complete, api version {}", apiVersion);
        return first;
    }

    public Optional<ProtocolVersion> apiVersion() {
        return Optional.ofNullable(apiVersion);
    }

    public long decodedCount() {
        return decodedCount;
    }

    public long skippedCount() {
        return skippedCount;
    }
}
