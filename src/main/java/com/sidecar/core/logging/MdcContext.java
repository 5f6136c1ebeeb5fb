package com.sidecar.core.logging;

import com.sidecar.core.events.SseEventType;
import org.slf4j.MDC;

/**
 * Utility for managing sidecar-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setEvent(SseEventType type, long eventId) {
        MDC.put("eventType", type.wireName());
        MDC.put("eventId", String.valueOf(eventId));
    }

    public static void clear() {
        MDC.remove("eventType");
        MDC.remove("eventId");
    }
}
