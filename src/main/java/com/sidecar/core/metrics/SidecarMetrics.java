package com.sidecar.core.metrics;

import com.sidecar.core.events.SseEventType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;

/**
 * Centralised Micrometer metrics for the outbound event stream.
 */
@Service
public class SidecarMetrics {

    private final MeterRegistry registry;

    public SidecarMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordEventSent(SseEventType type, int encodedBytes) {
        Counter.builder("sidecar.events.sent")
                .tag("type", type.wireName())
                .register(registry)
                .increment();
        DistributionSummary.builder("sidecar.events.encoded.bytes")
                .baseUnit("bytes")
                .tag("type", type.wireName())
                .register(registry)
                .record(encodedBytes);
    }

    public void recordDeliveryFailure(SseEventType type) {
        Counter.builder("sidecar.events.delivery_failures")
                .description("Frames that could not be written to a subscriber")
                .tag("type", type.wireName())
                .register(registry)
                .increment();
    }

    public void recordSubscription(String filter) {
        Counter.builder("sidecar.subscriptions.total")
                .tag("filter", filter)
                .register(registry)
                .increment();
    }
}
