package com.sidecar.dispatch.api;

import com.sidecar.config.SidecarProperties;
import com.sidecar.core.codec.SseDataCodec;
import com.sidecar.core.events.ApiVersion;
import com.sidecar.core.events.EventBus;
import com.sidecar.core.events.EventFilter;
import com.sidecar.core.events.PublishedEvent;
import com.sidecar.core.events.SseEventType;
import com.sidecar.core.logging.MdcContext;
import com.sidecar.core.metrics.SidecarMetrics;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Bridges {@link EventBus} subscriptions to {@link SseEmitter} instances.
 * <p>
 * Every new emitter first receives the {@link ApiVersion} handshake, which has no event id.
 * Only then is it subscribed to the bus, so no event can overtake the handshake. Later
 * frames carry the bus-assigned id, the event type as the SSE event name and the canonical
 * JSON encoding as data.
 * <p>
 * Heartbeats are sent as SSE comments (lines starting with ':') which EventSource clients
 * ignore, keeping idle connections open through proxies.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    private final EventBus eventBus;
    private final SseDataCodec codec;
    private final SidecarMetrics metrics;
    private final SidecarProperties properties;
    private final String handshakeJson;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    public SseStreamingService(EventBus eventBus,
                               SseDataCodec codec,
                               SidecarMetrics metrics,
                               SidecarProperties properties) {
        this.eventBus = eventBus;
        this.codec = codec;
        this.metrics = metrics;
        this.properties = properties;
        this.handshakeJson = codec.encode(new ApiVersion(properties.protocolVersion()));
    }

    @PostConstruct
    void startHeartbeat() {
        long interval = properties.getHeartbeatIntervalSeconds();
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats, interval, interval, TimeUnit.SECONDS);
        log.info("SSE heartbeat scheduler started (interval={}s)", interval);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("SSE heartbeat scheduler stopped");
    }

    private void sendHeartbeats() {
        if (activeRegistrations.isEmpty()) {
            return;
        }

        log.debug("Sending heartbeat to {} active SSE emitters", activeRegistrations.size());
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter().send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException e) {
                // onError/onCompletion callbacks do the cleanup
                log.debug("Heartbeat failed for {} stream (connection likely closed): {}",
                        registration.filter(), e.getMessage());
            } catch (IllegalStateException e) {
                log.debug("Heartbeat skipped for {} stream (emitter not active)", registration.filter());
            }
        }
    }

    /**
     * Creates an SSE emitter streaming the events the filter accepts.
     *
     * @param filter which events to stream
     * @return a configured {@link SseEmitter}, already holding the handshake frame
     */
    public SseEmitter createEmitter(EventFilter filter) {
        SseEmitter emitter = new SseEmitter(properties.getEmitterTimeoutMs());

        try {
            emitter.send(SseEmitter.event()
                    .name(SseEventType.API_VERSION.wireName())
                    .data(handshakeJson));
        } catch (IOException e) {
            log.warn("Failed to send ApiVersion handshake on {} stream: {}", filter, e.getMessage());
            emitter.completeWithError(e);
            return emitter;
        }

        EventBus.Subscription subscription = eventBus.subscribe(filter, event -> sendEvent(emitter, event));
        var registration = new EmitterRegistration(filter, emitter, subscription);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> {
            log.debug("SSE emitter completed for {} stream", filter);
            cleanup(registration);
        });
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for {} stream", filter);
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for {} stream: {}", filter, ex.getMessage());
            cleanup(registration);
        });

        metrics.recordSubscription(filter.name());
        log.info("SSE emitter created for {} stream (timeout={}ms)", filter, properties.getEmitterTimeoutMs());
        return emitter;
    }

    /**
     * Returns the number of currently active SSE emitters.
     */
    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private void sendEvent(SseEmitter emitter, PublishedEvent event) {
        var type = event.data().type();
        MdcContext.setEvent(type, event.id());
        try {
            String json = codec.encode(event.data());
            emitter.send(SseEmitter.event()
                    .id(Long.toString(event.id()))
                    .name(type.wireName())
                    .data(json));
            metrics.recordEventSent(type, json.getBytes(StandardCharsets.UTF_8).length);
        } catch (IOException | IllegalStateException e) {
            metrics.recordDeliveryFailure(type);
            log.debug("Failed to send SSE event {}: {}", event.id(), e.getMessage());
        } finally {
            MdcContext.clear();
        }
    }

    private void cleanup(EmitterRegistration registration) {
        registration.subscription().unsubscribe();
        activeRegistrations.remove(registration);
        log.debug("Cleaned up SSE registration for {} stream", registration.filter());
    }

    private record EmitterRegistration(
            EventFilter filter,
            SseEmitter emitter,
            EventBus.Subscription subscription
    ) {}
}
