package com.sidecar.dispatch.api;

import com.sidecar.core.events.EventFilter;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * SSE endpoints for the node event stream.
 */
@RestController
@RequestMapping("/events")
public class EventStreamController {

    private final SseStreamingService sseStreamingService;

    public EventStreamController(SseStreamingService sseStreamingService) {
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * GET /events — every event type.
     */
    @GetMapping(produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter all() {
        return sseStreamingService.createEmitter(EventFilter.ALL);
    }

    /**
     * GET /events/{filter} — one of {@code main}, {@code deploys} or {@code sigs}.
     */
    @GetMapping(path = "/{filter}", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> filtered(@PathVariable String filter) {
        return EventFilter.fromPath(filter)
                .filter(f -> f != EventFilter.ALL)
                .map(f -> ResponseEntity.ok(sseStreamingService.createEmitter(f)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
