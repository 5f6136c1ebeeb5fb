package com.sidecar.core.events;

import com.sidecar.testing.RandomEvents;
import com.sidecar.testing.TestRng;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private final TestRng rng = new TestRng();
    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    // -- Subscribe and publish tests ------------------------------------------

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers event to a matching subscriber")
        void deliversToMatchingSubscriber() {
            List<PublishedEvent> received = new ArrayList<>();
            eventBus.subscribe(EventFilter.MAIN, received::add);

            var event = RandomEvents.blockAdded(rng);
            eventBus.publish(event);

            assertEquals(1, received.size());
            assertSame(event, received.get(0).data());
        }

        @Test
        @DisplayName("does not deliver events the filter rejects")
        void respectsFilter() {
            List<PublishedEvent> received = new ArrayList<>();
            eventBus.subscribe(EventFilter.SIGNATURES, received::add);

            eventBus.publish(RandomEvents.blockAdded(rng));
            eventBus.publish(RandomEvents.deployAccepted(rng));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("every subscriber sees the same deploy instance and the same id")
        void sharedDelivery() {
            List<PublishedEvent> received1 = new ArrayList<>();
            List<PublishedEvent> received2 = new ArrayList<>();
            eventBus.subscribe(EventFilter.DEPLOYS, received1::add);
            eventBus.subscribe(EventFilter.ALL, received2::add);

            var event = RandomEvents.deployAccepted(rng);
            eventBus.publish(event);

            assertSame(((DeployAccepted) received1.get(0).data()).deploy(),
                    ((DeployAccepted) received2.get(0).data()).deploy());
            assertEquals(received1.get(0).id(), received2.get(0).id());
        }

        @Test
        @DisplayName("ids increase in publish order")
        void idsIncrease() {
            List<PublishedEvent> received = new ArrayList<>();
            eventBus.subscribe(EventFilter.ALL, received::add);

            eventBus.publish(RandomEvents.fault(rng));
            eventBus.publish(RandomEvents.step(rng));
            eventBus.publish(RandomEvents.deployExpired(rng));

            assertEquals(List.of(0L, 1L, 2L), received.stream().map(PublishedEvent::id).toList());
            assertEquals(SseEventType.FAULT, received.get(0).data().type());
            assertEquals(SseEventType.DEPLOY_EXPIRED, received.get(2).data().type());
        }

        @Test
        @DisplayName("ApiVersion cannot be published")
        void rejectsApiVersion() {
            assertThrows(IllegalArgumentException.class, () -> eventBus.publish(RandomEvents.apiVersion(rng)));
        }
    }

    // -- Unsubscribe tests ----------------------------------------------------

    @Nested
    @DisplayName("unsubscribe")
    class UnsubscribeTests {

        @Test
        @DisplayName("unsubscribing stops delivery of future events")
        void unsubscribeStopsDelivery() {
            List<PublishedEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribe(EventFilter.ALL, received::add);

            eventBus.publish(RandomEvents.fault(rng));
            assertEquals(1, received.size());

            subscription.unsubscribe();

            eventBus.publish(RandomEvents.fault(rng));
            assertEquals(1, received.size());
            assertEquals(0, eventBus.subscriberCount());
        }

        @Test
        @DisplayName("unsubscribing one subscriber does not affect others")
        void unsubscribeDoesNotAffectOthers() {
            List<PublishedEvent> received1 = new ArrayList<>();
            List<PublishedEvent> received2 = new ArrayList<>();
            EventBus.Subscription sub1 = eventBus.subscribe(EventFilter.ALL, received1::add);
            eventBus.subscribe(EventFilter.ALL, received2::add);

            sub1.unsubscribe();
            eventBus.publish(RandomEvents.step(rng));

            assertTrue(received1.isEmpty());
            assertEquals(1, received2.size());
        }
    }

    // -- Concurrency and edge cases -------------------------------------------

    @Test
    @DisplayName("handles concurrent publishes safely")
    void handlesConcurrentPublishes() throws InterruptedException {
        CopyOnWriteArrayList<PublishedEvent> received = new CopyOnWriteArrayList<>();
        eventBus.subscribe(EventFilter.ALL, received::add);
        SseData event = RandomEvents.deployExpired(rng);

        int threadCount = 10;
        int eventsPerThread = 100;
        CountDownLatch latch = new CountDownLatch(threadCount);

        for (int t = 0; t < threadCount; t++) {
            new Thread(() -> {
                for (int i = 0; i < eventsPerThread; i++) {
                    eventBus.publish(event);
                }
                latch.countDown();
            }).start();
        }

        assertTrue(latch.await(10, TimeUnit.SECONDS));
        assertEquals(threadCount * eventsPerThread, received.size());
        assertEquals(threadCount * eventsPerThread,
                received.stream().map(PublishedEvent::id).distinct().count());
    }

    @Test
    @DisplayName("subscriber exception does not prevent delivery to other subscribers")
    void subscriberExceptionDoesNotPreventOthers() {
        List<PublishedEvent> received = new ArrayList<>();
        eventBus.subscribe(EventFilter.ALL, e -> {
            throw new RuntimeException("boom");
        });
        eventBus.subscribe(EventFilter.ALL, received::add);

        assertDoesNotThrow(() -> eventBus.publish(RandomEvents.fault(rng)));
        assertEquals(1, received.size());
    }
}
