package com.reqminer.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventBusTest {

    private EventBus bus;

    @BeforeEach
    void setUp() {
        bus = new EventBus();
    }

    private static MiningEvent event(String type, String sessionId) {
        return MiningEvent.of(type, sessionId, sessionId + "-task", Map.of("round", 1));
    }

    @Test
    @DisplayName("session subscribers only see their own session")
    void sessionSubscription() {
        var received = new ArrayList<MiningEvent>();
        bus.subscribe("s-1", received::add);

        bus.publish(event(MiningEvent.STARTED, "s-1"));
        bus.publish(event(MiningEvent.STARTED, "s-2"));

        assertEquals(1, received.size());
        assertEquals("s-1", received.get(0).sessionId());
    }

    @Test
    @DisplayName("global subscribers see every event")
    void globalSubscription() {
        var received = new ArrayList<MiningEvent>();
        bus.subscribeAll(received::add);

        bus.publish(event(MiningEvent.PAUSED, "s-1"));
        bus.publish(event(MiningEvent.COMPLETED, "s-2"));

        assertEquals(List.of(MiningEvent.PAUSED, MiningEvent.COMPLETED),
                received.stream().map(MiningEvent::eventType).toList());
    }

    @Test
    @DisplayName("unsubscribed and released consumers receive nothing more")
    void unsubscribe() {
        var received = new ArrayList<MiningEvent>();
        var subscription = bus.subscribe("s-1", received::add);
        bus.subscribe("s-2", received::add);

        subscription.unsubscribe();
        bus.releaseSession("s-2");
        bus.publish(event(MiningEvent.RESUMED, "s-1"));
        bus.publish(event(MiningEvent.RESUMED, "s-2"));

        assertTrue(received.isEmpty());
    }

    @Test
    @DisplayName("a failing subscriber does not stop delivery to the others")
    void failingSubscriber() {
        var received = new ArrayList<MiningEvent>();
        bus.subscribe("s-1", e -> {
            throw new IllegalStateException("boom");
        });
        bus.subscribeAll(received::add);

        bus.publish(event(MiningEvent.FAILED, "s-1"));

        assertEquals(1, received.size());
    }

    @Test
    @DisplayName("events default to an empty payload")
    void defaultPayload() {
        var event = MiningEvent.of(MiningEvent.STARTED, "s-1", null, null);

        assertEquals(Map.of(), event.payload());
        assertNotNull(event.timestamp());
    }
}
