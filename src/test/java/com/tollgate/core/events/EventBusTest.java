package com.tollgate.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class EventBusTest {

    private EventBus bus;

    @BeforeEach
    void setUp() {
        bus = new EventBus();
    }

    private static GateEvent event(String type, String runId) {
        return new GateEvent(type, runId, null, Map.of(), Instant.now());
    }

    @Test
    @DisplayName("run subscribers only see their own run")
    void perRun() {
        var received = new ArrayList<GateEvent>();
        bus.subscribe("run-1", received::add);

        bus.publish(event(GateEvent.RUN_STARTED, "run-1"));
        bus.publish(event(GateEvent.RUN_STARTED, "run-2"));

        assertEquals(1, received.size());
        assertEquals("run-1", received.get(0).runId());
    }

    @Test
    @DisplayName("global subscribers see every run")
    void global() {
        var received = new ArrayList<GateEvent>();
        bus.subscribeAll(received::add);

        bus.publish(event(GateEvent.RUN_STARTED, "run-1"));
        bus.publish(event(GateEvent.RUN_COMPLETED, "run-2"));

        assertEquals(List.of(GateEvent.RUN_STARTED, GateEvent.RUN_COMPLETED),
                received.stream().map(GateEvent::eventType).toList());
    }

    @Test
    @DisplayName("unsubscribed consumers receive nothing further")
    void unsubscribe() {
        var received = new ArrayList<GateEvent>();
        var subscription = bus.subscribe("run-1", received::add);

        subscription.unsubscribe();
        bus.publish(event(GateEvent.RUN_STARTED, "run-1"));

        assertTrue(received.isEmpty());
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("a throwing subscriber does not stop delivery to others")
    void throwingSubscriber() {
        Consumer<GateEvent> broken = mock(Consumer.class);
        doThrow(new IllegalStateException("boom")).when(broken).accept(any());
        var received = new ArrayList<GateEvent>();
        bus.subscribe("run-1", broken);
        bus.subscribeAll(received::add);

        assertDoesNotThrow(() -> bus.publish(event(GateEvent.GATE_COMPLETED, "run-1")));

        verify(broken).accept(any());
        assertEquals(1, received.size());
    }
}
