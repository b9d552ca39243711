package com.tollgate.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process fan-out of {@link GateEvent}s.
 * <p>
 * A registration either follows one run or, with no run id, every run.
 * Consumers are called on the publishing thread in registration order; one that
 * throws is logged and the remaining consumers still get the event.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private record Registration(String runId, Consumer<GateEvent> consumer) {
        boolean accepts(GateEvent event) {
            return runId == null || runId.equals(event.runId());
        }
    }

    private final CopyOnWriteArrayList<Registration> registrations = new CopyOnWriteArrayList<>();

    /**
     * Delivers {@code event} to every registration that follows its run or all
     * runs, in the order they registered.
     *
     * @param event run- or gate-level event; never null
     */
    public void publish(GateEvent event) {
        log.debug("Event {} for run {}", event.eventType(), event.runId());
        for (Registration registration : registrations) {
            if (registration.accepts(event)) {
                deliver(registration, event);
            }
        }
    }

    /**
     * Registers {@code consumer} for the events of one run only.
     *
     * @param runId    id of the run to follow, as returned by {@code GateRun.runId()}
     * @param consumer called on the publishing thread for each matching event
     * @return handle that removes this registration
     * @throws IllegalArgumentException if {@code runId} is null
     */
    public Subscription subscribe(String runId, Consumer<GateEvent> consumer) {
        if (runId == null) {
            throw new IllegalArgumentException("runId must not be null; use subscribeAll");
        }
        return register(new Registration(runId, consumer));
    }

    /**
     * Registers {@code consumer} for the events of every run.
     *
     * @param consumer called on the publishing thread for each event
     * @return handle that removes this registration
     */
    public Subscription subscribeAll(Consumer<GateEvent> consumer) {
        return register(new Registration(null, consumer));
    }

    /** Handle returned by {@link #subscribe} and {@link #subscribeAll}. */
    @FunctionalInterface
    public interface Subscription {
        /** Stops delivery to the registration; calling it again has no effect. */
        void unsubscribe();
    }

    private Subscription register(Registration registration) {
        registrations.add(registration);
        return () -> registrations.remove(registration);
    }

    private void deliver(Registration registration, GateEvent event) {
        try {
            registration.consumer().accept(event);
        } catch (RuntimeException e) {
            log.warn("Consumer of {} events failed on {}: {}",
                    registration.runId() == null ? "all" : "run " + registration.runId(),
                    event.eventType(), e.getMessage(), e);
        }
    }
}
