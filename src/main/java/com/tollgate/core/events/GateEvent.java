package com.tollgate.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a gate run progresses.
 *
 * @param eventType   e.g. "run.started", "gate.started", "gate.completed", "run.aborted"
 * @param runId       the run this event belongs to
 * @param executionId the gate execution this event relates to (nullable for run-level events)
 * @param payload     arbitrary key-value data associated with the event
 * @param timestamp   when the event occurred
 */
public record GateEvent(
    String eventType,
    String runId,
    String executionId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String RUN_STARTED = "run.started";
    public static final String GATE_PENDING = "gate.pending";
    public static final String GATE_STARTED = "gate.started";
    public static final String GATE_COMPLETED = "gate.completed";
    public static final String RUN_ABORTED = "run.aborted";
    public static final String RUN_COMPLETED = "run.completed";
}
