package com.tollgate.core.persistence;

import com.tollgate.core.model.GateConfig;
import com.tollgate.core.model.GateExecution;
import com.tollgate.core.model.GateType;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Gate configurations, their rolling counters, and the execution history.
 * <p>
 * Implementations throw {@link com.tollgate.core.model.GateEnvironmentException}
 * when the backing store is unavailable.
 */
public interface GateConfigStore {

    List<GateConfig> getEnabledGates(String workspaceId, String projectId);

    /** All gates of a project, disabled ones included (dry runs). */
    List<GateConfig> getGates(String workspaceId, String projectId);

    Optional<GateConfig> findGate(String gateId);

    /** Inserts or replaces the execution with the same id. */
    void saveExecution(GateExecution execution);

    /**
     * Adds one evaluation to the gate's counters in a single atomic step:
     * {@code total + 1} and exactly one of {@code passed + 1} / {@code failed + 1},
     * plus {@code lastEvaluationAt} and {@code lastResult}.
     */
    void atomicIncrementCounters(String gateId, boolean passed, Instant evaluatedAt);

    Optional<GateExecution> findExecution(String executionId);

    List<GateExecution> findExecutions(ExecutionQuery query);

    /** Matching rows ignoring {@code limit} and {@code offset}. */
    long countExecutions(ExecutionQuery query);

    /** Gate types referenced by enabled configs across all projects. */
    Set<GateType> activeGateTypes();

    // -- project setup / admin --

    /**
     * Creates the gate, or updates its enabled/blocking/threshold/timeout fields.
     * Counters are never taken from the argument.
     *
     * @throws IllegalStateException if another gate already holds the same
     *                               (workspace, project, gate type)
     */
    GateConfig saveGate(GateConfig config);

    GateConfig updateThresholdConfig(String gateId, Map<String, ?> thresholdConfig);

    /**
     * @throws IllegalStateException if executions still reference the gate
     */
    void deleteGate(String gateId);
}
