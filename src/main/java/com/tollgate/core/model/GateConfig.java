package com.tollgate.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A project's configuration for one gate type, plus its rolling counters.
 * <p>
 * Unique per {@code (workspaceId, projectId, gateType)}. Counters change only
 * through the store's atomic increment; everything else only through explicit
 * config updates.
 *
 * @param id                identifier referenced by executions
 * @param workspaceId       owning workspace
 * @param projectId         owning project
 * @param gateType          which checker evaluates this gate
 * @param enabled           disabled gates are never executed outside a dry run
 * @param blocking          failed/error/timeout executions of this gate block the release
 * @param thresholdConfig   per-type thresholds, see the checker for required keys
 * @param timeoutSeconds    per-gate timeout override; {@code null} uses the global default
 * @param totalEvaluations  terminal, non-skipped executions counted so far
 * @param passedEvaluations executions that ended {@code passed} or {@code warning}
 * @param failedEvaluations executions that ended {@code failed}, {@code error} or {@code timeout}
 * @param lastEvaluationAt  completion time of the last counted execution
 * @param lastResult        whether the last counted execution passed
 */
public record GateConfig(
    String id,
    String workspaceId,
    String projectId,
    GateType gateType,
    boolean enabled,
    boolean blocking,
    Map<String, Object> thresholdConfig,
    Integer timeoutSeconds,
    long totalEvaluations,
    long passedEvaluations,
    long failedEvaluations,
    Instant lastEvaluationAt,
    Boolean lastResult
) {

    public GateConfig {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(workspaceId, "workspaceId must not be null");
        Objects.requireNonNull(projectId, "projectId must not be null");
        Objects.requireNonNull(gateType, "gateType must not be null");
        thresholdConfig = Snapshots.freeze(thresholdConfig);
        if (timeoutSeconds != null && timeoutSeconds <= 0) {
            throw new IllegalArgumentException("timeoutSeconds must be positive: " + timeoutSeconds);
        }
    }

    /** A freshly set-up gate with zeroed counters and the global timeout. */
    public static GateConfig create(String id, String workspaceId, String projectId, GateType gateType,
                                    boolean enabled, boolean blocking, Map<String, ?> thresholdConfig) {
        return new GateConfig(id, workspaceId, projectId, gateType, enabled, blocking,
                Snapshots.freeze(thresholdConfig), null, 0, 0, 0, null, null);
    }

    public GateConfig withThresholdConfig(Map<String, ?> newThresholds) {
        return new GateConfig(id, workspaceId, projectId, gateType, enabled, blocking,
                Snapshots.freeze(newThresholds), timeoutSeconds,
                totalEvaluations, passedEvaluations, failedEvaluations, lastEvaluationAt, lastResult);
    }

    public GateConfig withTimeoutSeconds(Integer newTimeoutSeconds) {
        return new GateConfig(id, workspaceId, projectId, gateType, enabled, blocking,
                thresholdConfig, newTimeoutSeconds,
                totalEvaluations, passedEvaluations, failedEvaluations, lastEvaluationAt, lastResult);
    }

    public GateConfig withEnabled(boolean newEnabled) {
        return new GateConfig(id, workspaceId, projectId, gateType, newEnabled, blocking,
                thresholdConfig, timeoutSeconds,
                totalEvaluations, passedEvaluations, failedEvaluations, lastEvaluationAt, lastResult);
    }

    /** Counters after one more terminal evaluation. */
    public GateConfig withEvaluation(boolean passed, Instant evaluatedAt) {
        return new GateConfig(id, workspaceId, projectId, gateType, enabled, blocking,
                thresholdConfig, timeoutSeconds,
                totalEvaluations + 1,
                passedEvaluations + (passed ? 1 : 0),
                failedEvaluations + (passed ? 0 : 1),
                evaluatedAt, passed);
    }
}
