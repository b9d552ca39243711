package com.tollgate.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One run of one gate against one target.
 * <p>
 * Instances are immutable; each lifecycle step returns a new instance and
 * rejects illegal transitions. {@code configUsed} is the threshold snapshot
 * taken at dispatch and is carried unchanged through every step.
 *
 * @param id                 execution identifier
 * @param gateId             owning {@link GateConfig#id()}
 * @param gateType           gate type at dispatch
 * @param target             what was evaluated
 * @param blocking           the config's blocking flag at dispatch
 * @param status             lifecycle status
 * @param createdAt          dispatch time
 * @param startedAt          set on {@code RUNNING}
 * @param completedAt        set on any terminal status
 * @param durationMs         set iff {@code completedAt} is set
 * @param passed             verdict; {@code null} until terminal and for skipped executions
 * @param passedWithWarnings carried through from the checker
 * @param issueCounts        issue tallies by severity
 * @param issues             full findings
 * @param metrics            checker measurements
 * @param recommendations    ordered follow-ups
 * @param resultDetails      checker details, or skip/cancel reasons
 * @param configUsed         immutable threshold snapshot taken at dispatch
 * @param errorMessage       set on {@code ERROR} and {@code TIMEOUT}
 */
public record GateExecution(
    String id,
    String gateId,
    GateType gateType,
    EvaluationTarget target,
    boolean blocking,
    GateStatus status,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    Long durationMs,
    Boolean passed,
    boolean passedWithWarnings,
    IssueCounts issueCounts,
    List<GateIssue> issues,
    Map<String, Object> metrics,
    List<String> recommendations,
    Map<String, Object> resultDetails,
    Map<String, Object> configUsed,
    String errorMessage
) {

    public GateExecution {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(gateId, "gateId must not be null");
        Objects.requireNonNull(gateType, "gateType must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        if ((completedAt == null) != (durationMs == null)) {
            throw new IllegalArgumentException("durationMs must be set iff completedAt is set");
        }
        if (status.isTerminal() != (completedAt != null)) {
            throw new IllegalArgumentException("completedAt must be set iff status is terminal (" + status + ")");
        }
        issueCounts = issueCounts == null ? IssueCounts.ZERO : issueCounts;
        issues = issues == null ? List.of() : List.copyOf(issues);
        metrics = Snapshots.freeze(metrics);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        resultDetails = Snapshots.freeze(resultDetails);
        configUsed = Snapshots.freeze(configUsed);
    }

    /** A newly dispatched execution, snapshotting the config's thresholds and blocking flag. */
    public static GateExecution pending(String id, GateConfig config, EvaluationTarget target, Instant now) {
        return new GateExecution(id, config.id(), config.gateType(), target, config.blocking(),
                GateStatus.PENDING, now, null, null, null, null, false,
                IssueCounts.ZERO, List.of(), Map.of(), List.of(), Map.of(),
                config.thresholdConfig(), null);
    }

    public GateExecution running(Instant now) {
        requireStatus(GateStatus.RUNNING, GateStatus.PENDING);
        return new GateExecution(id, gateId, gateType, target, blocking,
                GateStatus.RUNNING, createdAt, now, null, null, null, false,
                issueCounts, issues, metrics, recommendations, resultDetails, configUsed, null);
    }

    /** Normal checker return: {@code PASSED}, {@code WARNING} or {@code FAILED}. */
    public GateExecution completed(GateResult result, Instant now, long elapsedMs) {
        requireStatus(result.terminalStatus(), GateStatus.RUNNING);
        return new GateExecution(id, gateId, gateType, target, blocking,
                result.terminalStatus(), createdAt, startedAt, now, elapsedMs,
                result.passed(), result.passedWithWarnings(),
                IssueCounts.of(result.issues()), result.issues(), result.metrics(),
                result.recommendations(), result.details(), configUsed, null);
    }

    /** Checker raised, config was malformed, or no checker exists. Issue counts stay zero. */
    public GateExecution errored(String message, Instant now, long elapsedMs) {
        requireStatus(GateStatus.ERROR, GateStatus.RUNNING);
        return new GateExecution(id, gateId, gateType, target, blocking,
                GateStatus.ERROR, createdAt, startedAt, now, elapsedMs, false, false,
                IssueCounts.ZERO, List.of(), Map.of(), List.of(), Map.of(), configUsed, message);
    }

    /** Timeout exceeded; any partial result is discarded. */
    public GateExecution timedOut(String message, Instant now, long elapsedMs) {
        requireStatus(GateStatus.TIMEOUT, GateStatus.RUNNING);
        return new GateExecution(id, gateId, gateType, target, blocking,
                GateStatus.TIMEOUT, createdAt, startedAt, now, elapsedMs, false, false,
                IssueCounts.ZERO, List.of(), Map.of(), List.of(), Map.of(), configUsed, message);
    }

    /** Dry run of a disabled gate, or the run was aborted before this gate finished. */
    public GateExecution skipped(Map<String, ?> reasonDetails, Instant now, long elapsedMs) {
        requireStatus(GateStatus.SKIPPED, GateStatus.PENDING, GateStatus.RUNNING);
        return new GateExecution(id, gateId, gateType, target, blocking,
                GateStatus.SKIPPED, createdAt, startedAt, now, elapsedMs, null, false,
                IssueCounts.ZERO, List.of(), Map.of(), List.of(), Snapshots.freeze(reasonDetails),
                configUsed, null);
    }

    /** True when this execution contributes to the blocking decision. */
    public boolean isBlockingFailure() {
        return blocking && status.countsAsFailed();
    }

    private void requireStatus(GateStatus next, GateStatus... allowed) {
        for (GateStatus s : allowed) {
            if (status == s) {
                return;
            }
        }
        throw new IllegalStateException(
                "Illegal transition for execution " + id + ": " + status + " -> " + next);
    }
}
