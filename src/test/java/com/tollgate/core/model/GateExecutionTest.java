package com.tollgate.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GateExecutionTest {

    private static final Instant T0 = Instant.parse("2026-03-02T10:00:00Z");
    private static final EvaluationTarget TARGET = EvaluationTarget.forTaskRun("ws-1", "proj-1", "run-42");

    private GateConfig lintConfig(Map<String, Object> thresholds) {
        return GateConfig.create("gate-lint", "ws-1", "proj-1", GateType.LINT, true, true, thresholds);
    }

    private GateResult passingResult() {
        return new GateResult(true, false, List.of(), Map.of("errors", 0), List.of(), Map.of());
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("pending execution snapshots the gate's thresholds and blocking flag")
        void pendingSnapshotsConfig() {
            var execution = GateExecution.pending("e-1", lintConfig(Map.of("max_warnings", 10)), TARGET, T0);

            assertEquals(GateStatus.PENDING, execution.status());
            assertEquals(Map.of("max_warnings", 10), execution.configUsed());
            assertTrue(execution.blocking());
            assertNull(execution.passed());
            assertNull(execution.completedAt());
            assertNull(execution.durationMs());
        }

        @Test
        @DisplayName("pending -> running -> passed sets timestamps and duration together")
        void happyPath() {
            var done = GateExecution.pending("e-1", lintConfig(Map.of()), TARGET, T0)
                    .running(T0.plusMillis(5))
                    .completed(passingResult(), T0.plusMillis(105), 100);

            assertEquals(GateStatus.PASSED, done.status());
            assertEquals(T0.plusMillis(5), done.startedAt());
            assertEquals(T0.plusMillis(105), done.completedAt());
            assertEquals(100L, done.durationMs());
            assertEquals(Boolean.TRUE, done.passed());
        }

        @Test
        @DisplayName("a result that passed with warnings ends as WARNING")
        void warningStatus() {
            var result = new GateResult(true, true, List.of(GateIssue.of(Severity.HIGH, "unused import")),
                    Map.of(), List.of(), Map.of());
            var done = GateExecution.pending("e-1", lintConfig(Map.of()), TARGET, T0)
                    .running(T0)
                    .completed(result, T0, 1);

            assertEquals(GateStatus.WARNING, done.status());
            assertTrue(done.passedWithWarnings());
            assertEquals(1, done.issueCounts().high());
        }

        @Test
        @DisplayName("errored execution keeps zero issue counts and the message")
        void errored() {
            var done = GateExecution.pending("e-1", lintConfig(Map.of()), TARGET, T0)
                    .running(T0)
                    .errored("boom", T0, 3);

            assertEquals(GateStatus.ERROR, done.status());
            assertEquals("boom", done.errorMessage());
            assertEquals(IssueCounts.ZERO, done.issueCounts());
            assertEquals(Boolean.FALSE, done.passed());
        }

        @Test
        @DisplayName("skipped directly from pending leaves passed unset")
        void skippedFromPending() {
            var done = GateExecution.pending("e-1", lintConfig(Map.of()), TARGET, T0)
                    .skipped(Map.of("reason", "gate disabled (dry run)"), T0, 0);

            assertEquals(GateStatus.SKIPPED, done.status());
            assertNull(done.passed());
            assertEquals("gate disabled (dry run)", done.resultDetails().get("reason"));
        }
    }

    @Nested
    @DisplayName("illegal transitions")
    class IllegalTransitions {

        @Test
        @DisplayName("nothing leaves a terminal state")
        void terminalIsFinal() {
            var done = GateExecution.pending("e-1", lintConfig(Map.of()), TARGET, T0)
                    .running(T0)
                    .timedOut("too slow", T0, 5000);

            assertThrows(IllegalStateException.class, () -> done.running(T0));
            assertThrows(IllegalStateException.class, () -> done.completed(passingResult(), T0, 1));
            assertThrows(IllegalStateException.class, () -> done.skipped(Map.of(), T0, 1));
        }

        @Test
        @DisplayName("completing a pending execution is rejected")
        void completeRequiresRunning() {
            var pending = GateExecution.pending("e-1", lintConfig(Map.of()), TARGET, T0);
            assertThrows(IllegalStateException.class, () -> pending.completed(passingResult(), T0, 1));
        }

        @Test
        @DisplayName("duration without completion time is rejected")
        void durationRequiresCompletion() {
            var pending = GateExecution.pending("e-1", lintConfig(Map.of()), TARGET, T0);
            assertThrows(IllegalArgumentException.class, () -> new GateExecution(
                    pending.id(), pending.gateId(), pending.gateType(), pending.target(), pending.blocking(),
                    GateStatus.RUNNING, T0, T0, null, 12L, null, false, IssueCounts.ZERO,
                    List.of(), Map.of(), List.of(), Map.of(), Map.of(), null));
        }
    }

    @Test
    @DisplayName("config_used is unaffected by later edits to the gate's thresholds")
    void configUsedIsImmutableSnapshot() {
        var thresholds = new HashMap<String, Object>();
        thresholds.put("max_warnings", 10);
        var config = lintConfig(thresholds);
        var execution = GateExecution.pending("e-1", config, TARGET, T0);

        thresholds.put("max_warnings", 0);
        var edited = config.withThresholdConfig(Map.of("max_warnings", 0));

        assertEquals(10, execution.configUsed().get("max_warnings"));
        assertEquals(0, edited.thresholdConfig().get("max_warnings"));
        assertThrows(UnsupportedOperationException.class, () -> execution.configUsed().put("x", 1));
    }
}
