package com.tollgate.core.aggregate;

import com.tollgate.core.model.EvaluationTarget;
import com.tollgate.core.model.GateConfig;
import com.tollgate.core.model.GateExecution;
import com.tollgate.core.model.GateIssue;
import com.tollgate.core.model.GateResult;
import com.tollgate.core.model.GateStatus;
import com.tollgate.core.model.GateType;
import com.tollgate.core.model.Severity;
import com.tollgate.core.persistence.GateConfigStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ResultAggregatorTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");
    private static final EvaluationTarget TARGET = EvaluationTarget.forTask("ws", "proj", "t1");

    private GateConfigStore store;
    private ResultAggregator aggregator;

    @BeforeEach
    void setUp() {
        store = mock(GateConfigStore.class);
        aggregator = new ResultAggregator(store);
    }

    private static GateConfig gate(GateType type, boolean blocking) {
        return GateConfig.create("g-" + type.value(), "ws", "proj", type, true, blocking, Map.of());
    }

    private static GateExecution running(GateType type, boolean blocking) {
        return GateExecution.pending("e-" + type.value(), gate(type, blocking), TARGET, NOW).running(NOW);
    }

    private static GateExecution passed(GateType type, boolean blocking) {
        return running(type, blocking).completed(
                new GateResult(true, false, List.of(), Map.of(), List.of(), Map.of()), NOW, 10);
    }

    private static GateExecution warned(GateType type, boolean blocking) {
        return running(type, blocking).completed(
                new GateResult(true, true, List.of(GateIssue.of(Severity.MEDIUM, "meh")), Map.of(),
                        List.of("[MEDIUM] Code Quality: tidy up"), Map.of()), NOW, 10);
    }

    private static GateExecution failed(GateType type, boolean blocking) {
        return running(type, blocking).completed(
                new GateResult(false, false,
                        List.of(GateIssue.of(Severity.CRITICAL, "bad"), GateIssue.of(Severity.HIGH, "worse")),
                        Map.of(), List.of("[HIGH] Security: patch"), Map.of()), NOW, 10);
    }

    @Nested
    @DisplayName("record")
    class Record {

        @Test
        @DisplayName("passed and warning count as passes")
        void passes() {
            aggregator.record(passed(GateType.LINT, true));
            aggregator.record(warned(GateType.COVERAGE, true));

            verify(store).atomicIncrementCounters("g-lint", true, NOW);
            verify(store).atomicIncrementCounters("g-coverage", true, NOW);
        }

        @Test
        @DisplayName("error and timeout count as failures")
        void failures() {
            aggregator.record(running(GateType.LINT, true).errored("boom", NOW, 5));
            aggregator.record(running(GateType.SECURITY, true).timedOut("slow", NOW, 5));

            verify(store).atomicIncrementCounters("g-lint", false, NOW);
            verify(store).atomicIncrementCounters("g-security", false, NOW);
        }

        @Test
        @DisplayName("skipped and non-terminal executions count nothing")
        void ignored() {
            aggregator.record(running(GateType.LINT, true));
            aggregator.record(running(GateType.LINT, true).skipped(Map.of("reason", "cancelled"), NOW, 1));

            verifyNoInteractions(store);
        }
    }

    @Nested
    @DisplayName("blocking decision")
    class Decision {

        @Test
        @DisplayName("failure of a blocking gate blocks")
        void blockingFailure() {
            var decision = aggregator.decide(List.of(
                    passed(GateType.LINT, true),
                    failed(GateType.SECURITY, true),
                    running(GateType.PERFORMANCE, true).timedOut("slow", NOW, 5)));

            assertTrue(decision.blocking());
            assertEquals(List.of("g-security", "g-performance"), decision.blockingGateIds());
        }

        @Test
        @DisplayName("non-blocking failures and warnings do not block")
        void nonBlocking() {
            var decision = aggregator.decide(List.of(
                    failed(GateType.COMPLEXITY, false),
                    warned(GateType.LINT, true)));

            assertFalse(decision.blocking());
            assertTrue(decision.blockingGateIds().isEmpty());
        }
    }

    @Nested
    @DisplayName("summary")
    class Summary {

        @Test
        @DisplayName("blocking run is failed, with recommendations in order")
        void failedRun() {
            var result = aggregator.buildResult("run-1", TARGET, List.of(
                    warned(GateType.LINT, true),
                    failed(GateType.SECURITY, true)));

            assertTrue(result.blocking());
            assertEquals(GateStatus.FAILED, result.summary().overallStatus());
            assertEquals(List.of("[MEDIUM] Code Quality: tidy up", "[HIGH] Security: patch"),
                    result.summary().recommendations());
            assertEquals(3, result.summary().totalIssues());
            assertEquals(List.of("g-security"), result.summary().gateIds(GateStatus.FAILED));
        }

        @Test
        @DisplayName("non-blocking failure degrades the run to warning")
        void degraded() {
            var summary = aggregator.buildResult("run-2", TARGET, List.of(
                    passed(GateType.LINT, true),
                    failed(GateType.COMPLEXITY, false))).summary();

            assertEquals(GateStatus.WARNING, summary.overallStatus());
        }

        @Test
        @DisplayName("all passed is passed")
        void allPassed() {
            var result = aggregator.buildResult("run-3", TARGET, List.of(passed(GateType.LINT, true)));

            assertFalse(result.blocking());
            assertEquals(GateStatus.PASSED, result.summary().overallStatus());
            assertTrue(result.execution(GateType.LINT).isPresent());
        }
    }
}
