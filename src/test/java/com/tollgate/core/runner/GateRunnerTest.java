package com.tollgate.core.runner;

import com.tollgate.core.aggregate.ResultAggregator;
import com.tollgate.core.artifact.ArtifactProvider;
import com.tollgate.core.artifact.ExecutionArtifact;
import com.tollgate.core.checker.GateChecker;
import com.tollgate.core.checker.LintChecker;
import com.tollgate.core.checker.ThresholdConfig;
import com.tollgate.core.events.EventBus;
import com.tollgate.core.events.GateEvent;
import com.tollgate.core.metrics.GateMetrics;
import com.tollgate.core.model.EvaluationTarget;
import com.tollgate.core.model.GateConfig;
import com.tollgate.core.model.GateEnvironmentException;
import com.tollgate.core.model.GateExecution;
import com.tollgate.core.model.GateResult;
import com.tollgate.core.model.GateStatus;
import com.tollgate.core.model.GateType;
import com.tollgate.core.persistence.ExecutionQuery;
import com.tollgate.core.persistence.GateConfigStore;
import com.tollgate.core.persistence.InMemoryGateConfigStore;
import com.tollgate.core.registry.GateRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class GateRunnerTest {

    private static final EvaluationTarget TARGET = EvaluationTarget.forTaskRun("ws1", "proj1", "run-7");

    private GateConfigStore store;
    private GateRegistry registry;
    private EventBus eventBus;
    private SimpleMeterRegistry meterRegistry;
    private final List<GateEvent> events = Collections.synchronizedList(new ArrayList<>());
    private final List<GateRunner> runners = new ArrayList<>();
    private ArtifactProvider artifacts = (target, type) -> ExecutionArtifact.of(type, Map.of());

    /** Checker whose behaviour is supplied by the test. */
    private record StubChecker(GateType gateType, Function<ThresholdConfig, GateResult> body) implements GateChecker {
        @Override
        public GateResult evaluate(ExecutionArtifact artifact, ThresholdConfig thresholds) {
            return body.apply(thresholds);
        }
    }

    private static GateResult pass() {
        return new GateResult(true, false, List.of(), Map.of(), List.of(), Map.of());
    }

    private static GateResult failing() {
        return new GateResult(false, false, List.of(), Map.of(), List.of("[HIGH] Security: patch it"), Map.of());
    }

    @BeforeEach
    void setUp() {
        store = new InMemoryGateConfigStore();
        registry = new GateRegistry();
        eventBus = new EventBus();
        eventBus.subscribeAll(events::add);
        meterRegistry = new SimpleMeterRegistry();
    }

    @AfterEach
    void tearDown() {
        runners.forEach(GateRunner::shutdown);
    }

    private GateRunner runner(int maxParallel) {
        registry.seal();
        var runner = new GateRunner(registry, store, artifacts, new ResultAggregator(store), eventBus,
                new GateMetrics(meterRegistry), maxParallel, Duration.ofSeconds(30), Clock.systemUTC());
        runners.add(runner);
        return runner;
    }

    private GateRunner runner() {
        return runner(4);
    }

    private GateConfig gate(GateType type, boolean enabled, boolean blocking) {
        return store.saveGate(GateConfig.create("g-" + type.value(), "ws1", "proj1", type, enabled, blocking, Map.of()));
    }

    private void register(GateType type, Function<ThresholdConfig, GateResult> body) {
        registry.register(type, new StubChecker(type, body));
    }

    private static GateResult sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted");
        }
        return pass();
    }

    private static GateResult await(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted");
        }
        return pass();
    }

    @Nested
    @DisplayName("failure isolation")
    class Isolation {

        @Test
        @DisplayName("a throwing checker errors only its own gate")
        void throwingChecker() {
            for (GateType type : List.of(GateType.LINT, GateType.COVERAGE, GateType.SECURITY)) {
                gate(type, true, true);
                register(type, t -> pass());
            }
            gate(GateType.PERFORMANCE, true, true);
            register(GateType.PERFORMANCE, t -> {
                throw new IllegalStateException("profiler crashed");
            });

            var result = runner().runGates(TARGET);

            var perf = result.execution(GateType.PERFORMANCE).orElseThrow();
            assertEquals(GateStatus.ERROR, perf.status());
            assertEquals("IllegalStateException: profiler crashed", perf.errorMessage());
            assertEquals(0, perf.issueCounts().total());
            for (GateType type : List.of(GateType.LINT, GateType.COVERAGE, GateType.SECURITY)) {
                assertEquals(GateStatus.PASSED, result.execution(type).orElseThrow().status());
            }
            assertTrue(result.blocking());
            assertEquals(List.of("g-performance"), result.blockingGateIds());
        }

        @Test
        @DisplayName("a slow checker times out without holding up the run")
        void timeout() {
            store.saveGate(GateConfig.create("g-lint", "ws1", "proj1", GateType.LINT, true, true, Map.of())
                    .withTimeoutSeconds(5));
            register(GateType.LINT, t -> sleep(10_000));
            gate(GateType.COVERAGE, true, true);
            register(GateType.COVERAGE, t -> pass());

            var result = runner().runGates(TARGET);

            var lint = result.execution(GateType.LINT).orElseThrow();
            assertEquals(GateStatus.TIMEOUT, lint.status());
            assertEquals("Gate 'lint' exceeded timeout of 5s", lint.errorMessage());
            assertTrue(lint.durationMs() >= 5000 && lint.durationMs() < 6000, "duration " + lint.durationMs());
            assertEquals(Boolean.FALSE, lint.passed());
            assertEquals(GateStatus.PASSED, result.execution(GateType.COVERAGE).orElseThrow().status());
        }

        @Test
        @DisplayName("a gate type without a checker ends in error")
        void missingChecker() {
            gate(GateType.CONTRACT, true, false);

            var result = runner().runGates(TARGET);

            var contract = result.execution(GateType.CONTRACT).orElseThrow();
            assertEquals(GateStatus.ERROR, contract.status());
            assertEquals("No checker registered for gate type 'contract'", contract.errorMessage());
            assertFalse(result.blocking());
        }

        @Test
        @DisplayName("malformed thresholds end in error naming the key")
        void configError() {
            gate(GateType.LINT, true, true);
            registry.register(GateType.LINT, new LintChecker());

            var result = runner().runGates(TARGET);

            var lint = result.execution(GateType.LINT).orElseThrow();
            assertEquals(GateStatus.ERROR, lint.status());
            assertEquals("Invalid threshold config 'fail_on_warning': required key is missing", lint.errorMessage());
        }
    }

    @Nested
    @DisplayName("gate selection")
    class Selection {

        @Test
        @DisplayName("disabled gates produce no execution")
        void disabled() {
            gate(GateType.LINT, true, true);
            gate(GateType.COVERAGE, false, true);
            register(GateType.LINT, t -> pass());
            register(GateType.COVERAGE, t -> failing());

            var result = runner().runGates(TARGET);

            assertEquals(1, result.executions().size());
            assertTrue(result.execution(GateType.COVERAGE).isEmpty());
            assertEquals(1, store.countExecutions(ExecutionQuery.all("ws1", "proj1")));
        }

        @Test
        @DisplayName("dry run records disabled gates as skipped")
        void dryRun() {
            gate(GateType.LINT, true, true);
            gate(GateType.COVERAGE, false, true);
            register(GateType.LINT, t -> pass());
            register(GateType.COVERAGE, t -> failing());

            var result = runner().runGates(TARGET, RunOptions.dryRunOptions());

            var coverage = result.execution(GateType.COVERAGE).orElseThrow();
            assertEquals(GateStatus.SKIPPED, coverage.status());
            assertNull(coverage.passed());
            assertEquals("gate disabled (dry run)", coverage.resultDetails().get("reason"));
            assertEquals(GateStatus.PASSED, result.execution(GateType.LINT).orElseThrow().status());
            assertEquals(0, store.findGate("g-coverage").orElseThrow().totalEvaluations());
        }

        @Test
        @DisplayName("gate type filter restricts the run")
        void filter() {
            gate(GateType.LINT, true, true);
            gate(GateType.SECURITY, true, true);
            register(GateType.LINT, t -> pass());
            register(GateType.SECURITY, t -> failing());

            var result = runner().runGates(TARGET, RunOptions.only(GateType.LINT));

            assertEquals(List.of(GateType.LINT), result.executions().stream().map(GateExecution::gateType).toList());
            assertFalse(result.blocking());
        }

        @Test
        @DisplayName("a project without gates yields an empty passing result")
        void noGates() {
            var result = runner().runGates(TARGET);

            assertTrue(result.executions().isEmpty());
            assertFalse(result.blocking());
            assertEquals(GateStatus.PASSED, result.summary().overallStatus());
        }
    }

    @Nested
    @DisplayName("counters")
    class Counters {

        @Test
        @DisplayName("repeated runs count each execution exactly once")
        void exactlyOnce() {
            gate(GateType.LINT, true, true);
            gate(GateType.SECURITY, true, false);
            register(GateType.LINT, t -> pass());
            register(GateType.SECURITY, t -> failing());
            var runner = runner();

            int runs = 5;
            for (int i = 0; i < runs; i++) {
                runner.runGates(TARGET);
            }

            var lint = store.findGate("g-lint").orElseThrow();
            var security = store.findGate("g-security").orElseThrow();
            assertEquals(runs, lint.totalEvaluations());
            assertEquals(runs, lint.passedEvaluations());
            assertEquals(runs, security.totalEvaluations());
            assertEquals(runs, security.failedEvaluations());
            assertEquals(Boolean.FALSE, security.lastResult());
            assertEquals(2.0 * runs, meterRegistry.get("tollgate.gate.evaluations").counters().stream()
                    .mapToDouble(c -> c.count()).sum());
        }

        @Test
        @DisplayName("parallelism never exceeds the configured bound")
        void boundedParallelism() {
            var inFlight = new AtomicInteger();
            var peak = new AtomicInteger();
            for (GateType type : List.of(GateType.LINT, GateType.COVERAGE, GateType.SECURITY, GateType.COMPLEXITY)) {
                gate(type, true, true);
                register(type, t -> {
                    peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                    try {
                        return sleep(50);
                    } finally {
                        inFlight.decrementAndGet();
                    }
                });
            }

            var result = runner(2).runGates(TARGET);

            assertEquals(4, result.executions().size());
            assertTrue(peak.get() <= 2, "peak " + peak.get());
        }
    }

    @Nested
    @DisplayName("abort")
    class Abort {

        @Test
        @DisplayName("aborting skips unfinished gates and counts nothing for them")
        void abort() throws Exception {
            var started = new CountDownLatch(2);
            var never = new CountDownLatch(1);
            for (GateType type : List.of(GateType.LINT, GateType.COVERAGE)) {
                gate(type, true, true);
                register(type, t -> {
                    started.countDown();
                    return await(never);
                });
            }
            var run = runner().start(TARGET, RunOptions.DEFAULTS);
            assertTrue(started.await(5, TimeUnit.SECONDS));

            run.abort("superseded by newer commit");
            var result = run.await();

            assertTrue(run.isAborted());
            for (GateExecution execution : result.executions()) {
                assertEquals(GateStatus.SKIPPED, execution.status());
                assertEquals("cancelled", execution.resultDetails().get("reason"));
                assertEquals("superseded by newer commit", execution.resultDetails().get("cancellation_reason"));
                assertNotNull(execution.startedAt());
            }
            assertFalse(result.blocking());
            assertEquals(0, store.findGate("g-lint").orElseThrow().totalEvaluations());
            assertTrue(events.stream().anyMatch(e -> e.eventType().equals(GateEvent.RUN_ABORTED)));
            List<GateEvent> trace;
            synchronized (events) {
                trace = List.copyOf(events);
            }
            for (GateExecution execution : result.executions()) {
                var perExecution = trace.stream()
                        .filter(e -> execution.id().equals(e.executionId()))
                        .map(GateEvent::eventType)
                        .toList();
                assertEquals(List.of(GateEvent.GATE_PENDING, GateEvent.GATE_STARTED, GateEvent.GATE_COMPLETED),
                        perExecution);
            }
        }

        @Test
        @DisplayName("abort leaves finished gates untouched")
        void partial() throws Exception {
            var never = new CountDownLatch(1);
            var slowStarted = new CountDownLatch(1);
            gate(GateType.LINT, true, true);
            gate(GateType.SECURITY, true, true);
            register(GateType.LINT, t -> pass());
            register(GateType.SECURITY, t -> {
                slowStarted.countDown();
                return await(never);
            });
            var run = runner().start(TARGET, RunOptions.DEFAULTS);
            assertTrue(slowStarted.await(5, TimeUnit.SECONDS));
            waitUntilTerminal(run, GateType.LINT);

            run.abort("user cancelled");
            var result = run.await();

            assertEquals(GateStatus.PASSED, result.execution(GateType.LINT).orElseThrow().status());
            assertEquals(GateStatus.SKIPPED, result.execution(GateType.SECURITY).orElseThrow().status());
            assertEquals(1, store.findGate("g-lint").orElseThrow().totalEvaluations());
        }

        private void waitUntilTerminal(GateRun run, GateType type) throws InterruptedException {
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (System.nanoTime() < deadline) {
                boolean done = run.executions().stream()
                        .anyMatch(e -> e.gateType() == type && e.status().isTerminal());
                if (done) {
                    return;
                }
                Thread.sleep(10);
            }
            fail("gate " + type.value() + " did not finish");
        }
    }

    @Nested
    @DisplayName("environment failures")
    class Environment {

        @Test
        @DisplayName("artifact store outage fails the run with the partial result")
        void artifactOutage() {
            gate(GateType.LINT, true, true);
            gate(GateType.SECURITY, true, true);
            register(GateType.LINT, t -> pass());
            register(GateType.SECURITY, t -> pass());
            artifacts = (target, type) -> {
                if (type == GateType.SECURITY) {
                    throw new GateEnvironmentException("Artifact root not readable: /nowhere");
                }
                return ExecutionArtifact.of(type, Map.of());
            };

            var e = assertThrows(GateRunFailedException.class, () -> runner().runGates(TARGET));

            var partial = e.getPartialResult();
            assertEquals(GateStatus.PASSED, partial.execution(GateType.LINT).orElseThrow().status());
            var security = partial.execution(GateType.SECURITY).orElseThrow();
            assertEquals(GateStatus.ERROR, security.status());
            assertTrue(security.errorMessage().startsWith("Environment failure:"));
        }

        @Test
        @DisplayName("a gate deleted mid-run errors alone and the run still returns")
        void gateDeletedAfterLoading() {
            store = new InMemoryGateConfigStore() {
                @Override
                public List<GateConfig> getEnabledGates(String workspaceId, String projectId) {
                    var gates = super.getEnabledGates(workspaceId, projectId);
                    deleteGate("g-security");
                    return gates;
                }
            };
            gate(GateType.LINT, true, true);
            gate(GateType.SECURITY, true, true);
            register(GateType.LINT, t -> pass());
            register(GateType.SECURITY, t -> pass());

            var result = runner().runGates(TARGET);

            assertEquals(2, result.executions().size());
            assertEquals(GateStatus.PASSED, result.execution(GateType.LINT).orElseThrow().status());
            var security = result.execution(GateType.SECURITY).orElseThrow();
            assertEquals(GateStatus.ERROR, security.status());
            assertEquals("Execution could not be stored", security.errorMessage());
            assertEquals(1, store.findGate("g-lint").orElseThrow().totalEvaluations());
            assertEquals(List.of("g-security"), result.blockingGateIds());
        }

        @Test
        @DisplayName("unreadable gate configs fail before anything is dispatched")
        void configStoreOutage() {
            store = mock(GateConfigStore.class);
            when(store.getEnabledGates("ws1", "proj1")).thenThrow(new GateEnvironmentException("db down"));

            var e = assertThrows(GateRunFailedException.class, () -> runner().runGates(TARGET));

            assertTrue(e.getPartialResult().executions().isEmpty());
            verify(store, never()).saveExecution(any());
        }
    }

    @Test
    @DisplayName("events trace the run from start to completion")
    void events() {
        gate(GateType.LINT, true, true);
        register(GateType.LINT, t -> pass());

        var result = runner().runGates(TARGET);

        var types = events.stream().map(GateEvent::eventType).toList();
        assertEquals(List.of(GateEvent.RUN_STARTED, GateEvent.GATE_PENDING, GateEvent.GATE_STARTED,
                GateEvent.GATE_COMPLETED, GateEvent.RUN_COMPLETED), types);
        assertTrue(events.stream().allMatch(e -> e.runId().equals(result.runId())));
        var completed = events.get(3);
        assertEquals("passed", completed.payload().get("status"));
    }

    @Test
    @DisplayName("every gate has a persisted execution when start returns")
    void pendingPersisted() throws Exception {
        var release = new CountDownLatch(1);
        gate(GateType.LINT, true, true);
        register(GateType.LINT, t -> await(release));

        var run = runner().start(TARGET, RunOptions.DEFAULTS);
        var id = run.executions().get(0).id();
        var persisted = store.findExecution(id).orElseThrow();
        assertFalse(persisted.status().isTerminal());
        assertEquals(Map.of(), persisted.configUsed());

        release.countDown();
        assertEquals(GateStatus.PASSED, run.await().execution(GateType.LINT).orElseThrow().status());
    }
}
