package com.tollgate.core.runner;

import com.tollgate.core.aggregate.ResultAggregator;
import com.tollgate.core.artifact.ArtifactProvider;
import com.tollgate.core.checker.ConfigException;
import com.tollgate.core.checker.GateChecker;
import com.tollgate.core.checker.ThresholdConfig;
import com.tollgate.core.config.TollgateProperties;
import com.tollgate.core.events.EventBus;
import com.tollgate.core.events.GateEvent;
import com.tollgate.core.logging.MdcContext;
import com.tollgate.core.metrics.GateMetrics;
import com.tollgate.core.model.EvaluationTarget;
import com.tollgate.core.model.GateConfig;
import com.tollgate.core.model.GateEnvironmentException;
import com.tollgate.core.model.GateExecution;
import com.tollgate.core.model.GateResult;
import com.tollgate.core.model.GateStatus;
import com.tollgate.core.model.RunResult;
import com.tollgate.core.persistence.GateConfigStore;
import com.tollgate.core.registry.CheckerNotRegisteredException;
import com.tollgate.core.registry.GateRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Evaluates every enabled gate of a project against one target, concurrently
 * and each under its own timeout.
 * <p>
 * Each gate gets a dispatch thread that waits for one of
 * {@code max-parallel-gates} permits, marks its execution running, and then waits
 * (bounded by the gate's timeout) for the checker to finish on an evaluation
 * thread. A timeout cancels only that gate's evaluation. Checker exceptions,
 * timeouts and missing checkers end the gate as {@code error}/{@code timeout}
 * and never reach sibling gates or the caller.
 */
@Service
public class GateRunner {

    private static final Logger log = LoggerFactory.getLogger(GateRunner.class);

    static final String STORE_FAILURE = "Execution could not be stored";

    private final GateRegistry registry;
    private final GateConfigStore store;
    private final ArtifactProvider artifactProvider;
    private final ResultAggregator aggregator;
    private final EventBus eventBus;
    private final GateMetrics metrics;
    private final int maxParallelGates;
    private final Duration defaultTimeout;
    private final Clock clock;
    private final ExecutorService dispatchExecutor;
    private final ExecutorService evaluationExecutor;

    @Autowired
    public GateRunner(GateRegistry registry, GateConfigStore store, ArtifactProvider artifactProvider,
                      ResultAggregator aggregator, EventBus eventBus, GateMetrics metrics,
                      TollgateProperties properties) {
        this(registry, store, artifactProvider, aggregator, eventBus, metrics,
                properties.getMaxParallelGates(), properties.getDefaultTimeout(), Clock.systemUTC());
    }

    GateRunner(GateRegistry registry, GateConfigStore store, ArtifactProvider artifactProvider,
               ResultAggregator aggregator, EventBus eventBus, GateMetrics metrics,
               int maxParallelGates, Duration defaultTimeout, Clock clock) {
        if (maxParallelGates < 1) {
            throw new IllegalArgumentException("maxParallelGates must be >= 1");
        }
        this.registry = registry;
        this.store = store;
        this.artifactProvider = artifactProvider;
        this.aggregator = aggregator;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.maxParallelGates = maxParallelGates;
        this.defaultTimeout = defaultTimeout;
        this.clock = clock;
        this.dispatchExecutor = Executors.newCachedThreadPool(daemonThreads("gate-dispatch-"));
        this.evaluationExecutor = Executors.newCachedThreadPool(daemonThreads("gate-eval-"));
    }

    /**
     * Runs all enabled gates for {@code target} and waits for the result.
     * Interrupting the calling thread aborts the run; the returned result then
     * shows the cancelled gates as skipped and the interrupt flag stays set.
     *
     * @throws GateRunFailedException if the config store or artifact provider is unavailable
     */
    public RunResult runGates(EvaluationTarget target) {
        return runGates(target, RunOptions.DEFAULTS);
    }

    public RunResult runGates(EvaluationTarget target, RunOptions options) {
        GateRun run = start(target, options);
        try {
            return run.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            run.abort("caller interrupted");
            return run.finish();
        }
    }

    /**
     * Starts a run and returns immediately. Every considered gate already has a
     * persisted {@code pending} execution when this returns.
     *
     * @throws GateRunFailedException if the gate configs cannot be loaded
     */
    public GateRun start(EvaluationTarget target, RunOptions options) {
        String runId = UUID.randomUUID().toString();
        var run = new GateRun(runId, target, this);
        MdcContext.setRun(runId, target);
        try {
            List<GateConfig> configs = loadConfigs(run, options);
            log.info("Starting gate run for {} with {} gates{}", target, configs.size(),
                    options.dryRun() ? " (dry run)" : "");
            eventBus.publish(new GateEvent(GateEvent.RUN_STARTED, runId, null,
                    Map.of("target", target.toString(),
                           "gates", configs.size(),
                           "dryRun", options.dryRun()),
                    clock.instant()));

            var permits = new Semaphore(maxParallelGates);
            for (GateConfig config : configs) {
                var pending = GateExecution.pending(UUID.randomUUID().toString(), config, target, clock.instant());
                var slot = run.addSlot(config, pending);
                boolean stored = slot.persistPending();
                eventBus.publish(new GateEvent(GateEvent.GATE_PENDING, runId, pending.id(),
                        Map.of("gateId", config.id(), "gateType", config.gateType().value()),
                        pending.createdAt()));

                if (!stored) {
                    slot.fail(STORE_FAILURE);
                    continue;
                }
                if (!config.enabled()) {
                    slot.skip(Map.of("reason", "gate disabled (dry run)"));
                    continue;
                }
                try {
                    Future<?> worker = dispatchExecutor.submit(() -> runGate(slot, permits));
                    slot.attachWorker(worker);
                    run.addWorker(worker);
                } catch (RejectedExecutionException e) {
                    slot.fail("Gate runner is shutting down");
                }
            }
            return run;
        } finally {
            MdcContext.clear();
        }
    }

    private List<GateConfig> loadConfigs(GateRun run, RunOptions options) {
        EvaluationTarget target = run.target();
        try {
            List<GateConfig> configs = options.dryRun()
                    ? store.getGates(target.workspaceId(), target.projectId())
                    : store.getEnabledGates(target.workspaceId(), target.projectId());
            return configs.stream().filter(c -> options.includes(c.gateType())).toList();
        } catch (GateEnvironmentException e) {
            run.recordFault(e);
            throw new GateRunFailedException("Cannot load gate configs for " + target + ": " + e.getMessage(),
                    aggregator.buildResult(run.runId(), target, List.of()), e);
        }
    }

    private void runGate(GateRun.ExecutionSlot slot, Semaphore permits) {
        GateConfig config = slot.config();
        MdcContext.setGate(slot.runId(), slot.target(), config.gateType().value(), slot.execution().id());
        try {
            permits.acquire();
            try {
                evaluate(slot);
            } finally {
                permits.release();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            slot.fail("Gate evaluation interrupted");
        } catch (RuntimeException e) {
            log.error("Unexpected failure while running gate {}", config.id(), e);
            slot.fail("Unexpected failure: " + e.getMessage());
        } finally {
            MdcContext.clear();
        }
    }

    private void evaluate(GateRun.ExecutionSlot slot) throws InterruptedException {
        if (!slot.start()) {
            return;
        }
        GateConfig config = slot.config();
        GateExecution running = slot.execution();

        GateChecker checker;
        try {
            checker = registry.lookup(config.gateType());
        } catch (CheckerNotRegisteredException e) {
            slot.error(e.getMessage());
            return;
        }

        Duration timeout = timeoutFor(config);
        var thresholds = ThresholdConfig.of(running.configUsed());
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<GateResult> evaluation = evaluationExecutor.submit(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                var artifact = artifactProvider.getArtifact(slot.target(), config.gateType());
                return checker.evaluate(artifact, thresholds);
            } finally {
                MdcContext.clear();
            }
        });
        slot.attach(evaluation);

        try {
            slot.complete(awaitResult(evaluation, config, timeout));
        } catch (EvaluationTimeoutException e) {
            log.debug("Cancelled gate {} after {}", e.getGateType().value(), e.getTimeout());
            slot.timeout(e.getMessage());
        } catch (GateEnvironmentException e) {
            slot.run().recordFault(e);
            slot.error("Environment failure: " + e.getMessage());
        } catch (ConfigException | CheckerRuntimeException e) {
            slot.error(e.getMessage());
        } catch (CancellationException e) {
            log.debug("Evaluation of gate {} cancelled", config.id());
        }
    }

    /**
     * Waits for the checker within {@code timeout}.
     *
     * @throws EvaluationTimeoutException if the timeout elapsed; the evaluation is cancelled
     * @throws GateEnvironmentException   if the artifact could not be read
     * @throws ConfigException            if the thresholds are malformed
     * @throws CheckerRuntimeException    for anything else the checker threw
     */
    private GateResult awaitResult(Future<GateResult> evaluation, GateConfig config, Duration timeout)
            throws InterruptedException {
        try {
            return evaluation.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            evaluation.cancel(true);
            throw new EvaluationTimeoutException(config.gateType(), timeout);
        } catch (InterruptedException e) {
            evaluation.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof GateEnvironmentException env) {
                throw env;
            }
            if (cause instanceof ConfigException invalid) {
                throw invalid;
            }
            throw new CheckerRuntimeException(cause);
        }
    }

    Duration timeoutFor(GateConfig config) {
        return config.timeoutSeconds() != null ? Duration.ofSeconds(config.timeoutSeconds()) : defaultTimeout;
    }

    // ── Callbacks from GateRun ────────────────────────────────────────────

    Instant now() {
        return clock.instant();
    }

    /** Saves the execution; false when the store rejected it or is unavailable. */
    boolean persist(GateRun run, GateExecution execution) {
        try {
            store.saveExecution(execution);
            return true;
        } catch (GateEnvironmentException e) {
            run.recordFault(e);
            return false;
        } catch (RuntimeException e) {
            log.error("Cannot store {} execution {} of gate {}", execution.status().value(), execution.id(),
                    execution.gateId(), e);
            return false;
        }
    }

    void onStarted(GateRun run, GateExecution execution) {
        log.debug("Gate {} started", execution.gateType().value());
        eventBus.publish(new GateEvent(GateEvent.GATE_STARTED, run.runId(), execution.id(),
                Map.of("gateId", execution.gateId(), "gateType", execution.gateType().value()),
                execution.startedAt()));
    }

    void onTerminal(GateRun run, GateExecution execution) {
        try {
            aggregator.record(execution);
        } catch (GateEnvironmentException e) {
            run.recordFault(e);
        } catch (RuntimeException e) {
            log.error("Cannot update counters of gate {} for execution {}", execution.gateId(), execution.id(), e);
        }
        if (execution.status() != GateStatus.SKIPPED) {
            metrics.recordExecution(execution);
        }
        if (execution.status() == GateStatus.ERROR || execution.status() == GateStatus.TIMEOUT) {
            log.warn("Gate {} ended {} after {}ms: {}", execution.gateType().value(), execution.status().value(),
                    execution.durationMs(), execution.errorMessage());
        } else {
            log.info("Gate {} ended {} after {}ms", execution.gateType().value(), execution.status().value(),
                    execution.durationMs());
        }
        var payload = new HashMap<String, Object>();
        payload.put("gateId", execution.gateId());
        payload.put("gateType", execution.gateType().value());
        payload.put("status", execution.status().value());
        payload.put("durationMs", execution.durationMs());
        eventBus.publish(new GateEvent(GateEvent.GATE_COMPLETED, run.runId(), execution.id(),
                payload, execution.completedAt()));
    }

    void onAborted(GateRun run, String reason, int cancelled) {
        metrics.recordAbort();
        eventBus.publish(new GateEvent(GateEvent.RUN_ABORTED, run.runId(), null,
                Map.of("reason", reason, "cancelled", cancelled),
                clock.instant()));
    }

    RunResult onFinished(GateRun run, List<GateExecution> executions) {
        RunResult result = aggregator.buildResult(run.runId(), run.target(), executions);
        metrics.recordRun(result.blocking());
        MdcContext.setRun(run.runId(), run.target());
        try {
            log.info("Gate run for {} finished: {} (blocking={}, blocking gates={})", run.target(),
                    result.summary().overallStatus().value(), result.blocking(), result.blockingGateIds());
        } finally {
            MdcContext.clear();
        }
        eventBus.publish(new GateEvent(GateEvent.RUN_COMPLETED, run.runId(), null,
                Map.of("blocking", result.blocking(),
                       "overallStatus", result.summary().overallStatus().value(),
                       "blockingGateIds", result.blockingGateIds()),
                clock.instant()));
        return result;
    }

    @PreDestroy
    public void shutdown() {
        dispatchExecutor.shutdownNow();
        evaluationExecutor.shutdownNow();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
