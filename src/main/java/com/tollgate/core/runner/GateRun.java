package com.tollgate.core.runner;

import com.tollgate.core.model.EvaluationTarget;
import com.tollgate.core.model.GateConfig;
import com.tollgate.core.model.GateEnvironmentException;
import com.tollgate.core.model.GateExecution;
import com.tollgate.core.model.GateResult;
import com.tollgate.core.model.GateStatus;
import com.tollgate.core.model.RunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Handle on one in-flight gate run, returned by {@link GateRunner#start}.
 * <p>
 * Each considered gate has one execution slot. A slot's execution only moves
 * forward ({@code pending -> running -> terminal}); whichever thread performs the
 * terminal transition is the only one that reports it, so counters are
 * incremented exactly once per execution.
 */
public class GateRun {

    private static final Logger log = LoggerFactory.getLogger(GateRun.class);

    private final String runId;
    private final EvaluationTarget target;
    private final GateRunner runner;
    private final List<ExecutionSlot> slots = new ArrayList<>();
    private final List<Future<?>> workers = new ArrayList<>();
    private final AtomicReference<String> abortReason = new AtomicReference<>();
    private final AtomicReference<GateEnvironmentException> environmentFault = new AtomicReference<>();
    private RunResult result;

    GateRun(String runId, EvaluationTarget target, GateRunner runner) {
        this.runId = runId;
        this.target = target;
        this.runner = runner;
    }

    public String runId() {
        return runId;
    }

    public EvaluationTarget target() {
        return target;
    }

    /** Live snapshot of every execution of this run, in dispatch order. */
    public synchronized List<GateExecution> executions() {
        return slots.stream().map(ExecutionSlot::execution).toList();
    }

    public boolean isAborted() {
        return abortReason.get() != null;
    }

    /**
     * Cancels every pending or running gate of this run, recording each as skipped
     * with the cancellation reason. Terminal executions are left untouched.
     * Only the first call has an effect.
     */
    public void abort(String reason) {
        if (!abortReason.compareAndSet(null, reason == null ? "aborted" : reason)) {
            return;
        }
        List<ExecutionSlot> snapshot;
        synchronized (this) {
            snapshot = List.copyOf(slots);
        }
        int skipped = 0;
        for (ExecutionSlot slot : snapshot) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("reason", "cancelled");
            details.put("cancellation_reason", abortReason.get());
            if (slot.skip(details)) {
                slot.cancelWork();
                skipped++;
            }
        }
        log.warn("Run {} aborted ({}); {} gates cancelled", runId, abortReason.get(), skipped);
        runner.onAborted(this, abortReason.get(), skipped);
    }

    /**
     * Waits for every gate of this run to reach a terminal status.
     *
     * @throws GateRunFailedException if the store or artifact provider failed during the run;
     *                                executions that finished are kept in its partial result
     * @throws InterruptedException   if interrupted while waiting; the run keeps going
     */
    public RunResult await() throws InterruptedException {
        List<Future<?>> pending;
        synchronized (this) {
            pending = List.copyOf(workers);
        }
        for (Future<?> worker : pending) {
            try {
                worker.get();
            } catch (CancellationException e) {
                log.debug("Worker of run {} was cancelled", runId);
            } catch (ExecutionException e) {
                log.error("Gate worker of run {} failed unexpectedly", runId, e.getCause());
            }
        }
        return finish();
    }

    RunResult finish() {
        List<ExecutionSlot> snapshot;
        synchronized (this) {
            snapshot = List.copyOf(slots);
        }
        for (ExecutionSlot slot : snapshot) {
            slot.fail("Gate worker ended without a terminal status");
        }
        RunResult finished;
        synchronized (this) {
            if (result == null) {
                result = runner.onFinished(this, executions());
            }
            finished = result;
        }
        GateEnvironmentException fault = environmentFault.get();
        if (fault != null) {
            throw new GateRunFailedException("Gate run " + runId + " failed: " + fault.getMessage(), finished, fault);
        }
        return finished;
    }

    synchronized ExecutionSlot addSlot(GateConfig config, GateExecution pending) {
        var slot = new ExecutionSlot(config, pending);
        slots.add(slot);
        return slot;
    }

    synchronized void addWorker(Future<?> worker) {
        workers.add(worker);
    }

    void recordFault(GateEnvironmentException fault) {
        if (environmentFault.compareAndSet(null, fault)) {
            log.error("Environment fault in run {}: {}", runId, fault.getMessage());
        }
    }

    GateEnvironmentException environmentFault() {
        return environmentFault.get();
    }

    /**
     * One gate's execution within the run. All transitions happen under the slot's
     * monitor and are persisted before the monitor is released. Gate events are
     * published under {@code eventOrder}, which is always taken before the monitor,
     * so {@code gate.started} never follows the same execution's {@code gate.completed}.
     */
    final class ExecutionSlot {

        private final GateConfig config;
        private final Object eventOrder = new Object();
        private final long createdNanos = System.nanoTime();
        private GateExecution execution;
        private long startedNanos;
        private boolean started;
        private Future<?> work;
        private Future<?> worker;

        private ExecutionSlot(GateConfig config, GateExecution pending) {
            this.config = config;
            this.execution = pending;
        }

        GateConfig config() {
            return config;
        }

        synchronized GateExecution execution() {
            return execution;
        }

        String runId() {
            return runId;
        }

        GateRun run() {
            return GateRun.this;
        }

        EvaluationTarget target() {
            return target;
        }

        /** Persists the freshly created pending execution; false when it could not be stored. */
        synchronized boolean persistPending() {
            return runner.persist(GateRun.this, execution);
        }

        /**
         * {@code pending -> running}; false when the slot already ended (e.g. aborted)
         * or ended here because the running execution could not be stored.
         */
        boolean start() {
            boolean stored;
            synchronized (eventOrder) {
                GateExecution running;
                synchronized (this) {
                    if (execution.status().isTerminal()) {
                        return false;
                    }
                    markStarted();
                    execution = execution.running(runner.now());
                    running = execution;
                    stored = runner.persist(GateRun.this, running);
                }
                runner.onStarted(GateRun.this, running);
            }
            if (!stored) {
                error(GateRunner.STORE_FAILURE);
                return false;
            }
            return true;
        }

        boolean complete(GateResult gateResult) {
            return end(e -> e.completed(gateResult, runner.now(), elapsedMs()));
        }

        boolean error(String message) {
            return end(e -> e.errored(message, runner.now(), elapsedMs()));
        }

        boolean timeout(String message) {
            return end(e -> e.timedOut(message, runner.now(), elapsedMs()));
        }

        boolean skip(Map<String, ?> details) {
            return end(e -> e.skipped(details, runner.now(), elapsedMs()));
        }

        /** Last-resort error for a slot nobody finished; a no-op on terminal slots. */
        void fail(String message) {
            synchronized (this) {
                if (execution.status().isTerminal()) {
                    return;
                }
                if (execution.status() == GateStatus.PENDING) {
                    markStarted();
                    execution = execution.running(runner.now());
                }
            }
            error(message);
        }

        synchronized void attach(Future<?> evaluation) {
            this.work = evaluation;
        }

        synchronized void attachWorker(Future<?> gateWorker) {
            this.worker = gateWorker;
        }

        void cancelWork() {
            Future<?> evaluation;
            Future<?> gateWorker;
            synchronized (this) {
                evaluation = work;
                gateWorker = worker;
            }
            if (evaluation != null) {
                evaluation.cancel(true);
            }
            if (gateWorker != null) {
                gateWorker.cancel(true);
            }
        }

        private boolean end(UnaryOperator<GateExecution> transition) {
            synchronized (eventOrder) {
                GateExecution terminal;
                synchronized (this) {
                    if (execution.status().isTerminal()) {
                        return false;
                    }
                    execution = transition.apply(execution);
                    terminal = execution;
                    runner.persist(GateRun.this, terminal);
                }
                runner.onTerminal(GateRun.this, terminal);
            }
            return true;
        }

        private void markStarted() {
            startedNanos = System.nanoTime();
            started = true;
        }

        private long elapsedMs() {
            long from = started ? startedNanos : createdNanos;
            return (System.nanoTime() - from) / 1_000_000;
        }
    }
}
