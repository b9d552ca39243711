package com.tollgate.core.metrics;

import com.tollgate.core.model.GateExecution;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for gate evaluation.
 */
@Service
public class GateMetrics {

    private final MeterRegistry registry;

    public GateMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /** One terminal gate execution. */
    public void recordExecution(GateExecution execution) {
        String gateType = execution.gateType().value();
        String status = execution.status().value();
        if (execution.durationMs() != null) {
            Timer.builder("tollgate.gate.duration")
                    .tag("gate_type", gateType)
                    .tag("status", status)
                    .register(registry)
                    .record(Duration.ofMillis(execution.durationMs()));
        }
        Counter.builder("tollgate.gate.evaluations")
                .tag("gate_type", gateType)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordRun(boolean blocking) {
        Counter.builder("tollgate.runs.total")
                .tag("blocking", String.valueOf(blocking))
                .register(registry)
                .increment();
    }

    public void recordAbort() {
        Counter.builder("tollgate.runs.aborted")
                .description("Gate runs aborted by the caller")
                .register(registry)
                .increment();
    }
}
