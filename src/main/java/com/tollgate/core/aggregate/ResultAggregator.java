package com.tollgate.core.aggregate;

import com.tollgate.core.model.EvaluationTarget;
import com.tollgate.core.model.GateExecution;
import com.tollgate.core.model.GateStatus;
import com.tollgate.core.model.RunResult;
import com.tollgate.core.model.RunSummary;
import com.tollgate.core.persistence.GateConfigStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;

/**
 * Folds terminal executions into their gate's rolling counters and derives a
 * run's blocking decision and summary.
 */
@Service
public class ResultAggregator {

    private static final Logger log = LoggerFactory.getLogger(ResultAggregator.class);

    private final GateConfigStore store;

    public ResultAggregator(GateConfigStore store) {
        this.store = store;
    }

    /**
     * Counts one terminal execution against its gate. Skipped and non-terminal
     * executions count nothing. Callers invoke this once per execution.
     */
    public void record(GateExecution execution) {
        GateStatus status = execution.status();
        if (!status.isTerminal() || status == GateStatus.SKIPPED) {
            return;
        }
        store.atomicIncrementCounters(execution.gateId(), status.countsAsPassed(), execution.completedAt());
        log.debug("Counted execution {} ({}) against gate {}", execution.id(), status.value(), execution.gateId());
    }

    /**
     * Blocking iff some execution of a blocking gate ended failed, error or timeout.
     * Warnings and skips never block.
     */
    public BlockingDecision decide(List<GateExecution> executions) {
        var ids = new ArrayList<String>();
        for (GateExecution execution : executions) {
            if (execution.isBlockingFailure()) {
                ids.add(execution.gateId());
            }
        }
        return new BlockingDecision(!ids.isEmpty(), ids);
    }

    public RunSummary summarize(List<GateExecution> executions, BlockingDecision decision) {
        var byStatus = new EnumMap<GateStatus, List<String>>(GateStatus.class);
        var recommendations = new ArrayList<String>();
        int totalIssues = 0;
        boolean degraded = false;
        for (GateExecution execution : executions) {
            byStatus.computeIfAbsent(execution.status(), s -> new ArrayList<>()).add(execution.gateId());
            recommendations.addAll(execution.recommendations());
            totalIssues += execution.issueCounts().total();
            if (execution.status() == GateStatus.WARNING || execution.status().countsAsFailed()) {
                degraded = true;
            }
        }
        GateStatus overall = decision.blocking() ? GateStatus.FAILED
                : degraded ? GateStatus.WARNING
                : GateStatus.PASSED;
        return new RunSummary(overall, byStatus, recommendations, totalIssues);
    }

    public RunResult buildResult(String runId, EvaluationTarget target, List<GateExecution> executions) {
        BlockingDecision decision = decide(executions);
        return new RunResult(runId, target, executions, decision.blocking(), decision.blockingGateIds(),
                summarize(executions, decision));
    }
}
