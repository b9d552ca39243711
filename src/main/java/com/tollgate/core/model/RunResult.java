package com.tollgate.core.model;

import java.util.List;
import java.util.Optional;

/**
 * Everything a caller learns from one gate run.
 *
 * @param runId           identifier of the run
 * @param target          what was evaluated
 * @param executions      every considered gate, each in a terminal status
 * @param blocking        true iff a blocking gate ended failed, error or timeout
 * @param blockingGateIds exactly the gate ids responsible for {@code blocking}
 * @param summary         status roll-up and aggregated recommendations
 */
public record RunResult(
    String runId,
    EvaluationTarget target,
    List<GateExecution> executions,
    boolean blocking,
    List<String> blockingGateIds,
    RunSummary summary
) {

    public RunResult {
        executions = List.copyOf(executions);
        blockingGateIds = List.copyOf(blockingGateIds);
    }

    public Optional<GateExecution> execution(GateType gateType) {
        return executions.stream().filter(e -> e.gateType() == gateType).findFirst();
    }

    public Optional<GateExecution> executionForGate(String gateId) {
        return executions.stream().filter(e -> e.gateId().equals(gateId)).findFirst();
    }
}
