package com.tollgate.core.history;

import com.tollgate.core.model.GateExecution;

import java.util.List;

/**
 * One page of a project's execution history, newest first.
 */
public record GateHistoryPage(long totalCount, List<GateExecution> executions, int limit, int offset) {

    public GateHistoryPage {
        executions = List.copyOf(executions);
    }

    public boolean hasMore() {
        return offset + executions.size() < totalCount;
    }
}
