package com.tollgate.core.aggregate;

import java.util.List;

/**
 * Whether a run blocks the release, and exactly which gates caused it.
 */
public record BlockingDecision(boolean blocking, List<String> blockingGateIds) {

    public BlockingDecision {
        blockingGateIds = List.copyOf(blockingGateIds);
    }
}
