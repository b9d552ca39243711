package com.tollgate.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Roll-up of one run: which gates ended in which status, the overall verdict,
 * and every gate's recommendations.
 *
 * @param overallStatus     {@code FAILED}, {@code WARNING} or {@code PASSED}
 * @param gateIdsByStatus   gate ids per terminal status, in execution order
 * @param recommendations   all recommendations, in execution order
 * @param totalIssues       issues across all executions
 */
public record RunSummary(
    GateStatus overallStatus,
    Map<GateStatus, List<String>> gateIdsByStatus,
    List<String> recommendations,
    int totalIssues
) {

    public RunSummary {
        var copy = new EnumMap<GateStatus, List<String>>(GateStatus.class);
        gateIdsByStatus.forEach((status, ids) -> copy.put(status, List.copyOf(ids)));
        gateIdsByStatus = Collections.unmodifiableMap(copy);
        recommendations = List.copyOf(recommendations);
    }

    public List<String> gateIds(GateStatus status) {
        return gateIdsByStatus.getOrDefault(status, List.of());
    }
}
