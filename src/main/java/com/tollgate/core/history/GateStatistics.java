package com.tollgate.core.history;

import com.tollgate.core.model.GateStatus;
import com.tollgate.core.model.GateType;

import java.time.LocalDate;
import java.util.Map;

/**
 * Aggregates over a project's executions in the last {@code periodDays} days.
 *
 * @param periodDays        length of the window
 * @param totalExecutions   executions created in the window
 * @param byGateType        outcome tallies per gate type
 * @param byStatus          executions per status
 * @param successRate       percentage of executions with {@code passed == true}
 * @param averageDurationMs mean duration over executions that have one
 * @param totalIssues       issues across all executions
 * @param weeklyTrend       totals keyed by the Monday (UTC) starting each week
 */
public record GateStatistics(
    int periodDays,
    long totalExecutions,
    Map<GateType, TypeStats> byGateType,
    Map<GateStatus, Long> byStatus,
    double successRate,
    double averageDurationMs,
    long totalIssues,
    Map<LocalDate, WeekStats> weeklyTrend
) {

    public record TypeStats(long total, long passed, long failed, long warnings) {}

    public record WeekStats(long total, long passed) {}
}
