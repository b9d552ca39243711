package com.tollgate.core.history;

import com.tollgate.core.model.GateExecution;
import com.tollgate.core.model.GateStatus;
import com.tollgate.core.model.GateType;
import com.tollgate.core.persistence.ExecutionQuery;
import com.tollgate.core.persistence.GateConfigStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.TemporalAdjusters;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read-only views over the append-only execution history: paged listings and
 * period statistics for trend reporting.
 */
@Service
public class GateHistoryService {

    static final int MAX_PAGE_SIZE = 500;

    private final GateConfigStore store;
    private final Clock clock;

    @Autowired
    public GateHistoryService(GateConfigStore store) {
        this(store, Clock.systemUTC());
    }

    GateHistoryService(GateConfigStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * @param gateType optional filter; {@code null} for all gate types
     * @param limit    page size in {@code [1, 500]}
     */
    public GateHistoryPage history(String workspaceId, String projectId, GateType gateType, int limit, int offset) {
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("limit must be within [1, " + MAX_PAGE_SIZE + "]: " + limit);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0: " + offset);
        }
        var query = ExecutionQuery.all(workspaceId, projectId).withGateType(gateType);
        long total = store.countExecutions(query);
        List<GateExecution> page = store.findExecutions(query.page(limit, offset));
        return new GateHistoryPage(total, page, limit, offset);
    }

    public GateStatistics statistics(String workspaceId, String projectId, int days) {
        if (days < 1) {
            throw new IllegalArgumentException("days must be >= 1: " + days);
        }
        var since = clock.instant().minus(Duration.ofDays(days));
        List<GateExecution> executions = store.findExecutions(ExecutionQuery.all(workspaceId, projectId).withSince(since));

        Map<GateType, long[]> perType = new EnumMap<>(GateType.class);
        Map<GateStatus, Long> byStatus = new EnumMap<>(GateStatus.class);
        Map<LocalDate, long[]> perWeek = new TreeMap<>();
        long passedCount = 0;
        long totalIssues = 0;
        long durationSum = 0;
        long durationCount = 0;

        for (GateExecution e : executions) {
            long[] type = perType.computeIfAbsent(e.gateType(), t -> new long[4]);
            type[0]++;
            switch (e.status()) {
                case PASSED -> type[1]++;
                case WARNING -> type[3]++;
                case FAILED, ERROR, TIMEOUT -> type[2]++;
                default -> {
                    // skipped and in-flight executions only count toward the total
                }
            }
            byStatus.merge(e.status(), 1L, Long::sum);

            boolean passed = Boolean.TRUE.equals(e.passed());
            if (passed) {
                passedCount++;
            }
            totalIssues += e.issueCounts().total();
            if (e.durationMs() != null) {
                durationSum += e.durationMs();
                durationCount++;
            }

            LocalDate weekStart = e.createdAt().atZone(ZoneOffset.UTC).toLocalDate()
                    .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            long[] week = perWeek.computeIfAbsent(weekStart, w -> new long[2]);
            week[0]++;
            if (passed) {
                week[1]++;
            }
        }

        Map<GateType, GateStatistics.TypeStats> byGateType = new EnumMap<>(GateType.class);
        perType.forEach((type, c) -> byGateType.put(type, new GateStatistics.TypeStats(c[0], c[1], c[2], c[3])));
        Map<LocalDate, GateStatistics.WeekStats> trend = new TreeMap<>();
        perWeek.forEach((week, c) -> trend.put(week, new GateStatistics.WeekStats(c[0], c[1])));

        int total = executions.size();
        return new GateStatistics(
                days,
                total,
                byGateType,
                byStatus,
                total == 0 ? 0.0 : passedCount * 100.0 / total,
                durationCount == 0 ? 0.0 : (double) durationSum / durationCount,
                totalIssues,
                trend);
    }
}
