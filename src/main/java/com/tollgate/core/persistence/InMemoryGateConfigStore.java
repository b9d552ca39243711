package com.tollgate.core.persistence;

import com.tollgate.core.model.GateConfig;
import com.tollgate.core.model.GateExecution;
import com.tollgate.core.model.GateType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Non-durable {@link GateConfigStore} used when no {@code DataSource} is configured.
 * State is lost on restart.
 * <p>
 * Counter increments go through {@link ConcurrentHashMap#computeIfPresent}, which
 * runs atomically per gate id.
 */
public class InMemoryGateConfigStore implements GateConfigStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryGateConfigStore.class);

    private static final Comparator<GateExecution> NEWEST_FIRST =
            Comparator.comparing(GateExecution::createdAt).thenComparing(GateExecution::id).reversed();

    private final ConcurrentHashMap<String, GateConfig> gates = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, GateExecution> executions = new ConcurrentHashMap<>();
    private final Object referenceLock = new Object();

    @Override
    public List<GateConfig> getEnabledGates(String workspaceId, String projectId) {
        return projectGates(workspaceId, projectId).filter(GateConfig::enabled).toList();
    }

    @Override
    public List<GateConfig> getGates(String workspaceId, String projectId) {
        return projectGates(workspaceId, projectId).toList();
    }

    @Override
    public Optional<GateConfig> findGate(String gateId) {
        return Optional.ofNullable(gates.get(gateId));
    }

    @Override
    public void saveExecution(GateExecution execution) {
        synchronized (referenceLock) {
            if (!gates.containsKey(execution.gateId())) {
                throw new IllegalArgumentException("Execution " + execution.id() + " references unknown gate " + execution.gateId());
            }
            executions.put(execution.id(), execution);
        }
        log.debug("Saved execution {} [{}]", execution.id(), execution.status().value());
    }

    @Override
    public void atomicIncrementCounters(String gateId, boolean passed, Instant evaluatedAt) {
        GateConfig updated = gates.computeIfPresent(gateId, (id, gate) -> gate.withEvaluation(passed, evaluatedAt));
        if (updated == null) {
            throw new IllegalArgumentException("Unknown gate: " + gateId);
        }
    }

    @Override
    public Optional<GateExecution> findExecution(String executionId) {
        return Optional.ofNullable(executions.get(executionId));
    }

    @Override
    public List<GateExecution> findExecutions(ExecutionQuery query) {
        Stream<GateExecution> matches = matching(query).sorted(NEWEST_FIRST).skip(query.offset());
        if (query.limit() > 0) {
            matches = matches.limit(query.limit());
        }
        return matches.toList();
    }

    @Override
    public long countExecutions(ExecutionQuery query) {
        return matching(query).count();
    }

    @Override
    public Set<GateType> activeGateTypes() {
        var types = EnumSet.noneOf(GateType.class);
        gates.values().stream().filter(GateConfig::enabled).forEach(g -> types.add(g.gateType()));
        return types;
    }

    @Override
    public GateConfig saveGate(GateConfig config) {
        synchronized (referenceLock) {
            gates.values().stream()
                    .filter(g -> !g.id().equals(config.id()))
                    .filter(g -> sameSlot(g, config))
                    .findFirst()
                    .ifPresent(g -> {
                        throw new IllegalStateException("Gate " + g.id() + " already configures "
                                + config.gateType().value() + " for " + config.workspaceId() + "/" + config.projectId());
                    });
            GateConfig saved = gates.compute(config.id(), (id, existing) -> existing == null
                    ? withZeroCounters(config)
                    : new GateConfig(id, config.workspaceId(), config.projectId(), config.gateType(),
                            config.enabled(), config.blocking(), config.thresholdConfig(), config.timeoutSeconds(),
                            existing.totalEvaluations(), existing.passedEvaluations(), existing.failedEvaluations(),
                            existing.lastEvaluationAt(), existing.lastResult()));
            log.debug("Saved gate {} ({} for {}/{})", saved.id(), saved.gateType().value(),
                    saved.workspaceId(), saved.projectId());
            return saved;
        }
    }

    @Override
    public GateConfig updateThresholdConfig(String gateId, Map<String, ?> thresholdConfig) {
        GateConfig updated = gates.computeIfPresent(gateId, (id, gate) -> gate.withThresholdConfig(thresholdConfig));
        if (updated == null) {
            throw new IllegalArgumentException("Unknown gate: " + gateId);
        }
        return updated;
    }

    @Override
    public void deleteGate(String gateId) {
        synchronized (referenceLock) {
            boolean referenced = executions.values().stream().anyMatch(e -> e.gateId().equals(gateId));
            if (referenced) {
                throw new IllegalStateException("Gate " + gateId + " is still referenced by executions");
            }
            gates.remove(gateId);
        }
    }

    private Stream<GateConfig> projectGates(String workspaceId, String projectId) {
        return gates.values().stream()
                .filter(g -> g.workspaceId().equals(workspaceId) && g.projectId().equals(projectId))
                .sorted(Comparator.comparing(g -> g.gateType().value()));
    }

    private Stream<GateExecution> matching(ExecutionQuery query) {
        return executions.values().stream()
                .filter(e -> e.target().workspaceId().equals(query.workspaceId()))
                .filter(e -> e.target().projectId().equals(query.projectId()))
                .filter(e -> query.gateType() == null || e.gateType() == query.gateType())
                .filter(e -> query.since() == null || !e.createdAt().isBefore(query.since()));
    }

    private static boolean sameSlot(GateConfig a, GateConfig b) {
        return a.workspaceId().equals(b.workspaceId())
                && a.projectId().equals(b.projectId())
                && a.gateType() == b.gateType();
    }

    private static GateConfig withZeroCounters(GateConfig config) {
        return new GateConfig(config.id(), config.workspaceId(), config.projectId(), config.gateType(),
                config.enabled(), config.blocking(), config.thresholdConfig(), config.timeoutSeconds(),
                0, 0, 0, null, null);
    }
}
