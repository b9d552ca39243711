package com.tollgate.core.health;

import com.tollgate.core.model.GateType;
import com.tollgate.core.persistence.GateConfigStore;
import com.tollgate.core.persistence.InMemoryGateConfigStore;
import com.tollgate.core.registry.GateRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reports whether the engine can evaluate gates: every gate type has a checker,
 * and the gate store is reachable.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private static final int CONNECTION_VALID_TIMEOUT_SECONDS = 5;

    private final GateRegistry registry;
    private final GateConfigStore store;
    private final DataSource dataSource;

    /**
     * @param registry   checker registry whose coverage of {@link GateType} is reported
     * @param store      active gate store
     * @param dataSource backing database of a JDBC store; null when none is configured
     */
    public HealthCheckService(GateRegistry registry,
                              GateConfigStore store,
                              @Autowired(required = false) DataSource dataSource) {
        this.registry = registry;
        this.store = store;
        this.dataSource = dataSource;
    }

    /**
     * Checks every component once, in a fixed order: {@code registry}, then {@code store}.
     * A failing check is reported as a status, never thrown.
     *
     * @return one status per component
     */
    public List<HealthStatus> checkAll() {
        return List.of(checkRegistry(), checkStore());
    }

    /** UP when every gate type has a checker, DEGRADED naming the uncovered types otherwise. */
    private HealthStatus checkRegistry() {
        var registered = registry.registeredTypes();
        var uncovered = EnumSet.allOf(GateType.class);
        uncovered.removeAll(registered);
        Map<String, String> metadata = Map.of(
                "sealed", Boolean.toString(registry.isSealed()),
                "checkers", Integer.toString(registered.size()));
        if (uncovered.isEmpty()) {
            return HealthStatus.up("registry", "All gate types have a checker", metadata);
        }
        return HealthStatus.degraded("registry", "No checker for: "
                + uncovered.stream().map(GateType::value).collect(Collectors.joining(", ")), metadata);
    }

    /** The in-memory store is always UP; a JDBC store is UP while its connection validates. */
    private HealthStatus checkStore() {
        if (store instanceof InMemoryGateConfigStore) {
            return HealthStatus.up("store", "In-memory gate store (not durable)", Map.of("type", "memory"));
        }
        Map<String, String> jdbc = Map.of("type", "jdbc");
        if (dataSource == null) {
            return HealthStatus.down("store", "No DataSource configured", jdbc);
        }
        try (Connection conn = dataSource.getConnection()) {
            return conn.isValid(CONNECTION_VALID_TIMEOUT_SECONDS)
                    ? HealthStatus.up("store", "Database connection valid", jdbc)
                    : HealthStatus.down("store", "Database connection invalid", jdbc);
        } catch (SQLException e) {
            log.warn("Gate store health check failed: {}", e.getMessage());
            return HealthStatus.down("store", "Database error: " + e.getMessage(), jdbc);
        }
    }
}
