package com.tollgate.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tollgate.core.model.EvaluationTarget;
import com.tollgate.core.model.GateConfig;
import com.tollgate.core.model.GateEnvironmentException;
import com.tollgate.core.model.GateExecution;
import com.tollgate.core.model.GateIssue;
import com.tollgate.core.model.GateStatus;
import com.tollgate.core.model.GateType;
import com.tollgate.core.model.IssueCounts;
import com.tollgate.core.model.Severity;
import com.tollgate.core.model.TargetKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * {@link GateConfigStore} over plain JDBC.
 * <p>
 * Gates live in {@code quality_gates} (unique per workspace, project and gate
 * type); executions in {@code gate_executions}, which references its gate with
 * {@code ON DELETE RESTRICT}. JSON-valued columns are stored as TEXT. Counter
 * increments are a single {@code UPDATE ... SET n = n + 1} statement, so
 * concurrent runs never lose an increment.
 * <p>
 * Tables are created via {@link #createTables()}.
 */
public class JdbcGateConfigStore implements GateConfigStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcGateConfigStore.class);

    private static final String GATES_TABLE = "quality_gates";
    private static final String EXECUTIONS_TABLE = "gate_executions";

    private static final String CREATE_GATES_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id                 VARCHAR(64)  NOT NULL PRIMARY KEY,
                workspace_id       VARCHAR(64)  NOT NULL,
                project_id         VARCHAR(64)  NOT NULL,
                gate_type          VARCHAR(32)  NOT NULL,
                is_enabled         BOOLEAN      NOT NULL,
                is_blocking        BOOLEAN      NOT NULL,
                threshold_config   TEXT         NOT NULL,
                timeout_seconds    INTEGER,
                total_evaluations  BIGINT       NOT NULL DEFAULT 0,
                passed_evaluations BIGINT       NOT NULL DEFAULT 0,
                failed_evaluations BIGINT       NOT NULL DEFAULT 0,
                last_evaluation_at TIMESTAMP,
                last_result        BOOLEAN,
                created_at         TIMESTAMP    DEFAULT CURRENT_TIMESTAMP,
                updated_at         TIMESTAMP    DEFAULT CURRENT_TIMESTAMP,
                CONSTRAINT uq_quality_gates_unique_type UNIQUE (workspace_id, project_id, gate_type)
            )
            """.formatted(GATES_TABLE);

    private static final String CREATE_EXECUTIONS_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id                   VARCHAR(64)  NOT NULL PRIMARY KEY,
                gate_id              VARCHAR(64)  NOT NULL,
                workspace_id         VARCHAR(64)  NOT NULL,
                project_id           VARCHAR(64)  NOT NULL,
                gate_type            VARCHAR(32)  NOT NULL,
                target_kind          VARCHAR(32)  NOT NULL,
                task_id              VARCHAR(64),
                task_run_id          VARCHAR(64),
                sandbox_execution_id VARCHAR(64),
                is_blocking          BOOLEAN      NOT NULL,
                status               VARCHAR(16)  NOT NULL,
                created_at           TIMESTAMP    NOT NULL,
                started_at           TIMESTAMP,
                completed_at         TIMESTAMP,
                duration_ms          BIGINT,
                passed               BOOLEAN,
                passed_with_warnings BOOLEAN      NOT NULL DEFAULT FALSE,
                error_message        TEXT,
                issues_found         INTEGER      NOT NULL DEFAULT 0,
                critical_issues      INTEGER      NOT NULL DEFAULT 0,
                high_issues          INTEGER      NOT NULL DEFAULT 0,
                medium_issues        INTEGER      NOT NULL DEFAULT 0,
                low_issues           INTEGER      NOT NULL DEFAULT 0,
                issues               TEXT,
                metrics              TEXT,
                recommendations      TEXT,
                result_details       TEXT,
                config_used          TEXT         NOT NULL,
                CONSTRAINT fk_gate_executions_gate FOREIGN KEY (gate_id)
                    REFERENCES %s (id) ON DELETE RESTRICT
            )
            """.formatted(EXECUTIONS_TABLE, GATES_TABLE);

    private static final String CREATE_EXECUTIONS_INDEX_SQL = """
            CREATE INDEX IF NOT EXISTS idx_gate_executions_project
            ON %s (workspace_id, project_id, created_at)
            """.formatted(EXECUTIONS_TABLE);

    private static final String GATE_COLUMNS = """
            id, workspace_id, project_id, gate_type, is_enabled, is_blocking, threshold_config,
            timeout_seconds, total_evaluations, passed_evaluations, failed_evaluations,
            last_evaluation_at, last_result""";

    private static final String SELECT_PROJECT_GATES_SQL = """
            SELECT %s FROM %s
            WHERE workspace_id = ? AND project_id = ?
            ORDER BY gate_type
            """.formatted(GATE_COLUMNS, GATES_TABLE);

    private static final String SELECT_GATE_SQL = """
            SELECT %s FROM %s WHERE id = ?
            """.formatted(GATE_COLUMNS, GATES_TABLE);

    private static final String SELECT_ACTIVE_TYPES_SQL = """
            SELECT DISTINCT gate_type FROM %s WHERE is_enabled = TRUE
            """.formatted(GATES_TABLE);

    private static final String INSERT_GATE_SQL = """
            INSERT INTO %s (id, workspace_id, project_id, gate_type, is_enabled, is_blocking,
                            threshold_config, timeout_seconds)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(GATES_TABLE);

    private static final String UPDATE_GATE_SQL = """
            UPDATE %s
            SET workspace_id = ?, project_id = ?, gate_type = ?, is_enabled = ?, is_blocking = ?,
                threshold_config = ?, timeout_seconds = ?, updated_at = CURRENT_TIMESTAMP
            WHERE id = ?
            """.formatted(GATES_TABLE);

    private static final String UPDATE_THRESHOLDS_SQL = """
            UPDATE %s SET threshold_config = ?, updated_at = CURRENT_TIMESTAMP WHERE id = ?
            """.formatted(GATES_TABLE);

    private static final String INCREMENT_COUNTERS_SQL = """
            UPDATE %s
            SET total_evaluations  = total_evaluations + 1,
                passed_evaluations = passed_evaluations + ?,
                failed_evaluations = failed_evaluations + ?,
                last_evaluation_at = ?,
                last_result        = ?,
                updated_at         = CURRENT_TIMESTAMP
            WHERE id = ?
            """.formatted(GATES_TABLE);

    private static final String COUNT_GATE_EXECUTIONS_SQL = """
            SELECT COUNT(*) FROM %s WHERE gate_id = ?
            """.formatted(EXECUTIONS_TABLE);

    private static final String DELETE_GATE_SQL = """
            DELETE FROM %s WHERE id = ?
            """.formatted(GATES_TABLE);

    private static final String EXECUTION_COLUMNS = """
            id, gate_id, workspace_id, project_id, gate_type, target_kind, task_id, task_run_id,
            sandbox_execution_id, is_blocking, status, created_at, started_at, completed_at, duration_ms,
            passed, passed_with_warnings, error_message, issues_found, critical_issues, high_issues,
            medium_issues, low_issues, issues, metrics, recommendations, result_details, config_used""";

    private static final String INSERT_EXECUTION_SQL = """
            INSERT INTO %s (%s)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(EXECUTIONS_TABLE, EXECUTION_COLUMNS);

    private static final String UPDATE_EXECUTION_SQL = """
            UPDATE %s
            SET gate_id = ?, workspace_id = ?, project_id = ?, gate_type = ?, target_kind = ?, task_id = ?,
                task_run_id = ?, sandbox_execution_id = ?, is_blocking = ?, status = ?, created_at = ?,
                started_at = ?, completed_at = ?, duration_ms = ?, passed = ?, passed_with_warnings = ?,
                error_message = ?, issues_found = ?, critical_issues = ?, high_issues = ?, medium_issues = ?,
                low_issues = ?, issues = ?, metrics = ?, recommendations = ?, result_details = ?, config_used = ?
            WHERE id = ?
            """.formatted(EXECUTIONS_TABLE);

    private static final String SELECT_EXECUTION_SQL = """
            SELECT %s FROM %s WHERE id = ?
            """.formatted(EXECUTION_COLUMNS, EXECUTIONS_TABLE);

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcGateConfigStore(DataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper must not be null");
    }

    /**
     * Creates both tables if they do not already exist.
     * Should be called once during application startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_GATES_SQL);
            stmt.execute(CREATE_EXECUTIONS_SQL);
            stmt.execute(CREATE_EXECUTIONS_INDEX_SQL);
            log.info("Gate tables '{}' and '{}' ensured", GATES_TABLE, EXECUTIONS_TABLE);
        }
    }

    // ── Gates ─────────────────────────────────────────────────────────────

    @Override
    public List<GateConfig> getEnabledGates(String workspaceId, String projectId) {
        return getGates(workspaceId, projectId).stream().filter(GateConfig::enabled).toList();
    }

    @Override
    public List<GateConfig> getGates(String workspaceId, String projectId) {
        List<GateConfig> gates = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_PROJECT_GATES_SQL)) {
            stmt.setString(1, workspaceId);
            stmt.setString(2, projectId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    gates.add(gateFromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw unavailable("load gates for " + workspaceId + "/" + projectId, e);
        }
        return gates;
    }

    @Override
    public Optional<GateConfig> findGate(String gateId) {
        try (Connection conn = dataSource.getConnection()) {
            return findGate(conn, gateId);
        } catch (SQLException e) {
            throw unavailable("load gate " + gateId, e);
        }
    }

    @Override
    public Set<GateType> activeGateTypes() {
        var types = EnumSet.noneOf(GateType.class);
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_ACTIVE_TYPES_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                types.add(GateType.fromValue(rs.getString(1)));
            }
        } catch (SQLException e) {
            throw unavailable("load active gate types", e);
        }
        return types;
    }

    @Override
    public void atomicIncrementCounters(String gateId, boolean passed, Instant evaluatedAt) {
        int updated;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INCREMENT_COUNTERS_SQL)) {
            stmt.setInt(1, passed ? 1 : 0);
            stmt.setInt(2, passed ? 0 : 1);
            stmt.setTimestamp(3, Timestamp.from(evaluatedAt));
            stmt.setBoolean(4, passed);
            stmt.setString(5, gateId);
            updated = stmt.executeUpdate();
        } catch (SQLException e) {
            throw unavailable("increment counters of gate " + gateId, e);
        }
        if (updated == 0) {
            throw new IllegalArgumentException("Unknown gate: " + gateId);
        }
        log.debug("Incremented counters of gate {} (passed={})", gateId, passed);
    }

    @Override
    public GateConfig saveGate(GateConfig config) {
        try (Connection conn = dataSource.getConnection()) {
            int updated;
            try (PreparedStatement stmt = conn.prepareStatement(UPDATE_GATE_SQL)) {
                stmt.setString(1, config.workspaceId());
                stmt.setString(2, config.projectId());
                stmt.setString(3, config.gateType().value());
                stmt.setBoolean(4, config.enabled());
                stmt.setBoolean(5, config.blocking());
                stmt.setString(6, toJson(config.thresholdConfig()));
                setNullableInt(stmt, 7, config.timeoutSeconds());
                stmt.setString(8, config.id());
                updated = stmt.executeUpdate();
            }
            if (updated == 0) {
                try (PreparedStatement stmt = conn.prepareStatement(INSERT_GATE_SQL)) {
                    stmt.setString(1, config.id());
                    stmt.setString(2, config.workspaceId());
                    stmt.setString(3, config.projectId());
                    stmt.setString(4, config.gateType().value());
                    stmt.setBoolean(5, config.enabled());
                    stmt.setBoolean(6, config.blocking());
                    stmt.setString(7, toJson(config.thresholdConfig()));
                    setNullableInt(stmt, 8, config.timeoutSeconds());
                    stmt.executeUpdate();
                }
            }
            log.debug("Saved gate {} ({} for {}/{})", config.id(), config.gateType().value(),
                    config.workspaceId(), config.projectId());
            return findGate(conn, config.id()).orElseThrow();
        } catch (SQLException e) {
            if (isConstraintViolation(e)) {
                throw new IllegalStateException("Another gate already configures " + config.gateType().value()
                        + " for " + config.workspaceId() + "/" + config.projectId(), e);
            }
            throw unavailable("save gate " + config.id(), e);
        }
    }

    @Override
    public GateConfig updateThresholdConfig(String gateId, Map<String, ?> thresholdConfig) {
        try (Connection conn = dataSource.getConnection()) {
            try (PreparedStatement stmt = conn.prepareStatement(UPDATE_THRESHOLDS_SQL)) {
                stmt.setString(1, toJson(thresholdConfig));
                stmt.setString(2, gateId);
                if (stmt.executeUpdate() == 0) {
                    throw new IllegalArgumentException("Unknown gate: " + gateId);
                }
            }
            return findGate(conn, gateId).orElseThrow();
        } catch (SQLException e) {
            throw unavailable("update thresholds of gate " + gateId, e);
        }
    }

    @Override
    public void deleteGate(String gateId) {
        try (Connection conn = dataSource.getConnection()) {
            try (PreparedStatement stmt = conn.prepareStatement(COUNT_GATE_EXECUTIONS_SQL)) {
                stmt.setString(1, gateId);
                try (ResultSet rs = stmt.executeQuery()) {
                    rs.next();
                    if (rs.getLong(1) > 0) {
                        throw new IllegalStateException("Gate " + gateId + " is still referenced by executions");
                    }
                }
            }
            try (PreparedStatement stmt = conn.prepareStatement(DELETE_GATE_SQL)) {
                stmt.setString(1, gateId);
                stmt.executeUpdate();
            }
        } catch (SQLException e) {
            if (isConstraintViolation(e)) {
                throw new IllegalStateException("Gate " + gateId + " is still referenced by executions", e);
            }
            throw unavailable("delete gate " + gateId, e);
        }
    }

    // ── Executions ────────────────────────────────────────────────────────

    @Override
    public void saveExecution(GateExecution execution) {
        try (Connection conn = dataSource.getConnection()) {
            int updated;
            try (PreparedStatement stmt = conn.prepareStatement(UPDATE_EXECUTION_SQL)) {
                int next = bindExecution(stmt, execution, 1, false);
                stmt.setString(next, execution.id());
                updated = stmt.executeUpdate();
            }
            if (updated == 0) {
                try (PreparedStatement stmt = conn.prepareStatement(INSERT_EXECUTION_SQL)) {
                    bindExecution(stmt, execution, 1, true);
                    stmt.executeUpdate();
                }
            }
            log.debug("Saved execution {} [{}]", execution.id(), execution.status().value());
        } catch (SQLException e) {
            if (isConstraintViolation(e)) {
                throw new IllegalArgumentException("Execution " + execution.id()
                        + " references unknown gate " + execution.gateId(), e);
            }
            throw unavailable("save execution " + execution.id(), e);
        }
    }

    @Override
    public Optional<GateExecution> findExecution(String executionId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_EXECUTION_SQL)) {
            stmt.setString(1, executionId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(executionFromResultSet(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw unavailable("load execution " + executionId, e);
        }
    }

    @Override
    public List<GateExecution> findExecutions(ExecutionQuery query) {
        var sql = new StringBuilder("SELECT ").append(EXECUTION_COLUMNS).append(" FROM ").append(EXECUTIONS_TABLE);
        appendWhere(sql, query);
        sql.append(" ORDER BY created_at DESC, id DESC");
        if (query.limit() > 0) {
            sql.append(" LIMIT ").append(query.limit());
        }
        if (query.offset() > 0) {
            sql.append(" OFFSET ").append(query.offset());
        }

        List<GateExecution> executions = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
            bindWhere(stmt, query);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    executions.add(executionFromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw unavailable("query executions of " + query.workspaceId() + "/" + query.projectId(), e);
        }
        return executions;
    }

    @Override
    public long countExecutions(ExecutionQuery query) {
        var sql = new StringBuilder("SELECT COUNT(*) FROM ").append(EXECUTIONS_TABLE);
        appendWhere(sql, query);
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
            bindWhere(stmt, query);
            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                return rs.getLong(1);
            }
        } catch (SQLException e) {
            throw unavailable("count executions of " + query.workspaceId() + "/" + query.projectId(), e);
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private Optional<GateConfig> findGate(Connection conn, String gateId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_GATE_SQL)) {
            stmt.setString(1, gateId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(gateFromResultSet(rs)) : Optional.empty();
            }
        }
    }

    private static void appendWhere(StringBuilder sql, ExecutionQuery query) {
        sql.append(" WHERE workspace_id = ? AND project_id = ?");
        if (query.gateType() != null) {
            sql.append(" AND gate_type = ?");
        }
        if (query.since() != null) {
            sql.append(" AND created_at >= ?");
        }
    }

    private static void bindWhere(PreparedStatement stmt, ExecutionQuery query) throws SQLException {
        int i = 1;
        stmt.setString(i++, query.workspaceId());
        stmt.setString(i++, query.projectId());
        if (query.gateType() != null) {
            stmt.setString(i++, query.gateType().value());
        }
        if (query.since() != null) {
            stmt.setTimestamp(i, Timestamp.from(query.since()));
        }
    }

    /**
     * Binds all columns except the id (or including it first, for inserts).
     * Returns the next parameter index.
     */
    private int bindExecution(PreparedStatement stmt, GateExecution e, int start, boolean withId) throws SQLException {
        int i = start;
        if (withId) {
            stmt.setString(i++, e.id());
        }
        EvaluationTarget target = e.target();
        IssueCounts counts = e.issueCounts();
        stmt.setString(i++, e.gateId());
        stmt.setString(i++, target.workspaceId());
        stmt.setString(i++, target.projectId());
        stmt.setString(i++, e.gateType().value());
        stmt.setString(i++, target.kind().value());
        stmt.setString(i++, target.taskId());
        stmt.setString(i++, target.taskRunId());
        stmt.setString(i++, target.sandboxExecutionId());
        stmt.setBoolean(i++, e.blocking());
        stmt.setString(i++, e.status().value());
        stmt.setTimestamp(i++, Timestamp.from(e.createdAt()));
        setNullableTimestamp(stmt, i++, e.startedAt());
        setNullableTimestamp(stmt, i++, e.completedAt());
        if (e.durationMs() == null) {
            stmt.setNull(i++, Types.BIGINT);
        } else {
            stmt.setLong(i++, e.durationMs());
        }
        if (e.passed() == null) {
            stmt.setNull(i++, Types.BOOLEAN);
        } else {
            stmt.setBoolean(i++, e.passed());
        }
        stmt.setBoolean(i++, e.passedWithWarnings());
        stmt.setString(i++, e.errorMessage());
        stmt.setInt(i++, counts.total());
        stmt.setInt(i++, counts.critical());
        stmt.setInt(i++, counts.high());
        stmt.setInt(i++, counts.medium());
        stmt.setInt(i++, counts.low());
        stmt.setString(i++, toJson(issuesToJson(e.issues())));
        stmt.setString(i++, toJson(e.metrics()));
        stmt.setString(i++, toJson(e.recommendations()));
        stmt.setString(i++, toJson(e.resultDetails()));
        stmt.setString(i++, toJson(e.configUsed()));
        return i;
    }

    private GateConfig gateFromResultSet(ResultSet rs) throws SQLException {
        int timeout = rs.getInt("timeout_seconds");
        Integer timeoutSeconds = rs.wasNull() ? null : timeout;
        boolean lastResult = rs.getBoolean("last_result");
        Boolean lastResultOrNull = rs.wasNull() ? null : lastResult;
        return new GateConfig(
                rs.getString("id"),
                rs.getString("workspace_id"),
                rs.getString("project_id"),
                GateType.fromValue(rs.getString("gate_type")),
                rs.getBoolean("is_enabled"),
                rs.getBoolean("is_blocking"),
                mapFromJson(rs.getString("threshold_config")),
                timeoutSeconds,
                rs.getLong("total_evaluations"),
                rs.getLong("passed_evaluations"),
                rs.getLong("failed_evaluations"),
                instant(rs.getTimestamp("last_evaluation_at")),
                lastResultOrNull);
    }

    private GateExecution executionFromResultSet(ResultSet rs) throws SQLException {
        TargetKind kind = targetKind(rs.getString("target_kind"));
        String targetId = switch (kind) {
            case TASK -> rs.getString("task_id");
            case TASK_RUN -> rs.getString("task_run_id");
            case SANDBOX_EXECUTION -> rs.getString("sandbox_execution_id");
        };
        var target = new EvaluationTarget(rs.getString("workspace_id"), rs.getString("project_id"), kind, targetId);

        long duration = rs.getLong("duration_ms");
        Long durationMs = rs.wasNull() ? null : duration;
        boolean passed = rs.getBoolean("passed");
        Boolean passedOrNull = rs.wasNull() ? null : passed;

        return new GateExecution(
                rs.getString("id"),
                rs.getString("gate_id"),
                GateType.fromValue(rs.getString("gate_type")),
                target,
                rs.getBoolean("is_blocking"),
                GateStatus.valueOf(rs.getString("status").toUpperCase()),
                instant(rs.getTimestamp("created_at")),
                instant(rs.getTimestamp("started_at")),
                instant(rs.getTimestamp("completed_at")),
                durationMs,
                passedOrNull,
                rs.getBoolean("passed_with_warnings"),
                new IssueCounts(rs.getInt("critical_issues"), rs.getInt("high_issues"),
                        rs.getInt("medium_issues"), rs.getInt("low_issues")),
                issuesFromJson(rs.getString("issues")),
                mapFromJson(rs.getString("metrics")),
                fromJson(rs.getString("recommendations"), new TypeReference<List<String>>() {}),
                mapFromJson(rs.getString("result_details")),
                mapFromJson(rs.getString("config_used")),
                rs.getString("error_message"));
    }

    private static TargetKind targetKind(String value) {
        for (TargetKind kind : TargetKind.values()) {
            if (kind.value().equals(value)) {
                return kind;
            }
        }
        throw new IllegalStateException("Unknown target kind in gate_executions: " + value);
    }

    private static List<Map<String, Object>> issuesToJson(List<GateIssue> issues) {
        var rows = new ArrayList<Map<String, Object>>(issues.size());
        for (GateIssue issue : issues) {
            var row = new LinkedHashMap<String, Object>();
            row.put("severity", issue.severity().value());
            row.put("message", issue.message());
            row.put("location", issue.location());
            rows.add(row);
        }
        return rows;
    }

    private List<GateIssue> issuesFromJson(String json) {
        var rows = fromJson(json, new TypeReference<List<Map<String, Object>>>() {});
        if (rows == null) {
            return List.of();
        }
        var issues = new ArrayList<GateIssue>(rows.size());
        for (Map<String, Object> row : rows) {
            issues.add(new GateIssue(
                    Severity.valueOf(row.get("severity").toString().toUpperCase()),
                    row.get("message").toString(),
                    row.get("location") == null ? null : row.get("location").toString()));
        }
        return issues;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize gate data", e);
        }
    }

    private Map<String, Object> mapFromJson(String json) {
        return fromJson(json, new TypeReference<LinkedHashMap<String, Object>>() {});
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to deserialize gate data", e);
        }
    }

    private static void setNullableInt(PreparedStatement stmt, int index, Integer value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.INTEGER);
        } else {
            stmt.setInt(index, value);
        }
    }

    private static void setNullableTimestamp(PreparedStatement stmt, int index, Instant value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.TIMESTAMP);
        } else {
            stmt.setTimestamp(index, Timestamp.from(value));
        }
    }

    private static Instant instant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }

    private static boolean isConstraintViolation(SQLException e) {
        return e.getSQLState() != null && e.getSQLState().startsWith("23");
    }

    private static GateEnvironmentException unavailable(String action, SQLException e) {
        log.error("Failed to {}", action, e);
        return new GateEnvironmentException("Gate store unavailable: failed to " + action, e);
    }
}
