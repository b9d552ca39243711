package com.tollgate.core.persistence;

import com.tollgate.core.model.GateType;

import java.time.Instant;
import java.util.Objects;

/**
 * Filter over the execution history of one project. Results are newest first.
 *
 * @param workspaceId required
 * @param projectId   required
 * @param gateType    optional gate type filter
 * @param since       optional lower bound on {@code createdAt} (inclusive)
 * @param limit       page size; {@code 0} means unbounded
 * @param offset      rows to skip
 */
public record ExecutionQuery(
    String workspaceId,
    String projectId,
    GateType gateType,
    Instant since,
    int limit,
    int offset
) {

    public ExecutionQuery {
        Objects.requireNonNull(workspaceId, "workspaceId must not be null");
        Objects.requireNonNull(projectId, "projectId must not be null");
        if (limit < 0 || offset < 0) {
            throw new IllegalArgumentException("limit and offset must be >= 0");
        }
    }

    public static ExecutionQuery all(String workspaceId, String projectId) {
        return new ExecutionQuery(workspaceId, projectId, null, null, 0, 0);
    }

    public ExecutionQuery withGateType(GateType type) {
        return new ExecutionQuery(workspaceId, projectId, type, since, limit, offset);
    }

    public ExecutionQuery withSince(Instant from) {
        return new ExecutionQuery(workspaceId, projectId, gateType, from, limit, offset);
    }

    public ExecutionQuery page(int newLimit, int newOffset) {
        return new ExecutionQuery(workspaceId, projectId, gateType, since, newLimit, newOffset);
    }
}
