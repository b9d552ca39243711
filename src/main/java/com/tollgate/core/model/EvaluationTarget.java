package com.tollgate.core.model;

import java.util.Objects;

/**
 * The thing a gate run evaluates: exactly one task, task run, or sandbox execution
 * inside a workspace/project.
 *
 * @param workspaceId owning workspace
 * @param projectId   project whose gate configs apply
 * @param kind        which kind of target {@code targetId} refers to
 * @param targetId    identifier of the task, task run, or sandbox execution
 */
public record EvaluationTarget(
    String workspaceId,
    String projectId,
    TargetKind kind,
    String targetId
) {

    public EvaluationTarget {
        Objects.requireNonNull(workspaceId, "workspaceId must not be null");
        Objects.requireNonNull(projectId, "projectId must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (targetId == null || targetId.isBlank()) {
            throw new IllegalArgumentException("targetId must not be blank");
        }
    }

    public static EvaluationTarget forTask(String workspaceId, String projectId, String taskId) {
        return new EvaluationTarget(workspaceId, projectId, TargetKind.TASK, taskId);
    }

    public static EvaluationTarget forTaskRun(String workspaceId, String projectId, String taskRunId) {
        return new EvaluationTarget(workspaceId, projectId, TargetKind.TASK_RUN, taskRunId);
    }

    public static EvaluationTarget forSandboxExecution(String workspaceId, String projectId, String sandboxExecutionId) {
        return new EvaluationTarget(workspaceId, projectId, TargetKind.SANDBOX_EXECUTION, sandboxExecutionId);
    }

    public String taskId() {
        return kind == TargetKind.TASK ? targetId : null;
    }

    public String taskRunId() {
        return kind == TargetKind.TASK_RUN ? targetId : null;
    }

    public String sandboxExecutionId() {
        return kind == TargetKind.SANDBOX_EXECUTION ? targetId : null;
    }

    @Override
    public String toString() {
        return workspaceId + "/" + projectId + "/" + kind.value() + ":" + targetId;
    }
}
