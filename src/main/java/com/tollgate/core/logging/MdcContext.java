package com.tollgate.core.logging;

import com.tollgate.core.model.EvaluationTarget;
import org.slf4j.MDC;

/**
 * Utility for managing gate-run MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId, EvaluationTarget target) {
        MDC.put("runId", runId);
        MDC.put("workspaceId", target.workspaceId());
        MDC.put("projectId", target.projectId());
    }

    public static void setGate(String runId, EvaluationTarget target, String gateType, String executionId) {
        setRun(runId, target);
        MDC.put("gateType", gateType);
        MDC.put("executionId", executionId);
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("workspaceId");
        MDC.remove("projectId");
        MDC.remove("gateType");
        MDC.remove("executionId");
    }
}
