package com.tollgate.core.logging;

import com.tollgate.core.model.EvaluationTarget;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    private final EvaluationTarget target = EvaluationTarget.forSandboxExecution("ws", "proj", "sbx-1");

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("gate context carries run and gate keys")
    void gateKeys() {
        MdcContext.setGate("run-1", target, "lint", "exec-1");

        assertEquals("run-1", MDC.get("runId"));
        assertEquals("ws", MDC.get("workspaceId"));
        assertEquals("proj", MDC.get("projectId"));
        assertEquals("lint", MDC.get("gateType"));
        assertEquals("exec-1", MDC.get("executionId"));
    }

    @Test
    @DisplayName("clear removes only gate-run keys")
    void clearKeepsOthers() {
        MDC.put("requestId", "r-9");
        MdcContext.setGate("run-1", target, "lint", "exec-1");

        MdcContext.clear();

        assertNull(MDC.get("runId"));
        assertNull(MDC.get("gateType"));
        assertEquals("r-9", MDC.get("requestId"));
    }
}
