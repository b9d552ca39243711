package com.tollgate.core.model;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one {@code GateChecker.evaluate} call.
 *
 * @param passed             whether the gate's pass condition held
 * @param passedWithWarnings passed, but only partially (e.g. lint warnings tolerated)
 * @param issues             findings in artifact order
 * @param metrics            numeric measurements the decision was based on
 * @param recommendations    ordered, human-readable follow-ups
 * @param details            free-form breakdown copied into {@code result_details}
 */
public record GateResult(
    boolean passed,
    boolean passedWithWarnings,
    List<GateIssue> issues,
    Map<String, Object> metrics,
    List<String> recommendations,
    Map<String, Object> details
) {

    public GateResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
        metrics = Snapshots.freeze(metrics);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        details = Snapshots.freeze(details);
    }

    /**
     * Terminal status this result maps to. A warning is only ever a pass.
     */
    public GateStatus terminalStatus() {
        if (!passed) {
            return GateStatus.FAILED;
        }
        return passedWithWarnings ? GateStatus.WARNING : GateStatus.PASSED;
    }
}
