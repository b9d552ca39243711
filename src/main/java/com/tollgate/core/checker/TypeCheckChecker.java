package com.tollgate.core.checker;

import com.tollgate.core.artifact.ArtifactFormatException;
import com.tollgate.core.artifact.ExecutionArtifact;
import com.tollgate.core.model.GateIssue;
import com.tollgate.core.model.GateResult;
import com.tollgate.core.model.GateType;
import com.tollgate.core.model.Severity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Type-checker diagnostics against {@code strict_mode}. Errors always fail;
 * implicit {@code any} fails only in strict mode.
 */
public class TypeCheckChecker implements GateChecker {

    @Override
    public GateType gateType() {
        return GateType.TYPE_CHECK;
    }

    @Override
    public GateResult evaluate(ExecutionArtifact artifact, ThresholdConfig thresholds) {
        boolean strictMode = thresholds.requireBoolean("strict_mode");

        var issues = new ArrayList<GateIssue>();
        int errors = 0;
        int implicitAny = 0;
        int warnings = 0;
        var diagnostics = artifact.objectList("diagnostics");
        for (int i = 0; i < diagnostics.size(); i++) {
            var diagnostic = diagnostics.get(i);
            String path = "diagnostics[" + i + "]";
            String kind = ExecutionArtifact.string(diagnostic, "kind", path);
            String message = ExecutionArtifact.string(diagnostic, "message", path);
            String location = ExecutionArtifact.location(diagnostic);
            switch (kind) {
                case "error" -> {
                    errors++;
                    issues.add(new GateIssue(Severity.CRITICAL, message, location));
                }
                case "implicit_any" -> {
                    implicitAny++;
                    issues.add(new GateIssue(strictMode ? Severity.HIGH : Severity.MEDIUM, message, location));
                }
                case "warning" -> {
                    warnings++;
                    issues.add(new GateIssue(Severity.LOW, message, location));
                }
                default -> throw new ArtifactFormatException(
                        "Evidence field '" + path + ".kind' has unknown value '" + kind + "'");
            }
        }

        boolean passed = errors == 0 && (!strictMode || implicitAny == 0);

        var recommendations = new ArrayList<String>();
        if (errors > 0) {
            recommendations.add(Recommendations.of(Severity.CRITICAL, "Type Safety",
                    "Fix " + errors + " type errors"));
        }
        if (implicitAny > 0) {
            recommendations.add(Recommendations.of(strictMode ? Severity.HIGH : Severity.MEDIUM, "Type Safety",
                    "Add explicit types for " + implicitAny + " implicit 'any' usages"));
        }

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("errors", errors);
        metrics.put("implicit_any", implicitAny);
        metrics.put("warnings", warnings);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("strict_mode", strictMode);

        return new GateResult(passed, passed && (implicitAny + warnings) > 0, issues, metrics, recommendations, details);
    }
}
