package com.tollgate.core.checker;

import com.tollgate.core.artifact.ArtifactFormatException;
import com.tollgate.core.artifact.ExecutionArtifact;
import com.tollgate.core.model.GateIssue;
import com.tollgate.core.model.GateResult;
import com.tollgate.core.model.GateType;
import com.tollgate.core.model.IssueCounts;
import com.tollgate.core.model.Severity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dependency vulnerabilities against {@code critical_only}.
 * <p>
 * Any critical vulnerability fails the gate; with {@code critical_only == false}
 * any vulnerability at all does. Dev-only dependencies are left out unless
 * {@code allow_dev_dependencies} is explicitly {@code false}.
 */
public class SecurityChecker implements GateChecker {

    @Override
    public GateType gateType() {
        return GateType.SECURITY;
    }

    @Override
    public GateResult evaluate(ExecutionArtifact artifact, ThresholdConfig thresholds) {
        boolean criticalOnly = thresholds.requireBoolean("critical_only");
        Boolean allowDev = thresholds.optionalBoolean("allow_dev_dependencies");
        boolean includeDev = Boolean.FALSE.equals(allowDev);

        var issues = new ArrayList<GateIssue>();
        int excludedDev = 0;
        var vulnerabilities = artifact.objectList("vulnerabilities");
        for (int i = 0; i < vulnerabilities.size(); i++) {
            var vuln = vulnerabilities.get(i);
            String path = "vulnerabilities[" + i + "]";
            String id = ExecutionArtifact.string(vuln, "id", path);
            String pkg = ExecutionArtifact.string(vuln, "package", path);
            Severity severity = severity(ExecutionArtifact.string(vuln, "severity", path), path);
            if (ExecutionArtifact.flag(vuln, "dev_dependency") && !includeDev) {
                excludedDev++;
                continue;
            }
            String version = ExecutionArtifact.optionalString(vuln, "version");
            String title = ExecutionArtifact.optionalString(vuln, "title");
            String message = id + " in " + pkg + (title == null ? "" : ": " + title);
            issues.add(new GateIssue(severity, message, version == null ? pkg : pkg + "@" + version));
        }

        IssueCounts counts = IssueCounts.of(issues);
        boolean passed = counts.critical() == 0 && (criticalOnly || counts.total() == 0);

        var recommendations = new ArrayList<String>();
        if (counts.critical() > 0) {
            recommendations.add(Recommendations.of(Severity.CRITICAL, "Security",
                    "Upgrade or replace packages with " + counts.critical() + " critical vulnerabilities before release"));
        }
        if (counts.high() > 0) {
            recommendations.add(Recommendations.of(Severity.HIGH, "Security",
                    "Review " + counts.high() + " high-severity vulnerabilities"));
        }
        if (counts.medium() + counts.low() > 0) {
            recommendations.add(Recommendations.of(Severity.LOW, "Security",
                    "Schedule updates for " + (counts.medium() + counts.low()) + " lower-severity vulnerabilities"));
        }

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("critical", counts.critical());
        metrics.put("high", counts.high());
        metrics.put("medium", counts.medium());
        metrics.put("low", counts.low());
        metrics.put("total", counts.total());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("critical_only", criticalOnly);
        details.put("dev_dependencies_excluded", excludedDev);

        return new GateResult(passed, passed && counts.total() > 0, issues, metrics, recommendations, details);
    }

    private static Severity severity(String raw, String path) {
        return switch (raw.toLowerCase()) {
            case "critical" -> Severity.CRITICAL;
            case "high" -> Severity.HIGH;
            case "medium", "moderate" -> Severity.MEDIUM;
            case "low", "info" -> Severity.LOW;
            default -> throw new ArtifactFormatException("Evidence field '" + path + ".severity' has unknown value '" + raw + "'");
        };
    }
}
