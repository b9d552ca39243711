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
import java.util.TreeMap;

/**
 * Lint findings against {@code fail_on_warning} and {@code max_warnings}.
 * <p>
 * Passes iff there are no errors, warnings are either tolerated or absent, and
 * warnings never exceed {@code max_warnings}. Tolerated warnings make the result
 * a pass with warnings.
 */
public class LintChecker implements GateChecker {

    @Override
    public GateType gateType() {
        return GateType.LINT;
    }

    @Override
    public GateResult evaluate(ExecutionArtifact artifact, ThresholdConfig thresholds) {
        boolean failOnWarning = thresholds.requireBoolean("fail_on_warning");
        int maxWarnings = thresholds.requireNonNegativeInt("max_warnings");

        var issues = new ArrayList<GateIssue>();
        var byRule = new TreeMap<String, Integer>();
        int errors = 0;
        int warnings = 0;
        var findings = artifact.objectList("findings");
        for (int i = 0; i < findings.size(); i++) {
            var finding = findings.get(i);
            String path = "findings[" + i + "]";
            String severity = ExecutionArtifact.string(finding, "severity", path);
            String message = ExecutionArtifact.string(finding, "message", path);
            String rule = ExecutionArtifact.optionalString(finding, "rule");
            switch (severity) {
                case "error" -> {
                    errors++;
                    issues.add(new GateIssue(Severity.CRITICAL, label(rule, message), ExecutionArtifact.location(finding)));
                }
                case "warning" -> {
                    warnings++;
                    issues.add(new GateIssue(Severity.HIGH, label(rule, message), ExecutionArtifact.location(finding)));
                }
                default -> throw new ArtifactFormatException(
                        "Evidence field '" + path + ".severity' must be 'error' or 'warning' but was '" + severity + "'");
            }
            if (rule != null) {
                byRule.merge(rule, 1, Integer::sum);
            }
        }

        boolean passed = errors == 0
                && (!failOnWarning || warnings == 0)
                && warnings <= maxWarnings;

        var recommendations = new ArrayList<String>();
        if (errors > 0) {
            recommendations.add(Recommendations.of(Severity.HIGH, "Code Quality",
                    "Fix " + errors + " linting errors found in your code"));
        }
        if (warnings > maxWarnings) {
            recommendations.add(Recommendations.of(Severity.MEDIUM, "Code Quality",
                    "Reduce linting warnings from " + warnings + " to at most " + maxWarnings));
        } else if (warnings > 0) {
            recommendations.add(Recommendations.of(Severity.MEDIUM, "Code Quality",
                    "Address " + warnings + " linting warnings to improve code quality"));
        }

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("errors", errors);
        metrics.put("warnings", warnings);
        metrics.put("total_findings", errors + warnings);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("max_warnings", maxWarnings);
        details.put("fail_on_warning", failOnWarning);
        details.put("by_rule", byRule);

        return new GateResult(passed, passed && warnings > 0, issues, metrics, recommendations, details);
    }

    private static String label(String rule, String message) {
        return rule == null ? message : rule + ": " + message;
    }
}
