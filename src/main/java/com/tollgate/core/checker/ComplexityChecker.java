package com.tollgate.core.checker;

import com.tollgate.core.artifact.ExecutionArtifact;
import com.tollgate.core.model.GateIssue;
import com.tollgate.core.model.GateResult;
import com.tollgate.core.model.GateType;
import com.tollgate.core.model.Severity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-function cyclomatic and cognitive complexity against {@code max_cyclomatic}
 * and {@code max_cognitive}.
 */
public class ComplexityChecker implements GateChecker {

    @Override
    public GateType gateType() {
        return GateType.COMPLEXITY;
    }

    @Override
    public GateResult evaluate(ExecutionArtifact artifact, ThresholdConfig thresholds) {
        int maxCyclomatic = thresholds.requireNonNegativeInt("max_cyclomatic");
        int maxCognitive = thresholds.requireNonNegativeInt("max_cognitive");

        var issues = new ArrayList<GateIssue>();
        int worstCyclomatic = 0;
        int worstCognitive = 0;
        var functions = artifact.objectList("functions");
        for (int i = 0; i < functions.size(); i++) {
            var fn = functions.get(i);
            String path = "functions[" + i + "]";
            String name = ExecutionArtifact.string(fn, "name", path);
            int cyclomatic = (int) ExecutionArtifact.number(fn, "cyclomatic", path + ".cyclomatic");
            int cognitive = (int) ExecutionArtifact.number(fn, "cognitive", path + ".cognitive");
            worstCyclomatic = Math.max(worstCyclomatic, cyclomatic);
            worstCognitive = Math.max(worstCognitive, cognitive);

            var breaches = new ArrayList<String>();
            if (cyclomatic > maxCyclomatic) {
                breaches.add("cyclomatic " + cyclomatic + " > " + maxCyclomatic);
            }
            if (cognitive > maxCognitive) {
                breaches.add("cognitive " + cognitive + " > " + maxCognitive);
            }
            if (!breaches.isEmpty()) {
                issues.add(new GateIssue(Severity.MEDIUM, name + ": " + String.join(", ", breaches),
                        ExecutionArtifact.location(fn)));
            }
        }

        boolean passed = worstCyclomatic <= maxCyclomatic && worstCognitive <= maxCognitive;

        var recommendations = new ArrayList<String>();
        if (!issues.isEmpty()) {
            recommendations.add(Recommendations.of(Severity.MEDIUM, "Maintainability",
                    "Refactor " + issues.size() + " functions that exceed complexity limits"));
        }

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("functions_analyzed", functions.size());
        metrics.put("max_cyclomatic", worstCyclomatic);
        metrics.put("max_cognitive", worstCognitive);
        metrics.put("functions_over_limit", issues.size());

        return new GateResult(passed, false, issues, metrics, recommendations, Map.of());
    }
}
