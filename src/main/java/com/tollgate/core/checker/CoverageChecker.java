package com.tollgate.core.checker;

import com.tollgate.core.artifact.ArtifactFormatException;
import com.tollgate.core.artifact.ExecutionArtifact;
import com.tollgate.core.model.GateIssue;
import com.tollgate.core.model.GateResult;
import com.tollgate.core.model.GateType;
import com.tollgate.core.model.Severity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Measured coverage against {@code min_percentage}.
 * <p>
 * The measurement is {@code coverage_percentage} when present, otherwise
 * {@code covered_lines / total_lines}. Files listed under {@code files} below the
 * bar are named in the recommendations.
 */
public class CoverageChecker implements GateChecker {

    private static final int MAX_FILES_LISTED = 5;

    @Override
    public GateType gateType() {
        return GateType.COVERAGE;
    }

    @Override
    public GateResult evaluate(ExecutionArtifact artifact, ThresholdConfig thresholds) {
        double minPercentage = thresholds.requirePercentage("min_percentage");
        double measured = measuredPercentage(artifact);

        boolean passed = measured >= minPercentage;

        var issues = new ArrayList<GateIssue>();
        var recommendations = new ArrayList<String>();
        if (!passed) {
            issues.add(GateIssue.of(Severity.MEDIUM, "Coverage " + Recommendations.number(measured)
                    + "% is below the required " + Recommendations.number(minPercentage) + "%"));
            recommendations.add(Recommendations.of(Severity.MEDIUM, "Test Coverage",
                    "Add tests to raise coverage by " + Recommendations.number(minPercentage - measured)
                            + " percentage points"));
        }

        List<String> lowFiles = new ArrayList<>();
        var files = artifact.objectList("files");
        for (int i = 0; i < files.size(); i++) {
            var file = files.get(i);
            String path = "files[" + i + "]";
            double fileCoverage = ExecutionArtifact.number(file, "coverage_percentage", path + ".coverage_percentage");
            if (fileCoverage < minPercentage) {
                lowFiles.add(ExecutionArtifact.string(file, "path", path));
            }
        }
        if (!lowFiles.isEmpty()) {
            var shown = lowFiles.subList(0, Math.min(MAX_FILES_LISTED, lowFiles.size()));
            String suffix = lowFiles.size() > MAX_FILES_LISTED
                    ? " and " + (lowFiles.size() - MAX_FILES_LISTED) + " more" : "";
            recommendations.add(Recommendations.of(Severity.LOW, "Test Coverage",
                    "Files below " + Recommendations.number(minPercentage) + "%: " + String.join(", ", shown) + suffix));
        }

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("coverage_percentage", measured);
        metrics.put("min_percentage", minPercentage);
        metrics.put("files_below_threshold", lowFiles.size());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("files_below_threshold", lowFiles);

        return new GateResult(passed, false, issues, metrics, recommendations, details);
    }

    private static double measuredPercentage(ExecutionArtifact artifact) {
        if (artifact.has("coverage_percentage")) {
            return artifact.requireNumber("coverage_percentage");
        }
        if (artifact.has("covered_lines") && artifact.has("total_lines")) {
            double covered = artifact.requireNumber("covered_lines");
            double total = artifact.requireNumber("total_lines");
            if (total <= 0) {
                return 0.0;
            }
            return covered * 100.0 / total;
        }
        throw new ArtifactFormatException(
                "coverage evidence needs 'coverage_percentage' or 'covered_lines' and 'total_lines'");
    }
}
