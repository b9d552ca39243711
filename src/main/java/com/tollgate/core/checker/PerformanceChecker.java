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
 * Load-test results against {@code max_response_time_ms} and {@code min_throughput_rps}.
 * p95 latency is read directly or computed by nearest rank from {@code latency_samples_ms}.
 */
public class PerformanceChecker implements GateChecker {

    @Override
    public GateType gateType() {
        return GateType.PERFORMANCE;
    }

    @Override
    public GateResult evaluate(ExecutionArtifact artifact, ThresholdConfig thresholds) {
        double maxResponseTimeMs = thresholds.requireNumber("max_response_time_ms");
        double minThroughputRps = thresholds.requireNumber("min_throughput_rps");

        double p95 = p95(artifact);
        double throughput = artifact.requireNumber("throughput_rps");

        var issues = new ArrayList<GateIssue>();
        var recommendations = new ArrayList<String>();
        if (p95 > maxResponseTimeMs) {
            issues.add(GateIssue.of(Severity.HIGH, "p95 latency " + Recommendations.number(p95)
                    + "ms exceeds " + Recommendations.number(maxResponseTimeMs) + "ms"));
            recommendations.add(Recommendations.of(Severity.HIGH, "Performance",
                    "Profile slow request paths to bring p95 latency under " + Recommendations.number(maxResponseTimeMs) + "ms"));
        }
        if (throughput < minThroughputRps) {
            issues.add(GateIssue.of(Severity.HIGH, "Throughput " + Recommendations.number(throughput)
                    + " rps is below " + Recommendations.number(minThroughputRps) + " rps"));
            recommendations.add(Recommendations.of(Severity.HIGH, "Performance",
                    "Increase throughput to at least " + Recommendations.number(minThroughputRps) + " rps"));
        }

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("p95_latency_ms", p95);
        metrics.put("throughput_rps", throughput);
        metrics.put("max_response_time_ms", maxResponseTimeMs);
        metrics.put("min_throughput_rps", minThroughputRps);

        return new GateResult(issues.isEmpty(), false, issues, metrics, recommendations, Map.of());
    }

    private static double p95(ExecutionArtifact artifact) {
        if (artifact.has("p95_latency_ms")) {
            return artifact.requireNumber("p95_latency_ms");
        }
        List<Double> samples = artifact.numberList("latency_samples_ms");
        if (samples.isEmpty()) {
            throw new ArtifactFormatException("performance evidence needs 'p95_latency_ms' or non-empty 'latency_samples_ms'");
        }
        return nearestRank(samples, 95);
    }

    static double nearestRank(List<Double> samples, int percentile) {
        var sorted = new ArrayList<>(samples);
        sorted.sort(null);
        int rank = (int) Math.ceil(percentile / 100.0 * sorted.size());
        return sorted.get(Math.max(rank, 1) - 1);
    }
}
