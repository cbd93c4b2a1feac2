package io.fullerstack.performance.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one calibration micro-benchmark run.
 *
 * @param id         unique run id
 * @param name       benchmark name, e.g. "cpu-intensive"
 * @param timestamp  run time
 * @param category   what the benchmark stresses ("cpu", "memory")
 * @param metrics    raw measurements, e.g. {@code duration} in milliseconds
 * @param baseline   baseline values the run was compared against
 * @param comparison per-metric comparison against the baseline
 * @param score      0-100 score
 * @param details    free-form run parameters
 */
public record BenchmarkResult(
    String id,
    String name,
    Instant timestamp,
    String category,
    Map<String, Double> metrics,
    Map<String, Double> baseline,
    Map<String, Comparison> comparison,
    double score,
    Map<String, String> details
) {
    public BenchmarkResult {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        if (score < 0.0 || score > 100.0) {
            throw new IllegalArgumentException("score must be in range [0, 100], got: " + score);
        }
        metrics = Map.copyOf(metrics);
        baseline = Map.copyOf(baseline);
        comparison = Map.copyOf(comparison);
        details = Map.copyOf(details);
    }
}
