package io.fullerstack.performance.core.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Graded view of one subsystem.
 *
 * @param category subsystem
 * @param score    mean of the metric scores, in [0, 100]
 * @param status   status for the score
 * @param metrics  per-metric scores
 * @param trends   trend per tracked metric path
 * @param issues   issues raised by low metric scores
 */
public record CategoryScore(
    Category category,
    double score,
    HealthStatus status,
    List<MetricScore> metrics,
    Map<String, Trend> trends,
    List<PerformanceIssue> issues
) {
    public CategoryScore {
        Objects.requireNonNull(category, "category cannot be null");
        if (score < 0.0 || score > 100.0) {
            throw new IllegalArgumentException("score must be in range [0, 100], got: " + score);
        }
        Objects.requireNonNull(status, "status cannot be null");
        metrics = List.copyOf(metrics);
        trends = Map.copyOf(trends);
        issues = List.copyOf(issues);
    }

    public CategoryScore withTrends(Map<String, Trend> newTrends) {
        return new CategoryScore(category, score, status, metrics, newTrends, issues);
    }
}
