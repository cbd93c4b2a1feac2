package io.fullerstack.performance.core.model;

/**
 * Score of a single metric within a category.
 *
 * @param name   display name, e.g. "CPU Usage"
 * @param path   metric path the value came from
 * @param value  raw (or derived) value
 * @param score  0-100 score
 * @param status status for the score
 */
public record MetricScore(String name, String path, double value, double score, HealthStatus status) {

    public static MetricScore of(String name, String path, double value, double score) {
        return new MetricScore(name, path, value, score, HealthStatus.fromScore(score));
    }
}
