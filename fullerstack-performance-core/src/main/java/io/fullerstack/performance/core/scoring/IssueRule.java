package io.fullerstack.performance.core.scoring;

import io.fullerstack.performance.core.model.Category;
import io.fullerstack.performance.core.model.PerformanceIssue;
import io.fullerstack.performance.core.model.Severity;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Describes the issue raised when a metric scores below {@link #ISSUE_SCORE}.
 *
 * @param id                issue id
 * @param title             issue title
 * @param descriptionFormat format applied to the metric value, e.g. "CPU usage is %.1f%%"
 * @param impact            expected consequence
 * @param correlations      related symptoms
 */
public record IssueRule(
    String id,
    String title,
    String descriptionFormat,
    String impact,
    List<String> correlations
) {
    /** Scores below this raise an issue. */
    public static final double ISSUE_SCORE = 60.0;

    /** Scores below this raise a critical issue instead of a high one. */
    public static final double CRITICAL_SCORE = 30.0;

    public static final IssueRule HIGH_CPU_USAGE = new IssueRule(
        "high-cpu-usage", "High CPU Usage", "CPU usage is %.1f%%",
        "Reduced system responsiveness and throughput",
        List.of("response-time", "throughput"));

    public static final IssueRule HIGH_MEMORY_USAGE = new IssueRule(
        "high-memory-usage", "High Memory Usage", "Memory usage is %.1f%%",
        "Risk of memory exhaustion and system instability",
        List.of("gc-pressure", "response-time"));

    public static final IssueRule SLOW_RESPONSE_TIME = new IssueRule(
        "slow-response-time", "Slow Response Time", "Response time is %.1fms",
        "Poor user experience and reduced throughput",
        List.of("cpu-usage", "memory-usage", "queue-depth"));

    public static final IssueRule LOW_THROUGHPUT = new IssueRule(
        "low-throughput", "Low Throughput", "Throughput is %.1f req/s",
        "Requests queue up and latency grows under load",
        List.of("response-time", "cpu-usage"));

    public static final IssueRule HIGH_ERROR_RATE = new IssueRule(
        "high-error-rate", "High Error Rate", "Error rate is %.1f%%",
        "Reduced reliability and user satisfaction",
        List.of("resource-exhaustion", "external-dependencies"));

    public static final IssueRule HIGH_DISK_USAGE = new IssueRule(
        "high-disk-usage", "High Disk Usage", "Disk usage is %.1f%%",
        "Risk of disk full and system failure",
        List.of("log-retention", "data-growth"));

    public static final IssueRule HIGH_NETWORK_LATENCY = new IssueRule(
        "high-network-latency", "High Network Latency", "Network latency is %.1fms",
        "Slower remote calls and cascading timeouts",
        List.of("external-dependencies", "response-time"));

    public static final IssueRule POOR_AGENT_HEALTH = new IssueRule(
        "poor-agent-health", "Poor Agent Health", "Average agent health is %.1f%%",
        "Reduced task execution efficiency and reliability",
        List.of("resource-contention", "task-complexity"));

    public IssueRule {
        correlations = List.copyOf(correlations);
    }

    public boolean raisedBy(double score) {
        return score < ISSUE_SCORE;
    }

    public PerformanceIssue toIssue(Category category, String metricPath, double value, double score, Instant detectedAt) {
        Severity severity = score < CRITICAL_SCORE ? Severity.CRITICAL : Severity.HIGH;
        return new PerformanceIssue(
            id,
            category,
            severity,
            title,
            String.format(Locale.ROOT, descriptionFormat, value),
            impact,
            detectedAt,
            1,
            List.of(metricPath),
            correlations
        );
    }
}
