package io.fullerstack.performance.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A metric that scored badly enough to report.
 *
 * @param id              stable identifier, e.g. "high-cpu-usage"
 * @param category        category that raised the issue
 * @param severity        HIGH, or CRITICAL for very low scores
 * @param title           short title
 * @param description     current reading in words
 * @param impact          expected consequence
 * @param detectedAt      detection time
 * @param frequency       occurrences within the analysis
 * @param affectedMetrics metric paths involved
 * @param correlations    related symptoms worth checking
 */
public record PerformanceIssue(
    String id,
    Category category,
    Severity severity,
    String title,
    String description,
    String impact,
    Instant detectedAt,
    int frequency,
    List<String> affectedMetrics,
    List<String> correlations
) {
    public PerformanceIssue {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(category, "category cannot be null");
        Objects.requireNonNull(severity, "severity cannot be null");
        affectedMetrics = List.copyOf(affectedMetrics);
        correlations = List.copyOf(correlations);
    }
}
