package io.fullerstack.performance.engine.report;

import io.fullerstack.performance.core.config.TargetStrategy;
import io.fullerstack.performance.core.model.Priority;
import io.fullerstack.performance.core.model.Trend;

/**
 * An optimization target evaluated against the latest sample.
 *
 * @param current latest value of the metric, or null when no sample is stored
 * @param trend   recent trend of the metric
 * @param met     whether the target holds for the current value
 */
public record TargetStatus(
    String name,
    String metric,
    double target,
    Double current,
    Trend trend,
    TargetStrategy strategy,
    Priority priority,
    boolean met
) {
}
