package io.fullerstack.performance.core.config;

import io.fullerstack.performance.core.model.Priority;

import java.util.Objects;

/**
 * A goal the operator wants a metric to reach.
 *
 * @param name     target name, e.g. "response-time"
 * @param metric   metric path, e.g. "application.responseTime"
 * @param target   goal value
 * @param priority urgency
 * @param strategy how the goal is judged
 */
public record OptimizationTarget(
    String name,
    String metric,
    double target,
    Priority priority,
    TargetStrategy strategy
) {
    public OptimizationTarget {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(metric, "metric cannot be null");
        Objects.requireNonNull(priority, "priority cannot be null");
        Objects.requireNonNull(strategy, "strategy cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name cannot be blank");
        }
    }

    /**
     * Reads {@code optimization.target.<name>.metric}, {@code .value}, {@code .priority}
     * and {@code .strategy}.
     */
    public static OptimizationTarget fromConfig(HierarchicalConfig config, String name) {
        String prefix = "optimization.target." + name;
        String priority = config.getString(prefix + ".priority");
        try {
            return new OptimizationTarget(
                name,
                config.getString(prefix + ".metric"),
                config.getDouble(prefix + ".value"),
                Priority.parse(priority),
                TargetStrategy.parse(config.getString(prefix + ".strategy"))
            );
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid optimization target '" + name + "': " + e.getMessage(), e);
        }
    }
}
