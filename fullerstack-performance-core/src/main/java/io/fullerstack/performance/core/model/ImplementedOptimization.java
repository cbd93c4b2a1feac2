package io.fullerstack.performance.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Record of an executed recommendation with its before/after snapshots.
 *
 * @param id            recommendation id
 * @param name          recommendation title
 * @param implementedAt completion time
 * @param category      recommendation category
 * @param before        metric snapshot before the steps ran
 * @param after         metric snapshot after the stabilization delay
 * @param improvement   {@code after - before} for metrics present in both snapshots
 * @param cost          spend, as the magnitude of the recommendation's cost impact
 * @param effort        implementation effort
 * @param status        step outcome
 * @param notes         free-form notes
 */
public record ImplementedOptimization(
    String id,
    String name,
    Instant implementedAt,
    RecommendationCategory category,
    Map<String, Double> before,
    Map<String, Double> after,
    Map<String, Double> improvement,
    double cost,
    Level effort,
    OptimizationStatus status,
    String notes
) {
    public ImplementedOptimization {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(implementedAt, "implementedAt cannot be null");
        Objects.requireNonNull(status, "status cannot be null");
        before = Map.copyOf(before);
        after = Map.copyOf(after);
        improvement = Map.copyOf(improvement);
    }
}
