package io.fullerstack.performance.engine.report;

import io.fullerstack.performance.core.model.ImplementedOptimization;
import io.fullerstack.performance.core.model.OptimizationStatus;

import java.time.Instant;
import java.util.Map;

/**
 * Validation outcome of an implemented optimization.
 */
public record OptimizationResult(
    String optimizationId,
    Map<String, Double> beforeMetrics,
    Map<String, Double> afterMetrics,
    Map<String, Double> improvement,
    boolean success,
    String notes,
    Instant validatedAt
) {
    public OptimizationResult {
        beforeMetrics = Map.copyOf(beforeMetrics);
        afterMetrics = Map.copyOf(afterMetrics);
        improvement = Map.copyOf(improvement);
    }

    static OptimizationResult of(ImplementedOptimization optimization) {
        return new OptimizationResult(
            optimization.id(),
            optimization.before(),
            optimization.after(),
            optimization.improvement(),
            optimization.status() == OptimizationStatus.SUCCESS,
            optimization.notes(),
            optimization.implementedAt()
        );
    }
}
