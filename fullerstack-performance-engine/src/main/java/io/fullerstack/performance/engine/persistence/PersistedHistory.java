package io.fullerstack.performance.engine.persistence;

import io.fullerstack.performance.core.model.Analysis;
import io.fullerstack.performance.core.model.ImplementedOptimization;

import java.util.List;
import java.util.Map;

/**
 * Content of {@code performance-analysis.json}.
 */
public record PersistedHistory(
    List<Analysis> analysisHistory,
    List<ImplementedOptimization> optimizationHistory,
    Map<String, Double> performanceBaseline
) {
    public PersistedHistory {
        analysisHistory = List.copyOf(analysisHistory);
        optimizationHistory = List.copyOf(optimizationHistory);
        performanceBaseline = Map.copyOf(performanceBaseline);
    }
}
