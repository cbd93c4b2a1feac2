package io.fullerstack.performance.engine.report;

import io.fullerstack.performance.core.model.Level;
import io.fullerstack.performance.core.model.OptimizationRecommendation;
import io.fullerstack.performance.core.model.Priority;
import io.fullerstack.performance.core.model.RecommendationCategory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A current recommendation that has not been implemented yet.
 */
public record PlannedOptimization(
    String id,
    String name,
    Instant plannedFor,
    RecommendationCategory category,
    Map<String, Double> expectedImpact,
    double estimatedCost,
    Level estimatedEffort,
    Priority priority,
    List<String> dependencies,
    List<String> risks
) {
    public PlannedOptimization {
        expectedImpact = Map.copyOf(expectedImpact);
        dependencies = List.copyOf(dependencies);
        risks = List.copyOf(risks);
    }

    static PlannedOptimization of(OptimizationRecommendation recommendation, Instant plannedFor) {
        OptimizationRecommendation.Impact impact = recommendation.impact();
        Map<String, Double> expectedImpact = new LinkedHashMap<>();
        expectedImpact.put("performance", impact.performance());
        expectedImpact.put("cost", impact.cost());
        expectedImpact.put("reliability", impact.reliability());
        expectedImpact.put("maintainability", impact.maintainability());

        return new PlannedOptimization(
            recommendation.id(),
            recommendation.title(),
            plannedFor,
            recommendation.category(),
            expectedImpact,
            Math.abs(impact.cost()),
            recommendation.effort().implementation(),
            recommendation.priority(),
            recommendation.implementation().dependencies(),
            recommendation.risk().factors()
        );
    }
}
