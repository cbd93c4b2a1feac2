package io.fullerstack.performance.engine.optimization;

import io.fullerstack.performance.core.model.Level;
import io.fullerstack.performance.core.model.OptimizationRecommendation;
import io.fullerstack.performance.core.model.Priority;

import java.util.List;

/**
 * Decides which recommendations may run without an operator: high priority and low risk only.
 */
public final class AutoOptimizationGate {

    private AutoOptimizationGate() {
    }

    public static boolean admits(OptimizationRecommendation recommendation) {
        return recommendation.priority() == Priority.HIGH
            && recommendation.risk().level() == Level.LOW;
    }

    public static List<OptimizationRecommendation> select(List<OptimizationRecommendation> recommendations) {
        return recommendations.stream()
            .filter(AutoOptimizationGate::admits)
            .toList();
    }
}
