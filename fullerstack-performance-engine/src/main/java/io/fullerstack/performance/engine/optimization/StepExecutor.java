package io.fullerstack.performance.engine.optimization;

import io.fullerstack.performance.core.model.OptimizationRecommendation;

/**
 * Carries out one implementation step of a recommendation.
 *
 * <p>Returning {@code false} reports that the step ran but did not take effect; the
 * optimization continues and is recorded as partial or failed. Throwing aborts the whole
 * optimization.
 */
@FunctionalInterface
public interface StepExecutor {

    /**
     * @param step           step description from {@link OptimizationRecommendation.Implementation#steps()}
     * @param recommendation recommendation the step belongs to
     * @return true if the step took effect
     * @throws Exception if the step could not be carried out
     */
    boolean execute(String step, OptimizationRecommendation recommendation) throws Exception;
}
