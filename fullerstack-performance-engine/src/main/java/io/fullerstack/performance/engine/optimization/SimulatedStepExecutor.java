package io.fullerstack.performance.engine.optimization;

import io.fullerstack.performance.core.model.OptimizationRecommendation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Stand-in step executor: waits a fixed time and reports success.
 *
 * <p>Used when no real capability is registered for a step.
 */
public class SimulatedStepExecutor implements StepExecutor {

    private static final Logger logger = LoggerFactory.getLogger(SimulatedStepExecutor.class);

    private final Duration stepDelay;

    public SimulatedStepExecutor(Duration stepDelay) {
        this.stepDelay = stepDelay;
    }

    @Override
    public boolean execute(String step, OptimizationRecommendation recommendation) throws InterruptedException {
        logger.debug("Simulating step '{}' of {}", step, recommendation.id());
        Thread.sleep(stepDelay.toMillis());
        return true;
    }
}
