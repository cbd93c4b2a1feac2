package io.fullerstack.performance.engine.optimization;

import io.fullerstack.performance.core.model.OptimizationRecommendation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Routes steps to registered executors by step text, falling back to a default executor.
 *
 * <pre>
 * StepRegistry steps = new StepRegistry(new SimulatedStepExecutor(Duration.ofSeconds(1)))
 *     .register("Add load balancing", (step, rec) -> loadBalancer.addNode());
 * </pre>
 */
public class StepRegistry implements StepExecutor {

    private static final Logger logger = LoggerFactory.getLogger(StepRegistry.class);

    private final Map<String, StepExecutor> executors = new ConcurrentHashMap<>();
    private final StepExecutor fallback;

    public StepRegistry(StepExecutor fallback) {
        this.fallback = Objects.requireNonNull(fallback, "fallback cannot be null");
    }

    public StepRegistry register(String step, StepExecutor executor) {
        Objects.requireNonNull(step, "step cannot be null");
        Objects.requireNonNull(executor, "executor cannot be null");
        executors.put(step, executor);
        return this;
    }

    public boolean isRegistered(String step) {
        return executors.containsKey(step);
    }

    @Override
    public boolean execute(String step, OptimizationRecommendation recommendation) throws Exception {
        StepExecutor executor = executors.get(step);
        if (executor == null) {
            logger.debug("No executor registered for step '{}', using fallback", step);
            return fallback.execute(step, recommendation);
        }
        return executor.execute(step, recommendation);
    }
}
