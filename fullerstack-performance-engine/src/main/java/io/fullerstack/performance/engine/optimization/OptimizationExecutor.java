package io.fullerstack.performance.engine.optimization;

import io.fullerstack.performance.core.model.ImplementedOptimization;
import io.fullerstack.performance.core.model.OptimizationRecommendation;
import io.fullerstack.performance.core.model.OptimizationStatus;
import io.fullerstack.performance.core.store.MetricsStore;
import io.fullerstack.performance.core.store.RetentionBuffer;
import io.fullerstack.performance.engine.events.AnalyzerEvents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Executes recommendations and measures their effect.
 *
 * <h3>Per recommendation:</h3>
 * <ol>
 *   <li>Capture a before snapshot from the metrics store</li>
 *   <li>Run each step sequentially through the {@link StepExecutor}</li>
 *   <li>Wait the stabilization delay as a delayed continuation (no thread is held)</li>
 *   <li>Capture an after snapshot and compute {@code after - before} per metric</li>
 *   <li>Append an {@link ImplementedOptimization} and emit {@code optimization:completed}</li>
 * </ol>
 *
 * <p>Steps that return false make the result {@link OptimizationStatus#PARTIAL}, or
 * {@link OptimizationStatus#FAILED} when none took effect; both are still recorded. A failed
 * result is reported through {@code optimization:failed} instead of {@code optimization:completed}.
 * A step that throws aborts the optimization: nothing is recorded, {@code optimization:failed} is
 * emitted and the returned future completes exceptionally with an {@link OptimizationException}.
 *
 * <p>{@link #abortInFlight(String)} fails every optimization that has not been recorded yet and
 * rejects new ones, so no returned future is left pending once the executor is stopped.
 *
 * <p>There is no retry and no rollback.
 */
public class OptimizationExecutor {

    private static final Logger logger = LoggerFactory.getLogger(OptimizationExecutor.class);

    private final MetricsStore store;
    private final StepExecutor steps;
    private final Duration stabilizationDelay;
    private final Executor executor;
    private final AnalyzerEvents events;
    private final RetentionBuffer<ImplementedOptimization> history;
    private final Clock clock;

    // guarded by itself, together with closed
    private final Set<InFlight> inFlight = new LinkedHashSet<>();
    private boolean closed;

    public OptimizationExecutor(
        MetricsStore store,
        StepExecutor steps,
        Duration stabilizationDelay,
        Executor executor,
        AnalyzerEvents events,
        RetentionBuffer<ImplementedOptimization> history,
        Clock clock
    ) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.steps = Objects.requireNonNull(steps, "steps cannot be null");
        this.stabilizationDelay = Objects.requireNonNull(stabilizationDelay, "stabilizationDelay cannot be null");
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
        this.events = Objects.requireNonNull(events, "events cannot be null");
        this.history = Objects.requireNonNull(history, "history cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * Executes one recommendation.
     *
     * @return future of the recorded optimization; completes exceptionally with an
     *     {@link OptimizationException} if a step threw, if the executor was aborted before the
     *     optimization was recorded, or if the executor no longer accepts work
     */
    public CompletableFuture<ImplementedOptimization> execute(OptimizationRecommendation recommendation) {
        Objects.requireNonNull(recommendation, "recommendation cannot be null");

        InFlight pending = new InFlight(recommendation, new CompletableFuture<>());
        pending.result().whenComplete((result, error) -> {
            if (error != null) {
                Throwable cause = unwrap(error);
                logger.error("Optimization {} failed", recommendation.id(), cause);
                events.optimizationFailed(recommendation, cause);
            }
        });

        synchronized (inFlight) {
            if (closed) {
                pending.result().completeExceptionally(new OptimizationException(
                    recommendation.id(), "Optimizer is shut down, " + recommendation.id() + " not executed"));
                return pending.result();
            }
            inFlight.add(pending);
        }
        logger.info("Executing optimization {} ({})", recommendation.id(), recommendation.title());

        Executor afterStabilization = CompletableFuture.delayedExecutor(
            stabilizationDelay.toMillis(), TimeUnit.MILLISECONDS, executor);
        try {
            CompletableFuture.supplyAsync(() -> runSteps(recommendation), executor)
                .thenAcceptAsync(outcome -> record(pending, outcome), afterStabilization)
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        fail(pending, unwrap(error));
                    }
                });
        } catch (RejectedExecutionException e) {
            fail(pending, new OptimizationException(
                recommendation.id(), "Optimizer is not accepting work, " + recommendation.id() + " not executed", e));
        }
        return pending.result();
    }

    /**
     * Executes recommendations one after another. A failed optimization does not stop the rest.
     *
     * @return future of the optimizations that were recorded, in execution order
     */
    public CompletableFuture<List<ImplementedOptimization>> executeAll(List<OptimizationRecommendation> recommendations) {
        CompletableFuture<List<ImplementedOptimization>> chain = CompletableFuture.completedFuture(new ArrayList<>());
        for (OptimizationRecommendation recommendation : recommendations) {
            chain = chain.thenCompose(done -> execute(recommendation).handle((result, error) -> {
                // failures were logged and emitted by execute()
                if (result != null) {
                    done.add(result);
                }
                return done;
            }));
        }
        return chain.thenApply(List::copyOf);
    }

    /**
     * Rejects further optimizations and fails every one not recorded yet. A step already running
     * is not interrupted, but its result is discarded.
     *
     * @param reason message carried by the {@link OptimizationException} of each aborted optimization
     * @return number of optimizations aborted
     */
    public int abortInFlight(String reason) {
        List<InFlight> aborted;
        synchronized (inFlight) {
            closed = true;
            aborted = List.copyOf(inFlight);
            inFlight.clear();
        }
        for (InFlight pending : aborted) {
            String id = pending.recommendation().id();
            pending.result().completeExceptionally(new OptimizationException(id, "Optimization " + id + " aborted: " + reason));
        }
        if (!aborted.isEmpty()) {
            logger.warn("Aborted {} optimizations in flight: {}", aborted.size(), reason);
        }
        return aborted.size();
    }

    public List<ImplementedOptimization> history() {
        return history.snapshot();
    }

    public int pruneHistory() {
        return history.prune();
    }

    private StepOutcome runSteps(OptimizationRecommendation recommendation) {
        Map<String, Double> before = store.captureCurrent();
        List<String> planned = recommendation.implementation().steps();
        int failed = 0;

        for (String step : planned) {
            logger.debug("Executing step '{}' of {}", step, recommendation.id());
            boolean applied;
            try {
                applied = steps.execute(step, recommendation);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CompletionException(new OptimizationException(
                    recommendation.id(), "Interrupted during step '" + step + "'", e));
            } catch (Exception e) {
                throw new CompletionException(new OptimizationException(
                    recommendation.id(), "Step '" + step + "' of " + recommendation.id() + " failed", e));
            }
            if (!applied) {
                failed++;
                logger.warn("Step '{}' of {} reported failure", step, recommendation.id());
            }
        }
        return new StepOutcome(before, planned.size(), failed);
    }

    private void record(InFlight pending, StepOutcome outcome) {
        OptimizationRecommendation recommendation = pending.recommendation();
        Map<String, Double> after = store.captureCurrent();
        Map<String, Double> improvement = improvement(outcome.before(), after);
        OptimizationStatus status = outcome.status();

        ImplementedOptimization optimization = new ImplementedOptimization(
            recommendation.id(),
            recommendation.title(),
            clock.instant(),
            recommendation.category(),
            outcome.before(),
            after,
            improvement,
            Math.abs(recommendation.impact().cost()),
            recommendation.effort().implementation(),
            status,
            outcome.notes()
        );
        synchronized (inFlight) {
            if (!inFlight.remove(pending)) {
                logger.warn("Optimization {} was aborted before it could be recorded", recommendation.id());
                return;
            }
            history.add(optimization);
        }

        switch (status) {
            case SUCCESS -> {
                logger.info("Optimization {} completed, net change {}", recommendation.id(),
                    improvement.values().stream().mapToDouble(Double::doubleValue).sum());
                events.optimizationCompleted(optimization);
            }
            case PARTIAL -> {
                logger.warn("Optimization {} partially applied: {}", recommendation.id(), outcome.notes());
                events.optimizationCompleted(optimization);
            }
            case FAILED -> {
                logger.error("Optimization {} failed: {}", recommendation.id(), outcome.notes());
                events.optimizationFailed(recommendation, new OptimizationException(recommendation.id(), outcome.notes()));
            }
        }
        pending.result().complete(optimization);
    }

    private void fail(InFlight pending, Throwable error) {
        synchronized (inFlight) {
            inFlight.remove(pending);
        }
        pending.result().completeExceptionally(error);
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    static Map<String, Double> improvement(Map<String, Double> before, Map<String, Double> after) {
        Map<String, Double> improvement = new LinkedHashMap<>();
        before.forEach((metric, beforeValue) -> {
            Double afterValue = after.get(metric);
            if (afterValue != null) {
                improvement.put(metric, afterValue - beforeValue);
            }
        });
        return improvement;
    }

    private record InFlight(OptimizationRecommendation recommendation, CompletableFuture<ImplementedOptimization> result) {
    }

    private record StepOutcome(Map<String, Double> before, int total, int failed) {

        OptimizationStatus status() {
            if (failed == 0) {
                return OptimizationStatus.SUCCESS;
            }
            return failed == total ? OptimizationStatus.FAILED : OptimizationStatus.PARTIAL;
        }

        String notes() {
            return switch (status()) {
                case SUCCESS -> "All " + total + " steps executed successfully";
                case PARTIAL -> failed + " of " + total + " steps reported failure";
                case FAILED -> "All " + total + " steps reported failure";
            };
        }
    }
}
