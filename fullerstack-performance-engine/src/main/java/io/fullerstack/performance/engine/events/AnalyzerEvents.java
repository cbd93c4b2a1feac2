package io.fullerstack.performance.engine.events;

import io.fullerstack.performance.core.model.Analysis;
import io.fullerstack.performance.core.model.ImplementedOptimization;
import io.fullerstack.performance.core.model.OptimizationRecommendation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Typed listener registry.
 *
 * <p>Listeners are notified in subscription order. A listener that throws is logged and skipped;
 * the remaining listeners still receive the event.
 */
public class AnalyzerEvents {

    private static final Logger logger = LoggerFactory.getLogger(AnalyzerEvents.class);

    private final List<AnalyzerListener> listeners = new CopyOnWriteArrayList<>();

    public Subscription subscribe(AnalyzerListener listener) {
        Objects.requireNonNull(listener, "listener cannot be null");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }

    public void initialized() {
        dispatch("analyzer:initialized", AnalyzerListener::onInitialized);
    }

    public void analysisCompleted(Analysis analysis) {
        dispatch("analysis:completed", listener -> listener.onAnalysisCompleted(analysis));
    }

    public void analysisFailed(Throwable error) {
        dispatch("analysis:failed", listener -> listener.onAnalysisFailed(error));
    }

    public void optimizationCompleted(ImplementedOptimization optimization) {
        dispatch("optimization:completed", listener -> listener.onOptimizationCompleted(optimization));
    }

    public void optimizationFailed(OptimizationRecommendation recommendation, Throwable error) {
        dispatch("optimization:failed", listener -> listener.onOptimizationFailed(recommendation, error));
    }

    public void shutdown(Optional<Analysis> finalAnalysis) {
        dispatch("analyzer:shutdown", listener -> listener.onShutdown(finalAnalysis));
    }

    private void dispatch(String event, Consumer<AnalyzerListener> delivery) {
        for (AnalyzerListener listener : listeners) {
            try {
                delivery.accept(listener);
            } catch (RuntimeException e) {
                logger.error("Listener {} failed handling {}", listener, event, e);
            }
        }
    }
}
