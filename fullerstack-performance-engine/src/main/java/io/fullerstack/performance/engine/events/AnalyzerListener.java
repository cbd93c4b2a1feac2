package io.fullerstack.performance.engine.events;

import io.fullerstack.performance.core.model.Analysis;
import io.fullerstack.performance.core.model.ImplementedOptimization;
import io.fullerstack.performance.core.model.OptimizationRecommendation;

import java.util.Optional;

/**
 * Receives analyzer lifecycle, analysis and optimization events.
 *
 * <p>Every method has an empty default so listeners override only what they need. Callbacks run
 * on the analyzer's threads; slow listeners delay the cycle.
 */
public interface AnalyzerListener {

    /** The analyzer started its timer and ran the initial benchmarks. */
    default void onInitialized() {
    }

    default void onAnalysisCompleted(Analysis analysis) {
    }

    /** A cycle aborted. The previous analysis stays current. */
    default void onAnalysisFailed(Throwable error) {
    }

    default void onOptimizationCompleted(ImplementedOptimization optimization) {
    }

    /** A step threw. Nothing was recorded for the recommendation. */
    default void onOptimizationFailed(OptimizationRecommendation recommendation, Throwable error) {
    }

    /**
     * The analyzer stopped.
     *
     * @param finalAnalysis last analysis flagged as the shutdown report, empty when no cycle ever completed
     */
    default void onShutdown(Optional<Analysis> finalAnalysis) {
    }
}
