package io.fullerstack.performance.engine.report;

import io.fullerstack.performance.core.model.Analysis;
import io.fullerstack.performance.core.model.ImplementedOptimization;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Snapshot of where optimization stands: the current analysis, what was done, what is planned,
 * whether targets are met and what to do next.
 */
public record OptimizationReport(
    Instant timestamp,
    Analysis analysis,
    List<ImplementedOptimization> implementedOptimizations,
    List<PlannedOptimization> plannedOptimizations,
    List<OptimizationResult> results,
    List<TargetStatus> targets,
    Roi roi,
    List<String> nextSteps
) {
    public OptimizationReport {
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        Objects.requireNonNull(analysis, "analysis cannot be null");
        Objects.requireNonNull(roi, "roi cannot be null");
        implementedOptimizations = List.copyOf(implementedOptimizations);
        plannedOptimizations = List.copyOf(plannedOptimizations);
        results = List.copyOf(results);
        targets = List.copyOf(targets);
        nextSteps = List.copyOf(nextSteps);
    }
}
