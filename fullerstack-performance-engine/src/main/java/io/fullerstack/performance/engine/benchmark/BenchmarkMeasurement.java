package io.fullerstack.performance.engine.benchmark;

import java.util.Map;

/**
 * Raw output of one benchmark run.
 *
 * @param metrics   measured values, e.g. {@code duration} in milliseconds
 * @param reference reference values the workload is scored against; lower measured values compare better
 * @param score     0-100 score
 * @param details   run parameters and checksums
 */
public record BenchmarkMeasurement(
    Map<String, Double> metrics,
    Map<String, Double> reference,
    double score,
    Map<String, String> details
) {
    public BenchmarkMeasurement {
        metrics = Map.copyOf(metrics);
        reference = Map.copyOf(reference);
        details = Map.copyOf(details);
    }
}
