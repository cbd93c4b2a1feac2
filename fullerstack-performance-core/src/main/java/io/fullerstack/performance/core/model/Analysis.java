package io.fullerstack.performance.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot produced by one analysis cycle.
 *
 * @param timestamp       cycle time
 * @param period          window of samples the cycle looked at
 * @param overallScore    unweighted mean of the category scores
 * @param categories      score per category
 * @param bottlenecks     bottlenecks on the latest sample
 * @param recommendations ranked recommendations
 * @param trends          composite and per-category trends
 * @param benchmarks      benchmark results of this cycle
 * @param shutdownReport  true for the final snapshot emitted on shutdown
 */
public record Analysis(
    Instant timestamp,
    Duration period,
    double overallScore,
    Map<Category, CategoryScore> categories,
    List<Bottleneck> bottlenecks,
    List<OptimizationRecommendation> recommendations,
    TrendSummary trends,
    List<BenchmarkResult> benchmarks,
    boolean shutdownReport
) {
    public Analysis {
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        Objects.requireNonNull(period, "period cannot be null");
        Objects.requireNonNull(trends, "trends cannot be null");
        categories = Map.copyOf(categories);
        bottlenecks = List.copyOf(bottlenecks);
        recommendations = List.copyOf(recommendations);
        benchmarks = List.copyOf(benchmarks);
    }

    public Analysis asShutdownReport(Instant at) {
        return new Analysis(at, period, overallScore, categories, bottlenecks, recommendations, trends, benchmarks, true);
    }

    public CategoryScore category(Category category) {
        return categories.get(category);
    }
}
