package io.fullerstack.performance.engine.benchmark;

import io.fullerstack.performance.core.model.BenchmarkResult;
import io.fullerstack.performance.core.model.Comparison;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs the benchmark suite sequentially and compares scores against the baseline.
 *
 * <p>Each benchmark is isolated: one that throws is logged and left out of the results while
 * the rest of the suite continues.
 *
 * <h3>Comparison:</h3>
 * <ul>
 *   <li>Every reference metric: measured below reference is better, equal is same, above is worse</li>
 *   <li>{@code score}: compared against the baseline score when one has been seeded</li>
 * </ul>
 *
 * @author Fullerstack
 */
public class BenchmarkRunner {

    private static final Logger logger = LoggerFactory.getLogger(BenchmarkRunner.class);

    static final String SCORE = "score";

    private final List<Benchmark> suite;
    private final PerformanceBaseline baseline;
    private final Clock clock;

    public BenchmarkRunner(List<Benchmark> suite, PerformanceBaseline baseline, Clock clock) {
        this.suite = List.copyOf(suite);
        this.baseline = Objects.requireNonNull(baseline, "baseline cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * CPU-intensive and memory-allocation benchmarks.
     */
    public static List<Benchmark> standardSuite() {
        return List.of(new CpuIntensiveBenchmark(), new MemoryAllocationBenchmark());
    }

    /**
     * Runs every benchmark once, in suite order.
     *
     * @return results of the benchmarks that completed
     */
    public List<BenchmarkResult> runAll() {
        List<BenchmarkResult> results = new ArrayList<>();
        for (Benchmark benchmark : suite) {
            try {
                results.add(runOne(benchmark));
            } catch (Exception e) {
                logger.error("Benchmark {} failed", benchmark.name(), e);
                // Continue with the rest of the suite
            }
        }
        return results;
    }

    /**
     * Runs the suite and seeds a baseline for every benchmark that has none yet.
     */
    public List<BenchmarkResult> runInitialBenchmarks() {
        logger.info("Running initial benchmarks");
        List<BenchmarkResult> results = runAll();

        for (BenchmarkResult result : results) {
            if (baseline.seedIfAbsent(result.name(), result.score())) {
                logger.info("Baseline for {} set to {}", result.name(), result.score());
            }
        }

        logger.info("Initial benchmarks completed: {} of {} succeeded, average score {}",
            results.size(), suite.size(),
            results.stream().mapToDouble(BenchmarkResult::score).average().orElse(0.0));
        return results;
    }

    private BenchmarkResult runOne(Benchmark benchmark) throws Exception {
        Instant timestamp = clock.instant();
        BenchmarkMeasurement measurement = benchmark.run();

        Map<String, Double> reference = new HashMap<>(measurement.reference());
        Map<String, Comparison> comparison = new HashMap<>();
        measurement.reference().forEach((metric, expected) -> {
            Double measured = measurement.metrics().get(metric);
            if (measured != null) {
                // Reference metrics are costs: lower measured values compare better
                comparison.put(metric, Comparison.of(expected, measured));
            }
        });

        Double baselineScore = baseline.getBaseline(benchmark.name());
        if (baselineScore != null) {
            reference.put(SCORE, baselineScore);
            comparison.put(SCORE, Comparison.of(measurement.score(), baselineScore));
        }

        BenchmarkResult result = new BenchmarkResult(
            benchmark.name() + "-" + timestamp.toEpochMilli(),
            benchmark.name(),
            timestamp,
            benchmark.category(),
            measurement.metrics(),
            reference,
            comparison,
            measurement.score(),
            measurement.details()
        );
        logger.debug("Benchmark {} scored {}", benchmark.name(), result.score());
        return result;
    }
}
