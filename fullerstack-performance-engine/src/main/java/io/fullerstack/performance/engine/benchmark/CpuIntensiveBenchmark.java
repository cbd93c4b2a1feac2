package io.fullerstack.performance.engine.benchmark;

import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Accumulates one million square roots.
 *
 * <p>Score: {@code max(0, 100 - duration / 100ms * 100)}.
 */
public class CpuIntensiveBenchmark implements Benchmark {

    public static final String NAME = "cpu-intensive";

    static final int OPERATIONS = 1_000_000;
    static final double REFERENCE_DURATION_MS = 100.0;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String category() {
        return "cpu";
    }

    @Override
    public BenchmarkMeasurement run() {
        long start = System.nanoTime();
        double result = 0.0;
        for (int i = 0; i < OPERATIONS; i++) {
            result += Math.sqrt(i);
        }
        double durationMs = (System.nanoTime() - start) / (double) TimeUnit.MILLISECONDS.toNanos(1);

        return new BenchmarkMeasurement(
            Map.of("duration", durationMs, "operations", (double) OPERATIONS),
            Map.of("duration", REFERENCE_DURATION_MS, "operations", (double) OPERATIONS),
            score(durationMs),
            Map.of("result", Double.toString(result))
        );
    }

    static double score(double durationMs) {
        return Math.max(0.0, 100.0 - (durationMs / REFERENCE_DURATION_MS) * 100.0);
    }
}
