package io.fullerstack.performance.engine.benchmark;

import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Allocates 1000 arrays of 1000 doubles and reads heap usage afterwards.
 *
 * <p>Score: {@code max(0, 100 - duration / 50ms * 50 - heapUsed / 256MiB * 50)}.
 */
public class MemoryAllocationBenchmark implements Benchmark {

    public static final String NAME = "memory-allocation";

    static final int ALLOCATIONS = 1000;
    static final int ARRAY_LENGTH = 1000;
    static final double REFERENCE_DURATION_MS = 50.0;
    static final double REFERENCE_HEAP_BYTES = 256.0 * 1024 * 1024;

    private final Runtime runtime;

    public MemoryAllocationBenchmark() {
        this(Runtime.getRuntime());
    }

    MemoryAllocationBenchmark(Runtime runtime) {
        this.runtime = runtime;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String category() {
        return "memory";
    }

    @Override
    public BenchmarkMeasurement run() {
        long start = System.nanoTime();
        double[][] arrays = new double[ALLOCATIONS][];
        for (int i = 0; i < ALLOCATIONS; i++) {
            arrays[i] = new double[ARRAY_LENGTH];
            Arrays.fill(arrays[i], ThreadLocalRandom.current().nextDouble());
        }
        double durationMs = (System.nanoTime() - start) / (double) TimeUnit.MILLISECONDS.toNanos(1);
        double heapUsed = runtime.totalMemory() - runtime.freeMemory();

        return new BenchmarkMeasurement(
            Map.of("duration", durationMs, "heapUsed", heapUsed, "allocations", (double) ALLOCATIONS),
            Map.of("duration", REFERENCE_DURATION_MS, "heapUsed", REFERENCE_HEAP_BYTES, "allocations", (double) ALLOCATIONS),
            score(durationMs, heapUsed),
            Map.of("arrays", Integer.toString(arrays.length))
        );
    }

    static double score(double durationMs, double heapUsedBytes) {
        double score = 100.0
            - (durationMs / REFERENCE_DURATION_MS) * 50.0
            - (heapUsedBytes / REFERENCE_HEAP_BYTES) * 50.0;
        return Math.max(0.0, Math.min(100.0, score));
    }
}
