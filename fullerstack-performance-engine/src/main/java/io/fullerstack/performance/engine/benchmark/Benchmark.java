package io.fullerstack.performance.engine.benchmark;

/**
 * A calibration micro-benchmark.
 *
 * <p>Implementations measure one workload and score it against a fixed reference. The runner
 * adds identity, timestamps and baseline comparison.
 */
public interface Benchmark {

    /** Stable name used as the baseline key, e.g. "cpu-intensive". */
    String name();

    /** What the benchmark stresses, e.g. "cpu". */
    String category();

    /**
     * Runs the workload once.
     *
     * @return measurements and score
     * @throws Exception if the workload cannot complete
     */
    BenchmarkMeasurement run() throws Exception;
}
