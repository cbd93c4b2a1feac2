package io.fullerstack.performance.core.config;

import java.util.Objects;

/**
 * Scoring breakpoints for every metric the analyzer grades.
 *
 * <p>Defaults keep the directions the engine has always used: response time, error rate and
 * network latency are lower-is-better; throughput, CPU, memory and disk are scored
 * higher-is-better. Operators who want utilisation treated as a cost flip the direction per
 * metric in {@code analyzer.properties} ({@code thresholds.cpu-usage.direction=lower-is-better}).
 *
 * @param responseTime   request latency in milliseconds
 * @param throughput     requests per second
 * @param cpuUsage       CPU utilisation percent
 * @param memoryUsage    memory utilisation percent
 * @param errorRate      failed request percent
 * @param diskUsage      disk utilisation percent
 * @param networkLatency network round trip in milliseconds
 */
public record ScoreThresholds(
    ThresholdBand responseTime,
    ThresholdBand throughput,
    ThresholdBand cpuUsage,
    ThresholdBand memoryUsage,
    ThresholdBand errorRate,
    ThresholdBand diskUsage,
    ThresholdBand networkLatency
) {
    public ScoreThresholds {
        Objects.requireNonNull(responseTime, "responseTime cannot be null");
        Objects.requireNonNull(throughput, "throughput cannot be null");
        Objects.requireNonNull(cpuUsage, "cpuUsage cannot be null");
        Objects.requireNonNull(memoryUsage, "memoryUsage cannot be null");
        Objects.requireNonNull(errorRate, "errorRate cannot be null");
        Objects.requireNonNull(diskUsage, "diskUsage cannot be null");
        Objects.requireNonNull(networkLatency, "networkLatency cannot be null");
    }

    /**
     * Creates thresholds from configuration ({@code thresholds.<metric>.*} keys).
     *
     * @param config hierarchical configuration
     * @return thresholds from config
     */
    public static ScoreThresholds fromConfig(HierarchicalConfig config) {
        return new ScoreThresholds(
            ThresholdBand.fromConfig(config, "thresholds.response-time"),
            ThresholdBand.fromConfig(config, "thresholds.throughput"),
            ThresholdBand.fromConfig(config, "thresholds.cpu-usage"),
            ThresholdBand.fromConfig(config, "thresholds.memory-usage"),
            ThresholdBand.fromConfig(config, "thresholds.error-rate"),
            ThresholdBand.fromConfig(config, "thresholds.disk-usage"),
            ThresholdBand.fromConfig(config, "thresholds.network-latency")
        );
    }

    /**
     * Default breakpoints:
     * <ul>
     *   <li>Response time: 100 / 500 / 2000 ms</li>
     *   <li>Throughput: 1000 / 500 / 100 req/s</li>
     *   <li>CPU: 50 / 70 / 90 %</li>
     *   <li>Memory: 60 / 80 / 95 %</li>
     *   <li>Error rate: 0.1 / 1 / 5 %</li>
     *   <li>Disk: 60 / 80 / 95 %</li>
     *   <li>Network latency: 10 / 50 / 200 ms</li>
     * </ul>
     *
     * @return thresholds with defaults
     */
    public static ScoreThresholds withDefaults() {
        return new ScoreThresholds(
            ThresholdBand.lowerIsBetter(100, 500, 2000),
            ThresholdBand.higherIsBetter(1000, 500, 100),
            ThresholdBand.higherIsBetter(50, 70, 90),
            ThresholdBand.higherIsBetter(60, 80, 95),
            ThresholdBand.lowerIsBetter(0.1, 1, 5),
            ThresholdBand.higherIsBetter(60, 80, 95),
            ThresholdBand.lowerIsBetter(10, 50, 200)
        );
    }

    public ScoreThresholds withCpuUsage(ThresholdBand band) {
        return new ScoreThresholds(responseTime, throughput, band, memoryUsage, errorRate, diskUsage, networkLatency);
    }

    public ScoreThresholds withMemoryUsage(ThresholdBand band) {
        return new ScoreThresholds(responseTime, throughput, cpuUsage, band, errorRate, diskUsage, networkLatency);
    }
}
