package io.fullerstack.performance.core.model;

import java.time.Instant;

/**
 * Builders for metric samples used across core tests.
 */
public final class SampleFixtures {

    private SampleFixtures() {
    }

    /**
     * Sample with the given CPU, memory and response time; every other metric healthy.
     */
    public static MetricSample sample(Instant timestamp, double cpu, double memory, double responseTime) {
        return new MetricSample(
            timestamp,
            new SystemMetrics(cpu, memory, 70, 5),
            new ApplicationMetrics(responseTime, 1500, 0.05, 150),
            new AgentMetrics(10, 10, 0.95)
        );
    }

    public static MetricSample healthy(Instant timestamp) {
        return sample(timestamp, 60, 70, 80);
    }

    public static MetricSample application(Instant timestamp, double responseTime, double throughput, double errorRate) {
        return new MetricSample(
            timestamp,
            new SystemMetrics(60, 70, 70, 5),
            new ApplicationMetrics(responseTime, throughput, errorRate, 150),
            new AgentMetrics(10, 10, 0.95)
        );
    }
}
