package io.fullerstack.performance.core.model;

/**
 * Application level readings.
 *
 * @param responseTime      mean response time in milliseconds
 * @param throughput        requests per second
 * @param errorRate         failed request percent
 * @param activeConnections open client connections
 */
public record ApplicationMetrics(
    double responseTime,
    double throughput,
    double errorRate,
    double activeConnections
) {
}
