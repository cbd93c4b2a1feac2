package io.fullerstack.performance.core.model;

/**
 * Host level readings.
 *
 * @param cpu     CPU utilisation percent
 * @param memory  memory utilisation percent
 * @param disk    disk utilisation percent
 * @param network network latency in milliseconds
 */
public record SystemMetrics(double cpu, double memory, double disk, double network) {
}
