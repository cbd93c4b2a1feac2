package io.fullerstack.performance.core.model;

/**
 * Worker agent pool readings.
 *
 * @param total         agents registered
 * @param active        agents currently busy
 * @param averageHealth mean agent health in [0, 1]
 */
public record AgentMetrics(int total, int active, double averageHealth) {
}
