package io.fullerstack.performance.core.bottleneck;

import io.fullerstack.performance.core.config.ScoreThresholds;
import io.fullerstack.performance.core.model.BottleneckType;
import io.fullerstack.performance.core.model.MetricSample;
import io.fullerstack.performance.core.model.Severity;

import java.util.List;

/**
 * The standard bottleneck rule table, keyed off the poor breakpoints.
 *
 * <ul>
 *   <li>cpu-bottleneck: cpu above cpuUsage.poor, impact 80, cost 5000</li>
 *   <li>memory-bottleneck: memory above memoryUsage.poor, impact 75, cost 2000</li>
 *   <li>response-time-bottleneck: response time above responseTime.poor, impact 85, cost 3000</li>
 * </ul>
 */
public final class BottleneckRules {

    private BottleneckRules() {
    }

    public static List<BottleneckRule> defaults(ScoreThresholds thresholds) {
        return List.of(
            new BottleneckRule(
                "cpu-bottleneck",
                BottleneckType.CPU,
                Severity.HIGH,
                MetricSample.SYSTEM_CPU,
                thresholds.cpuUsage().poor(),
                "CPU usage is consistently high",
                80,
                "system",
                List.of(
                    "Optimize CPU-intensive algorithms",
                    "Implement parallel processing",
                    "Consider horizontal scaling"
                ),
                5000
            ),
            new BottleneckRule(
                "memory-bottleneck",
                BottleneckType.MEMORY,
                Severity.HIGH,
                MetricSample.SYSTEM_MEMORY,
                thresholds.memoryUsage().poor(),
                "Memory usage is consistently high",
                75,
                "system",
                List.of(
                    "Optimize memory usage patterns",
                    "Implement memory pooling",
                    "Add more RAM"
                ),
                2000
            ),
            new BottleneckRule(
                "response-time-bottleneck",
                BottleneckType.APPLICATION,
                Severity.HIGH,
                MetricSample.APPLICATION_RESPONSE_TIME,
                thresholds.responseTime().poor(),
                "Response times are consistently slow",
                85,
                "application",
                List.of(
                    "Implement caching strategies",
                    "Optimize database queries",
                    "Add load balancing"
                ),
                3000
            )
        );
    }
}
