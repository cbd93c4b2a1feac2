package io.fullerstack.performance.core.scoring;

import io.fullerstack.performance.core.config.ScoreThresholds;
import io.fullerstack.performance.core.model.Category;
import io.fullerstack.performance.core.model.MetricSample;

import java.util.List;

/**
 * Disk usage and network latency.
 */
public class ResourceScorer extends AbstractCategoryScorer {

    private final ScoreThresholds thresholds;

    public ResourceScorer(ScoreThresholds thresholds) {
        super(Category.RESOURCES, List.of(MetricSample.SYSTEM_DISK, MetricSample.SYSTEM_NETWORK));
        this.thresholds = thresholds;
    }

    @Override
    protected void scoreMetrics(MetricSample latest, Collector collector) {
        collector.threshold("Disk Usage", MetricSample.SYSTEM_DISK, thresholds.diskUsage(), IssueRule.HIGH_DISK_USAGE);
        collector.threshold("Network Latency", MetricSample.SYSTEM_NETWORK,
            thresholds.networkLatency(), IssueRule.HIGH_NETWORK_LATENCY);
    }
}
