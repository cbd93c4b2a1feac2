package io.fullerstack.performance.core.scoring;

import io.fullerstack.performance.core.config.ScoreThresholds;
import io.fullerstack.performance.core.model.Category;
import io.fullerstack.performance.core.model.MetricSample;

import java.util.List;

/**
 * CPU and memory.
 */
public class SystemScorer extends AbstractCategoryScorer {

    private final ScoreThresholds thresholds;

    public SystemScorer(ScoreThresholds thresholds) {
        super(Category.SYSTEM, List.of(MetricSample.SYSTEM_CPU, MetricSample.SYSTEM_MEMORY));
        this.thresholds = thresholds;
    }

    @Override
    protected void scoreMetrics(MetricSample latest, Collector collector) {
        collector.threshold("CPU Usage", MetricSample.SYSTEM_CPU, thresholds.cpuUsage(), IssueRule.HIGH_CPU_USAGE);
        collector.threshold("Memory Usage", MetricSample.SYSTEM_MEMORY, thresholds.memoryUsage(), IssueRule.HIGH_MEMORY_USAGE);
    }
}
