package io.fullerstack.performance.core.scoring;

import io.fullerstack.performance.core.config.ScoreThresholds;
import io.fullerstack.performance.core.model.Category;
import io.fullerstack.performance.core.model.MetricSample;

import java.util.List;

/**
 * Response time, throughput and error rate.
 */
public class ApplicationScorer extends AbstractCategoryScorer {

    private final ScoreThresholds thresholds;

    public ApplicationScorer(ScoreThresholds thresholds) {
        super(Category.APPLICATION, List.of(
            MetricSample.APPLICATION_RESPONSE_TIME,
            MetricSample.APPLICATION_THROUGHPUT,
            MetricSample.APPLICATION_ERROR_RATE
        ));
        this.thresholds = thresholds;
    }

    @Override
    protected void scoreMetrics(MetricSample latest, Collector collector) {
        collector.threshold("Response Time", MetricSample.APPLICATION_RESPONSE_TIME,
            thresholds.responseTime(), IssueRule.SLOW_RESPONSE_TIME);
        collector.threshold("Throughput", MetricSample.APPLICATION_THROUGHPUT,
            thresholds.throughput(), IssueRule.LOW_THROUGHPUT);
        collector.threshold("Error Rate", MetricSample.APPLICATION_ERROR_RATE,
            thresholds.errorRate(), IssueRule.HIGH_ERROR_RATE);
    }
}
