package io.fullerstack.performance.core.scoring;

import io.fullerstack.performance.core.model.Category;
import io.fullerstack.performance.core.model.MetricSample;

import java.util.List;

/**
 * Connection load. 100 or more active connections scores 100; the score scales linearly below
 * that. Never raises issues.
 */
public class NetworkScorer extends AbstractCategoryScorer {

    static final double FULL_SCORE_CONNECTIONS = 100.0;

    public NetworkScorer() {
        super(Category.NETWORK, List.of(MetricSample.APPLICATION_ACTIVE_CONNECTIONS));
    }

    @Override
    protected void scoreMetrics(MetricSample latest, Collector collector) {
        double connections = latest.value(MetricSample.APPLICATION_ACTIVE_CONNECTIONS);
        double score = Math.min(100.0, connections / FULL_SCORE_CONNECTIONS * 100.0);
        collector.derived("Active Connections", MetricSample.APPLICATION_ACTIVE_CONNECTIONS, score, null);
    }
}
