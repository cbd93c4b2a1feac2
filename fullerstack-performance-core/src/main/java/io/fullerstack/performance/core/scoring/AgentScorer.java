package io.fullerstack.performance.core.scoring;

import io.fullerstack.performance.core.model.Category;
import io.fullerstack.performance.core.model.MetricSample;

import java.util.List;

/**
 * Agent pool health and utilisation.
 *
 * <ul>
 *   <li>Health: {@code averageHealth * 100}, raises {@code poor-agent-health} when low</li>
 *   <li>Utilisation: {@code active / total * 100}, or 0 with no agents registered</li>
 * </ul>
 */
public class AgentScorer extends AbstractCategoryScorer {

    public AgentScorer() {
        super(Category.AGENTS, List.of(MetricSample.AGENTS_AVERAGE_HEALTH, MetricSample.AGENTS_ACTIVE));
    }

    @Override
    protected void scoreMetrics(MetricSample latest, Collector collector) {
        double health = latest.value(MetricSample.AGENTS_AVERAGE_HEALTH) * 100.0;
        collector.derived("Agent Health", MetricSample.AGENTS_AVERAGE_HEALTH, health, IssueRule.POOR_AGENT_HEALTH);

        double total = latest.value(MetricSample.AGENTS_TOTAL);
        double utilization = total > 0 ? latest.value(MetricSample.AGENTS_ACTIVE) / total * 100.0 : 0.0;
        collector.derived("Agent Utilization", MetricSample.AGENTS_ACTIVE, utilization, null);
    }
}
