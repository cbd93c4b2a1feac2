package io.fullerstack.performance.core.scoring;

import io.fullerstack.performance.core.config.ThresholdBand;
import io.fullerstack.performance.core.model.Category;
import io.fullerstack.performance.core.model.CategoryScore;
import io.fullerstack.performance.core.model.HealthStatus;
import io.fullerstack.performance.core.model.MetricSample;
import io.fullerstack.performance.core.model.MetricScore;
import io.fullerstack.performance.core.model.PerformanceIssue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Shared plumbing for category scorers: collects metric scores and issues, then averages.
 *
 * <p>Subclasses implement {@link #scoreMetrics} and call {@link Collector#threshold} for
 * threshold-scored metrics or {@link Collector#derived} for ratios scored directly.
 */
public abstract class AbstractCategoryScorer implements CategoryScorer {

    private final Category category;
    private final List<String> trackedMetrics;

    protected AbstractCategoryScorer(Category category, List<String> trackedMetrics) {
        this.category = category;
        this.trackedMetrics = List.copyOf(trackedMetrics);
    }

    @Override
    public Category category() {
        return category;
    }

    @Override
    public List<String> trackedMetrics() {
        return trackedMetrics;
    }

    @Override
    public CategoryScore score(MetricSample latest, Instant detectedAt) {
        Collector collector = new Collector(latest, detectedAt);
        scoreMetrics(latest, collector);

        double average = collector.metrics.stream()
            .mapToDouble(MetricScore::score)
            .average()
            .orElse(0.0);
        double score = MetricScorer.clamp(average);

        return new CategoryScore(
            category,
            score,
            HealthStatus.fromScore(score),
            collector.metrics,
            Map.of(),
            collector.issues
        );
    }

    protected abstract void scoreMetrics(MetricSample latest, Collector collector);

    protected final class Collector {
        private final MetricSample sample;
        private final Instant detectedAt;
        private final List<MetricScore> metrics = new ArrayList<>();
        private final List<PerformanceIssue> issues = new ArrayList<>();

        private Collector(MetricSample sample, Instant detectedAt) {
            this.sample = sample;
            this.detectedAt = detectedAt;
        }

        /**
         * Scores a metric against its band, raising the rule's issue on a low score.
         */
        public double threshold(String name, String path, ThresholdBand band, IssueRule rule) {
            double value = sample.value(path);
            double score = MetricScorer.score(value, band);
            metrics.add(MetricScore.of(name, path, value, score));
            if (rule != null && rule.raisedBy(score)) {
                issues.add(rule.toIssue(category, path, value, score, detectedAt));
            }
            return score;
        }

        /**
         * Records a metric whose value is already on the 0-100 scale.
         */
        public double derived(String name, String path, double value, IssueRule rule) {
            double score = MetricScorer.clamp(value);
            metrics.add(MetricScore.of(name, path, value, score));
            if (rule != null && rule.raisedBy(score)) {
                issues.add(rule.toIssue(category, path, value, score, detectedAt));
            }
            return score;
        }
    }
}
