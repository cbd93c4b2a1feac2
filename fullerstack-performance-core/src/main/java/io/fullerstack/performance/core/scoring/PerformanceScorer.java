package io.fullerstack.performance.core.scoring;

import io.fullerstack.performance.core.config.ScoreThresholds;
import io.fullerstack.performance.core.model.Category;
import io.fullerstack.performance.core.model.CategoryScore;
import io.fullerstack.performance.core.model.MetricSample;
import io.fullerstack.performance.core.trend.TrendAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs every category scorer over a sample window.
 *
 * <p>The latest sample drives the scores; the whole window drives the per-metric trends.
 */
public class PerformanceScorer {

    private static final Logger logger = LoggerFactory.getLogger(PerformanceScorer.class);

    private final List<CategoryScorer> scorers;
    private final TrendAnalyzer trendAnalyzer;

    public PerformanceScorer(List<CategoryScorer> scorers, TrendAnalyzer trendAnalyzer) {
        this.scorers = List.copyOf(scorers);
        this.trendAnalyzer = trendAnalyzer;
    }

    /**
     * System, application, resources, network and agents scorers.
     */
    public static PerformanceScorer standard(ScoreThresholds thresholds, TrendAnalyzer trendAnalyzer) {
        return new PerformanceScorer(List.of(
            new SystemScorer(thresholds),
            new ApplicationScorer(thresholds),
            new ResourceScorer(thresholds),
            new NetworkScorer(),
            new AgentScorer()
        ), trendAnalyzer);
    }

    /**
     * @param samples    window of samples, oldest first, not empty
     * @param detectedAt timestamp for raised issues
     * @return score per category
     */
    public Map<Category, CategoryScore> score(List<MetricSample> samples, Instant detectedAt) {
        if (samples.isEmpty()) {
            throw new IllegalArgumentException("samples cannot be empty");
        }
        MetricSample latest = samples.get(samples.size() - 1);

        Map<Category, CategoryScore> categories = new EnumMap<>(Category.class);
        for (CategoryScorer scorer : scorers) {
            CategoryScore score = scorer.score(latest, detectedAt)
                .withTrends(trendAnalyzer.trends(samples, scorer.trackedMetrics()));
            categories.put(scorer.category(), score);
            logger.debug("Category {} scored {} ({}), {} issues",
                scorer.category(), score.score(), score.status(), score.issues().size());
        }
        return categories;
    }

    /**
     * Unweighted mean of the category scores present, 0 when none.
     */
    public static double overallScore(Collection<CategoryScore> categories) {
        return MetricScorer.clamp(categories.stream()
            .mapToDouble(CategoryScore::score)
            .average()
            .orElse(0.0));
    }
}
