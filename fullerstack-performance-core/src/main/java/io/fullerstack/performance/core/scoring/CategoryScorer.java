package io.fullerstack.performance.core.scoring;

import io.fullerstack.performance.core.model.Category;
import io.fullerstack.performance.core.model.CategoryScore;
import io.fullerstack.performance.core.model.MetricSample;

import java.time.Instant;
import java.util.List;

/**
 * Grades one subsystem from the latest sample.
 */
public interface CategoryScorer {

    Category category();

    /**
     * Scores the subsystem. Trends are filled in later from the sample window.
     *
     * @param latest     newest sample
     * @param detectedAt timestamp stamped on raised issues
     * @return category score with an empty trend map
     */
    CategoryScore score(MetricSample latest, Instant detectedAt);

    /**
     * Metric paths whose trends are reported for this category.
     */
    List<String> trackedMetrics();
}
