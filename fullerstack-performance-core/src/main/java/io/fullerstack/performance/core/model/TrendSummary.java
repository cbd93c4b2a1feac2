package io.fullerstack.performance.core.model;

import java.util.Map;
import java.util.Objects;

/**
 * Trend of the composite performance index plus per-category trends.
 *
 * @param overall    trend of {@code (cpu + memory + responseTime) / 3}
 * @param categories per-category trends
 */
public record TrendSummary(Trend overall, Map<Category, Trend> categories) {

    public TrendSummary {
        Objects.requireNonNull(overall, "overall cannot be null");
        categories = Map.copyOf(categories);
    }

    public static TrendSummary stable() {
        return new TrendSummary(Trend.STABLE, Map.of());
    }
}
