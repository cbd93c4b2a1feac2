package io.fullerstack.performance.core.trend;

import io.fullerstack.performance.core.model.Category;
import io.fullerstack.performance.core.model.MetricSample;
import io.fullerstack.performance.core.model.Trend;
import io.fullerstack.performance.core.model.TrendSummary;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Classifies a series as improving, stable or degrading.
 *
 * <h3>Strategy:</h3>
 * Compare the average of the last {@value #WINDOW} values against the average of the
 * {@value #WINDOW} before them. A relative change above {@value #CHANGE_THRESHOLD} is
 * improving, below its negation degrading, anything else stable. A series with fewer than two
 * values, or with nothing before the recent window, is stable. When the older average is zero
 * the sign of the recent average decides.
 *
 * <p>"Improving" means the values rise. Whether a rising metric is good news depends on the
 * metric; callers interpret the direction.
 *
 * @author Fullerstack
 */
public class TrendAnalyzer {

    public static final int WINDOW = 5;
    public static final double CHANGE_THRESHOLD = 0.10;

    public Trend trend(List<Double> values) {
        int n = values.size();
        if (n < 2) {
            return Trend.STABLE;
        }

        List<Double> recent = values.subList(Math.max(0, n - WINDOW), n);
        List<Double> older = values.subList(Math.max(0, n - 2 * WINDOW), Math.max(0, n - WINDOW));
        if (recent.isEmpty() || older.isEmpty()) {
            return Trend.STABLE;
        }

        double recentAvg = average(recent);
        double olderAvg = average(older);

        if (olderAvg == 0.0) {
            if (recentAvg > 0.0) {
                return Trend.IMPROVING;
            }
            return recentAvg < 0.0 ? Trend.DEGRADING : Trend.STABLE;
        }

        double change = (recentAvg - olderAvg) / olderAvg;
        if (change > CHANGE_THRESHOLD) {
            return Trend.IMPROVING;
        }
        if (change < -CHANGE_THRESHOLD) {
            return Trend.DEGRADING;
        }
        return Trend.STABLE;
    }

    /**
     * Trend per metric path over the samples, oldest first.
     */
    public Map<String, Trend> trends(List<MetricSample> samples, List<String> paths) {
        Map<String, Trend> trends = new LinkedHashMap<>();
        for (String path : paths) {
            trends.put(path, trend(series(samples, sample -> sample.value(path))));
        }
        return trends;
    }

    /**
     * Composite trend of {@code (cpu + memory + responseTime) / 3}, plus system
     * ({@code (cpu + memory) / 2}) and application (response time) trends.
     */
    public TrendSummary summarize(List<MetricSample> samples) {
        Trend overall = trend(series(samples, sample -> (
            sample.value(MetricSample.SYSTEM_CPU)
                + sample.value(MetricSample.SYSTEM_MEMORY)
                + sample.value(MetricSample.APPLICATION_RESPONSE_TIME)
        ) / 3.0));

        Map<Category, Trend> categories = new EnumMap<>(Category.class);
        categories.put(Category.SYSTEM, trend(series(samples, sample -> (
            sample.value(MetricSample.SYSTEM_CPU) + sample.value(MetricSample.SYSTEM_MEMORY)
        ) / 2.0)));
        categories.put(Category.APPLICATION,
            trend(series(samples, sample -> sample.value(MetricSample.APPLICATION_RESPONSE_TIME))));

        return new TrendSummary(overall, categories);
    }

    private static List<Double> series(List<MetricSample> samples, ToDoubleFunction<MetricSample> extractor) {
        return samples.stream()
            .map(sample -> extractor.applyAsDouble(sample))
            .toList();
    }

    private static double average(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }
}
