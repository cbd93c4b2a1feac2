package io.fullerstack.performance.core.scoring;

import io.fullerstack.performance.core.config.Direction;
import io.fullerstack.performance.core.config.ThresholdBand;

/**
 * Maps a raw metric value onto the 0-100 scale using a {@link ThresholdBand}.
 *
 * <h3>Lower is better:</h3>
 * <ul>
 *   <li>value &le; good → 100</li>
 *   <li>value &le; acceptable → 80</li>
 *   <li>value &le; poor → 60</li>
 *   <li>otherwise {@code max(0, 40 - ((value - poor) / poor) * 40)}</li>
 * </ul>
 *
 * <h3>Higher is better:</h3>
 * <ul>
 *   <li>value &ge; good → 100</li>
 *   <li>value &ge; acceptable → 80</li>
 *   <li>value &ge; poor → 60</li>
 *   <li>otherwise {@code max(0, 40 - ((poor - value) / poor) * 40)}</li>
 * </ul>
 *
 * <p>A non-positive {@code poor} breakpoint on the penalty branch scores 0, as does a
 * non-finite value. Results are always clamped to [0, 100].
 */
public final class MetricScorer {

    private MetricScorer() {
    }

    public static double score(double value, ThresholdBand band) {
        if (!Double.isFinite(value)) {
            return 0.0;
        }
        double score = band.direction() == Direction.LOWER_IS_BETTER
            ? lowerIsBetter(value, band)
            : higherIsBetter(value, band);
        return clamp(score);
    }

    private static double lowerIsBetter(double value, ThresholdBand band) {
        if (value <= band.good()) {
            return 100.0;
        }
        if (value <= band.acceptable()) {
            return 80.0;
        }
        if (value <= band.poor()) {
            return 60.0;
        }
        if (band.poor() <= 0.0) {
            return 0.0;
        }
        return Math.max(0.0, 40.0 - ((value - band.poor()) / band.poor()) * 40.0);
    }

    private static double higherIsBetter(double value, ThresholdBand band) {
        if (value >= band.good()) {
            return 100.0;
        }
        if (value >= band.acceptable()) {
            return 80.0;
        }
        if (value >= band.poor()) {
            return 60.0;
        }
        if (band.poor() <= 0.0) {
            return 0.0;
        }
        return Math.max(0.0, 40.0 - ((band.poor() - value) / band.poor()) * 40.0);
    }

    public static double clamp(double score) {
        if (Double.isNaN(score)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(100.0, score));
    }
}
