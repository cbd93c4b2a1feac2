package io.fullerstack.performance.core.config;

import java.util.Objects;

/**
 * Three breakpoints that map a raw metric value onto the 0-100 score scale.
 *
 * <p>The breakpoints are read in the metric's {@link Direction}: for
 * {@link Direction#LOWER_IS_BETTER} a value at or under {@code good} scores 100, for
 * {@link Direction#HIGHER_IS_BETTER} a value at or over {@code good} scores 100.
 * No ordering between the breakpoints is enforced; the shipped defaults for some
 * utilisation metrics are ascending while their direction is higher-is-better.
 *
 * @param good       breakpoint for a score of 100
 * @param acceptable breakpoint for a score of 80
 * @param poor       breakpoint for a score of 60 and the base of the penalty slope
 * @param direction  which way the metric improves
 */
public record ThresholdBand(
    double good,
    double acceptable,
    double poor,
    Direction direction
) {
    public ThresholdBand {
        Objects.requireNonNull(direction, "direction cannot be null");
        requireFinite("good", good);
        requireFinite("acceptable", acceptable);
        requireFinite("poor", poor);
    }

    public static ThresholdBand lowerIsBetter(double good, double acceptable, double poor) {
        return new ThresholdBand(good, acceptable, poor, Direction.LOWER_IS_BETTER);
    }

    public static ThresholdBand higherIsBetter(double good, double acceptable, double poor) {
        return new ThresholdBand(good, acceptable, poor, Direction.HIGHER_IS_BETTER);
    }

    public ThresholdBand withDirection(Direction newDirection) {
        return new ThresholdBand(good, acceptable, poor, newDirection);
    }

    /**
     * Reads {@code <prefix>.good}, {@code .acceptable}, {@code .poor} and {@code .direction}.
     *
     * @param config configuration source
     * @param prefix key prefix, e.g. {@code thresholds.cpu-usage}
     * @return band from configuration
     */
    public static ThresholdBand fromConfig(HierarchicalConfig config, String prefix) {
        return new ThresholdBand(
            config.getDouble(prefix + ".good"),
            config.getDouble(prefix + ".acceptable"),
            config.getDouble(prefix + ".poor"),
            Direction.parse(config.getString(prefix + ".direction"))
        );
    }

    private static void requireFinite(String name, double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(name + " must be finite, got: " + value);
        }
    }
}
