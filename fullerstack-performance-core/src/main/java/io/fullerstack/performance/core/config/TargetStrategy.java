package io.fullerstack.performance.core.config;

import java.util.Locale;

/**
 * How an optimization target is judged as met.
 */
public enum TargetStrategy {
    /** Met when the current value is at or below the target. */
    REDUCE,
    /** Met when the current value is at or above the target. */
    INCREASE,
    /** Met when the metric is not trending either way. */
    STABILIZE;

    public static TargetStrategy parse(String value) {
        try {
            return TargetStrategy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown target strategy: " + value, e);
        }
    }
}
