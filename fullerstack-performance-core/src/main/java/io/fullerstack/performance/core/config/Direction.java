package io.fullerstack.performance.core.config;

/**
 * Which way a metric improves.
 */
public enum Direction {
    /** Smaller values are healthier (latency, error rate). */
    LOWER_IS_BETTER,
    /** Larger values are healthier (throughput). */
    HIGHER_IS_BETTER;

    /**
     * Parses a configuration value such as {@code lower-is-better} or {@code HIGHER_IS_BETTER}.
     *
     * @param value raw configuration value
     * @return matching direction
     * @throws ConfigurationException if the value names no direction
     */
    public static Direction parse(String value) {
        String normalized = value.trim().replace('-', '_').toUpperCase(java.util.Locale.ROOT);
        try {
            return Direction.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown score direction: " + value, e);
        }
    }
}
