package io.fullerstack.performance.core.model;

import java.util.Locale;

/**
 * Recommendation and target priority. Declaration order is ascending urgency.
 */
public enum Priority {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public static Priority fromSeverity(Severity severity) {
        return switch (severity) {
            case LOW -> LOW;
            case MEDIUM -> MEDIUM;
            case HIGH -> HIGH;
            case CRITICAL -> CRITICAL;
        };
    }

    public static Priority parse(String value) {
        return Priority.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
