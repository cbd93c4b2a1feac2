package io.fullerstack.performance.core.model;

/**
 * Coarse three-step scale used for risk and effort estimates.
 */
public enum Level {
    LOW,
    MEDIUM,
    HIGH
}
