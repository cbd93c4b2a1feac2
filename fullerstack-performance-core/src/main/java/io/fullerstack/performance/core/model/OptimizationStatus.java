package io.fullerstack.performance.core.model;

public enum OptimizationStatus {
    /** Every step reported success. */
    SUCCESS,
    /** At least one step reported failure, at least one succeeded. */
    PARTIAL,
    /** Every step reported failure. */
    FAILED
}
