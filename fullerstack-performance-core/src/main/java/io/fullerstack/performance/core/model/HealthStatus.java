package io.fullerstack.performance.core.model;

/**
 * Qualitative label for a 0-100 score.
 */
public enum HealthStatus {
    EXCELLENT,
    GOOD,
    ACCEPTABLE,
    POOR,
    CRITICAL;

    /**
     * Maps a score onto the fixed cutoffs: 90, 80, 60, 40.
     *
     * @param score value in [0, 100]
     * @return status for the score
     */
    public static HealthStatus fromScore(double score) {
        if (score >= 90) {
            return EXCELLENT;
        }
        if (score >= 80) {
            return GOOD;
        }
        if (score >= 60) {
            return ACCEPTABLE;
        }
        if (score >= 40) {
            return POOR;
        }
        return CRITICAL;
    }
}
