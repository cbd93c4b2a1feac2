package io.fullerstack.performance.core.model;

/**
 * Outcome of comparing a benchmark score against its baseline.
 */
public enum Comparison {
    BETTER,
    SAME,
    WORSE;

    public static Comparison of(double score, double baseline) {
        int result = Double.compare(score, baseline);
        if (result > 0) {
            return BETTER;
        }
        return result < 0 ? WORSE : SAME;
    }
}
