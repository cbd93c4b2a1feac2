package io.fullerstack.performance.engine.optimization;

/**
 * An optimization did not complete: one of its steps threw, none of its steps took effect, or
 * the optimizer was shut down before it could be recorded.
 */
public class OptimizationException extends Exception {

    private final String recommendationId;

    public OptimizationException(String recommendationId, String message) {
        super(message);
        this.recommendationId = recommendationId;
    }

    public OptimizationException(String recommendationId, String message, Throwable cause) {
        super(message, cause);
        this.recommendationId = recommendationId;
    }

    public String recommendationId() {
        return recommendationId;
    }
}
