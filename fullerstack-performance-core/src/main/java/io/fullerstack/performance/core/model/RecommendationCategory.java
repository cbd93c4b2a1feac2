package io.fullerstack.performance.core.model;

public enum RecommendationCategory {
    PERFORMANCE,
    RESOURCE,
    ARCHITECTURE,
    CONFIGURATION
}
