package io.fullerstack.performance.core.model;

public enum Trend {
    IMPROVING,
    STABLE,
    DEGRADING
}
