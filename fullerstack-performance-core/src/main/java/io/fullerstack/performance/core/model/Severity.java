package io.fullerstack.performance.core.model;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
