package io.fullerstack.performance.core.model;

/**
 * Subsystems the analyzer grades.
 */
public enum Category {
    SYSTEM,
    APPLICATION,
    RESOURCES,
    NETWORK,
    AGENTS
}
