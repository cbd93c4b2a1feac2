package io.fullerstack.performance.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A resource saturated past its poor threshold.
 *
 * @param id               rule identifier, e.g. "cpu-bottleneck"
 * @param type             resource kind
 * @param severity         severity of the rule
 * @param description      current reading in words
 * @param impact           estimated performance impact, 0-100
 * @param location         where the bottleneck sits
 * @param detectingMetrics metric paths that triggered detection
 * @param recommendations  remediation texts
 * @param estimatedCost    estimated remediation cost
 */
public record Bottleneck(
    String id,
    BottleneckType type,
    Severity severity,
    String description,
    double impact,
    String location,
    List<String> detectingMetrics,
    List<String> recommendations,
    double estimatedCost
) {
    public Bottleneck {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(severity, "severity cannot be null");
        if (impact < 0.0 || impact > 100.0) {
            throw new IllegalArgumentException("impact must be in range [0, 100], got: " + impact);
        }
        detectingMetrics = List.copyOf(detectingMetrics);
        recommendations = List.copyOf(recommendations);
    }
}
