package io.fullerstack.performance.core.bottleneck;

import io.fullerstack.performance.core.model.Bottleneck;
import io.fullerstack.performance.core.model.BottleneckType;
import io.fullerstack.performance.core.model.MetricSample;
import io.fullerstack.performance.core.model.Severity;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Fires when a metric on the latest sample is strictly above a threshold.
 *
 * @param id              bottleneck id
 * @param type            resource kind
 * @param severity        severity of the bottleneck
 * @param metric          metric path compared
 * @param threshold       value the metric must exceed
 * @param description     bottleneck description
 * @param impact          estimated impact, 0-100
 * @param location        where the bottleneck sits
 * @param recommendations remediation texts
 * @param estimatedCost   estimated remediation cost
 */
public record BottleneckRule(
    String id,
    BottleneckType type,
    Severity severity,
    String metric,
    double threshold,
    String description,
    double impact,
    String location,
    List<String> recommendations,
    double estimatedCost
) {
    public BottleneckRule {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(severity, "severity cannot be null");
        Objects.requireNonNull(metric, "metric cannot be null");
        recommendations = List.copyOf(recommendations);
    }

    public Optional<Bottleneck> evaluate(MetricSample sample) {
        if (sample.value(metric) <= threshold) {
            return Optional.empty();
        }
        return Optional.of(new Bottleneck(
            id,
            type,
            severity,
            description,
            impact,
            location,
            List.of(metric),
            recommendations,
            estimatedCost
        ));
    }
}
