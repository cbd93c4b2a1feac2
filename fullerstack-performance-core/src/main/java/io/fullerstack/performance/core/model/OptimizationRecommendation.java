package io.fullerstack.performance.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A proposed change with its expected impact, effort, risk and rollout plan.
 *
 * <p>Recommendations are produced fresh every analysis cycle and are never mutated. The
 * {@link Implementation#steps() steps} are opaque descriptions handed to a step executor.
 *
 * @param id             stable identifier, e.g. "system-optimization" or "fix-cpu-bottleneck"
 * @param title          short title
 * @param description    what the change achieves
 * @param category       kind of change
 * @param priority       urgency
 * @param impact         expected effect
 * @param effort         cost of doing it
 * @param risk           what could go wrong
 * @param implementation how to roll it out
 * @param validation     how to confirm it worked
 * @param alternatives   other options considered
 * @param references     further reading
 */
public record OptimizationRecommendation(
    String id,
    String title,
    String description,
    RecommendationCategory category,
    Priority priority,
    Impact impact,
    Effort effort,
    Risk risk,
    Implementation implementation,
    Validation validation,
    List<String> alternatives,
    List<String> references
) {
    public OptimizationRecommendation {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(category, "category cannot be null");
        Objects.requireNonNull(priority, "priority cannot be null");
        Objects.requireNonNull(impact, "impact cannot be null");
        Objects.requireNonNull(effort, "effort cannot be null");
        Objects.requireNonNull(risk, "risk cannot be null");
        Objects.requireNonNull(implementation, "implementation cannot be null");
        Objects.requireNonNull(validation, "validation cannot be null");
        alternatives = List.copyOf(alternatives);
        references = List.copyOf(references);
    }

    /**
     * Expected effect. Positive values are gains; a negative {@code cost} is spend, in
     * thousands.
     */
    public record Impact(double performance, double cost, double reliability, double maintainability) {
    }

    public record Effort(Level implementation, Level testing, Level maintenance) {
        public Effort {
            Objects.requireNonNull(implementation, "implementation cannot be null");
            Objects.requireNonNull(testing, "testing cannot be null");
            Objects.requireNonNull(maintenance, "maintenance cannot be null");
        }
    }

    public record Risk(Level level, List<String> factors, List<String> mitigation) {
        public Risk {
            Objects.requireNonNull(level, "level cannot be null");
            factors = List.copyOf(factors);
            mitigation = List.copyOf(mitigation);
        }
    }

    public record Implementation(
        List<String> steps,
        String timeline,
        List<String> resources,
        List<String> dependencies
    ) {
        public Implementation {
            steps = List.copyOf(steps);
            resources = List.copyOf(resources);
            dependencies = List.copyOf(dependencies);
        }
    }

    public record Validation(List<String> metrics, List<String> tests, List<String> criteria) {
        public Validation {
            metrics = List.copyOf(metrics);
            tests = List.copyOf(tests);
            criteria = List.copyOf(criteria);
        }
    }
}
