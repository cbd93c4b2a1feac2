package io.fullerstack.performance.core.recommendation;

import io.fullerstack.performance.core.model.Bottleneck;
import io.fullerstack.performance.core.model.Category;
import io.fullerstack.performance.core.model.CategoryScore;
import io.fullerstack.performance.core.model.Level;
import io.fullerstack.performance.core.model.OptimizationRecommendation;
import io.fullerstack.performance.core.model.OptimizationRecommendation.Effort;
import io.fullerstack.performance.core.model.OptimizationRecommendation.Impact;
import io.fullerstack.performance.core.model.OptimizationRecommendation.Implementation;
import io.fullerstack.performance.core.model.OptimizationRecommendation.Risk;
import io.fullerstack.performance.core.model.OptimizationRecommendation.Validation;
import io.fullerstack.performance.core.model.Priority;
import io.fullerstack.performance.core.model.RecommendationCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns category scores and bottlenecks into a ranked list of recommendations.
 *
 * <h3>Rules:</h3>
 * <ul>
 *   <li>System score below {@value #CATEGORY_SCORE_LIMIT}: {@code system-optimization}
 *       (high priority, low risk)</li>
 *   <li>Application score below {@value #CATEGORY_SCORE_LIMIT}: {@code application-optimization}
 *       (high priority, medium risk)</li>
 *   <li>Each distinct bottleneck: {@code fix-<bottleneck id>} (priority from severity, low risk,
 *       the bottleneck's remediation texts as steps)</li>
 * </ul>
 *
 * <p>Output is ordered by priority, then by performance impact, both descending. Ties keep
 * generation order.
 *
 * @author Fullerstack
 */
public class RecommendationEngine {

    private static final Logger logger = LoggerFactory.getLogger(RecommendationEngine.class);

    public static final double CATEGORY_SCORE_LIMIT = 70.0;

    static final Comparator<OptimizationRecommendation> RANKING =
        Comparator.comparing(OptimizationRecommendation::priority, Comparator.reverseOrder())
            .thenComparing(rec -> rec.impact().performance(), Comparator.reverseOrder());

    public List<OptimizationRecommendation> recommend(
        Map<Category, CategoryScore> categories,
        List<Bottleneck> bottlenecks
    ) {
        List<OptimizationRecommendation> recommendations = new ArrayList<>();

        CategoryScore system = categories.get(Category.SYSTEM);
        if (system != null && system.score() < CATEGORY_SCORE_LIMIT) {
            recommendations.add(systemOptimization());
        }

        CategoryScore application = categories.get(Category.APPLICATION);
        if (application != null && application.score() < CATEGORY_SCORE_LIMIT) {
            recommendations.add(applicationOptimization());
        }

        Set<String> seen = new HashSet<>();
        for (Bottleneck bottleneck : bottlenecks) {
            if (seen.add(bottleneck.id())) {
                recommendations.add(fixBottleneck(bottleneck));
            } else {
                logger.debug("Skipping duplicate bottleneck {}", bottleneck.id());
            }
        }

        recommendations.sort(RANKING);
        return recommendations;
    }

    static OptimizationRecommendation systemOptimization() {
        return new OptimizationRecommendation(
            "system-optimization",
            "System Resource Optimization",
            "Optimize system resource utilization to improve overall performance",
            RecommendationCategory.RESOURCE,
            Priority.HIGH,
            new Impact(25, -10, 20, 15),
            new Effort(Level.MEDIUM, Level.MEDIUM, Level.LOW),
            new Risk(
                Level.LOW,
                List.of("Temporary performance impact during optimization"),
                List.of("Perform during maintenance window", "Gradual rollout")
            ),
            new Implementation(
                List.of(
                    "Analyze current resource usage patterns",
                    "Identify optimization opportunities",
                    "Implement resource-efficient algorithms",
                    "Monitor and validate improvements"
                ),
                "2-3 weeks",
                List.of("DevOps Engineer", "Performance Analyst"),
                List.of("Monitoring system", "Test environment")
            ),
            new Validation(
                List.of("system.cpu", "system.memory"),
                List.of("Load testing", "Stress testing"),
                List.of("CPU usage < 70%", "Memory usage < 80%")
            ),
            List.of("Horizontal scaling", "Infrastructure upgrade"),
            List.of("Performance Best Practices", "Resource Optimization Guide")
        );
    }

    static OptimizationRecommendation applicationOptimization() {
        return new OptimizationRecommendation(
            "application-optimization",
            "Application Performance Optimization",
            "Optimize application performance through caching and algorithm improvements",
            RecommendationCategory.PERFORMANCE,
            Priority.HIGH,
            new Impact(30, -5, 25, 10),
            new Effort(Level.HIGH, Level.HIGH, Level.MEDIUM),
            new Risk(
                Level.MEDIUM,
                List.of("Code changes may introduce bugs", "Performance regression risk"),
                List.of("Comprehensive testing", "Feature flags", "Gradual rollout")
            ),
            new Implementation(
                List.of(
                    "Profile application performance",
                    "Identify performance bottlenecks",
                    "Implement caching strategies",
                    "Optimize critical code paths",
                    "Validate performance improvements"
                ),
                "4-6 weeks",
                List.of("Senior Developer", "Performance Engineer"),
                List.of("Code profiling tools", "Test data")
            ),
            new Validation(
                List.of("application.responseTime", "application.throughput"),
                List.of("Performance regression tests", "Load testing"),
                List.of("Response time < 500ms", "Throughput > 1000 req/s")
            ),
            List.of("Infrastructure scaling", "CDN implementation"),
            List.of("Application Performance Guide", "Caching Best Practices")
        );
    }

    static OptimizationRecommendation fixBottleneck(Bottleneck bottleneck) {
        return new OptimizationRecommendation(
            "fix-" + bottleneck.id(),
            "Fix " + bottleneck.type().name().toLowerCase(Locale.ROOT) + " bottleneck",
            bottleneck.description(),
            RecommendationCategory.PERFORMANCE,
            Priority.fromSeverity(bottleneck.severity()),
            new Impact(bottleneck.impact(), -bottleneck.estimatedCost() / 1000.0, 20, 10),
            new Effort(Level.MEDIUM, Level.MEDIUM, Level.LOW),
            new Risk(
                Level.LOW,
                List.of("Performance changes may affect other components"),
                List.of("Gradual rollout", "Monitoring", "Rollback plan")
            ),
            new Implementation(
                bottleneck.recommendations(),
                "1-2 weeks",
                List.of("DevOps Engineer"),
                List.of("Monitoring tools")
            ),
            new Validation(
                bottleneck.detectingMetrics(),
                List.of("Performance testing"),
                List.of("Improved performance metrics")
            ),
            List.of("Infrastructure upgrade"),
            List.of("Performance Optimization Guide")
        );
    }
}
