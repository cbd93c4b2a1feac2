package io.fullerstack.performance.core.scoring;

import io.fullerstack.performance.core.config.Direction;
import io.fullerstack.performance.core.config.ScoreThresholds;
import io.fullerstack.performance.core.model.AgentMetrics;
import io.fullerstack.performance.core.model.ApplicationMetrics;
import io.fullerstack.performance.core.model.Category;
import io.fullerstack.performance.core.model.CategoryScore;
import io.fullerstack.performance.core.model.HealthStatus;
import io.fullerstack.performance.core.model.MetricSample;
import io.fullerstack.performance.core.model.PerformanceIssue;
import io.fullerstack.performance.core.model.SampleFixtures;
import io.fullerstack.performance.core.model.Severity;
import io.fullerstack.performance.core.model.SystemMetrics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;

class CategoryScorerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final ScoreThresholds DEFAULTS = ScoreThresholds.withDefaults();

    @Nested
    @DisplayName("system")
    class SystemCategory {

        @Test
        void saturatedHostIsHealthyUnderDefaultDirections() {
            CategoryScore score = new SystemScorer(DEFAULTS).score(SampleFixtures.sample(NOW, 99, 99, 80), NOW);

            assertThat(score.score()).isEqualTo(100);
            assertThat(score.issues()).isEmpty();
        }

        @Test
        void lowerIsBetterCpuRaisesIssue() {
            ScoreThresholds thresholds = DEFAULTS.withCpuUsage(DEFAULTS.cpuUsage().withDirection(Direction.LOWER_IS_BETTER))
                .withMemoryUsage(DEFAULTS.memoryUsage().withDirection(Direction.LOWER_IS_BETTER));

            CategoryScore score = new SystemScorer(thresholds).score(SampleFixtures.sample(NOW, 95, 50, 80), NOW);

            // cpu: 40 - (5 / 90) * 40 = 37.78, memory: 100
            assertThat(score.score()).isCloseTo((37.777_777 + 100) / 2, within(1e-3));
            assertThat(score.status()).isEqualTo(HealthStatus.ACCEPTABLE);
            assertThat(score.issues()).singleElement().satisfies(issue -> {
                assertThat(issue.id()).isEqualTo("high-cpu-usage");
                assertThat(issue.category()).isEqualTo(Category.SYSTEM);
                assertThat(issue.severity()).isEqualTo(Severity.HIGH);
                assertThat(issue.description()).isEqualTo("CPU usage is 95.0%");
                assertThat(issue.affectedMetrics()).containsExactly("system.cpu");
                assertThat(issue.detectedAt()).isEqualTo(NOW);
            });
        }
    }

    @Nested
    @DisplayName("application")
    class Application {

        @Test
        void degradedApplicationIsCritical() {
            MetricSample sample = SampleFixtures.application(NOW, 2500, 50, 10);

            CategoryScore score = new ApplicationScorer(DEFAULTS).score(sample, NOW);

            // response time 30, throughput 20, error rate 0
            assertThat(score.score()).isCloseTo(50.0 / 3, within(1e-9));
            assertThat(score.status()).isEqualTo(HealthStatus.CRITICAL);
            assertThat(score.issues())
                .extracting(PerformanceIssue::id, PerformanceIssue::severity)
                .containsExactly(
                    tuple("slow-response-time", Severity.HIGH),
                    tuple("low-throughput", Severity.CRITICAL),
                    tuple("high-error-rate", Severity.CRITICAL)
                );
        }

        @Test
        void healthyApplicationHasNoIssues() {
            CategoryScore score = new ApplicationScorer(DEFAULTS).score(SampleFixtures.application(NOW, 90, 1200, 0.05), NOW);

            assertThat(score.score()).isEqualTo(100);
            assertThat(score.status()).isEqualTo(HealthStatus.EXCELLENT);
            assertThat(score.issues()).isEmpty();
            assertThat(score.metrics()).hasSize(3);
        }
    }

    @Nested
    @DisplayName("network and agents")
    class DerivedScores {

        @Test
        void connectionsScaleLinearlyAndCap() {
            NetworkScorer scorer = new NetworkScorer();

            assertThat(scorer.score(withConnections(50), NOW).score()).isEqualTo(50);
            assertThat(scorer.score(withConnections(250), NOW).score()).isEqualTo(100);
            assertThat(scorer.score(withConnections(0), NOW).issues()).isEmpty();
        }

        @Test
        void emptyAgentPoolHasZeroUtilization() {
            MetricSample sample = new MetricSample(NOW, null, null, new AgentMetrics(0, 0, 0.5));

            CategoryScore score = new AgentScorer().score(sample, NOW);

            assertThat(score.score()).isEqualTo(25);
            assertThat(score.issues()).singleElement().satisfies(issue -> {
                assertThat(issue.id()).isEqualTo("poor-agent-health");
                assertThat(issue.severity()).isEqualTo(Severity.HIGH);
            });
        }

        @Test
        void resourcesUseDiskAndLatency() {
            CategoryScore score = new ResourceScorer(DEFAULTS).score(SampleFixtures.healthy(NOW), NOW);

            assertThat(score.category()).isEqualTo(Category.RESOURCES);
            assertThat(score.score()).isEqualTo(100);
        }

        private MetricSample withConnections(double connections) {
            return new MetricSample(
                NOW,
                new SystemMetrics(50, 50, 50, 5),
                new ApplicationMetrics(80, 1000, 0, connections),
                null
            );
        }
    }
}
