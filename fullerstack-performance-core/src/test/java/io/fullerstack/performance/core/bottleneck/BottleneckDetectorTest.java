package io.fullerstack.performance.core.bottleneck;

import io.fullerstack.performance.core.config.ScoreThresholds;
import io.fullerstack.performance.core.model.Bottleneck;
import io.fullerstack.performance.core.model.BottleneckType;
import io.fullerstack.performance.core.model.MetricSample;
import io.fullerstack.performance.core.model.SampleFixtures;
import io.fullerstack.performance.core.model.Severity;
import io.fullerstack.performance.core.model.SystemMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BottleneckDetectorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private BottleneckDetector detector;

    @BeforeEach
    void setUp() {
        detector = new BottleneckDetector(BottleneckRules.defaults(ScoreThresholds.withDefaults()));
    }

    @Test
    @DisplayName("CPU just above the poor threshold is a bottleneck")
    void cpuAbovePoor() {
        List<Bottleneck> bottlenecks = detector.detect(List.of(SampleFixtures.sample(NOW, 91, 50, 80)));

        assertThat(bottlenecks).singleElement().satisfies(bottleneck -> {
            assertThat(bottleneck.id()).isEqualTo("cpu-bottleneck");
            assertThat(bottleneck.type()).isEqualTo(BottleneckType.CPU);
            assertThat(bottleneck.severity()).isEqualTo(Severity.HIGH);
            assertThat(bottleneck.impact()).isEqualTo(80);
            assertThat(bottleneck.estimatedCost()).isEqualTo(5000);
            assertThat(bottleneck.detectingMetrics()).containsExactly("system.cpu");
            assertThat(bottleneck.recommendations()).containsExactly(
                "Optimize CPU-intensive algorithms",
                "Implement parallel processing",
                "Consider horizontal scaling"
            );
        });
    }

    @Test
    @DisplayName("CPU exactly at the poor threshold is not a bottleneck")
    void cpuAtPoorIsNotBottleneck() {
        assertThat(detector.detect(List.of(SampleFixtures.sample(NOW, 90, 50, 80)))).isEmpty();
    }

    @Test
    void onlyLatestSampleCounts() {
        List<Bottleneck> bottlenecks = detector.detect(List.of(
            SampleFixtures.sample(NOW.minusSeconds(60), 99, 99, 9000),
            SampleFixtures.healthy(NOW)
        ));

        assertThat(bottlenecks).isEmpty();
    }

    @Test
    void detectsEveryRuleInTableOrder() {
        List<Bottleneck> bottlenecks = detector.detect(List.of(SampleFixtures.sample(NOW, 95, 96, 2500)));

        assertThat(bottlenecks)
            .extracting(Bottleneck::id)
            .containsExactly("cpu-bottleneck", "memory-bottleneck", "response-time-bottleneck");
        assertThat(bottlenecks.get(2).type()).isEqualTo(BottleneckType.APPLICATION);
        assertThat(bottlenecks.get(2).impact()).isEqualTo(85);
    }

    @Test
    void extraRulesExtendTheTable() {
        List<BottleneckRule> rules = new ArrayList<>(BottleneckRules.defaults(ScoreThresholds.withDefaults()));
        rules.add(new BottleneckRule(
            "disk-bottleneck", BottleneckType.DISK, Severity.MEDIUM, "system.disk", 95,
            "Disk nearly full", 60, "storage", List.of("Rotate logs"), 1000
        ));

        List<Bottleneck> bottlenecks = new BottleneckDetector(rules).detect(List.of(
            new MetricSample(
                NOW,
                new SystemMetrics(50, 50, 97, 5),
                null,
                null
            )
        ));

        assertThat(bottlenecks).extracting(Bottleneck::id).containsExactly("disk-bottleneck");
    }

    @Test
    void emptyWindowHasNoBottlenecks() {
        assertThat(detector.detect(List.of())).isEmpty();
    }
}
