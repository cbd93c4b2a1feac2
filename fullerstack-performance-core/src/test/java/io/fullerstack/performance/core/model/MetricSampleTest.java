package io.fullerstack.performance.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MetricSampleTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    @DisplayName("resolves every dotted metric path")
    void resolvesPaths() {
        MetricSample sample = new MetricSample(
            NOW,
            new SystemMetrics(41, 52, 63, 7),
            new ApplicationMetrics(120, 900, 0.5, 33),
            new AgentMetrics(12, 9, 0.8)
        );

        assertThat(sample.value("system.cpu")).isEqualTo(41);
        assertThat(sample.value("system.memory")).isEqualTo(52);
        assertThat(sample.value("system.disk")).isEqualTo(63);
        assertThat(sample.value("system.network")).isEqualTo(7);
        assertThat(sample.value("application.responseTime")).isEqualTo(120);
        assertThat(sample.value("application.throughput")).isEqualTo(900);
        assertThat(sample.value("application.errorRate")).isEqualTo(0.5);
        assertThat(sample.value("application.activeConnections")).isEqualTo(33);
        assertThat(sample.value("agents.total")).isEqualTo(12);
        assertThat(sample.value("agents.active")).isEqualTo(9);
        assertThat(sample.value("agents.averageHealth")).isEqualTo(0.8);
    }

    @Test
    @DisplayName("unknown paths and absent groups resolve to zero")
    void unknownPathIsZero() {
        MetricSample sample = new MetricSample(NOW, null, null, null);

        assertThat(sample.value("system.cpu")).isZero();
        assertThat(sample.value("agents.averageHealth")).isZero();
        assertThat(SampleFixtures.healthy(NOW).value("system.gpu")).isZero();
        assertThat(SampleFixtures.healthy(NOW).value(null)).isZero();
    }

    @Test
    void timestampIsRequired() {
        assertThatThrownBy(() -> new MetricSample(null, null, null, null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("timestamp");
    }
}
