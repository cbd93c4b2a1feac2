package io.fullerstack.performance.core.store;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetentionBufferTest {

    private static final Instant START = Instant.parse("2026-03-01T00:00:00Z");

    private record Entry(String name, Instant at) {
    }

    @Test
    void pruneRemovesOnlyExpiredEntries() {
        MutableClock clock = new MutableClock(START);
        RetentionBuffer<Entry> buffer = new RetentionBuffer<>(10, Duration.ofHours(1), Entry::at, clock);
        buffer.add(new Entry("old", START));
        buffer.add(new Entry("new", START.plus(Duration.ofMinutes(45))));

        clock.advance(Duration.ofMinutes(90));

        assertThat(buffer.prune()).isEqualTo(1);
        assertThat(buffer.snapshot()).extracting(Entry::name).containsExactly("new");
    }

    @Test
    void addReportsEviction() {
        RetentionBuffer<Entry> buffer = new RetentionBuffer<>(1, Duration.ofHours(1), Entry::at, new MutableClock(START));

        assertThat(buffer.add(new Entry("a", START))).isFalse();
        assertThat(buffer.add(new Entry("b", START))).isTrue();
        assertThat(buffer.latest()).map(Entry::name).contains("b");
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new RetentionBuffer<Entry>(0, Duration.ofHours(1), Entry::at, new MutableClock(START)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
