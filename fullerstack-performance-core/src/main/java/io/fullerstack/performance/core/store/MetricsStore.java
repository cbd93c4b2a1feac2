package io.fullerstack.performance.core.store;

import io.fullerstack.performance.core.model.MetricSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Time series of metric samples fed by an external collector.
 *
 * <p>Samples are accepted as-is; the store never rejects or validates their contents.
 * Every append prunes samples older than the retention period.
 *
 * @author Fullerstack
 */
public class MetricsStore {

    private static final Logger logger = LoggerFactory.getLogger(MetricsStore.class);

    /** Window used by {@link #getRecent()}. */
    public static final Duration DEFAULT_WINDOW = Duration.ofHours(1);

    private final RetentionBuffer<MetricSample> samples;
    private final Duration defaultWindow;

    public MetricsStore(int capacity, Duration retention, Clock clock) {
        this(capacity, retention, DEFAULT_WINDOW, clock);
    }

    public MetricsStore(int capacity, Duration retention, Duration defaultWindow, Clock clock) {
        this.samples = new RetentionBuffer<>(capacity, retention, MetricSample::timestamp, clock);
        this.defaultWindow = defaultWindow;
    }

    /**
     * Appends a sample and prunes expired ones. A null sample is ignored.
     */
    public void addMetrics(MetricSample sample) {
        if (sample == null) {
            logger.warn("Ignoring null metric sample");
            return;
        }
        if (samples.add(sample)) {
            logger.debug("Sample buffer full ({}), evicted oldest sample", samples.capacity());
        }
        int pruned = samples.prune();
        if (pruned > 0) {
            logger.debug("Pruned {} expired samples", pruned);
        }
    }

    public List<MetricSample> getRecent() {
        return getRecent(defaultWindow);
    }

    /**
     * Samples within {@code window} of now, oldest first.
     */
    public List<MetricSample> getRecent(Duration window) {
        return samples.within(window);
    }

    public Optional<MetricSample> latest() {
        return samples.latest();
    }

    /**
     * Current values of the snapshot metrics, read from the newest sample.
     *
     * @return path to value, empty when no sample has arrived yet
     */
    public Map<String, Double> captureCurrent() {
        Optional<MetricSample> latest = samples.latest();
        if (latest.isEmpty()) {
            return Map.of();
        }
        Map<String, Double> snapshot = new LinkedHashMap<>();
        for (String path : MetricSample.SNAPSHOT_PATHS) {
            snapshot.put(path, latest.get().value(path));
        }
        return Collections.unmodifiableMap(snapshot);
    }

    public int prune() {
        return samples.prune();
    }

    public int size() {
        return samples.size();
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }
}
