package io.fullerstack.performance.core.bottleneck;

import io.fullerstack.performance.core.model.Bottleneck;
import io.fullerstack.performance.core.model.MetricSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates bottleneck rules against the newest sample only.
 *
 * <p>Additional rules (disk, network, database) are added by passing a longer rule list.
 */
public class BottleneckDetector {

    private static final Logger logger = LoggerFactory.getLogger(BottleneckDetector.class);

    private final List<BottleneckRule> rules;

    public BottleneckDetector(List<BottleneckRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public List<Bottleneck> detect(List<MetricSample> samples) {
        if (samples.isEmpty()) {
            return List.of();
        }
        MetricSample latest = samples.get(samples.size() - 1);

        List<Bottleneck> bottlenecks = new ArrayList<>();
        for (BottleneckRule rule : rules) {
            rule.evaluate(latest).ifPresent(bottleneck -> {
                logger.info("Bottleneck detected: {} ({} = {} > {})",
                    bottleneck.id(), rule.metric(), latest.value(rule.metric()), rule.threshold());
                bottlenecks.add(bottleneck);
            });
        }
        return bottlenecks;
    }
}
