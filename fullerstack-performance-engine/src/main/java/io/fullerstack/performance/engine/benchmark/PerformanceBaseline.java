package io.fullerstack.performance.engine.benchmark;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Benchmark name to reference score.
 * <p>
 * Seeded by the first benchmark run for each name and never overwritten by later runs. An
 * operator replaces it wholesale with {@link #replaceAll(Map)} when reloading from disk.
 *
 * @author Fullerstack
 */
public class PerformanceBaseline {

    private final Map<String, Double> scores = new ConcurrentHashMap<>();

    /**
     * Records a baseline only if none exists for the name.
     *
     * @return true if the score became the baseline
     */
    public boolean seedIfAbsent(String name, double score) {
        return scores.putIfAbsent(name, score) == null;
    }

    /**
     * @param name benchmark name
     * @return baseline score, or null if not seeded
     */
    public Double getBaseline(String name) {
        return scores.get(name);
    }

    public void replaceAll(Map<String, Double> restored) {
        scores.clear();
        scores.putAll(restored);
    }

    public Map<String, Double> snapshot() {
        return Map.copyOf(scores);
    }

    public int size() {
        return scores.size();
    }

    public boolean isEmpty() {
        return scores.isEmpty();
    }

    /**
     * Clears all baselines.
     * Primarily for testing purposes.
     */
    public void clear() {
        scores.clear();
    }
}
