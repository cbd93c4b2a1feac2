package io.fullerstack.performance.core.config;

import io.fullerstack.performance.core.model.MetricSample;
import io.fullerstack.performance.core.model.Priority;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Settings for the analysis engine.
 *
 * @param analysisInterval     period between analysis cycles (default: 60 seconds)
 * @param retentionPeriod      how long samples and histories are kept (default: 7 days)
 * @param recentWindow         sample window an analysis cycle looks at (default: 1 hour)
 * @param thresholds           scoring breakpoints
 * @param optimizationTargets  goals reported on in the optimization report
 * @param reportingEnabled     write the optimization report on shutdown (default: true)
 * @param autoOptimization     execute high priority, low risk recommendations automatically (default: false)
 * @param benchmarkEnabled     run the benchmark suite every cycle (default: true)
 * @param stabilizationDelay   wait between the last optimization step and the after snapshot (default: 30 seconds)
 * @param stepDelay            simulated duration of one optimization step (default: 1 second)
 * @param sampleCapacity       ring buffer size for metric samples (default: 100000)
 * @param historyCapacity      ring buffer size for analysis, benchmark and optimization histories (default: 10000)
 * @param reportDirectory      where JSON history, baseline and reports are written (default: logs)
 * @param shutdownDrainTimeout how long shutdown waits for a running cycle (default: 2 minutes)
 */
public record AnalyzerConfig(
    Duration analysisInterval,
    Duration retentionPeriod,
    Duration recentWindow,
    ScoreThresholds thresholds,
    List<OptimizationTarget> optimizationTargets,
    boolean reportingEnabled,
    boolean autoOptimization,
    boolean benchmarkEnabled,
    Duration stabilizationDelay,
    Duration stepDelay,
    int sampleCapacity,
    int historyCapacity,
    Path reportDirectory,
    Duration shutdownDrainTimeout
) {
    public AnalyzerConfig {
        Objects.requireNonNull(analysisInterval, "analysisInterval cannot be null");
        Objects.requireNonNull(retentionPeriod, "retentionPeriod cannot be null");
        Objects.requireNonNull(recentWindow, "recentWindow cannot be null");
        Objects.requireNonNull(thresholds, "thresholds cannot be null");
        Objects.requireNonNull(optimizationTargets, "optimizationTargets cannot be null");
        Objects.requireNonNull(stabilizationDelay, "stabilizationDelay cannot be null");
        Objects.requireNonNull(stepDelay, "stepDelay cannot be null");
        Objects.requireNonNull(reportDirectory, "reportDirectory cannot be null");
        Objects.requireNonNull(shutdownDrainTimeout, "shutdownDrainTimeout cannot be null");

        if (analysisInterval.isNegative() || analysisInterval.isZero()) {
            throw new IllegalArgumentException("analysisInterval must be positive");
        }
        if (retentionPeriod.isNegative() || retentionPeriod.isZero()) {
            throw new IllegalArgumentException("retentionPeriod must be positive");
        }
        if (recentWindow.isNegative() || recentWindow.isZero()) {
            throw new IllegalArgumentException("recentWindow must be positive");
        }
        if (stabilizationDelay.isNegative()) {
            throw new IllegalArgumentException("stabilizationDelay cannot be negative");
        }
        if (stepDelay.isNegative()) {
            throw new IllegalArgumentException("stepDelay cannot be negative");
        }
        if (shutdownDrainTimeout.isNegative()) {
            throw new IllegalArgumentException("shutdownDrainTimeout cannot be negative");
        }
        if (sampleCapacity <= 0) {
            throw new IllegalArgumentException("sampleCapacity must be positive, got: " + sampleCapacity);
        }
        if (historyCapacity <= 0) {
            throw new IllegalArgumentException("historyCapacity must be positive, got: " + historyCapacity);
        }
        optimizationTargets = List.copyOf(optimizationTargets);
    }

    /**
     * Defaults for every setting, including the three standard optimization targets.
     */
    public static AnalyzerConfig withDefaults() {
        return builder().build();
    }

    /**
     * Reads every setting from configuration.
     *
     * <p>Keys: {@code analysis.interval-ms}, {@code analysis.retention-ms},
     * {@code analysis.recent-window-ms}, {@code analysis.reporting-enabled},
     * {@code analysis.auto-optimization}, {@code analysis.benchmark-enabled},
     * {@code optimization.stabilization-delay-ms}, {@code optimization.step-delay-ms},
     * {@code store.sample-capacity}, {@code store.history-capacity}, {@code report.directory},
     * {@code shutdown.drain-timeout-ms}, {@code thresholds.*} and
     * {@code optimization.targets} (comma separated names, each read with
     * {@link OptimizationTarget#fromConfig}).
     *
     * @param config hierarchical configuration
     * @return analyzer configuration
     * @throws ConfigurationException if a key is missing or malformed
     */
    public static AnalyzerConfig fromConfig(HierarchicalConfig config) {
        List<OptimizationTarget> targets = new ArrayList<>();
        for (String name : config.getString("optimization.targets", "").split(",")) {
            if (!name.isBlank()) {
                targets.add(OptimizationTarget.fromConfig(config, name.trim()));
            }
        }

        try {
            return new AnalyzerConfig(
                config.getMillis("analysis.interval-ms"),
                config.getMillis("analysis.retention-ms"),
                config.getMillis("analysis.recent-window-ms"),
                ScoreThresholds.fromConfig(config),
                targets,
                config.getBoolean("analysis.reporting-enabled"),
                config.getBoolean("analysis.auto-optimization"),
                config.getBoolean("analysis.benchmark-enabled"),
                config.getMillis("optimization.stabilization-delay-ms"),
                config.getMillis("optimization.step-delay-ms"),
                config.getInt("store.sample-capacity"),
                config.getInt("store.history-capacity"),
                Path.of(config.getString("report.directory")),
                config.getMillis("shutdown.drain-timeout-ms")
            );
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid analyzer configuration in " + config.context() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Standard targets: response time at most 200 ms, throughput at least 1000 req/s, CPU at most 60 %.
     */
    public static List<OptimizationTarget> defaultTargets() {
        return List.of(
            new OptimizationTarget("response-time", MetricSample.APPLICATION_RESPONSE_TIME, 200, Priority.HIGH, TargetStrategy.REDUCE),
            new OptimizationTarget("throughput", MetricSample.APPLICATION_THROUGHPUT, 1000, Priority.MEDIUM, TargetStrategy.INCREASE),
            new OptimizationTarget("cpu-usage", MetricSample.SYSTEM_CPU, 60, Priority.HIGH, TargetStrategy.REDUCE)
        );
    }

    public Builder toBuilder() {
        return new Builder()
            .analysisInterval(analysisInterval)
            .retentionPeriod(retentionPeriod)
            .recentWindow(recentWindow)
            .thresholds(thresholds)
            .optimizationTargets(optimizationTargets)
            .reportingEnabled(reportingEnabled)
            .autoOptimization(autoOptimization)
            .benchmarkEnabled(benchmarkEnabled)
            .stabilizationDelay(stabilizationDelay)
            .stepDelay(stepDelay)
            .sampleCapacity(sampleCapacity)
            .historyCapacity(historyCapacity)
            .reportDirectory(reportDirectory)
            .shutdownDrainTimeout(shutdownDrainTimeout);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration analysisInterval = Duration.ofSeconds(60);
        private Duration retentionPeriod = Duration.ofDays(7);
        private Duration recentWindow = Duration.ofHours(1);
        private ScoreThresholds thresholds = ScoreThresholds.withDefaults();
        private List<OptimizationTarget> optimizationTargets = defaultTargets();
        private boolean reportingEnabled = true;
        private boolean autoOptimization = false;
        private boolean benchmarkEnabled = true;
        private Duration stabilizationDelay = Duration.ofSeconds(30);
        private Duration stepDelay = Duration.ofSeconds(1);
        private int sampleCapacity = 100_000;
        private int historyCapacity = 10_000;
        private Path reportDirectory = Path.of("logs");
        private Duration shutdownDrainTimeout = Duration.ofMinutes(2);

        public Builder analysisInterval(Duration analysisInterval) {
            this.analysisInterval = analysisInterval;
            return this;
        }

        public Builder retentionPeriod(Duration retentionPeriod) {
            this.retentionPeriod = retentionPeriod;
            return this;
        }

        public Builder recentWindow(Duration recentWindow) {
            this.recentWindow = recentWindow;
            return this;
        }

        public Builder thresholds(ScoreThresholds thresholds) {
            this.thresholds = thresholds;
            return this;
        }

        public Builder optimizationTargets(List<OptimizationTarget> optimizationTargets) {
            this.optimizationTargets = optimizationTargets;
            return this;
        }

        public Builder reportingEnabled(boolean reportingEnabled) {
            this.reportingEnabled = reportingEnabled;
            return this;
        }

        public Builder autoOptimization(boolean autoOptimization) {
            this.autoOptimization = autoOptimization;
            return this;
        }

        public Builder benchmarkEnabled(boolean benchmarkEnabled) {
            this.benchmarkEnabled = benchmarkEnabled;
            return this;
        }

        public Builder stabilizationDelay(Duration stabilizationDelay) {
            this.stabilizationDelay = stabilizationDelay;
            return this;
        }

        public Builder stepDelay(Duration stepDelay) {
            this.stepDelay = stepDelay;
            return this;
        }

        public Builder sampleCapacity(int sampleCapacity) {
            this.sampleCapacity = sampleCapacity;
            return this;
        }

        public Builder historyCapacity(int historyCapacity) {
            this.historyCapacity = historyCapacity;
            return this;
        }

        public Builder reportDirectory(Path reportDirectory) {
            this.reportDirectory = reportDirectory;
            return this;
        }

        public Builder shutdownDrainTimeout(Duration shutdownDrainTimeout) {
            this.shutdownDrainTimeout = shutdownDrainTimeout;
            return this;
        }

        public AnalyzerConfig build() {
            return new AnalyzerConfig(
                analysisInterval,
                retentionPeriod,
                recentWindow,
                thresholds,
                optimizationTargets,
                reportingEnabled,
                autoOptimization,
                benchmarkEnabled,
                stabilizationDelay,
                stepDelay,
                sampleCapacity,
                historyCapacity,
                reportDirectory,
                shutdownDrainTimeout
            );
        }
    }
}
