package io.fullerstack.performance.engine.scheduler;

import io.fullerstack.performance.core.config.AnalyzerConfig;
import io.fullerstack.performance.core.model.Analysis;
import io.fullerstack.performance.core.model.BenchmarkResult;
import io.fullerstack.performance.core.model.Bottleneck;
import io.fullerstack.performance.core.model.ImplementedOptimization;
import io.fullerstack.performance.core.model.MetricSample;
import io.fullerstack.performance.core.model.OptimizationRecommendation;
import io.fullerstack.performance.core.store.MetricsStore;
import io.fullerstack.performance.core.store.RetentionBuffer;
import io.fullerstack.performance.engine.benchmark.Benchmark;
import io.fullerstack.performance.engine.benchmark.BenchmarkRunner;
import io.fullerstack.performance.engine.benchmark.PerformanceBaseline;
import io.fullerstack.performance.engine.events.AnalyzerEvents;
import io.fullerstack.performance.engine.events.AnalyzerListener;
import io.fullerstack.performance.engine.events.Subscription;
import io.fullerstack.performance.engine.optimization.AutoOptimizationGate;
import io.fullerstack.performance.engine.optimization.OptimizationException;
import io.fullerstack.performance.engine.optimization.OptimizationExecutor;
import io.fullerstack.performance.engine.optimization.SimulatedStepExecutor;
import io.fullerstack.performance.engine.optimization.StepExecutor;
import io.fullerstack.performance.engine.persistence.AnalysisRepository;
import io.fullerstack.performance.engine.persistence.PersistedHistory;
import io.fullerstack.performance.engine.report.OptimizationReport;
import io.fullerstack.performance.engine.report.OptimizationReportGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Performance analyzer facade: ingests samples, runs analysis cycles on a fixed-rate timer and
 * optionally applies low-risk recommendations.
 * <p>
 * <b>Cycle:</b> score, trend, detect, recommend, benchmark (if enabled), assemble the
 * {@link Analysis}, append it to history, prune histories, emit {@code analysis:completed}, then
 * run the auto-optimization gate's selections serially when auto-optimization is on. A tick is
 * skipped, not queued, while a cycle (including its optimizations) is in progress or while no
 * samples are stored.
 * <p>
 * <b>Threads:</b>
 * <ul>
 *   <li>{@code performance-analyzer} - single daemon thread running ticks and cycles</li>
 *   <li>{@code performance-optimizer} - single daemon thread running optimization steps</li>
 * </ul>
 * The stabilization delay between steps and the after snapshot is a delayed continuation and
 * holds neither thread.
 * <p>
 * Usage:
 * <pre>
 * AnalysisScheduler analyzer = new AnalysisScheduler(AnalyzerConfig.fromConfig(HierarchicalConfig.global()));
 * analyzer.subscribe(listener);
 * analyzer.initialize();
 *
 * analyzer.addMetrics(sample);
 *
 * // ... later ...
 * analyzer.shutdown();
 * </pre>
 *
 * @author Fullerstack
 */
public class AnalysisScheduler implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisScheduler.class);

    private static final long EXECUTOR_TERMINATION_SECONDS = 5;

    private final AnalyzerConfig config;
    private final Clock clock;
    private final MetricsStore store;
    private final AnalyzerEvents events;
    private final PerformanceBaseline baseline;
    private final AnalysisCycle cycle;
    private final OptimizationExecutor optimizer;
    private final OptimizationReportGenerator reportGenerator;
    private final AnalysisRepository repository;
    private final RetentionBuffer<Analysis> analysisHistory;
    private final RetentionBuffer<BenchmarkResult> benchmarkHistory;

    private final ScheduledExecutorService scheduler;
    private final ExecutorService optimizerExecutor;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final AtomicBoolean cycleInProgress = new AtomicBoolean(false);

    private volatile Analysis currentAnalysis;
    private volatile ScheduledFuture<?> timer;
    private volatile CompletableFuture<Optional<Analysis>> runningCycle = CompletableFuture.completedFuture(Optional.empty());

    /**
     * Simulated optimization steps, standard benchmark suite, system UTC clock.
     */
    public AnalysisScheduler(AnalyzerConfig config) {
        this(
            config,
            new SimulatedStepExecutor(config.stepDelay()),
            BenchmarkRunner.standardSuite(),
            Clock.systemUTC()
        );
    }

    /**
     * @param config     analyzer settings
     * @param steps      capability that carries out recommendation steps
     * @param benchmarks benchmark suite, run in order
     * @param clock      time source for timestamps and retention
     */
    public AnalysisScheduler(AnalyzerConfig config, StepExecutor steps, List<Benchmark> benchmarks, Clock clock) {
        this(config, steps, benchmarks, clock,
            runner -> AnalysisCycle.standard(config.thresholds(), runner, config.recentWindow(), clock));
    }

    /**
     * @param cycleFactory builds the analysis pass around the scheduler's benchmark runner
     */
    AnalysisScheduler(
        AnalyzerConfig config,
        StepExecutor steps,
        List<Benchmark> benchmarks,
        Clock clock,
        Function<BenchmarkRunner, AnalysisCycle> cycleFactory
    ) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        Objects.requireNonNull(steps, "steps cannot be null");
        Objects.requireNonNull(cycleFactory, "cycleFactory cannot be null");

        this.store = new MetricsStore(config.sampleCapacity(), config.retentionPeriod(), config.recentWindow(), clock);
        this.events = new AnalyzerEvents();
        this.baseline = new PerformanceBaseline();
        this.repository = new AnalysisRepository(config.reportDirectory());
        this.analysisHistory = new RetentionBuffer<>(
            config.historyCapacity(), config.retentionPeriod(), Analysis::timestamp, clock);
        this.benchmarkHistory = new RetentionBuffer<>(
            config.historyCapacity(), config.retentionPeriod(), BenchmarkResult::timestamp, clock);

        this.cycle = cycleFactory.apply(new BenchmarkRunner(benchmarks, baseline, clock));
        this.reportGenerator = new OptimizationReportGenerator(
            config.optimizationTargets(), cycle.trendAnalyzer(), clock);

        this.scheduler = Executors.newSingleThreadScheduledExecutor(daemon("performance-analyzer"));
        this.optimizerExecutor = Executors.newSingleThreadExecutor(daemon("performance-optimizer"));
        this.optimizer = new OptimizationExecutor(
            store,
            steps,
            config.stabilizationDelay(),
            optimizerExecutor,
            events,
            new RetentionBuffer<>(config.historyCapacity(), config.retentionPeriod(),
                ImplementedOptimization::implementedAt, clock),
            clock
        );
    }

    private static ThreadFactory daemon(String name) {
        return r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        };
    }

    // ========== Lifecycle ==========

    /**
     * Loads the stored baseline, runs the initial benchmarks when enabled, starts the timer and
     * emits {@code analyzer:initialized}. Ignored, with a warning, once the analyzer is initialized
     * or shut down.
     */
    public void initialize() {
        if (stopped.get()) {
            logger.warn("Analyzer has been shut down, not initializing");
            return;
        }
        if (!started.compareAndSet(false, true)) {
            logger.warn("Performance analyzer already initialized");
            return;
        }
        logger.info("Initializing performance analyzer: interval={}, autoOptimization={}, benchmarks={}",
            config.analysisInterval(), config.autoOptimization(), config.benchmarkEnabled());

        reloadBaseline();

        if (config.benchmarkEnabled()) {
            try {
                cycle.benchmarkRunner().runInitialBenchmarks().forEach(benchmarkHistory::add);
            } catch (RuntimeException e) {
                logger.error("Initial benchmarks failed", e);
                // Continue without a seeded baseline
            }
        }

        long intervalMillis = config.analysisInterval().toMillis();
        timer = scheduler.scheduleAtFixedRate(this::tick, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        logger.info("Performance analysis started");

        events.initialized();
    }

    /**
     * Stops the timer, waits for the running cycle, aborts optimizations still in flight, persists history and baseline, writes the final
     * report when reporting is enabled and emits {@code analyzer:shutdown} with the final analysis
     * flagged as a shutdown report. Calling it again has no effect.
     */
    public void shutdown() {
        if (!stopped.compareAndSet(false, true)) {
            logger.debug("Performance analyzer already shut down");
            return;
        }
        logger.info("Shutting down performance analyzer");

        ScheduledFuture<?> activeTimer = timer;
        if (activeTimer != null) {
            activeTimer.cancel(false);
        }
        drainRunningCycle();
        optimizer.abortInFlight("analyzer shutting down");
        if (!runningCycle.isDone()) {
            logger.warn("Analysis cycle still running after aborting its optimizations");
        }

        saveResults();
        if (config.reportingEnabled()) {
            writeFinalReport();
        }

        Optional<Analysis> finalAnalysis = Optional.ofNullable(currentAnalysis)
            .map(analysis -> analysis.asShutdownReport(clock.instant()));
        events.shutdown(finalAnalysis);

        stop(scheduler);
        stop(optimizerExecutor);
        logger.info("Performance analyzer stopped");
    }

    @Override
    public void close() {
        shutdown();
    }

    private void drainRunningCycle() {
        long timeoutMillis = config.shutdownDrainTimeout().toMillis();
        try {
            // a cycle starting on the analyzer thread has published runningCycle once this returns
            scheduler.submit(() -> { }).get(timeoutMillis, TimeUnit.MILLISECONDS);
            runningCycle.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            logger.warn("Running analysis cycle did not finish within {}", config.shutdownDrainTimeout());
        } catch (ExecutionException e) {
            logger.error("Running analysis cycle failed during shutdown", e.getCause());
        } catch (InterruptedException e) {
            logger.warn("Interrupted while waiting for running analysis cycle");
            Thread.currentThread().interrupt();
        }
    }

    private void saveResults() {
        try {
            repository.saveHistory(new PersistedHistory(
                analysisHistory.snapshot(), optimizer.history(), baseline.snapshot()));
            repository.saveBaseline(baseline.snapshot());
        } catch (UncheckedIOException e) {
            logger.error("Failed to save analysis results", e);
        }
    }

    private void writeFinalReport() {
        Optional<OptimizationReport> report = generateOptimizationReport();
        if (report.isEmpty()) {
            logger.info("No analysis available, skipping final report");
            return;
        }
        try {
            repository.saveReport(report.get());
        } catch (UncheckedIOException e) {
            logger.error("Failed to write final optimization report", e);
        }
    }

    private void stop(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(EXECUTOR_TERMINATION_SECONDS, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ========== Ingest and control ==========

    /**
     * Stores a sample. Never rejects; a null sample is logged and ignored.
     */
    public void addMetrics(MetricSample sample) {
        store.addMetrics(sample);
    }

    /**
     * Runs a cycle now on the analyzer thread, subject to the same skip rules as a timer tick.
     *
     * @return future of the analysis, completed after the cycle's optimizations; empty if the
     *     cycle was skipped or failed
     */
    public CompletableFuture<Optional<Analysis>> analyzeNow() {
        if (stopped.get()) {
            logger.warn("Analyzer has been shut down, not analyzing");
            return CompletableFuture.completedFuture(Optional.empty());
        }
        try {
            return CompletableFuture.supplyAsync(this::startCycle, scheduler).thenCompose(cycleResult -> cycleResult);
        } catch (RejectedExecutionException e) {
            logger.warn("Analyzer thread is no longer accepting work", e);
            return CompletableFuture.completedFuture(Optional.empty());
        }
    }

    /**
     * Executes a recommendation regardless of the auto-optimization gate.
     *
     * @return future of the recorded optimization; completes exceptionally with an
     *     {@link OptimizationException} if a step threw or the analyzer has been shut down
     */
    public CompletableFuture<ImplementedOptimization> executeOptimization(OptimizationRecommendation recommendation) {
        if (stopped.get()) {
            logger.warn("Analyzer has been shut down, not executing {}", recommendation.id());
            return CompletableFuture.failedFuture(new OptimizationException(
                recommendation.id(), "Analyzer has been shut down, " + recommendation.id() + " not executed"));
        }
        return optimizer.execute(recommendation);
    }

    /**
     * Replaces the baseline with the stored one.
     *
     * @return true if a stored baseline was found and loaded
     */
    public boolean reloadBaseline() {
        try {
            Optional<Map<String, Double>> stored = repository.loadBaseline();
            stored.ifPresent(baseline::replaceAll);
            return stored.isPresent();
        } catch (UncheckedIOException e) {
            logger.warn("Failed to load performance baseline, keeping current one", e);
            return false;
        }
    }

    public Subscription subscribe(AnalyzerListener listener) {
        return events.subscribe(listener);
    }

    // ========== Queries ==========

    public Optional<Analysis> getCurrentAnalysis() {
        return Optional.ofNullable(currentAnalysis);
    }

    public List<OptimizationRecommendation> getOptimizationRecommendations() {
        Analysis analysis = currentAnalysis;
        return analysis == null ? List.of() : analysis.recommendations();
    }

    public List<Bottleneck> getBottlenecks() {
        Analysis analysis = currentAnalysis;
        return analysis == null ? List.of() : analysis.bottlenecks();
    }

    public List<ImplementedOptimization> getOptimizationHistory() {
        return optimizer.history();
    }

    public List<Analysis> getAnalysisHistory() {
        return analysisHistory.snapshot();
    }

    public List<BenchmarkResult> getBenchmarkHistory() {
        return benchmarkHistory.snapshot();
    }

    public Map<String, Double> getPerformanceBaseline() {
        return baseline.snapshot();
    }

    /**
     * @return report over the current analysis, or empty if no analysis has completed yet
     */
    public Optional<OptimizationReport> generateOptimizationReport() {
        Analysis analysis = currentAnalysis;
        if (analysis == null) {
            return Optional.empty();
        }
        return Optional.of(reportGenerator.generate(analysis, optimizer.history(), store.getRecent()));
    }

    public AnalyzerConfig config() {
        return config;
    }

    public boolean isCycleInProgress() {
        return cycleInProgress.get();
    }

    // ========== Cycle ==========

    private void tick() {
        try {
            startCycle();
        } catch (RuntimeException e) {
            // Keep the timer alive
            logger.error("Analysis tick failed", e);
        }
    }

    private CompletableFuture<Optional<Analysis>> startCycle() {
        if (stopped.get()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        if (store.isEmpty()) {
            logger.debug("No metrics stored, skipping analysis");
            return CompletableFuture.completedFuture(Optional.empty());
        }
        if (!cycleInProgress.compareAndSet(false, true)) {
            logger.warn("Analysis cycle still in progress, skipping tick");
            return CompletableFuture.completedFuture(Optional.empty());
        }

        CompletableFuture<Optional<Analysis>> current;
        try {
            current = runCycle();
        } catch (RuntimeException e) {
            cycleInProgress.set(false);
            throw e;
        }
        current = current.whenComplete((analysis, error) -> cycleInProgress.set(false));
        runningCycle = current;
        return current;
    }

    private CompletableFuture<Optional<Analysis>> runCycle() {
        Analysis analysis;
        try {
            Optional<Analysis> completed = performAnalysis();
            if (completed.isEmpty()) {
                return CompletableFuture.completedFuture(Optional.empty());
            }
            analysis = completed.get();
        } catch (RuntimeException e) {
            logger.error("Performance analysis failed", e);
            events.analysisFailed(e);
            return CompletableFuture.completedFuture(Optional.empty());
        }

        if (!config.autoOptimization()) {
            return CompletableFuture.completedFuture(Optional.of(analysis));
        }
        List<OptimizationRecommendation> selected = AutoOptimizationGate.select(analysis.recommendations());
        if (selected.isEmpty()) {
            return CompletableFuture.completedFuture(Optional.of(analysis));
        }

        logger.info("Auto-optimizing {} of {} recommendations", selected.size(), analysis.recommendations().size());
        return optimizer.executeAll(selected)
            .thenApply(implemented -> {
                logger.info("Auto-optimization finished: {} of {} recorded", implemented.size(), selected.size());
                return Optional.of(analysis);
            });
    }

    private Optional<Analysis> performAnalysis() {
        List<MetricSample> recent = store.getRecent();
        if (recent.isEmpty()) {
            logger.warn("No metrics within the last {}, skipping analysis", config.recentWindow());
            return Optional.empty();
        }

        Analysis analysis = cycle.run(recent, config.benchmarkEnabled());

        currentAnalysis = analysis;
        analysisHistory.add(analysis);
        analysis.benchmarks().forEach(benchmarkHistory::add);
        pruneHistories();

        logger.info("Performance analysis completed: overall score {}, {} bottlenecks, {} recommendations",
            String.format("%.1f", analysis.overallScore()),
            analysis.bottlenecks().size(),
            analysis.recommendations().size());
        events.analysisCompleted(analysis);
        return Optional.of(analysis);
    }

    private void pruneHistories() {
        int pruned = store.prune()
            + analysisHistory.prune()
            + benchmarkHistory.prune()
            + optimizer.pruneHistory();
        if (pruned > 0) {
            logger.debug("Pruned {} entries older than {}", pruned, config.retentionPeriod());
        }
    }
}
