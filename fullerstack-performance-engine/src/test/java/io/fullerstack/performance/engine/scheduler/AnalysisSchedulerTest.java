package io.fullerstack.performance.engine.scheduler;

import io.fullerstack.performance.core.bottleneck.BottleneckDetector;
import io.fullerstack.performance.core.bottleneck.BottleneckRules;
import io.fullerstack.performance.core.config.AnalyzerConfig;
import io.fullerstack.performance.core.config.ScoreThresholds;
import io.fullerstack.performance.core.model.Analysis;
import io.fullerstack.performance.core.model.Bottleneck;
import io.fullerstack.performance.core.model.Category;
import io.fullerstack.performance.core.model.HealthStatus;
import io.fullerstack.performance.core.model.ImplementedOptimization;
import io.fullerstack.performance.core.model.OptimizationRecommendation;
import io.fullerstack.performance.core.model.OptimizationStatus;
import io.fullerstack.performance.core.recommendation.RecommendationEngine;
import io.fullerstack.performance.core.scoring.PerformanceScorer;
import io.fullerstack.performance.core.trend.TrendAnalyzer;
import io.fullerstack.performance.engine.EngineFixtures;
import io.fullerstack.performance.engine.benchmark.Benchmark;
import io.fullerstack.performance.engine.benchmark.BenchmarkMeasurement;
import io.fullerstack.performance.engine.events.AnalyzerListener;
import io.fullerstack.performance.engine.optimization.OptimizationException;
import io.fullerstack.performance.engine.optimization.StepExecutor;
import io.fullerstack.performance.engine.persistence.AnalysisRepository;
import io.fullerstack.performance.engine.report.OptimizationReport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class AnalysisSchedulerTest {

    @TempDir
    Path reportDirectory;

    private StepExecutor steps;
    private AnalyzerListener listener;
    private AnalysisScheduler analyzer;

    @BeforeEach
    void setUp() throws Exception {
        steps = mock(StepExecutor.class);
        when(steps.execute(anyString(), any())).thenReturn(true);
        listener = mock(AnalyzerListener.class);
    }

    @AfterEach
    void tearDown() {
        if (analyzer != null) {
            analyzer.shutdown();
        }
    }

    private AnalyzerConfig.Builder config() {
        return AnalyzerConfig.builder()
            .analysisInterval(Duration.ofHours(1))
            .benchmarkEnabled(false)
            .autoOptimization(false)
            .stabilizationDelay(Duration.ZERO)
            .stepDelay(Duration.ZERO)
            .shutdownDrainTimeout(Duration.ofSeconds(5))
            .reportDirectory(reportDirectory);
    }

    private AnalysisScheduler start(AnalyzerConfig config, List<Benchmark> benchmarks) {
        analyzer = new AnalysisScheduler(config, steps, benchmarks, Clock.systemUTC());
        analyzer.subscribe(listener);
        analyzer.initialize();
        return analyzer;
    }

    /**
     * Ten samples with CPU rising from 50 to 95 and response time from 100 to 2500 ms; the
     * latest also has throughput 50 req/s and a 10% error rate. Response time alone leaves the
     * application category at (30 + 100 + 100) / 3, above the critical cutoff, so throughput and
     * error rate are degraded as well.
     */
    private static void feedDegradingSamples(AnalysisScheduler analyzer) {
        Instant now = Instant.now();
        for (int i = 0; i < 10; i++) {
            boolean latest = i == 9;
            analyzer.addMetrics(EngineFixtures.sample(
                now.minusSeconds(10 - i),
                50 + i * 5,
                latest ? 2500 : 100 + i * 250,
                latest ? 50 : 1500,
                latest ? 10 : 0.1
            ));
        }
    }

    private static Analysis analyze(AnalysisScheduler analyzer) throws Exception {
        Optional<Analysis> analysis = analyzer.analyzeNow().get(30, TimeUnit.SECONDS);
        assertThat(analysis).isPresent();
        return analysis.get();
    }

    @Nested
    @DisplayName("Analysis cycle")
    class Cycle {

        @Test
        @DisplayName("degrading samples yield critical application health, bottlenecks and recommendations")
        void endToEnd() throws Exception {
            // given
            start(config().build(), List.of());
            feedDegradingSamples(analyzer);

            // when
            Analysis analysis = analyze(analyzer);

            // then
            assertThat(analysis.category(Category.APPLICATION).status()).isEqualTo(HealthStatus.CRITICAL);
            assertThat(analysis.bottlenecks()).extracting(Bottleneck::id)
                .contains("cpu-bottleneck", "response-time-bottleneck");
            assertThat(analysis.recommendations()).hasSizeGreaterThanOrEqualTo(2);
            assertThat(analysis.recommendations()).extracting(OptimizationRecommendation::id)
                .anyMatch(id -> id.startsWith("fix-"));
            assertThat(analysis.shutdownReport()).isFalse();

            assertThat(analyzer.getCurrentAnalysis()).contains(analysis);
            assertThat(analyzer.getAnalysisHistory()).containsExactly(analysis);
            assertThat(analyzer.getBottlenecks()).isEqualTo(analysis.bottlenecks());
            assertThat(analyzer.getOptimizationRecommendations()).isEqualTo(analysis.recommendations());
            verify(listener).onInitialized();
            verify(listener).onAnalysisCompleted(analysis);
        }

        @Test
        @DisplayName("an empty store skips the cycle")
        void emptyStoreSkips() throws Exception {
            start(config().build(), List.of());

            assertThat(analyzer.analyzeNow().get(5, TimeUnit.SECONDS)).isEmpty();

            assertThat(analyzer.getCurrentAnalysis()).isEmpty();
            verify(listener, never()).onAnalysisCompleted(any());
        }

        @Test
        void timerRunsCycles() {
            start(config().analysisInterval(Duration.ofMillis(100)).build(), List.of());
            analyzer.addMetrics(EngineFixtures.healthy(Instant.now()));

            await().atMost(5, TimeUnit.SECONDS).until(() -> analyzer.getCurrentAnalysis().isPresent());

            assertThat(analyzer.getAnalysisHistory()).isNotEmpty();
        }

        @Test
        @DisplayName("a cycle requested while another is optimizing is skipped, not queued")
        void overlappingCycleIsSkipped() throws Exception {
            // given a cycle held in its first optimization step
            CountDownLatch release = new CountDownLatch(1);
            when(steps.execute(anyString(), any())).thenAnswer(invocation -> release.await(10, TimeUnit.SECONDS));
            start(config().autoOptimization(true).build(), List.of());
            feedDegradingSamples(analyzer);
            CompletableFuture<Optional<Analysis>> first = analyzer.analyzeNow();
            verify(steps, timeout(5000)).execute(anyString(), any());

            try {
                // when
                Optional<Analysis> second = analyzer.analyzeNow().get(5, TimeUnit.SECONDS);

                // then
                assertThat(second).isEmpty();
                assertThat(analyzer.isCycleInProgress()).isTrue();
                assertThat(analyzer.getAnalysisHistory()).hasSize(1);
            } finally {
                release.countDown();
            }
            assertThat(first.get(10, TimeUnit.SECONDS)).isPresent();
            assertThat(analyzer.isCycleInProgress()).isFalse();
            assertThat(analyzer.getAnalysisHistory()).hasSize(1);
            verify(listener).onAnalysisCompleted(any());
        }

        @Test
        @DisplayName("a failing cycle emits analysis:failed and the next cycle still runs")
        void failedCycleDoesNotStopAnalysis() throws Exception {
            // given a recommender that fails once
            RecommendationEngine recommender = spy(new RecommendationEngine());
            doThrow(new IllegalStateException("recommender unavailable"))
                .doCallRealMethod()
                .when(recommender).recommend(any(), any());
            analyzer = new AnalysisScheduler(config().build(), steps, List.of(), Clock.systemUTC(), runner -> {
                TrendAnalyzer trends = new TrendAnalyzer();
                return new AnalysisCycle(
                    PerformanceScorer.standard(ScoreThresholds.withDefaults(), trends),
                    trends,
                    new BottleneckDetector(BottleneckRules.defaults(ScoreThresholds.withDefaults())),
                    recommender,
                    runner,
                    Duration.ofHours(1),
                    Clock.systemUTC()
                );
            });
            analyzer.subscribe(listener);
            analyzer.initialize();
            feedDegradingSamples(analyzer);

            // when
            Optional<Analysis> failed = analyzer.analyzeNow().get(5, TimeUnit.SECONDS);

            // then
            assertThat(failed).isEmpty();
            assertThat(analyzer.getCurrentAnalysis()).isEmpty();
            assertThat(analyzer.isCycleInProgress()).isFalse();
            verify(listener).onAnalysisFailed(argThat(error -> error.getMessage().equals("recommender unavailable")));
            verify(listener, never()).onAnalysisCompleted(any());

            Analysis next = analyze(analyzer);
            assertThat(analyzer.getCurrentAnalysis()).contains(next);
            assertThat(next.recommendations()).isNotEmpty();
        }

        @Test
        void periodIsTheRecentWindow() throws Exception {
            start(config().recentWindow(Duration.ofMinutes(15)).build(), List.of());
            analyzer.addMetrics(EngineFixtures.healthy(Instant.now()));

            assertThat(analyze(analyzer).period()).isEqualTo(Duration.ofMinutes(15));
        }

        @Test
        void benchmarksRunWhenEnabled() throws Exception {
            start(config().benchmarkEnabled(true).build(), List.of(fixedBenchmark(75.0)));
            analyzer.addMetrics(EngineFixtures.healthy(Instant.now()));

            Analysis analysis = analyze(analyzer);

            assertThat(analysis.benchmarks()).singleElement()
                .satisfies(result -> assertThat(result.comparison()).containsKey("score"));
            // initial run plus the cycle's run
            assertThat(analyzer.getBenchmarkHistory()).hasSize(2);
            assertThat(analyzer.getPerformanceBaseline()).containsEntry("fixed", 75.0);
        }
    }

    @Nested
    @DisplayName("Auto-optimization")
    class AutoOptimization {

        @Test
        @DisplayName("only gated recommendations run, and the cycle completes after them")
        void gatedRecommendationsRun() throws Exception {
            start(config().autoOptimization(true).build(), List.of());
            feedDegradingSamples(analyzer);

            analyze(analyzer);

            assertThat(analyzer.getOptimizationHistory()).extracting(ImplementedOptimization::id)
                .containsExactlyInAnyOrder("fix-cpu-bottleneck", "fix-response-time-bottleneck");
            assertThat(analyzer.getOptimizationHistory())
                .allSatisfy(optimization -> assertThat(optimization.status()).isEqualTo(OptimizationStatus.SUCCESS));
            assertThat(analyzer.isCycleInProgress()).isFalse();
        }

        @Test
        void disabledMeansNothingRuns() throws Exception {
            start(config().build(), List.of());
            feedDegradingSamples(analyzer);

            analyze(analyzer);

            assertThat(analyzer.getOptimizationHistory()).isEmpty();
            verify(steps, never()).execute(anyString(), any());
        }

        @Test
        @DisplayName("recommendations outside the gate can be executed explicitly")
        void explicitExecution() throws Exception {
            start(config().build(), List.of());
            feedDegradingSamples(analyzer);
            OptimizationRecommendation applicationOptimization = analyze(analyzer).recommendations().stream()
                .filter(recommendation -> recommendation.id().equals("application-optimization"))
                .findFirst()
                .orElseThrow();

            ImplementedOptimization result = analyzer.executeOptimization(applicationOptimization)
                .get(10, TimeUnit.SECONDS);

            assertThat(result.status()).isEqualTo(OptimizationStatus.SUCCESS);
            assertThat(analyzer.getOptimizationHistory()).containsExactly(result);
            verify(listener).onOptimizationCompleted(result);
        }
    }

    @Nested
    @DisplayName("Reports and shutdown")
    class Shutdown {

        @Test
        void noReportBeforeFirstAnalysis() {
            start(config().build(), List.of());

            assertThat(analyzer.generateOptimizationReport()).isEmpty();
        }

        @Test
        void reportReflectsCurrentAnalysis() throws Exception {
            start(config().build(), List.of());
            feedDegradingSamples(analyzer);
            Analysis analysis = analyze(analyzer);

            OptimizationReport report = analyzer.generateOptimizationReport().orElseThrow();

            assertThat(report.analysis()).isEqualTo(analysis);
            assertThat(report.plannedOptimizations()).hasSize(analysis.recommendations().size());
            assertThat(report.nextSteps()).last().isEqualTo("Continue monitoring and analysis");
            assertThat(report.targets()).extracting(status -> status.name())
                .containsExactly("response-time", "throughput", "cpu-usage");
        }

        @Test
        @DisplayName("shutdown persists results and emits the final analysis flagged as shutdown report")
        void shutdownPersistsAndEmits() throws Exception {
            start(config().build(), List.of());
            feedDegradingSamples(analyzer);
            analyze(analyzer);

            analyzer.shutdown();

            verify(listener).onShutdown(argThat(finalAnalysis ->
                finalAnalysis.isPresent() && finalAnalysis.get().shutdownReport()));
            assertThat(reportDirectory.resolve(AnalysisRepository.HISTORY_FILE)).exists();
            assertThat(reportDirectory.resolve(AnalysisRepository.BASELINE_FILE)).exists();
            assertThat(reportFiles()).hasSize(1);
        }

        @Test
        void reportingDisabledWritesNoReport() throws Exception {
            start(config().reportingEnabled(false).build(), List.of());
            feedDegradingSamples(analyzer);
            analyze(analyzer);

            analyzer.shutdown();

            assertThat(reportFiles()).isEmpty();
            assertThat(reportDirectory.resolve(AnalysisRepository.HISTORY_FILE)).exists();
        }

        @Test
        void shutdownWithoutAnalysisEmitsEmpty() {
            start(config().build(), List.of());

            analyzer.shutdown();
            analyzer.shutdown();

            verify(listener).onShutdown(Optional.empty());
        }

        @Test
        @DisplayName("entry points called after shutdown log instead of throwing")
        void entryPointsAfterShutdown() {
            start(config().build(), List.of());
            analyzer.shutdown();
            OptimizationRecommendation recommendation = EngineFixtures.recommendation("tune-pool", List.of("Resize pool"));

            analyzer.initialize();
            CompletableFuture<ImplementedOptimization> future = analyzer.executeOptimization(recommendation);

            verify(listener).onInitialized();
            assertThat(future).isCompletedExceptionally();
            assertThatThrownBy(() -> future.get(1, TimeUnit.SECONDS))
                .hasCauseInstanceOf(OptimizationException.class);
            assertThat(analyzer.getOptimizationHistory()).isEmpty();
            verifyNoInteractions(steps);
        }

        @Test
        @DisplayName("optimizations outlasting the drain timeout are failed and the cycle completes")
        void drainTimeoutAbortsOptimizations() throws Exception {
            // given a cycle whose first optimization waits out a long stabilization delay
            start(config()
                .autoOptimization(true)
                .stabilizationDelay(Duration.ofSeconds(30))
                .shutdownDrainTimeout(Duration.ofMillis(200))
                .build(), List.of());
            feedDegradingSamples(analyzer);
            CompletableFuture<Optional<Analysis>> cycle = analyzer.analyzeNow();
            verify(steps, timeout(5000).atLeastOnce()).execute(anyString(), any());

            // when
            analyzer.shutdown();

            // then
            assertThat(cycle).isDone();
            assertThat(cycle.get()).isPresent();
            assertThat(analyzer.isCycleInProgress()).isFalse();
            assertThat(analyzer.getOptimizationHistory()).isEmpty();
            verify(listener, times(2)).onOptimizationFailed(any(), any(OptimizationException.class));
            verify(listener, never()).onOptimizationCompleted(any());
            verify(listener).onShutdown(argThat(Optional::isPresent));
        }

        @Test
        @DisplayName("the baseline saved on shutdown is loaded by the next analyzer")
        void baselineSurvivesRestart() {
            start(config().benchmarkEnabled(true).build(), List.of(fixedBenchmark(75.0)));
            analyzer.shutdown();

            AnalysisScheduler restarted = new AnalysisScheduler(config().build(), steps, List.of(), Clock.systemUTC());
            try {
                restarted.initialize();

                assertThat(restarted.getPerformanceBaseline()).containsOnly(Map.entry("fixed", 75.0));
                assertThat(restarted.reloadBaseline()).isTrue();
            } finally {
                restarted.shutdown();
            }
        }

        private List<Path> reportFiles() throws IOException {
            try (Stream<Path> files = Files.list(reportDirectory)) {
                return files
                    .filter(file -> file.getFileName().toString().startsWith(AnalysisRepository.REPORT_PREFIX))
                    .toList();
            }
        }
    }

    private static Benchmark fixedBenchmark(double score) {
        return new Benchmark() {
            @Override
            public String name() {
                return "fixed";
            }

            @Override
            public String category() {
                return "cpu";
            }

            @Override
            public BenchmarkMeasurement run() {
                return new BenchmarkMeasurement(Map.of("duration", 10.0), Map.of("duration", 100.0), score, Map.of());
            }
        };
    }
}
