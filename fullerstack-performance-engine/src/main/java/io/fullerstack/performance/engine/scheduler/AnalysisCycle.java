package io.fullerstack.performance.engine.scheduler;

import io.fullerstack.performance.core.bottleneck.BottleneckDetector;
import io.fullerstack.performance.core.bottleneck.BottleneckRules;
import io.fullerstack.performance.core.config.ScoreThresholds;
import io.fullerstack.performance.core.model.Analysis;
import io.fullerstack.performance.core.model.BenchmarkResult;
import io.fullerstack.performance.core.model.Bottleneck;
import io.fullerstack.performance.core.model.Category;
import io.fullerstack.performance.core.model.CategoryScore;
import io.fullerstack.performance.core.model.MetricSample;
import io.fullerstack.performance.core.model.OptimizationRecommendation;
import io.fullerstack.performance.core.model.TrendSummary;
import io.fullerstack.performance.core.recommendation.RecommendationEngine;
import io.fullerstack.performance.core.scoring.PerformanceScorer;
import io.fullerstack.performance.core.trend.TrendAnalyzer;
import io.fullerstack.performance.engine.benchmark.BenchmarkRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One analysis pass: score, trend, detect, recommend and, when enabled, benchmark.
 * <p>
 * Holds no state of its own; the scheduler decides when to run it and what to do with the
 * resulting {@link Analysis}.
 */
public class AnalysisCycle {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisCycle.class);

    private final PerformanceScorer scorer;
    private final TrendAnalyzer trendAnalyzer;
    private final BottleneckDetector detector;
    private final RecommendationEngine recommender;
    private final BenchmarkRunner benchmarkRunner;
    private final Duration period;
    private final Clock clock;

    public AnalysisCycle(
        PerformanceScorer scorer,
        TrendAnalyzer trendAnalyzer,
        BottleneckDetector detector,
        RecommendationEngine recommender,
        BenchmarkRunner benchmarkRunner,
        Duration period,
        Clock clock
    ) {
        this.scorer = Objects.requireNonNull(scorer, "scorer cannot be null");
        this.trendAnalyzer = Objects.requireNonNull(trendAnalyzer, "trendAnalyzer cannot be null");
        this.detector = Objects.requireNonNull(detector, "detector cannot be null");
        this.recommender = Objects.requireNonNull(recommender, "recommender cannot be null");
        this.benchmarkRunner = Objects.requireNonNull(benchmarkRunner, "benchmarkRunner cannot be null");
        this.period = Objects.requireNonNull(period, "period cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * Standard scorers and bottleneck rules for the thresholds.
     */
    public static AnalysisCycle standard(
        ScoreThresholds thresholds,
        BenchmarkRunner benchmarkRunner,
        Duration period,
        Clock clock
    ) {
        TrendAnalyzer trendAnalyzer = new TrendAnalyzer();
        return new AnalysisCycle(
            PerformanceScorer.standard(thresholds, trendAnalyzer),
            trendAnalyzer,
            new BottleneckDetector(BottleneckRules.defaults(thresholds)),
            new RecommendationEngine(),
            benchmarkRunner,
            period,
            clock
        );
    }

    /**
     * @param samples       recent samples, oldest first, not empty
     * @param runBenchmarks whether to run the benchmark suite in this pass
     */
    public Analysis run(List<MetricSample> samples, boolean runBenchmarks) {
        Instant timestamp = clock.instant();

        Map<Category, CategoryScore> categories = scorer.score(samples, timestamp);
        double overall = PerformanceScorer.overallScore(categories.values());
        TrendSummary trends = trendAnalyzer.summarize(samples);
        List<Bottleneck> bottlenecks = detector.detect(samples);
        List<OptimizationRecommendation> recommendations = recommender.recommend(categories, bottlenecks);
        List<BenchmarkResult> benchmarks = runBenchmarks ? benchmarkRunner.runAll() : List.of();

        logger.debug("Analysis over {} samples: overall {}, trend {}, {} bottlenecks, {} recommendations",
            samples.size(), overall, trends.overall(), bottlenecks.size(), recommendations.size());

        return new Analysis(
            timestamp,
            period,
            overall,
            categories,
            bottlenecks,
            recommendations,
            trends,
            benchmarks,
            false
        );
    }

    public TrendAnalyzer trendAnalyzer() {
        return trendAnalyzer;
    }

    public BenchmarkRunner benchmarkRunner() {
        return benchmarkRunner;
    }
}
