package io.fullerstack.performance.engine.report;

import io.fullerstack.performance.core.config.OptimizationTarget;
import io.fullerstack.performance.core.model.Analysis;
import io.fullerstack.performance.core.model.ImplementedOptimization;
import io.fullerstack.performance.core.model.MetricSample;
import io.fullerstack.performance.core.model.Trend;
import io.fullerstack.performance.core.trend.TrendAnalyzer;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds {@link OptimizationReport}s.
 *
 * <h3>Next steps:</h3>
 * <ul>
 *   <li>overall score below 70: prioritize high-impact recommendations</li>
 *   <li>bottlenecks present: address them by impact</li>
 *   <li>recommendations present: implement the top three</li>
 *   <li>always: continue monitoring</li>
 * </ul>
 *
 * @author Fullerstack
 */
public class OptimizationReportGenerator {

    static final double ATTENTION_SCORE = 70.0;

    static final String PRIORITIZE = "Prioritize high-impact optimization recommendations";
    static final String ADDRESS_BOTTLENECKS = "Address identified bottlenecks starting with highest impact";
    static final String IMPLEMENT_TOP = "Implement top 3 optimization recommendations";
    static final String CONTINUE_MONITORING = "Continue monitoring and analysis";

    private final List<OptimizationTarget> targets;
    private final TrendAnalyzer trendAnalyzer;
    private final Clock clock;

    public OptimizationReportGenerator(List<OptimizationTarget> targets, TrendAnalyzer trendAnalyzer, Clock clock) {
        this.targets = List.copyOf(targets);
        this.trendAnalyzer = Objects.requireNonNull(trendAnalyzer, "trendAnalyzer cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * @param analysis current analysis
     * @param history  implemented optimizations, oldest first
     * @param recent   recent samples, oldest first; may be empty
     */
    public OptimizationReport generate(
        Analysis analysis,
        List<ImplementedOptimization> history,
        List<MetricSample> recent
    ) {
        Instant now = clock.instant();

        Set<String> implemented = history.stream()
            .map(ImplementedOptimization::id)
            .collect(Collectors.toSet());
        List<PlannedOptimization> planned = analysis.recommendations().stream()
            .filter(recommendation -> !implemented.contains(recommendation.id()))
            .map(recommendation -> PlannedOptimization.of(recommendation, now))
            .toList();

        List<OptimizationResult> results = history.stream()
            .map(OptimizationResult::of)
            .toList();

        return new OptimizationReport(
            now,
            analysis,
            history,
            planned,
            results,
            evaluateTargets(recent),
            Roi.from(history),
            nextSteps(analysis)
        );
    }

    List<TargetStatus> evaluateTargets(List<MetricSample> recent) {
        MetricSample latest = recent.isEmpty() ? null : recent.get(recent.size() - 1);
        List<TargetStatus> statuses = new ArrayList<>();

        for (OptimizationTarget target : targets) {
            Trend trend = trendAnalyzer.trend(recent.stream()
                .map(sample -> sample.value(target.metric()))
                .toList());
            Double current = latest == null ? null : latest.value(target.metric());
            statuses.add(new TargetStatus(
                target.name(), target.metric(), target.target(), current, trend,
                target.strategy(), target.priority(), isMet(target, current, trend)));
        }
        return statuses;
    }

    private static boolean isMet(OptimizationTarget target, Double current, Trend trend) {
        if (current == null) {
            return false;
        }
        return switch (target.strategy()) {
            case REDUCE -> current <= target.target();
            case INCREASE -> current >= target.target();
            case STABILIZE -> trend == Trend.STABLE;
        };
    }

    static List<String> nextSteps(Analysis analysis) {
        List<String> steps = new ArrayList<>();
        if (analysis.overallScore() < ATTENTION_SCORE) {
            steps.add(PRIORITIZE);
        }
        if (!analysis.bottlenecks().isEmpty()) {
            steps.add(ADDRESS_BOTTLENECKS);
        }
        if (!analysis.recommendations().isEmpty()) {
            steps.add(IMPLEMENT_TOP);
        }
        steps.add(CONTINUE_MONITORING);
        return steps;
    }
}
