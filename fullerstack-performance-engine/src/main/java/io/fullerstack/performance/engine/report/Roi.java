package io.fullerstack.performance.engine.report;

import io.fullerstack.performance.core.model.ImplementedOptimization;

import java.util.List;

/**
 * Return on the optimizations implemented so far.
 *
 * @param totalInvestment sum of optimization costs
 * @param totalSavings    sum of every improvement value of every optimization
 * @param paybackPeriod   investment / savings, 0 when savings are not positive
 * @param roi             savings / investment * 100, 0 when investment is not positive
 */
public record Roi(double totalInvestment, double totalSavings, double paybackPeriod, double roi) {

    public static Roi from(List<ImplementedOptimization> history) {
        double investment = history.stream()
            .mapToDouble(ImplementedOptimization::cost)
            .sum();
        double savings = history.stream()
            .flatMap(optimization -> optimization.improvement().values().stream())
            .mapToDouble(Double::doubleValue)
            .sum();

        return new Roi(
            investment,
            savings,
            savings > 0 ? investment / savings : 0.0,
            investment > 0 ? savings / investment * 100.0 : 0.0
        );
    }

    public static Roi none() {
        return new Roi(0.0, 0.0, 0.0, 0.0);
    }
}
