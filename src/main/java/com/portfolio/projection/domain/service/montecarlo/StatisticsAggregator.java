package com.portfolio.projection.domain.service.montecarlo;

import com.portfolio.projection.domain.model.DistributionPoint;
import com.portfolio.projection.domain.model.SimulationPath;
import com.portfolio.projection.domain.model.SimulationRequest;
import com.portfolio.projection.domain.model.SimulationStatistics;
import com.portfolio.projection.domain.model.WithdrawalSummary;
import com.portfolio.projection.domain.model.YearlyPercentileBand;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Turns the final values of a batch into percentile, return, risk and probability figures.
 * Percentiles interpolate linearly between neighbouring order statistics at rank
 * {@code p / 100 * (n - 1)}. Every ratio with a zero denominator evaluates to 0.
 */
@Component
public class StatisticsAggregator {

    public SimulationStatistics aggregate(double[] finalValues, SimulationRequest request) {
        double initial = request.getInitialInvestment();
        int horizon = request.getTimeHorizon();
        int n = finalValues.length;

        double[] sorted = finalValues.clone();
        Arrays.sort(sorted);

        double mean = mean(sorted);
        double std = populationStdDeviation(sorted, mean);
        double minValue = n > 0 ? sorted[0] : 0.0;
        double maxValue = n > 0 ? sorted[n - 1] : 0.0;

        int depleted = 0;
        int maintained = 0;
        int doubled = 0;
        for (double v : sorted) {
            if (v <= 0) depleted++;
            if (v >= initial) maintained++;
            if (v >= 2 * initial) doubled++;
        }

        return SimulationStatistics.builder()
                .sampleSize(n)
                .percentile5(point(percentile(sorted, 5), initial, horizon))
                .percentile10(point(percentile(sorted, 10), initial, horizon))
                .percentile25(point(percentile(sorted, 25), initial, horizon))
                .median(point(percentile(sorted, 50), initial, horizon))
                .percentile75(point(percentile(sorted, 75), initial, horizon))
                .percentile90(point(percentile(sorted, 90), initial, horizon))
                .percentile95(point(percentile(sorted, 95), initial, horizon))
                .mean(point(mean, initial, horizon))
                .min(point(minValue, initial, horizon))
                .max(point(maxValue, initial, horizon))
                .finalValueStdDeviation(std)
                .totalReturnStdDeviation(safeDivide(std, initial))
                .volatility(safeDivide(std, mean))
                .probabilityOfDepletion(fraction(depleted, n))
                .probabilityOfMaintaining(fraction(maintained, n))
                .probabilityOfDoubling(fraction(doubled, n))
                .totalDrawdowns(totalDrawdowns(request))
                .drawdownEnabled(request.isEnableDrawdown())
                .startingDrawdown(request.getAnnualDrawdown())
                .inflationRate(request.getInflationRate())
                .timeHorizon(horizon)
                .initialInvestment(initial)
                .build();
    }

    /**
     * Cross-sectional percentiles of portfolio value for every year of the horizon.
     */
    public List<YearlyPercentileBand> yearlyBands(List<SimulationPath> paths, int timeHorizon) {
        List<YearlyPercentileBand> bands = new ArrayList<>(timeHorizon + 1);
        double[] column = new double[paths.size()];

        for (int year = 0; year <= timeHorizon; year++) {
            for (int i = 0; i < paths.size(); i++) {
                column[i] = paths.get(i).valueAt(year);
            }
            Arrays.sort(column);
            bands.add(YearlyPercentileBand.builder()
                    .year(year)
                    .percentile5(percentile(column, 5))
                    .percentile25(percentile(column, 25))
                    .median(percentile(column, 50))
                    .percentile75(percentile(column, 75))
                    .percentile95(percentile(column, 95))
                    .build());
        }
        return bands;
    }

    public WithdrawalSummary summarizeWithdrawals(List<SimulationPath> paths) {
        double gross = 0.0;
        double tax = 0.0;
        double net = 0.0;
        int depleted = 0;
        Integer earliest = null;

        for (SimulationPath path : paths) {
            gross += path.getTotalGrossWithdrawn();
            tax += path.getTotalTaxPaid();
            net += path.getTotalNetWithdrawn();
            if (path.isDepleted()) {
                depleted++;
                if (earliest == null || path.getDepletionYear() < earliest) {
                    earliest = path.getDepletionYear();
                }
            }
        }

        int n = paths.size();
        return WithdrawalSummary.builder()
                .meanGrossWithdrawn(safeDivide(gross, n))
                .meanTaxPaid(safeDivide(tax, n))
                .meanNetWithdrawn(safeDivide(net, n))
                .depletedPathCount(depleted)
                .earliestDepletionYear(earliest)
                .build();
    }

    /**
     * Nominal pre-tax sum of the scheduled withdrawals over the horizon.
     */
    public double totalDrawdowns(SimulationRequest request) {
        if (!request.withdrawsEachYear()) return 0.0;

        double total = 0.0;
        for (int year = 1; year <= request.getTimeHorizon(); year++) {
            total += request.getAnnualDrawdown() * Math.pow(1.0 + request.getInflationRate(), year - 1);
        }
        return total;
    }

    public double totalReturn(double value, double initialInvestment) {
        if (initialInvestment == 0) return 0.0;
        return value / initialInvestment - 1.0;
    }

    public double annualizedReturn(double totalReturn, int years) {
        if (years <= 0) return 0.0;
        double growth = 1.0 + totalReturn;
        if (growth <= 0) return -1.0;
        return Math.pow(growth, 1.0 / years) - 1.0;
    }

    static double percentile(double[] sorted, double p) {
        if (sorted.length == 0) return 0.0;

        double index = (p / 100.0) * (sorted.length - 1);
        int lower = (int) Math.floor(index);
        int upper = Math.min(lower + 1, sorted.length - 1);
        double fraction = index - lower;
        return sorted[lower] + fraction * (sorted[upper] - sorted[lower]);
    }

    private DistributionPoint point(double value, double initialInvestment, int horizon) {
        double totalReturn = totalReturn(value, initialInvestment);
        return DistributionPoint.builder()
                .finalValue(value)
                .totalReturn(totalReturn)
                .annualizedReturn(annualizedReturn(totalReturn, horizon))
                .build();
    }

    private double mean(double[] values) {
        if (values.length == 0) return 0.0;
        double sum = 0.0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    private double populationStdDeviation(double[] values, double mean) {
        if (values.length == 0) return 0.0;
        double m2 = 0.0;
        for (double v : values) {
            double d = v - mean;
            m2 += d * d;
        }
        return Math.sqrt(m2 / values.length);
    }

    private double fraction(int count, int n) {
        return n == 0 ? 0.0 : (double) count / n;
    }

    private double safeDivide(double numerator, double denominator) {
        return denominator == 0 ? 0.0 : numerator / denominator;
    }
}
