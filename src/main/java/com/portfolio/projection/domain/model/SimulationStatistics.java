package com.portfolio.projection.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SimulationStatistics {

    private int sampleSize;

    private DistributionPoint percentile5;
    private DistributionPoint percentile10;
    private DistributionPoint percentile25;
    private DistributionPoint median;
    private DistributionPoint percentile75;
    private DistributionPoint percentile90;
    private DistributionPoint percentile95;

    private DistributionPoint mean;
    private DistributionPoint min;
    private DistributionPoint max;

    private double finalValueStdDeviation;
    private double totalReturnStdDeviation;

    /** Coefficient of variation of final values, std / mean; 0 when the mean is 0. */
    private double volatility;

    private double probabilityOfDepletion;
    private double probabilityOfMaintaining;
    private double probabilityOfDoubling;

    private double totalDrawdowns;

    private boolean drawdownEnabled;
    private double startingDrawdown;
    private double inflationRate;
    private int timeHorizon;
    private double initialInvestment;

    /**
     * Percentiles from p5 up to p95, in ascending order.
     */
    @JsonIgnore
    public List<DistributionPoint> orderedPercentiles() {
        return List.of(percentile5, percentile10, percentile25, median,
                percentile75, percentile90, percentile95);
    }
}
