package com.portfolio.projection.domain.model;

import com.portfolio.projection.domain.service.montecarlo.ExecutionMode;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class SimulationResult {

    private final String id;
    private final long timestamp;
    private final SimulationRequest request;
    private final List<SimulationPath> paths;
    private final double[] finalValues;
    private final SimulationStatistics statistics;
    private final List<YearlyPercentileBand> yearlyBands;
    private final WithdrawalSummary withdrawalSummary;
    private final long seed;
    private final ExecutionMode executionMode;
    private final long calcDurationMicros;

    public List<SimulationPath> getPaths() {
        return List.copyOf(paths);
    }

    public double[] getFinalValues() {
        return finalValues.clone();
    }
}
