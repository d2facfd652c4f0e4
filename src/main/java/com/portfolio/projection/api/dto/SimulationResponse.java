package com.portfolio.projection.api.dto;

import com.portfolio.projection.domain.model.PathPoint;
import com.portfolio.projection.domain.model.SimulationRequest;
import com.portfolio.projection.domain.model.SimulationStatistics;
import com.portfolio.projection.domain.model.WithdrawalSummary;
import com.portfolio.projection.domain.model.YearlyPercentileBand;

import java.util.List;

public record SimulationResponse(
        String id,
        long timestamp,
        List<List<PathPoint>> simulationPaths,
        int totalPaths,
        double[] finalValues,
        SimulationStatistics statistics,
        List<YearlyPercentileBand> yearlyBands,
        WithdrawalSummary withdrawalSummary,
        SimulationRequest parameters,
        long seed,
        String executionMode,
        long calcDurationMicros
) {
}
