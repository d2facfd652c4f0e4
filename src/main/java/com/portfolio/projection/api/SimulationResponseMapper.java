package com.portfolio.projection.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.portfolio.projection.api.dto.SimulationResponse;
import com.portfolio.projection.domain.model.DistributionPoint;
import com.portfolio.projection.domain.model.PathPoint;
import com.portfolio.projection.domain.model.SimulationPath;
import com.portfolio.projection.domain.model.SimulationResult;
import com.portfolio.projection.domain.model.SimulationRunRecord;
import com.portfolio.projection.domain.model.SimulationStatistics;
import com.portfolio.projection.domain.model.WithdrawalSummary;
import com.portfolio.projection.domain.model.YearlyPercentileBand;
import com.portfolio.projection.domain.service.montecarlo.SimulationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Display formatting applied only on the way out: money to cents, ratios to six decimals,
 * and a capped number of sample paths. The engine itself keeps full precision.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SimulationResponseMapper {

    private static final int MONEY_SCALE = 2;
    private static final int RATIO_SCALE = 6;

    private final SimulationProperties properties;
    private final ObjectMapper objectMapper;

    public SimulationResponse toResponse(SimulationResult result) {
        int maxPaths = Math.max(0, properties.getApi().getMaxPathsInResponse());
        List<List<PathPoint>> samplePaths = result.getPaths().stream()
                .limit(maxPaths)
                .map(this::roundPath)
                .toList();

        double[] finalValues = result.getFinalValues();
        for (int i = 0; i < finalValues.length; i++) {
            finalValues[i] = money(finalValues[i]);
        }

        return new SimulationResponse(
                result.getId(),
                result.getTimestamp(),
                samplePaths,
                result.getPaths().size(),
                finalValues,
                roundStatistics(result.getStatistics()),
                result.getYearlyBands().stream().map(this::roundBand).toList(),
                roundWithdrawals(result.getWithdrawalSummary()),
                result.getRequest(),
                result.getSeed(),
                result.getExecutionMode().name(),
                result.getCalcDurationMicros());
    }

    public Map<String, Object> toSummary(SimulationRunRecord record) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("run_id", record.getRunId());
        summary.put("created_at_epoch_ms", record.getCreatedAtEpochMs());
        summary.put("initial_investment", money(record.getInitialInvestment()));
        summary.put("time_horizon", record.getTimeHorizon());
        summary.put("num_simulations", record.getNumSimulations());
        summary.put("asset_class_count", record.getAssetClassCount());
        summary.put("drawdown_enabled", record.isDrawdownEnabled());
        summary.put("annual_drawdown", money(record.getAnnualDrawdown()));
        summary.put("account_type", record.getAccountType());
        summary.put("execution_mode", record.getExecutionMode());
        summary.put("median_final_value", money(record.getMedianFinalValue()));
        summary.put("percentile_5_final_value", money(record.getPercentile5FinalValue()));
        summary.put("percentile_95_final_value", money(record.getPercentile95FinalValue()));
        summary.put("mean_final_value", money(record.getMeanFinalValue()));
        summary.put("probability_of_depletion", ratio(record.getProbabilityOfDepletion()));
        return summary;
    }

    public Map<String, Object> toDetail(SimulationRunRecord record) {
        Map<String, Object> detail = toSummary(record);
        detail.put("seed", record.getSeed());
        detail.put("calc_duration_micros", record.getCalcDurationMicros());
        detail.put("parameters", readTree(record.getRequestJson()));
        detail.put("statistics", readTree(record.getStatisticsJson()));
        return detail;
    }

    SimulationStatistics roundStatistics(SimulationStatistics s) {
        return s.toBuilder()
                .percentile5(roundPoint(s.getPercentile5()))
                .percentile10(roundPoint(s.getPercentile10()))
                .percentile25(roundPoint(s.getPercentile25()))
                .median(roundPoint(s.getMedian()))
                .percentile75(roundPoint(s.getPercentile75()))
                .percentile90(roundPoint(s.getPercentile90()))
                .percentile95(roundPoint(s.getPercentile95()))
                .mean(roundPoint(s.getMean()))
                .min(roundPoint(s.getMin()))
                .max(roundPoint(s.getMax()))
                .finalValueStdDeviation(money(s.getFinalValueStdDeviation()))
                .totalReturnStdDeviation(ratio(s.getTotalReturnStdDeviation()))
                .volatility(ratio(s.getVolatility()))
                .probabilityOfDepletion(ratio(s.getProbabilityOfDepletion()))
                .probabilityOfMaintaining(ratio(s.getProbabilityOfMaintaining()))
                .probabilityOfDoubling(ratio(s.getProbabilityOfDoubling()))
                .totalDrawdowns(money(s.getTotalDrawdowns()))
                .build();
    }

    private DistributionPoint roundPoint(DistributionPoint p) {
        return p.toBuilder()
                .finalValue(money(p.getFinalValue()))
                .totalReturn(ratio(p.getTotalReturn()))
                .annualizedReturn(ratio(p.getAnnualizedReturn()))
                .build();
    }

    private YearlyPercentileBand roundBand(YearlyPercentileBand b) {
        return b.toBuilder()
                .percentile5(money(b.getPercentile5()))
                .percentile25(money(b.getPercentile25()))
                .median(money(b.getMedian()))
                .percentile75(money(b.getPercentile75()))
                .percentile95(money(b.getPercentile95()))
                .build();
    }

    private WithdrawalSummary roundWithdrawals(WithdrawalSummary w) {
        return w.toBuilder()
                .meanGrossWithdrawn(money(w.getMeanGrossWithdrawn()))
                .meanTaxPaid(money(w.getMeanTaxPaid()))
                .meanNetWithdrawn(money(w.getMeanNetWithdrawn()))
                .build();
    }

    private List<PathPoint> roundPath(SimulationPath path) {
        return path.getPoints().stream()
                .map(p -> new PathPoint(p.year(), money(p.portfolioValue())))
                .toList();
    }

    private JsonNode readTree(String json) {
        if (json == null) return null;
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("[MC API] stored JSON unreadable: {}", e.getOriginalMessage());
            return null;
        }
    }

    static double money(double value) {
        return round(value, MONEY_SCALE);
    }

    static double ratio(double value) {
        return round(value, RATIO_SCALE);
    }

    private static double round(double value, int scale) {
        if (!Double.isFinite(value)) return value;
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
