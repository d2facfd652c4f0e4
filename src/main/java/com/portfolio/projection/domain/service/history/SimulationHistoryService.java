package com.portfolio.projection.domain.service.history;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.portfolio.projection.domain.model.SimulationResult;
import com.portfolio.projection.domain.model.SimulationRunRecord;
import com.portfolio.projection.domain.model.SimulationStatistics;
import com.portfolio.projection.domain.repository.SimulationRunRepository;
import com.portfolio.projection.domain.service.montecarlo.SimulationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Bounded history of finished runs. Only headline numbers plus the request and statistics JSON
 * are kept; paths are never stored.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SimulationHistoryService {

    private final SimulationRunRepository repository;
    private final SimulationProperties properties;
    private final ObjectMapper objectMapper;

    public SimulationRunRecord record(SimulationResult result) {
        SimulationStatistics stats = result.getStatistics();
        SimulationRunRecord saved = repository.save(SimulationRunRecord.builder()
                .runId(result.getId())
                .createdAtEpochMs(result.getTimestamp())
                .initialInvestment(result.getRequest().getInitialInvestment())
                .timeHorizon(result.getRequest().getTimeHorizon())
                .numSimulations(result.getRequest().getNumSimulations())
                .assetClassCount(result.getRequest().getAssetClasses().size())
                .drawdownEnabled(result.getRequest().isEnableDrawdown())
                .annualDrawdown(result.getRequest().getAnnualDrawdown())
                .accountType(result.getRequest().effectiveTaxSettings().effectiveAccountType().name())
                .seed(result.getSeed())
                .executionMode(result.getExecutionMode().name())
                .calcDurationMicros(result.getCalcDurationMicros())
                .medianFinalValue(stats.getMedian().getFinalValue())
                .percentile5FinalValue(stats.getPercentile5().getFinalValue())
                .percentile95FinalValue(stats.getPercentile95().getFinalValue())
                .meanFinalValue(stats.getMean().getFinalValue())
                .probabilityOfDepletion(stats.getProbabilityOfDepletion())
                .requestJson(toJson(result.getRequest()))
                .statisticsJson(toJson(stats))
                .build());

        log.debug("[History] run stored: runId={}, id={}", saved.getRunId(), saved.getId());
        return saved;
    }

    public Page<SimulationRunRecord> recent(int page, int size) {
        int safePage = Math.max(0, page);
        int safeSize = Math.min(properties.getHistory().getMaxRecords(), Math.max(1, size));
        return repository.findAllByOrderByCreatedAtEpochMsDesc(PageRequest.of(safePage, safeSize));
    }

    public int defaultPageSize() {
        return properties.getHistory().getPageSize();
    }

    public Optional<SimulationRunRecord> find(String runId) {
        if (runId == null || runId.isBlank()) return Optional.empty();
        return repository.findByRunId(runId);
    }

    @Scheduled(fixedDelayString = "${simulation.history.prune-interval-ms:60000}")
    public void pruneHistory() {
        int maxRecords = properties.getHistory().getMaxRecords();
        long total = repository.count();
        if (total <= maxRecords) return;

        int excess = (int) Math.min(Integer.MAX_VALUE, total - maxRecords);
        List<SimulationRunRecord> oldest = repository.findAll(
                PageRequest.of(0, excess, Sort.by("createdAtEpochMs").ascending().and(Sort.by("id").ascending())))
                .getContent();

        repository.deleteAllInBatch(oldest);
        log.info("[History] pruned {} runs, kept={}", oldest.size(), total - oldest.size());
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("[History] JSON serialization failed: type={}", value.getClass().getSimpleName(), e);
            return null;
        }
    }
}
