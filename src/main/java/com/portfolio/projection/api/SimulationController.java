package com.portfolio.projection.api;

import com.portfolio.projection.domain.model.DefaultPortfolio;
import com.portfolio.projection.domain.model.SimulationRequest;
import com.portfolio.projection.domain.model.SimulationResult;
import com.portfolio.projection.domain.model.SimulationRunRecord;
import com.portfolio.projection.domain.service.defaults.DefaultAssetCatalog;
import com.portfolio.projection.domain.service.history.SimulationHistoryService;
import com.portfolio.projection.domain.service.montecarlo.SimulationError;
import com.portfolio.projection.domain.service.montecarlo.SimulationOrchestrator;
import com.portfolio.projection.domain.service.montecarlo.SimulationOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class SimulationController {

    private final SimulationOrchestrator orchestrator;
    private final SimulationHistoryService historyService;
    private final DefaultAssetCatalog defaultAssetCatalog;
    private final SimulationResponseMapper responseMapper;

    @GetMapping("/")
    public ResponseEntity<Map<String, Object>> root() {
        return ResponseEntity.ok(Map.of("message", "Investment Portfolio Analyzer API"));
    }

    @PostMapping("/simulate")
    public ResponseEntity<Object> simulate(@RequestBody SimulationRequest request) {
        log.info("[MC API] simulation requested: assets={}, horizon={}, paths={}, drawdown={}",
                request.getAssetClasses() == null ? 0 : request.getAssetClasses().size(),
                request.getTimeHorizon(), request.getNumSimulations(), request.isEnableDrawdown());

        SimulationOutcome outcome = orchestrator.simulate(request);
        if (!outcome.isSuccess()) {
            SimulationError error = outcome.error().orElseThrow();
            return ResponseEntity.status(statusFor(error)).body(Map.of(
                    "success", false,
                    "error", error.getKind().name(),
                    "message", error.getMessage()));
        }

        SimulationResult result = outcome.result().orElseThrow();
        CompletableFuture.runAsync(() -> {
            try {
                historyService.record(result);
            } catch (Exception e) {
                log.warn("[MC API] history store failed: runId={}", result.getId(), e);
            }
        });

        return ResponseEntity.ok(responseMapper.toResponse(result));
    }

    @GetMapping("/simulations")
    public ResponseEntity<Map<String, Object>> history(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(required = false) Integer size
    ) {
        int pageSize = size != null ? size : historyService.defaultPageSize();
        Page<SimulationRunRecord> result = historyService.recent(page, pageSize);

        List<Map<String, Object>> items = result.getContent().stream()
                .map(responseMapper::toSummary)
                .toList();

        return ResponseEntity.ok(Map.of(
                "success", true,
                "items", items,
                "page", result.getNumber(),
                "size", result.getSize(),
                "total_pages", result.getTotalPages(),
                "total_elements", result.getTotalElements(),
                "has_next", result.hasNext(),
                "has_previous", result.hasPrevious()
        ));
    }

    @GetMapping("/simulations/{runId}")
    public ResponseEntity<Map<String, Object>> historyEntry(@PathVariable String runId) {
        return historyService.find(runId)
                .map(responseMapper::toDetail)
                .<ResponseEntity<Map<String, Object>>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
                        "success", false,
                        "run_id", runId,
                        "message", "No stored simulation with this id")));
    }

    @GetMapping("/default-assets")
    public ResponseEntity<DefaultPortfolio> defaultAssets() {
        return ResponseEntity.ok(defaultAssetCatalog.getDefaults());
    }

    private HttpStatus statusFor(SimulationError error) {
        return switch (error.getCategory()) {
            case VALIDATION, CONFIGURATION -> HttpStatus.BAD_REQUEST;
            case CANCELLED -> HttpStatus.SERVICE_UNAVAILABLE;
            case INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
