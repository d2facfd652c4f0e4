package com.portfolio.projection.domain.service.montecarlo;

import com.portfolio.projection.domain.model.AccountType;
import com.portfolio.projection.domain.model.SimulationPath;
import com.portfolio.projection.domain.model.SimulationRequest;
import com.portfolio.projection.domain.model.SimulationResult;
import com.portfolio.projection.domain.model.SimulationStatistics;
import com.portfolio.projection.domain.service.montecarlo.SimulationError.Kind;
import com.portfolio.projection.infra.monitor.SimulationMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static com.portfolio.projection.domain.service.montecarlo.TestRequests.balancedRequest;
import static com.portfolio.projection.domain.service.montecarlo.TestRequests.flatRequest;
import static com.portfolio.projection.domain.service.montecarlo.TestRequests.taxes;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Slf4j
class SimulationOrchestratorTest {

    private final PathSimulator pathSimulator = new PathSimulator(new ReturnSampler(), new WithdrawalTaxCalculator());
    private final StatisticsAggregator aggregator = new StatisticsAggregator();

    private SimulationProperties properties;
    private SimpleMeterRegistry registry;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        properties = new SimulationProperties();
        properties.setParallelism(4);
        registry = new SimpleMeterRegistry();
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("zero-volatility portfolio without withdrawals stays flat on every path")
    void flatPortfolio() {
        SimulationResult result = success(orchestrator(pathSimulator).simulate(flatRequest().build()));

        assertThat(result.getPaths()).hasSize(5000);
        assertThat(result.getPaths()).allSatisfy(path ->
                assertThat(path.getValues()).containsOnly(1_000_000));
        SimulationStatistics stats = result.getStatistics();
        assertThat(stats.getMedian().getFinalValue()).isEqualTo(1_000_000);
        assertThat(stats.getProbabilityOfMaintaining()).isEqualTo(1.0);
        assertThat(stats.getProbabilityOfDepletion()).isZero();
        assertThat(result.getYearlyBands()).hasSize(4);
    }

    @Test
    @DisplayName("withdrawal larger than the portfolio depletes every path in year 1")
    void forcedDepletion() {
        SimulationRequest request = flatRequest()
                .enableDrawdown(true)
                .annualDrawdown(2_000_000)
                .taxSettings(taxes(AccountType.TAX_FREE, 0.15, 0.22, 0.0))
                .build();

        SimulationResult result = success(orchestrator(pathSimulator).simulate(request));

        assertThat(result.getPaths()).allSatisfy(path -> {
            assertThat(path.getValues()).containsExactly(1_000_000, 0, 0, 0);
            assertThat(path.getDepletionYear()).isEqualTo(1);
        });
        assertThat(result.getStatistics().getProbabilityOfDepletion()).isEqualTo(1.0);
        assertThat(result.getWithdrawalSummary().getDepletedPathCount()).isEqualTo(5000);
        assertThat(result.getWithdrawalSummary().getEarliestDepletionYear()).isEqualTo(1);
    }

    @Test
    @DisplayName("same request and seed reproduce the same final values")
    void deterministicPerSeed() {
        SimulationRequest request = balancedRequest().seed(7L).build();
        SimulationOrchestrator orchestrator = orchestrator(pathSimulator);

        SimulationResult first = success(orchestrator.simulate(request));
        SimulationResult second = success(orchestrator.simulate(request));
        SimulationResult otherSeed = success(orchestrator.simulate(balancedRequest().seed(8L).build()));

        assertThat(first.getFinalValues()).containsExactly(second.getFinalValues());
        assertThat(first.getFinalValues()).isNotEqualTo(otherSeed.getFinalValues());
        assertThat(first.getSeed()).isEqualTo(7L);
        assertThat(first.getId()).isNotEqualTo(second.getId());
    }

    @Test
    @DisplayName("requests without a seed fall back to the configured default seed")
    void defaultSeed() {
        SimulationResult result = success(orchestrator(pathSimulator).simulate(balancedRequest().build()));

        assertThat(result.getSeed()).isEqualTo(42L);
        assertThat(result.getExecutionMode()).isEqualTo(ExecutionMode.SEQUENTIAL);
    }

    @Test
    @DisplayName("parallel mode is deterministic per seed and keeps path order")
    void parallelDeterminism() {
        SimulationRequest request = balancedRequest().seed(11L).build();
        SimulationResult sequential = success(orchestrator(pathSimulator).simulate(request));

        properties.setExecutionMode(ExecutionMode.PARALLEL);
        SimulationOrchestrator parallel = orchestrator(pathSimulator);
        SimulationResult first = success(parallel.simulate(request));
        SimulationResult second = success(parallel.simulate(request));

        assertThat(first.getExecutionMode()).isEqualTo(ExecutionMode.PARALLEL);
        assertThat(first.getPaths()).hasSize(5000).doesNotContainNull();
        assertThatThrownBy(() -> first.getPaths().set(0, null)).isInstanceOf(UnsupportedOperationException.class);
        assertThat(first.getFinalValues()).containsExactly(second.getFinalValues());
        assertThat(first.getFinalValues()).isNotEqualTo(sequential.getFinalValues());

        // path i of a parallel batch is reproducible on its own
        SimulationPath path17 = pathSimulator.simulate(request, RandomStreams.pathStream(11L, 17));
        assertThat(first.getPaths().get(17).getValues()).containsExactly(path17.getValues());
    }

    @Test
    @DisplayName("every path has horizon + 1 non-negative values starting at the initial investment")
    void pathInvariants() {
        SimulationResult result = success(orchestrator(pathSimulator).simulate(balancedRequest().build()));

        assertThat(result.getPaths()).allSatisfy(path -> {
            assertThat(path.size()).isEqualTo(11);
            assertThat(path.valueAt(0)).isEqualTo(5_000_000);
            assertThat(Arrays.stream(path.getValues()).min().getAsDouble()).isGreaterThanOrEqualTo(0.0);
        });
        log.info("balanced median={}, pDepletion={}",
                result.getStatistics().getMedian().getFinalValue(),
                result.getStatistics().getProbabilityOfDepletion());
    }

    @Test
    @DisplayName("sequential batch stops at the next path once cancelled")
    void sequentialCancellation() {
        AtomicInteger polls = new AtomicInteger();
        CancellationSignal afterHundredPaths = () -> polls.incrementAndGet() > 100;

        SimulationOutcome outcome = orchestrator(pathSimulator).simulate(balancedRequest().build(), afterHundredPaths);

        assertThat(outcome.isSuccess()).isFalse();
        SimulationError error = outcome.error().orElseThrow();
        assertThat(error.getKind()).isEqualTo(Kind.CANCELLED);
        assertThat(error.getMessage()).contains("100 of 5000");
        assertThat(failures(Kind.CANCELLED)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("parallel batch reports cancellation")
    void parallelCancellation() {
        properties.setExecutionMode(ExecutionMode.PARALLEL);

        SimulationOutcome outcome = orchestrator(pathSimulator).simulate(balancedRequest().build(), () -> true);

        assertThat(outcome.error()).map(SimulationError::getKind).contains(Kind.CANCELLED);
    }

    @Test
    @DisplayName("validation failure is returned without simulating any path")
    void validationFailure() {
        PathSimulator simulator = mock(PathSimulator.class);

        SimulationOutcome outcome = orchestrator(simulator).simulate(flatRequest().numSimulations(1000).build());

        assertThat(outcome.error()).map(SimulationError::getKind).contains(Kind.TOO_FEW_SIMULATIONS);
        assertThat(outcome.result()).isEmpty();
        verify(simulator, never()).simulate(any(), any());
        assertThat(failures(Kind.TOO_FEW_SIMULATIONS)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("unexpected failure inside a path becomes an internal error")
    void internalError() {
        PathSimulator simulator = mock(PathSimulator.class);
        when(simulator.simulate(any(), any())).thenThrow(new IllegalStateException("boom"));

        SimulationOutcome sequential = orchestrator(simulator).simulate(flatRequest().build());
        properties.setExecutionMode(ExecutionMode.PARALLEL);
        SimulationOutcome parallel = orchestrator(simulator).simulate(flatRequest().build());

        assertThat(sequential.error()).map(SimulationError::getKind).contains(Kind.INTERNAL_ERROR);
        assertThat(sequential.error().get().getMessage()).contains("boom");
        assertThat(parallel.error()).map(SimulationError::getKind).contains(Kind.INTERNAL_ERROR);
    }

    @Test
    @DisplayName("successful batch is timed per execution mode")
    void batchMetrics() {
        success(orchestrator(pathSimulator).simulate(flatRequest().build()));

        assertThat(registry.get("simulation.batch.duration").tag("mode", "SEQUENTIAL").timer().count()).isEqualTo(1);
        assertThat(registry.get("simulation.batch.paths").summary().totalAmount()).isEqualTo(5000);
    }

    private SimulationOrchestrator orchestrator(PathSimulator simulator) {
        return new SimulationOrchestrator(new RequestValidator(properties), simulator, aggregator,
                properties, executor, new SimulationMetrics(registry));
    }

    private double failures(Kind kind) {
        Counter counter = registry.find("simulation.failures").tag("kind", kind.name()).counter();
        return counter == null ? 0.0 : counter.count();
    }

    private static SimulationResult success(SimulationOutcome outcome) {
        assertThat(outcome.error()).isEmpty();
        return outcome.result().orElseThrow();
    }
}
