package com.portfolio.projection.domain.service.montecarlo;

import com.portfolio.projection.domain.model.SimulationPath;
import com.portfolio.projection.domain.model.SimulationRequest;
import com.portfolio.projection.domain.model.SimulationResult;
import com.portfolio.projection.domain.model.SimulationStatistics;
import com.portfolio.projection.domain.service.montecarlo.SimulationError.Kind;
import com.portfolio.projection.infra.monitor.SimulationMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.SplittableRandom;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Validates a request, runs its paths and aggregates them into a {@link SimulationResult}.
 *
 * <p>In {@link ExecutionMode#SEQUENTIAL} mode all paths share one stream seeded once per batch,
 * so a given request and seed always reproduce the same result bit for bit. In
 * {@link ExecutionMode#PARALLEL} mode every path draws from its own stream derived from the
 * batch seed and its index; results are still deterministic per seed but differ from the
 * sequential ones.
 *
 * <p>Cancellation is polled before each path starts.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SimulationOrchestrator {

    private static final long CANCELLATION_POLL_MILLIS = 10;

    private final RequestValidator requestValidator;
    private final PathSimulator pathSimulator;
    private final StatisticsAggregator statisticsAggregator;
    private final SimulationProperties properties;
    private final ExecutorService simulationExecutor;
    private final SimulationMetrics metrics;

    public SimulationOutcome simulate(SimulationRequest request) {
        return simulate(request, CancellationSignal.deadline(properties.getTimeout()));
    }

    public SimulationOutcome simulate(SimulationRequest request, CancellationSignal cancellation) {
        Optional<SimulationError> invalid = requestValidator.validate(request);
        if (invalid.isPresent()) {
            SimulationError error = invalid.get();
            log.warn("[MC] request rejected: kind={}, message={}", error.getKind(), error.getMessage());
            metrics.recordFailure(error.getKind());
            return SimulationOutcome.failure(error);
        }

        long seed = request.getSeed() != null ? request.getSeed() : properties.getDefaultSeed();
        ExecutionMode mode = properties.getExecutionMode();
        int pathCount = request.getNumSimulations();

        long startNano = System.nanoTime();
        List<SimulationPath> paths;
        try {
            paths = mode == ExecutionMode.PARALLEL
                    ? runParallel(request, seed, cancellation)
                    : runSequential(request, seed, cancellation);
        } catch (SimulationCancelledException e) {
            log.warn("[MC] batch cancelled: completed={}/{}, mode={}", e.getCompletedPaths(), pathCount, mode);
            metrics.recordFailure(Kind.CANCELLED);
            return SimulationOutcome.failure(Kind.CANCELLED,
                    "Simulation cancelled after " + e.getCompletedPaths() + " of " + pathCount + " paths");
        } catch (RuntimeException e) {
            log.error("[MC] batch failed: mode={}, paths={}", mode, pathCount, e);
            metrics.recordFailure(Kind.INTERNAL_ERROR);
            return SimulationOutcome.failure(Kind.INTERNAL_ERROR, "Simulation failed: " + e.getMessage());
        }

        double[] finalValues = new double[paths.size()];
        for (int i = 0; i < finalValues.length; i++) {
            finalValues[i] = paths.get(i).finalValue();
        }

        SimulationStatistics statistics = statisticsAggregator.aggregate(finalValues, request);
        long elapsedMicros = (System.nanoTime() - startNano) / 1_000;

        SimulationResult result = SimulationResult.builder()
                .id(UUID.randomUUID().toString())
                .timestamp(System.currentTimeMillis())
                .request(request)
                .paths(paths)
                .finalValues(finalValues)
                .statistics(statistics)
                .yearlyBands(statisticsAggregator.yearlyBands(paths, request.getTimeHorizon()))
                .withdrawalSummary(statisticsAggregator.summarizeWithdrawals(paths))
                .seed(seed)
                .executionMode(mode)
                .calcDurationMicros(elapsedMicros)
                .build();

        metrics.recordBatch(mode, pathCount, elapsedMicros);
        log.info("[MC] batch done: id={}, mode={}, paths={}, years={}, assets={}, median={}, pDepletion={}, elapsed={}ms",
                result.getId(), mode, pathCount, request.getTimeHorizon(), request.getAssetClasses().size(),
                String.format("%.2f", statistics.getMedian().getFinalValue()),
                String.format("%.4f", statistics.getProbabilityOfDepletion()),
                elapsedMicros / 1_000);

        return SimulationOutcome.success(result);
    }

    private List<SimulationPath> runSequential(SimulationRequest request, long seed,
                                               CancellationSignal cancellation) {
        int pathCount = request.getNumSimulations();
        SplittableRandom rng = RandomStreams.batchStream(seed);
        List<SimulationPath> paths = new ArrayList<>(pathCount);

        for (int i = 0; i < pathCount; i++) {
            if (cancellation.isCancelled()) {
                throw new SimulationCancelledException(i);
            }
            paths.add(pathSimulator.simulate(request, rng));
        }
        return paths;
    }

    private List<SimulationPath> runParallel(SimulationRequest request, long seed,
                                             CancellationSignal cancellation) {
        if (cancellation.isCancelled()) {
            throw new SimulationCancelledException(0);
        }

        int pathCount = request.getNumSimulations();
        int chunks = Math.max(1, Math.min(properties.effectiveParallelism(), pathCount));
        int chunkSize = (pathCount + chunks - 1) / chunks;

        SimulationPath[] paths = new SimulationPath[pathCount];
        AtomicBoolean aborted = new AtomicBoolean(false);
        AtomicInteger completed = new AtomicInteger(0);
        List<Future<?>> futures = new ArrayList<>(chunks);

        for (int c = 0; c < chunks; c++) {
            int from = c * chunkSize;
            int to = Math.min(pathCount, from + chunkSize);
            if (from >= to) break;

            futures.add(simulationExecutor.submit(() -> {
                for (int i = from; i < to; i++) {
                    if (aborted.get()) return;
                    paths[i] = pathSimulator.simulate(request, RandomStreams.pathStream(seed, i));
                    completed.incrementAndGet();
                }
            }));
        }

        log.debug("[MC] parallel batch submitted: paths={}, chunks={}, chunkSize={}", pathCount, chunks, chunkSize);

        try {
            for (Future<?> future : futures) {
                while (!awaitBriefly(future)) {
                    if (cancellation.isCancelled()) {
                        aborted.set(true);
                        futures.forEach(f -> f.cancel(true));
                        throw new SimulationCancelledException(completed.get());
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            aborted.set(true);
            futures.forEach(f -> f.cancel(true));
            throw new SimulationCancelledException(completed.get());
        } catch (ExecutionException e) {
            aborted.set(true);
            futures.forEach(f -> f.cancel(true));
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) throw runtime;
            throw new IllegalStateException("path worker failed", cause);
        }

        return Arrays.asList(paths);
    }

    private boolean awaitBriefly(Future<?> future) throws InterruptedException, ExecutionException {
        try {
            future.get(CANCELLATION_POLL_MILLIS, TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        }
    }
}
