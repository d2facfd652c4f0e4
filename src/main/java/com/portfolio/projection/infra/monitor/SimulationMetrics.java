package com.portfolio.projection.infra.monitor;

import com.portfolio.projection.domain.service.montecarlo.ExecutionMode;
import com.portfolio.projection.domain.service.montecarlo.SimulationError;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Slf4j
@Component
public class SimulationMetrics {

    static final String BATCH_DURATION = "simulation.batch.duration";
    static final String BATCH_PATHS = "simulation.batch.paths";
    static final String FAILURES = "simulation.failures";

    private final MeterRegistry meterRegistry;
    private final DistributionSummary pathSummary;

    public SimulationMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.pathSummary = DistributionSummary.builder(BATCH_PATHS)
                .description("Paths simulated per successful batch")
                .register(meterRegistry);
    }

    public void recordBatch(ExecutionMode mode, int paths, long durationMicros) {
        Timer.builder(BATCH_DURATION)
                .tag("mode", mode.name())
                .description("Wall time of one simulation batch")
                .register(meterRegistry)
                .record(durationMicros, TimeUnit.MICROSECONDS);
        pathSummary.record(paths);
    }

    public void recordFailure(SimulationError.Kind kind) {
        Counter.builder(FAILURES)
                .tag("kind", kind.name())
                .tag("category", kind.getCategory().name())
                .description("Simulation requests that ended without a result")
                .register(meterRegistry)
                .increment();
    }

    @Scheduled(fixedRate = 60_000)
    public void logMetricsSummary() {
        long batches = 0;
        double meanMicros = 0.0;
        for (Timer timer : meterRegistry.find(BATCH_DURATION).timers()) {
            long count = timer.count();
            if (count == 0) continue;
            meanMicros = (meanMicros * batches + timer.mean(TimeUnit.MICROSECONDS) * count) / (batches + count);
            batches += count;
        }
        if (batches == 0) return;

        double failures = meterRegistry.find(FAILURES).counters().stream()
                .mapToDouble(Counter::count)
                .sum();

        log.info("[Metrics] batches={} avg={}ms paths/batch={} failures={}",
                batches,
                String.format("%.1f", meanMicros / 1_000.0),
                String.format("%.0f", pathSummary.mean()),
                (long) failures);
    }
}
