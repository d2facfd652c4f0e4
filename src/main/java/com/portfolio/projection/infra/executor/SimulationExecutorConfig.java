package com.portfolio.projection.infra.executor;

import com.portfolio.projection.domain.service.montecarlo.SimulationProperties;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class SimulationExecutorConfig {

    private final SimulationProperties properties;

    private ExecutorService workerPool;

    @Bean
    public ExecutorService simulationExecutor() {
        int threads = properties.effectiveParallelism();
        workerPool = Executors.newFixedThreadPool(threads, namedThreadFactory("mc-worker"));

        log.info("[Executor] simulation worker pool started: threads={}, mode={}",
                threads, properties.getExecutionMode());

        return workerPool;
    }

    @PreDestroy
    public void shutdown() {
        if (workerPool == null) return;

        log.info("[Executor] shutting down simulation worker pool...");
        workerPool.shutdownNow();
        try {
            if (!workerPool.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[Executor] worker pool did not terminate within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private ThreadFactory namedThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
