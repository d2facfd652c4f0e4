package com.portfolio.projection.domain.service.montecarlo;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "simulation")
public class SimulationProperties {

    private int minSimulations = 5000;
    private int maxTimeHorizon = 50;
    private int minTimeHorizon = 1;
    private double allocationTolerance = 0.001;
    private long defaultSeed = 42L;
    private ExecutionMode executionMode = ExecutionMode.SEQUENTIAL;
    private int parallelism = 0;
    private Duration timeout = Duration.ofMinutes(2);
    private History history = new History();
    private Api api = new Api();

    public int effectiveParallelism() {
        return parallelism > 0 ? parallelism : Runtime.getRuntime().availableProcessors();
    }

    @Getter
    @Setter
    public static class History {
        private int maxRecords = 100;
        private int pageSize = 10;
        private long pruneIntervalMs = 60_000;
    }

    @Getter
    @Setter
    public static class Api {
        private int maxPathsInResponse = 100;
    }
}
