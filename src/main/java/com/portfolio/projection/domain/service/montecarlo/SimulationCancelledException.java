package com.portfolio.projection.domain.service.montecarlo;

public class SimulationCancelledException extends RuntimeException {

    private final int completedPaths;

    public SimulationCancelledException(int completedPaths) {
        super("simulation cancelled after " + completedPaths + " paths");
        this.completedPaths = completedPaths;
    }

    public int getCompletedPaths() {
        return completedPaths;
    }
}
