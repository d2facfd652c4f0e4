package com.portfolio.projection.domain.service.montecarlo;

import com.portfolio.projection.domain.model.SimulationResult;

import java.util.Optional;

/**
 * Either a finished result or the typed reason there is none.
 */
public final class SimulationOutcome {

    private final SimulationResult result;
    private final SimulationError error;

    private SimulationOutcome(SimulationResult result, SimulationError error) {
        this.result = result;
        this.error = error;
    }

    public static SimulationOutcome success(SimulationResult result) {
        return new SimulationOutcome(result, null);
    }

    public static SimulationOutcome failure(SimulationError error) {
        return new SimulationOutcome(null, error);
    }

    public static SimulationOutcome failure(SimulationError.Kind kind, String message) {
        return failure(SimulationError.of(kind, message));
    }

    public boolean isSuccess() {
        return result != null;
    }

    public Optional<SimulationResult> result() {
        return Optional.ofNullable(result);
    }

    public Optional<SimulationError> error() {
        return Optional.ofNullable(error);
    }
}
