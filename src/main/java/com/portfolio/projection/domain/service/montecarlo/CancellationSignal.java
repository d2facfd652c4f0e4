package com.portfolio.projection.domain.service.montecarlo;

import java.time.Duration;

/**
 * Polled by the orchestrator between paths, never inside one.
 */
@FunctionalInterface
public interface CancellationSignal {

    boolean isCancelled();

    static CancellationSignal none() {
        return () -> false;
    }

    /**
     * Cancelled once {@code timeout} has elapsed from now or the polling thread is interrupted.
     */
    static CancellationSignal deadline(Duration timeout) {
        long deadlineNanos = System.nanoTime() + timeout.toNanos();
        return () -> System.nanoTime() - deadlineNanos >= 0 || Thread.currentThread().isInterrupted();
    }

    default CancellationSignal or(CancellationSignal other) {
        return () -> isCancelled() || other.isCancelled();
    }
}
