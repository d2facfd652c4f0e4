package com.portfolio.projection.domain.service.montecarlo;

public enum ExecutionMode {

    /** One stream seeded once per batch, consumed path by path. Byte-identical reruns. */
    SEQUENTIAL,

    /** One stream per path derived from (seed, path index), paths spread over a worker pool. */
    PARALLEL
}
