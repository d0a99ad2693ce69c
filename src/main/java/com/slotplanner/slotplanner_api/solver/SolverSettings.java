package com.slotplanner.slotplanner_api.solver;

import java.time.Duration;

/**
 * Engine-wide search defaults, bound from {@code slotplanner.solver.*}.
 */
public record SolverSettings(Duration defaultTimeLimit,
                             long nodeLimit,
                             int parallelism,
                             long randomSeed,
                             Duration progressInterval) {

    public static SolverSettings defaults() {
        return new SolverSettings(Duration.ofSeconds(30), 0L, 1, 42L, Duration.ofSeconds(1));
    }

    public SolverSettings withParallelism(int workers) {
        return new SolverSettings(defaultTimeLimit, nodeLimit, workers, randomSeed, progressInterval);
    }

    public SolverSettings withNodeLimit(long limit) {
        return new SolverSettings(defaultTimeLimit, limit, parallelism, randomSeed, progressInterval);
    }
}
