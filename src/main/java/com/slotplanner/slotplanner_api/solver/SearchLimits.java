package com.slotplanner.slotplanner_api.solver;

import java.time.Duration;

/**
 * Budgets of one search. A node limit of 0 means unlimited; it is only deterministic with a
 * single worker.
 */
public record SearchLimits(Duration timeLimit, long nodeLimit, int parallelism, long randomSeed) {

    public SearchLimits {
        if (timeLimit == null || timeLimit.isNegative() || timeLimit.isZero()) {
            throw new IllegalArgumentException("Time limit must be positive.");
        }
        if (nodeLimit < 0) {
            throw new IllegalArgumentException("Node limit must not be negative.");
        }
        parallelism = Math.max(1, parallelism);
    }

    public static SearchLimits of(Duration timeLimit) {
        return new SearchLimits(timeLimit, 0L, 1, 42L);
    }
}
