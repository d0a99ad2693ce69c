package com.slotplanner.slotplanner_api.solver;

import java.time.Duration;

public record SolveProgress(SearchState state, Duration elapsed, int bestCoverage, double bestScore, long nodesExplored) {
}
