package com.slotplanner.slotplanner_api.solver;

/**
 * A search strategy over a {@link FeasibleSpace}. Implementations must only return assignments
 * that respect the teacher calendar rules and must honour the monitor's cancellation and deadline.
 */
public interface SearchBackend {

    String name();

    SearchResult findBest(FeasibleSpace space, Objective objective, SearchLimits limits, SearchMonitor monitor);
}
