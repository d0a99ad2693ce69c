package com.slotplanner.slotplanner_api.solver;

/**
 * Life cycle of one search. The last three are terminal.
 */
public enum SearchState {
    UNEXPLORED,
    BOUNDING,
    BRANCHING,
    OPTIMAL,
    FEASIBLE_TIME_LIMITED,
    INFEASIBLE;

    public boolean isTerminal() {
        return this == OPTIMAL || this == FEASIBLE_TIME_LIMITED || this == INFEASIBLE;
    }
}
