package com.slotplanner.slotplanner_api.model;

public enum SolveStatus {
    OPTIMAL,
    FEASIBLE,
    NO_SOLUTION
}
