package com.slotplanner.slotplanner_api.solver;

/**
 * Raw outcome of a backend. {@code assignment[i]} is the candidate held by child {@code i}, or
 * {@code null} when the child stays unassigned.
 */
public record SearchResult(Candidate[] assignment, SearchState status, ObjectiveValue bestValue, long nodesExplored) {

    public int assignedCount() {
        int count = 0;
        for (Candidate candidate : assignment) {
            if (candidate != null) count++;
        }
        return count;
    }
}
