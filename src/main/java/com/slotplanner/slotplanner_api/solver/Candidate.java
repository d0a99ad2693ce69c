package com.slotplanner.slotplanner_api.solver;

/**
 * A legal atomic decision: child {@code child} meets teacher {@code teacher} in the session
 * starting at grid position {@code position}. {@code ordinal} is the candidate's index in the
 * child's candidate list.
 */
public record Candidate(int child, int ordinal, int teacher, int position) {

    public boolean samePlacementAs(Candidate other) {
        return other != null && teacher == other.teacher && position == other.position;
    }

    /** Unique key of the (teacher, start) pair within one search space. */
    public long placementKey() {
        return ((long) teacher << 32) | position;
    }
}
