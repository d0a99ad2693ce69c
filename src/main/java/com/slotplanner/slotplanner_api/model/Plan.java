package com.slotplanner.slotplanner_api.model;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of one solve. Assignments are sorted by child id; children without an assignment are
 * unassigned.
 */
public record Plan(List<Assignment> assignments,
                   SolveStatus status,
                   @JsonIgnore Duration runtime,
                   ScoreBreakdown score,
                   List<Violation> violations,
                   List<DiffEntry> diff) {

    public Plan {
        assignments = List.copyOf(assignments);
        violations = List.copyOf(violations);
        diff = List.copyOf(diff);
    }

    @JsonProperty("runtimeMillis")
    public long runtimeMillis() {
        return runtime.toMillis();
    }

    public Optional<Assignment> assignmentOf(String childId) {
        return assignments.stream().filter(a -> a.childId().equals(childId)).findFirst();
    }

    public boolean isAssigned(String childId) {
        return assignmentOf(childId).isPresent();
    }

    /** Copy with the runtime zeroed, for comparing two plans by content. */
    public Plan withoutRuntime() {
        return new Plan(assignments, status, Duration.ZERO, score, violations, diff);
    }
}
