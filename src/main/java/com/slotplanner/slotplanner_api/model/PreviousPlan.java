package com.slotplanner.slotplanner_api.model;

import java.util.List;
import java.util.Optional;

public record PreviousPlan(List<Assignment> assignments) {

    public PreviousPlan {
        assignments = assignments == null ? null : List.copyOf(assignments);
    }

    public static PreviousPlan empty() {
        return new PreviousPlan(List.of());
    }

    public Optional<Assignment> find(String childId) {
        return assignments.stream().filter(a -> a.childId().equals(childId)).findFirst();
    }
}
