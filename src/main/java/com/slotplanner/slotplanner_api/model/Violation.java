package com.slotplanner.slotplanner_api.model;

import java.util.List;

public record Violation(ViolationKind kind, List<String> subjectIds, String detail) {

    public Violation {
        subjectIds = List.copyOf(subjectIds);
    }
}
