package com.slotplanner.slotplanner_api.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

public record Teacher(String id, String name, Set<TimeSlot> availability) {

    public Teacher {
        availability = availability == null ? null : Collections.unmodifiableSet(new LinkedHashSet<>(availability));
    }
}
