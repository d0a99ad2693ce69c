package com.slotplanner.slotplanner_api.model;

import java.util.List;

public record TandemOccupantSession(String teacherId, TimeSlot slot, Tandem tandem, String childA, String childB)
        implements Session {

    @Override
    public List<String> childIds() {
        return List.of(childA, childB);
    }
}
