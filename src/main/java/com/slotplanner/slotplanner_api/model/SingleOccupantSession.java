package com.slotplanner.slotplanner_api.model;

import java.util.List;

public record SingleOccupantSession(String teacherId, TimeSlot slot, String childId) implements Session {

    @Override
    public List<String> childIds() {
        return List.of(childId);
    }
}
