package com.slotplanner.slotplanner_api.model;

import java.time.DayOfWeek;
import java.time.LocalTime;

import com.fasterxml.jackson.annotation.JsonFormat;

public record Assignment(String childId,
                         String teacherId,
                         DayOfWeek weekday,
                         @JsonFormat(pattern = "HH:mm") LocalTime startTime) {

    public static Assignment of(String childId, String teacherId, TimeSlot slot) {
        return new Assignment(childId, teacherId, slot.weekday(), slot.startTime());
    }

    public TimeSlot slot() {
        return new TimeSlot(weekday, startTime);
    }

    /** Same teacher and same start, ignoring the child. */
    public boolean samePlacementAs(Assignment other) {
        return other != null
                && teacherId.equals(other.teacherId)
                && weekday == other.weekday
                && startTime.equals(other.startTime);
    }
}
