package com.slotplanner.slotplanner_api.model;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.Set;
import java.util.TreeSet;

/**
 * Builders for availability sets. Ranges are half-open, so {@code range(MONDAY, 08:00, 08:45)}
 * yields the positions 08:00, 08:15 and 08:30.
 */
public final class Availability {

    public static final int RASTER_MINUTES = 15;

    private Availability() {}

    public static Set<TimeSlot> range(DayOfWeek day, LocalTime from, LocalTime to) {
        Set<TimeSlot> slots = new TreeSet<>();
        LocalTime cursor = from;
        while (cursor.isBefore(to)) {
            slots.add(new TimeSlot(day, cursor));
            LocalTime next = cursor.plusMinutes(RASTER_MINUTES);
            if (next.isBefore(cursor)) break; // wrapped past midnight
            cursor = next;
        }
        return slots;
    }

    public static Set<TimeSlot> range(DayOfWeek day, String from, String to) {
        return range(day, LocalTime.parse(from), LocalTime.parse(to));
    }
}
