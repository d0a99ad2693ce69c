package com.slotplanner.slotplanner_api.model;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.Comparator;

import com.fasterxml.jackson.annotation.JsonFormat;

/**
 * One 15-minute raster position of the week. Ordered by weekday, then start time.
 */
public record TimeSlot(DayOfWeek weekday, @JsonFormat(pattern = "HH:mm") LocalTime startTime)
        implements Comparable<TimeSlot> {

    private static final Comparator<TimeSlot> ORDER = Comparator
            .comparing(TimeSlot::weekday)
            .thenComparing(TimeSlot::startTime);

    public static TimeSlot of(DayOfWeek weekday, int hour, int minute) {
        return new TimeSlot(weekday, LocalTime.of(hour, minute));
    }

    public TimeSlot plusMinutes(int minutes) {
        return new TimeSlot(weekday, startTime.plusMinutes(minutes));
    }

    @Override
    public int compareTo(TimeSlot other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return weekday + " " + startTime;
    }
}
