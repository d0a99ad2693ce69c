package com.slotplanner.slotplanner_api.solver.domain;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.Objects;

import ai.timefold.solver.core.api.domain.lookup.PlanningId;

/**
 * Problem fact for one session start on the grid. The id is the grid position.
 */
public class Timeslot {
    @PlanningId
    private Long id;
    private DayOfWeek dayOfWeek;
    private LocalTime startTime;
    private LocalTime endTime;
    private int dayIndex;
    private int tick;

    // No-arg constructor required
    public Timeslot() {}

    public Timeslot(Long id, DayOfWeek dayOfWeek, LocalTime startTime, LocalTime endTime, int dayIndex, int tick) {
        this.id = id;
        this.dayOfWeek = dayOfWeek;
        this.startTime = startTime;
        this.endTime = endTime;
        this.dayIndex = dayIndex;
        this.tick = tick;
    }

    public Long getId() { return id; }
    public DayOfWeek getDayOfWeek() { return dayOfWeek; }
    public LocalTime getStartTime() { return startTime; }
    public LocalTime getEndTime() { return endTime; }
    public int getDayIndex() { return dayIndex; }
    public int getTick() { return tick; }

    @Override
    public String toString() {
        return dayOfWeek + " " + startTime;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Timeslot timeslot = (Timeslot) o;
        if (id == null || timeslot.id == null) {
            return false;
        }
        return Objects.equals(id, timeslot.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }
}
