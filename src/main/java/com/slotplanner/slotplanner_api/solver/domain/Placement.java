package com.slotplanner.slotplanner_api.solver.domain;

import com.slotplanner.slotplanner_api.solver.Candidate;

/**
 * Value of a {@link ChildSession}: one legal (teacher, start) for that child.
 */
public class Placement {

    private final Candidate candidate;
    private final String teacherId;
    private final Timeslot timeslot;

    public Placement(Candidate candidate, String teacherId, Timeslot timeslot) {
        this.candidate = candidate;
        this.teacherId = teacherId;
        this.timeslot = timeslot;
    }

    public Candidate getCandidate() { return candidate; }
    public String getTeacherId() { return teacherId; }
    public int getTeacherIndex() { return candidate.teacher(); }
    public Timeslot getTimeslot() { return timeslot; }
    public long getKey() { return candidate.placementKey(); }

    @Override
    public String toString() {
        return teacherId + "@" + timeslot;
    }
}
