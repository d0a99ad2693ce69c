package com.slotplanner.slotplanner_api.solver;

import com.slotplanner.slotplanner_api.model.ScoreBreakdown;

/**
 * Per-term fixed-point totals of one complete assignment.
 */
public record ObjectiveTally(int coverage,
                             long preferredTeacher,
                             long priorityEarlySlot,
                             long tandemFulfilled,
                             long teacherPauseRespected,
                             long preserveExistingPlan) {

    public long total() {
        return preferredTeacher + priorityEarlySlot + tandemFulfilled + teacherPauseRespected + preserveExistingPlan;
    }

    public ObjectiveValue value() {
        return new ObjectiveValue(coverage, total());
    }

    public ScoreBreakdown toBreakdown() {
        return new ScoreBreakdown(coverage,
                Objective.unscale(preferredTeacher),
                Objective.unscale(priorityEarlySlot),
                Objective.unscale(tandemFulfilled),
                Objective.unscale(teacherPauseRespected),
                Objective.unscale(preserveExistingPlan),
                Objective.unscale(total()));
    }
}
