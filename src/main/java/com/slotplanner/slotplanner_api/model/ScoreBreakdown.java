package com.slotplanner.slotplanner_api.model;

/**
 * Per-term totals of a plan's objective, already multiplied by their weights.
 */
public record ScoreBreakdown(int assignedChildren,
                             double preferredTeacher,
                             double priorityEarlySlot,
                             double tandemFulfilled,
                             double teacherPauseRespected,
                             double preserveExistingPlan,
                             double total) {
}
