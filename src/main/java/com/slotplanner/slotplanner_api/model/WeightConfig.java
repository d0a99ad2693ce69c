package com.slotplanner.slotplanner_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Weights of the five soft goals. Zero switches a goal off.
 */
public record WeightConfig(
        @JsonProperty("preferred_teacher") double preferredTeacher,
        @JsonProperty("priority_early_slot") double priorityEarlySlot,
        @JsonProperty("tandem_fulfilled") double tandemFulfilled,
        @JsonProperty("teacher_pause_respected") double teacherPauseRespected,
        @JsonProperty("preserve_existing_plan") double preserveExistingPlan) {

    public static WeightConfig defaults() {
        return new WeightConfig(5, 3, 4, 1, 10);
    }

    public static WeightConfig none() {
        return new WeightConfig(0, 0, 0, 0, 0);
    }
}
