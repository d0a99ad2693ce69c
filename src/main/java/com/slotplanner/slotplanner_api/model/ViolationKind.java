package com.slotplanner.slotplanner_api.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ViolationKind {
    UNASSIGNED_CHILD("unassigned_child"),
    PREFERRED_TEACHER_UNMET("preferred_teacher_unmet"),
    EARLY_PREFERENCE_UNMET("early_preference_unmet"),
    TANDEM_UNFULFILLED("tandem_unfulfilled"),
    TEACHER_PAUSE_VIOLATED("teacher_pause_violated");

    private final String code;

    ViolationKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
