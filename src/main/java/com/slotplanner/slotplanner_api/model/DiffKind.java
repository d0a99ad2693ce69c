package com.slotplanner.slotplanner_api.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DiffKind {
    UNCHANGED("unchanged"),
    CHANGED("changed"),
    ADDED("added"),
    REMOVED("removed");

    private final String code;

    DiffKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
