package com.slotplanner.slotplanner_api.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiffEntry(String childId,
                        DiffKind kind,
                        @JsonProperty("old") Assignment previous,
                        @JsonProperty("new") Assignment current) {
}
