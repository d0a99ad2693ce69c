package com.slotplanner.slotplanner_api.dto;

import java.util.List;

import com.slotplanner.slotplanner_api.model.Assignment;
import com.slotplanner.slotplanner_api.model.PreviousPlan;

public record DiffRequest(List<Assignment> assignments, PreviousPlan previousPlan) {
}
