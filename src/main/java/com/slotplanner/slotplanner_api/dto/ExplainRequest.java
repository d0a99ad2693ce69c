package com.slotplanner.slotplanner_api.dto;

import java.util.List;

import com.slotplanner.slotplanner_api.model.Assignment;
import com.slotplanner.slotplanner_api.model.Child;
import com.slotplanner.slotplanner_api.model.Tandem;
import com.slotplanner.slotplanner_api.model.Teacher;

public record ExplainRequest(List<Assignment> assignments,
                             List<Child> children,
                             List<Teacher> teachers,
                             List<Tandem> tandems) {
}
