package com.slotplanner.slotplanner_api.dto;

import java.util.List;

import com.slotplanner.slotplanner_api.model.Child;
import com.slotplanner.slotplanner_api.model.PlanningProblem;
import com.slotplanner.slotplanner_api.model.PreviousPlan;
import com.slotplanner.slotplanner_api.model.Tandem;
import com.slotplanner.slotplanner_api.model.Teacher;
import com.slotplanner.slotplanner_api.model.WeightConfig;

/**
 * Body of a solve call. Missing tandems mean none; missing weights mean the defaults.
 */
public record SolveRequest(List<Child> children,
                           List<Teacher> teachers,
                           List<Tandem> tandems,
                           WeightConfig weights,
                           PreviousPlan previousPlan,
                           Long timeLimitSeconds) {

    public PlanningProblem toProblem() {
        return new PlanningProblem(children, teachers,
                tandems == null ? List.of() : tandems,
                weights == null ? WeightConfig.defaults() : weights,
                previousPlan);
    }
}
