package com.slotplanner.slotplanner_api.model;

import java.util.List;

/**
 * Everything one solve reads. A missing previous plan means no stability credit.
 */
public record PlanningProblem(List<Child> children,
                              List<Teacher> teachers,
                              List<Tandem> tandems,
                              WeightConfig weights,
                              PreviousPlan previousPlan) {

    public PlanningProblem(List<Child> children, List<Teacher> teachers, List<Tandem> tandems, WeightConfig weights) {
        this(children, teachers, tandems, weights, null);
    }

    public PreviousPlan previousPlanOrEmpty() {
        return previousPlan == null ? PreviousPlan.empty() : previousPlan;
    }
}
