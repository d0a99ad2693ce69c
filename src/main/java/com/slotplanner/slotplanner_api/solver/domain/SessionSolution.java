package com.slotplanner.slotplanner_api.solver.domain;

import java.util.List;

import ai.timefold.solver.core.api.domain.solution.PlanningEntityCollectionProperty;
import ai.timefold.solver.core.api.domain.solution.PlanningScore;
import ai.timefold.solver.core.api.domain.solution.PlanningSolution;
import ai.timefold.solver.core.api.domain.solution.ProblemFactCollectionProperty;
import ai.timefold.solver.core.api.score.buildin.hardmediumsoftlong.HardMediumSoftLongScore;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Planning solution of the local-search backend. Value ranges live on each {@link ChildSession}.
 */
@PlanningSolution
@Data
@NoArgsConstructor
public class SessionSolution {

    @ProblemFactCollectionProperty
    private List<Timeslot> timeslots;

    @PlanningEntityCollectionProperty
    private List<ChildSession> sessions;

    @PlanningScore
    private HardMediumSoftLongScore score;

    public SessionSolution(List<Timeslot> timeslots, List<ChildSession> sessions) {
        this.timeslots = timeslots;
        this.sessions = sessions;
    }
}
