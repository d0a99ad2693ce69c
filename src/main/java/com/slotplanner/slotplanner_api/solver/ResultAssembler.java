package com.slotplanner.slotplanner_api.solver;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.slotplanner.slotplanner_api.model.Assignment;
import com.slotplanner.slotplanner_api.model.DiffEntry;
import com.slotplanner.slotplanner_api.model.Plan;
import com.slotplanner.slotplanner_api.model.ScoreBreakdown;
import com.slotplanner.slotplanner_api.model.SolveStatus;
import com.slotplanner.slotplanner_api.model.Violation;

public class ResultAssembler {

    public Plan assemble(List<Assignment> assignments, SearchState searchState, int childCount, Duration runtime,
                         ScoreBreakdown score, List<Violation> violations, List<DiffEntry> diff) {
        List<Assignment> sorted = new ArrayList<>(assignments);
        sorted.sort(Comparator.comparing(Assignment::childId));
        return new Plan(sorted, statusOf(searchState, sorted.size(), childCount), runtime, score, violations, diff);
    }

    public static SolveStatus statusOf(SearchState searchState, int assigned, int childCount) {
        if (assigned == 0 && childCount > 0) return SolveStatus.NO_SOLUTION;
        switch (searchState) {
            case OPTIMAL:
                return SolveStatus.OPTIMAL;
            case FEASIBLE_TIME_LIMITED:
                return SolveStatus.FEASIBLE;
            case INFEASIBLE:
                return SolveStatus.NO_SOLUTION;
            default:
                throw new IllegalStateException("Search ended in non-terminal state " + searchState);
        }
    }
}
