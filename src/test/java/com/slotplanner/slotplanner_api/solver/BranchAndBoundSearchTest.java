package com.slotplanner.slotplanner_api.solver;

import static com.slotplanner.slotplanner_api.solver.PlanningFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import java.time.DayOfWeek;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.slotplanner.slotplanner_api.model.Child;
import com.slotplanner.slotplanner_api.model.Tandem;
import com.slotplanner.slotplanner_api.model.Teacher;
import com.slotplanner.slotplanner_api.model.WeightConfig;

class BranchAndBoundSearchTest {

    private final SlotGrid grid = SlotGrid.standard();
    private final ConstraintEncoder encoder = new ConstraintEncoder(grid);
    private final ObjectiveBuilder objectiveBuilder = new ObjectiveBuilder();
    private final BranchAndBoundSearch search = new BranchAndBoundSearch();

    private SearchResult run(FeasibleSpace space, WeightConfig weights, int parallelism) {
        Objective objective = objectiveBuilder.build(space, weights, null);
        SearchLimits limits = new SearchLimits(Duration.ofSeconds(20), 0L, parallelism, 42L);
        SearchMonitor monitor = new SearchMonitor();
        monitor.start(limits);
        return search.findBest(space, objective, limits, monitor);
    }

    @Test
    void tiesResolveToLexicographicallySmallestAssignment() {
        FeasibleSpace space = encoder.encode(
                List.of(child("C1", on(DayOfWeek.MONDAY, "08:00", "09:00")),
                        child("C2", on(DayOfWeek.MONDAY, "08:00", "09:00"))),
                List.of(teacher("T1", on(DayOfWeek.MONDAY, "08:00", "09:00")),
                        teacher("T2", on(DayOfWeek.MONDAY, "08:00", "09:00"))),
                List.of());

        SearchResult result = run(space, WeightConfig.none(), 1);

        assertEquals(SearchState.OPTIMAL, result.status());
        assertEquals(2, result.assignedCount());
        assertEquals(0, result.assignment()[0].teacher());
        assertEquals(0, result.assignment()[0].ordinal());
        assertEquals(1, result.assignment()[1].teacher());
    }

    @Test
    void coverageBeatsAnyScore() {
        // C1 prefers T1, but taking T1 would leave C2 without a session
        FeasibleSpace space = encoder.encode(
                List.of(child("C1", on(DayOfWeek.MONDAY, "08:00", "11:00"), false, "T1"),
                        child("C2", on(DayOfWeek.MONDAY, "08:00", "08:45"))),
                List.of(teacher("T1", on(DayOfWeek.MONDAY, "08:00", "08:45")),
                        teacher("T2", on(DayOfWeek.MONDAY, "10:00", "10:45"))),
                List.of());

        SearchResult result = run(space, new WeightConfig(100, 0, 0, 0, 0), 1);

        assertEquals(2, result.assignedCount());
        assertEquals(1, result.assignment()[0].teacher());
        assertEquals(0, result.assignment()[1].teacher());
    }

    @Test
    void thirdChildNeverJoinsTandemSession() {
        FeasibleSpace space = encoder.encode(
                List.of(child("A", on(DayOfWeek.MONDAY, "08:00", "08:45")),
                        child("B", on(DayOfWeek.MONDAY, "08:00", "08:45")),
                        child("C", on(DayOfWeek.MONDAY, "08:00", "08:45"))),
                List.of(teacher("T1", on(DayOfWeek.MONDAY, "08:00", "08:45"))),
                List.of(new Tandem("A", "B")));

        SearchResult result = run(space, WeightConfig.defaults(), 1);

        assertEquals(SearchState.OPTIMAL, result.status());
        assertEquals(2, result.assignedCount());
        assertTrue(result.assignment()[0].samePlacementAs(result.assignment()[1]));
        assertNull(result.assignment()[2]);
    }

    @Test
    void parallelSplitReturnsTheSameOptimum() {
        List<Child> children = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            children.add(child("C" + i, on(DayOfWeek.MONDAY, "08:00", "10:00"), i % 2 == 0, i % 3 == 0 ? "T2" : "T1"));
        }
        List<Teacher> teachers = List.of(
                teacher("T1", on(DayOfWeek.MONDAY, "08:00", "10:00")),
                teacher("T2", on(DayOfWeek.MONDAY, "08:00", "10:00")));
        FeasibleSpace space = encoder.encode(children, teachers, List.of(new Tandem("C4", "C5")));

        SearchResult single = run(space, WeightConfig.defaults(), 1);
        SearchResult parallel = run(space, WeightConfig.defaults(), 4);

        assertEquals(SearchState.OPTIMAL, single.status());
        assertEquals(SearchState.OPTIMAL, parallel.status());
        assertEquals(single.bestValue(), parallel.bestValue());
        assertArrayEquals(single.assignment(), parallel.assignment());
    }

    @Test
    void emptyProblemIsTriviallyOptimal() {
        FeasibleSpace space = encoder.encode(List.of(), List.of(teacher("T1", on(DayOfWeek.MONDAY, "08:00", "09:00"))), List.of());

        SearchResult result = run(space, WeightConfig.defaults(), 1);

        assertEquals(SearchState.OPTIMAL, result.status());
        assertEquals(0, result.assignment().length);
    }

    @Test
    void cancelledSearchKeepsBestSoFar() {
        List<Child> children = new ArrayList<>();
        for (int i = 10; i < 24; i++) {
            children.add(child("C" + i, everyWeekday("07:00", "20:00"), i % 2 == 0, "T" + (i % 3)));
        }
        FeasibleSpace space = encoder.encode(children,
                List.of(teacher("T0", everyWeekday("07:00", "20:00")),
                        teacher("T1", everyWeekday("07:00", "20:00")),
                        teacher("T2", everyWeekday("07:00", "20:00"))),
                List.of());
        Objective objective = objectiveBuilder.build(space, WeightConfig.defaults(), null);
        SearchLimits limits = new SearchLimits(Duration.ofMinutes(5), 0L, 1, 42L);
        SearchMonitor monitor = new SearchMonitor();
        monitor.start(limits);
        monitor.cancel();

        SearchResult result = search.findBest(space, objective, limits, monitor);

        assertEquals(SearchState.FEASIBLE_TIME_LIMITED, result.status());
        assertEquals(children.size(), result.assignedCount());
        assertTrue(result.nodesExplored() <= 2L * BranchAndBoundSearch.CHECK_INTERVAL);
    }
}
