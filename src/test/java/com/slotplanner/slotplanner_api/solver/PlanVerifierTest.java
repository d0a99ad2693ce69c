package com.slotplanner.slotplanner_api.solver;

import static com.slotplanner.slotplanner_api.solver.PlanningFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import java.time.DayOfWeek;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.slotplanner.slotplanner_api.exception.SolverFaultException;
import com.slotplanner.slotplanner_api.model.Assignment;
import com.slotplanner.slotplanner_api.model.Child;
import com.slotplanner.slotplanner_api.model.Tandem;
import com.slotplanner.slotplanner_api.model.Teacher;
import com.slotplanner.slotplanner_api.model.TimeSlot;

class PlanVerifierTest {

    private final PlanVerifier verifier = new PlanVerifier(SlotGrid.standard());

    private final List<Child> children = List.of(
            child("C1", on(DayOfWeek.MONDAY, "08:00", "10:00")),
            child("C2", on(DayOfWeek.MONDAY, "08:00", "10:00")),
            child("C3", on(DayOfWeek.MONDAY, "08:00", "08:30")));
    private final List<Teacher> teachers = List.of(teacher("T1", on(DayOfWeek.MONDAY, "08:00", "10:00")));

    @Test
    void acceptsTandemSharingOneStart() {
        TimeSlot start = TimeSlot.of(DayOfWeek.MONDAY, 8, 0);
        List<Assignment> assignments = List.of(Assignment.of("C1", "T1", start), Assignment.of("C2", "T1", start));

        assertTrue(verifier.findProblems(assignments, children, teachers, List.of(new Tandem("C1", "C2"))).isEmpty());
    }

    @Test
    void rejectsSharedStartWithoutTandem() {
        TimeSlot start = TimeSlot.of(DayOfWeek.MONDAY, 8, 0);
        List<Assignment> assignments = List.of(Assignment.of("C1", "T1", start), Assignment.of("C2", "T1", start));

        List<String> problems = verifier.findProblems(assignments, children, teachers, List.of());

        assertEquals(1, problems.size());
        assertTrue(problems.get(0).contains("overlapping"));
    }

    @Test
    void rejectsOverlapAndMissingAvailability() {
        List<Assignment> assignments = List.of(
                Assignment.of("C1", "T1", TimeSlot.of(DayOfWeek.MONDAY, 8, 0)),
                Assignment.of("C2", "T1", TimeSlot.of(DayOfWeek.MONDAY, 8, 30)));

        assertFalse(verifier.findProblems(assignments, children, teachers, List.of()).isEmpty());
        assertThrows(SolverFaultException.class, () -> verifier.verify(
                List.of(Assignment.of("C3", "T1", TimeSlot.of(DayOfWeek.MONDAY, 8, 0))), children, teachers, List.of()));
    }

    @Test
    void rejectsUnknownIdsAndDuplicates() {
        TimeSlot start = TimeSlot.of(DayOfWeek.MONDAY, 8, 0);
        List<Assignment> assignments = List.of(
                Assignment.of("C1", "T1", start),
                Assignment.of("C1", "T1", TimeSlot.of(DayOfWeek.MONDAY, 9, 0)),
                Assignment.of("C9", "T7", TimeSlot.of(DayOfWeek.MONDAY, 9, 0)));

        List<String> problems = verifier.findProblems(assignments, children, teachers, List.of());

        assertEquals(3, problems.size());
    }

    @Test
    void rejectsStartThatCannotHoldASession() {
        List<Assignment> assignments = List.of(Assignment.of("C1", "T1", TimeSlot.of(DayOfWeek.MONDAY, 19, 30)));

        assertEquals(1, verifier.findProblems(assignments, children, teachers, List.of()).size());
    }
}
