package com.slotplanner.slotplanner_api.validation;

import static com.slotplanner.slotplanner_api.solver.PlanningFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.slotplanner.slotplanner_api.exception.ValidationException;
import com.slotplanner.slotplanner_api.model.Assignment;
import com.slotplanner.slotplanner_api.model.Child;
import com.slotplanner.slotplanner_api.model.PlanningProblem;
import com.slotplanner.slotplanner_api.model.PreviousPlan;
import com.slotplanner.slotplanner_api.model.Tandem;
import com.slotplanner.slotplanner_api.model.Teacher;
import com.slotplanner.slotplanner_api.model.TimeSlot;
import com.slotplanner.slotplanner_api.model.WeightConfig;
import com.slotplanner.slotplanner_api.solver.SlotGrid;

class PlanningInputValidatorTest {

    private static final Duration LIMIT = Duration.ofSeconds(5);

    private final PlanningInputValidator validator = new PlanningInputValidator(SlotGrid.standard());

    private final List<Teacher> teachers = List.of(teacher("T1", on(DayOfWeek.MONDAY, "08:00", "12:00")));

    @Test
    void acceptsWellFormedProblem() {
        PlanningProblem problem = new PlanningProblem(
                List.of(child("C1", on(DayOfWeek.MONDAY, "08:00", "09:00")),
                        child("C2", on(DayOfWeek.MONDAY, "08:00", "09:00"), true, "T1")),
                teachers, List.of(new Tandem("C1", "C2", "T1")), WeightConfig.defaults());

        assertDoesNotThrow(() -> validator.validate(problem, LIMIT));
    }

    @Test
    void unknownPreferredTeacherIsOnlyAWarning() {
        PlanningProblem problem = new PlanningProblem(
                List.of(child("C1", on(DayOfWeek.MONDAY, "08:00", "09:00"), false, "T9")),
                teachers, List.of(), WeightConfig.defaults());

        assertDoesNotThrow(() -> validator.validate(problem, LIMIT));
    }

    @Test
    void collectsEveryEntityError() {
        List<Child> children = Arrays.asList(
                child("C1", on(DayOfWeek.MONDAY, "08:00", "09:00")),
                child("C1", on(DayOfWeek.MONDAY, "08:00", "09:00")),
                child(" ", on(DayOfWeek.MONDAY, "08:00", "09:00")),
                null);
        PlanningProblem problem = new PlanningProblem(children, teachers,
                List.of(new Tandem("C1", "C1"), new Tandem("C1", "C7")), WeightConfig.defaults());

        ValidationException ex = assertThrows(ValidationException.class, () -> validator.validate(problem, LIMIT));

        List<String> errors = ex.getErrors();
        assertTrue(errors.contains("Duplicate child id 'C1'."));
        assertTrue(errors.stream().anyMatch(e -> e.startsWith("Child id must not be blank")));
        assertTrue(errors.contains("Children list contains a null entry."));
        assertTrue(errors.stream().anyMatch(e -> e.contains("with itself")));
        assertTrue(errors.stream().anyMatch(e -> e.contains("unknown child 'C7'")));
        assertEquals(5, errors.size());
    }

    @Test
    void rejectsAvailabilityOutsideTheGrid() {
        Set<TimeSlot> weird = Set.of(
                TimeSlot.of(DayOfWeek.SATURDAY, 9, 0),
                TimeSlot.of(DayOfWeek.MONDAY, 8, 10),
                TimeSlot.of(DayOfWeek.MONDAY, 6, 45),
                new TimeSlot(DayOfWeek.MONDAY, LocalTime.of(20, 0)));
        PlanningProblem problem = new PlanningProblem(List.of(child("C1", weird)), teachers, List.of(),
                WeightConfig.defaults());

        ValidationException ex = assertThrows(ValidationException.class, () -> validator.validate(problem, LIMIT));

        assertEquals(4, ex.getErrors().size());
    }

    @Test
    void rejectsNegativeAndNonFiniteWeights() {
        PlanningProblem problem = new PlanningProblem(List.of(), teachers, List.of(),
                new WeightConfig(-1, Double.NaN, 0, Double.POSITIVE_INFINITY, 0));

        ValidationException ex = assertThrows(ValidationException.class, () -> validator.validate(problem, LIMIT));

        assertEquals(3, ex.getErrors().size());
    }

    @Test
    void tandemMemberCannotBePairedTwice() {
        PlanningProblem problem = new PlanningProblem(
                List.of(child("A", Set.of()), child("B", Set.of()), child("C", Set.of())),
                teachers, List.of(new Tandem("A", "B"), new Tandem("B", "C")), WeightConfig.defaults());

        ValidationException ex = assertThrows(ValidationException.class, () -> validator.validate(problem, LIMIT));

        assertEquals(List.of("Child 'B' is already paired in tandem A+B."), ex.getErrors());
    }

    @Test
    void tandemPriorityMustBeBetweenOneAndTen() {
        List<Child> children = List.of(child("A", Set.of()), child("B", Set.of()), child("C", Set.of()),
                child("D", Set.of()), child("E", Set.of()), child("F", Set.of()));
        PlanningProblem problem = new PlanningProblem(children, teachers,
                List.of(new Tandem("A", "B", null, 0), new Tandem("C", "D", null, 11), new Tandem("E", "F", null, 2)),
                WeightConfig.defaults());

        ValidationException ex = assertThrows(ValidationException.class, () -> validator.validate(problem, LIMIT));

        assertEquals(List.of("Tandem A+B priority must be between 1 and 10, was 0.",
                "Tandem C+D priority must be between 1 and 10, was 11."), ex.getErrors());
    }

    @Test
    void missingTandemPriorityMeansDefault() {
        Tandem tandem = new Tandem("A", "B", "T1", null);

        assertEquals(Tandem.DEFAULT_PRIORITY, tandem.priority());
        assertEquals(1.0, tandem.priorityFactor(), 1e-9);
    }

    @Test
    void nullEntriesInsideChildAndTeacherAreReported() {
        Set<TimeSlot> withNull = new HashSet<>(on(DayOfWeek.MONDAY, "08:00", "09:00"));
        withNull.add(null);
        Child child = new Child("C1", "C1", withNull, Arrays.asList("T1", null), false);
        Teacher teacher = new Teacher("T1", "T1", withNull);

        ValidationException ex = assertThrows(ValidationException.class,
                () -> validator.validateEntities(List.of(child), List.of(teacher), List.of()));

        assertEquals(List.of("Teacher 'T1' has a null availability entry.",
                "Child 'C1' has a null availability entry.",
                "Child 'C1' lists a blank preferred teacher id."), ex.getErrors());
    }

    @Test
    void rejectsBrokenPreviousPlanAndTimeLimit() {
        PreviousPlan previous = new PreviousPlan(List.of(
                Assignment.of("C1", "T1", TimeSlot.of(DayOfWeek.MONDAY, 8, 0)),
                Assignment.of("C1", "T1", TimeSlot.of(DayOfWeek.MONDAY, 9, 0)),
                new Assignment("C2", null, DayOfWeek.MONDAY, LocalTime.of(8, 0))));
        PlanningProblem problem = new PlanningProblem(List.of(), teachers, List.of(), WeightConfig.defaults(), previous);

        ValidationException ex = assertThrows(ValidationException.class, () -> validator.validate(problem, Duration.ZERO));

        assertEquals(3, ex.getErrors().size());
        assertTrue(ex.getMessage().startsWith("Invalid planning input"));
    }

    @Test
    void nullListsAreReported() {
        ValidationException ex = assertThrows(ValidationException.class,
                () -> validator.validateEntities(null, null, null));

        assertEquals(3, ex.getErrors().size());
    }
}
