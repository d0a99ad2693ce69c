package com.slotplanner.slotplanner_api.solver;

import static com.slotplanner.slotplanner_api.solver.PlanningFixtures.*;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.slotplanner.slotplanner_api.model.Assignment;
import com.slotplanner.slotplanner_api.model.PreviousPlan;
import com.slotplanner.slotplanner_api.model.Tandem;
import com.slotplanner.slotplanner_api.model.TimeSlot;
import com.slotplanner.slotplanner_api.model.WeightConfig;
import com.slotplanner.slotplanner_api.solver.domain.ChildSession;
import com.slotplanner.slotplanner_api.solver.domain.Placement;
import com.slotplanner.slotplanner_api.solver.domain.SessionSolution;

import ai.timefold.solver.test.api.score.stream.ConstraintVerifier;

class SessionConstraintProviderTest {

    private final ConstraintVerifier<SessionConstraintProvider, SessionSolution> constraintVerifier =
            ConstraintVerifier.build(new SessionConstraintProvider(), SessionSolution.class, ChildSession.class);

    private ChildSession a;
    private ChildSession b;
    private ChildSession c;
    private ChildSession d;

    @BeforeEach
    void setUp() {
        FeasibleSpace space = new ConstraintEncoder(SlotGrid.standard()).encode(
                List.of(child("A", everyWeekday("08:00", "12:00"), true, "T1"),
                        child("B", everyWeekday("08:00", "12:00")),
                        child("C", everyWeekday("08:00", "12:00")),
                        child("D", everyWeekday("08:00", "12:00"))),
                List.of(teacher("T1", everyWeekday("08:00", "12:00")),
                        teacher("T2", everyWeekday("08:00", "12:00"))),
                List.of(new Tandem("A", "B", "T1")));
        PreviousPlan previous = new PreviousPlan(List.of(
                Assignment.of("C", "T2", TimeSlot.of(DayOfWeek.MONDAY, 9, 0))));
        Objective objective = new ObjectiveBuilder().build(space, new WeightConfig(5, 3, 4, 1, 10), previous);

        List<ChildSession> sessions = new TimefoldSearch().buildProblem(space, objective).getSessions();
        a = sessions.get(0);
        b = sessions.get(1);
        c = sessions.get(2);
        d = sessions.get(3);
    }

    @Test
    void overlappingSessionsOfOneTeacherConflict() {
        place(c, "T1", 8, 0);
        place(d, "T1", 8, 30);

        constraintVerifier.verifyThat(SessionConstraintProvider::teacherConflict)
                .given(c, d)
                .penalizesBy(1);
    }

    @Test
    void adjacentSessionsDoNotConflict() {
        place(c, "T1", 8, 0);
        place(d, "T1", 8, 45);

        constraintVerifier.verifyThat(SessionConstraintProvider::teacherConflict)
                .given(c, d)
                .penalizesBy(0);
    }

    @Test
    void tandemSharingAStartIsNoConflict() {
        place(a, "T1", 8, 0);
        place(b, "T1", 8, 0);

        constraintVerifier.verifyThat(SessionConstraintProvider::teacherConflict)
                .given(a, b)
                .penalizesBy(0);
        constraintVerifier.verifyThat(SessionConstraintProvider::tandemFulfilled)
                .given(a, b)
                .rewardsWith(9 * Objective.SCALE);
    }

    @Test
    void tandemWithOtherTeacherEarnsBaseBonusOnly() {
        place(a, "T2", 8, 0);
        place(b, "T2", 8, 0);

        constraintVerifier.verifyThat(SessionConstraintProvider::tandemFulfilled)
                .given(a, b)
                .rewardsWith(4 * Objective.SCALE);
    }

    @Test
    void unassignedChildrenCostOneMediumEach() {
        place(c, "T1", 8, 0);

        constraintVerifier.verifyThat(SessionConstraintProvider::unassignedChild)
                .given(c, d)
                .penalizesBy(1);
    }

    @Test
    void preferredTeacherAndEarlySlotUseObjectiveCredits() {
        place(a, "T1", 8, 0);

        constraintVerifier.verifyThat(SessionConstraintProvider::preferredTeacher)
                .given(a)
                .rewardsWith(5 * Objective.SCALE);
        constraintVerifier.verifyThat(SessionConstraintProvider::earlySlot)
                .given(a)
                .rewardsWith(Objective.scale(3, SlotGrid.standard().earliness(4)));
    }

    @Test
    void keptPlacementIsRewarded() {
        place(c, "T2", 9, 0);
        place(d, "T2", 9, 45);

        constraintVerifier.verifyThat(SessionConstraintProvider::preserveExistingPlan)
                .given(c, d)
                .rewardsWith(10 * Objective.SCALE);
    }

    @Test
    void pauseBetweenConsecutiveSessionsIsRewardedOnce() {
        place(a, "T1", 8, 0);
        place(b, "T1", 8, 0);
        place(c, "T1", 9, 0);
        place(d, "T1", 10, 0);

        constraintVerifier.verifyThat(SessionConstraintProvider::teacherPauseRespected)
                .given(a, b, c, d)
                .rewardsWith(2 * Objective.SCALE);
    }

    @Test
    void backToBackSessionsEarnNoPause() {
        place(c, "T1", 8, 0);
        place(d, "T1", 8, 45);

        constraintVerifier.verifyThat(SessionConstraintProvider::teacherPauseRespected)
                .given(c, d)
                .rewardsWith(0);
    }

    private static void place(ChildSession session, String teacherId, int hour, int minute) {
        LocalTime start = LocalTime.of(hour, minute);
        for (Placement placement : session.getPlacements()) {
            if (placement.getTeacherId().equals(teacherId)
                    && placement.getTimeslot().getDayOfWeek() == DayOfWeek.MONDAY
                    && placement.getTimeslot().getStartTime().equals(start)) {
                session.setPlacement(placement);
                return;
            }
        }
        throw new IllegalArgumentException("No placement " + teacherId + " MONDAY " + start + " for " + session.getChildId());
    }
}
