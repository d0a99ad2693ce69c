package com.slotplanner.slotplanner_api.solver;

import com.slotplanner.slotplanner_api.solver.domain.ChildSession;

import ai.timefold.solver.core.api.score.buildin.hardmediumsoftlong.HardMediumSoftLongScore;
import ai.timefold.solver.core.api.score.stream.Constraint;
import ai.timefold.solver.core.api.score.stream.ConstraintFactory;
import ai.timefold.solver.core.api.score.stream.ConstraintProvider;
import ai.timefold.solver.core.api.score.stream.Joiners;

/**
 * Constraint streams of the local-search backend. Hard: teacher windows never overlap. Medium:
 * every unassigned child costs one. Soft: the five weighted goals, using the credits of the
 * shared {@link Objective}.
 */
public class SessionConstraintProvider implements ConstraintProvider {

    @Override
    public Constraint[] defineConstraints(ConstraintFactory constraintFactory) {
        return new Constraint[] {
                teacherConflict(constraintFactory),
                unassignedChild(constraintFactory),
                preferredTeacher(constraintFactory),
                earlySlot(constraintFactory),
                preserveExistingPlan(constraintFactory),
                tandemFulfilled(constraintFactory),
                teacherPauseRespected(constraintFactory)
        };
    }

    // --- HARD ---

    Constraint teacherConflict(ConstraintFactory constraintFactory) {
        return constraintFactory
                .forEachUniquePair(ChildSession.class,
                        Joiners.equal(ChildSession::getTeacherIndex),
                        Joiners.equal(ChildSession::getDayIndex))
                .filter((a, b) -> Math.abs(a.getStartTick() - b.getStartTick()) < SlotGrid.SESSION_TICKS)
                .filter((a, b) -> !isJointTandemSession(a, b))
                .penalize(HardMediumSoftLongScore.ONE_HARD)
                .asConstraint("Teacher conflict");
    }

    private static boolean isJointTandemSession(ChildSession a, ChildSession b) {
        return a.isInTandem()
                && a.getGroupKey().equals(b.getGroupKey())
                && a.getPlacementKey().equals(b.getPlacementKey());
    }

    // --- MEDIUM ---

    Constraint unassignedChild(ConstraintFactory constraintFactory) {
        return constraintFactory
                .forEachIncludingUnassigned(ChildSession.class)
                .filter(session -> !session.isAssigned())
                .penalize(HardMediumSoftLongScore.ONE_MEDIUM)
                .asConstraint("Unassigned child");
    }

    // --- SOFT ---

    Constraint preferredTeacher(ConstraintFactory constraintFactory) {
        return constraintFactory
                .forEach(ChildSession.class)
                .filter(session -> session.getObjective().preferredCredit(session.getPlacement().getCandidate()) > 0)
                .rewardLong(HardMediumSoftLongScore.ONE_SOFT,
                        session -> session.getObjective().preferredCredit(session.getPlacement().getCandidate()))
                .asConstraint("Preferred teacher");
    }

    Constraint earlySlot(ConstraintFactory constraintFactory) {
        return constraintFactory
                .forEach(ChildSession.class)
                .filter(session -> session.getObjective().earlyCredit(session.getPlacement().getCandidate()) > 0)
                .rewardLong(HardMediumSoftLongScore.ONE_SOFT,
                        session -> session.getObjective().earlyCredit(session.getPlacement().getCandidate()))
                .asConstraint("Early slot");
    }

    Constraint preserveExistingPlan(ConstraintFactory constraintFactory) {
        return constraintFactory
                .forEach(ChildSession.class)
                .filter(session -> session.getObjective().preserveCredit(session.getPlacement().getCandidate()) > 0)
                .rewardLong(HardMediumSoftLongScore.ONE_SOFT,
                        session -> session.getObjective().preserveCredit(session.getPlacement().getCandidate()))
                .asConstraint("Preserve existing plan");
    }

    Constraint tandemFulfilled(ConstraintFactory constraintFactory) {
        return constraintFactory
                .forEach(ChildSession.class)
                .filter(ChildSession::isInTandem)
                .join(ChildSession.class,
                        Joiners.equal(ChildSession::getGroupKey),
                        Joiners.equal(ChildSession::getPlacementKey),
                        Joiners.lessThan(ChildSession::getChildId))
                .filter((a, b) -> a.getObjective().tandemBonus(a.getTandemIndex(), a.getTeacherIndex()) > 0)
                .rewardLong(HardMediumSoftLongScore.ONE_SOFT,
                        (a, b) -> a.getObjective().tandemBonus(a.getTandemIndex(), a.getTeacherIndex()))
                .asConstraint("Tandem fulfilled");
    }

    /**
     * Rewards each pair of consecutive sessions of a teacher on one day with a free tick between
     * them. Only the lowest child id of a session leads, so a joint tandem session counts once.
     */
    Constraint teacherPauseRespected(ConstraintFactory constraintFactory) {
        return constraintFactory
                .forEach(ChildSession.class)
                .filter(session -> session.getObjective().rewardsPauses())
                .ifNotExists(ChildSession.class,
                        Joiners.equal(ChildSession::getPlacementKey),
                        Joiners.greaterThan(ChildSession::getChildId))
                .join(ChildSession.class,
                        Joiners.equal(ChildSession::getTeacherIndex),
                        Joiners.equal(ChildSession::getDayIndex),
                        Joiners.filtering((earlier, later) -> later.getStartTick() - earlier.getStartTick() > SlotGrid.SESSION_TICKS))
                .ifNotExists(ChildSession.class,
                        Joiners.equal((earlier, later) -> earlier.getTeacherIndex(), ChildSession::getTeacherIndex),
                        Joiners.equal((earlier, later) -> earlier.getDayIndex(), ChildSession::getDayIndex),
                        Joiners.filtering((earlier, later, between) -> between.getStartTick() > earlier.getStartTick()
                                && between.getStartTick() < later.getStartTick()))
                .ifNotExists(ChildSession.class,
                        Joiners.equal((earlier, later) -> later.getPlacementKey(), ChildSession::getPlacementKey),
                        Joiners.filtering((earlier, later, other) -> other.getChildId().compareTo(later.getChildId()) < 0))
                .rewardLong(HardMediumSoftLongScore.ONE_SOFT, (earlier, later) -> earlier.getObjective().pauseCredit())
                .asConstraint("Teacher pause respected");
    }
}
