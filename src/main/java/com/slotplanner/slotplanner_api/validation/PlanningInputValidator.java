package com.slotplanner.slotplanner_api.validation;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

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

/**
 * Rejects structurally broken input before any search starts. Every check runs; the resulting
 * {@link ValidationException} lists all of them. Soft oddities are only logged.
 */
public class PlanningInputValidator {

    private static final Logger logger = LoggerFactory.getLogger(PlanningInputValidator.class);

    private final SlotGrid grid;

    public PlanningInputValidator(SlotGrid grid) {
        this.grid = grid;
    }

    public void validate(PlanningProblem problem, Duration timeLimit) {
        List<String> errors = new ArrayList<>();
        if (problem == null) {
            throw new ValidationException(List.of("Planning problem must not be null."));
        }
        checkEntities(problem.children(), problem.teachers(), problem.tandems(), errors);
        checkWeights(problem.weights(), errors);
        checkPreviousPlan(problem.previousPlan(), errors);
        if (timeLimit == null || timeLimit.isNegative() || timeLimit.isZero()) {
            errors.add("Time limit must be positive, was " + timeLimit + ".");
        }
        failIfAny(errors);
    }

    public void validateEntities(List<Child> children, List<Teacher> teachers, List<Tandem> tandems) {
        List<String> errors = new ArrayList<>();
        checkEntities(children, teachers, tandems, errors);
        failIfAny(errors);
    }

    public void validateAssignments(List<Assignment> assignments) {
        List<String> errors = new ArrayList<>();
        checkAssignments("Assignment list", assignments, errors);
        failIfAny(errors);
    }

    public void validatePreviousPlan(PreviousPlan previousPlan) {
        List<String> errors = new ArrayList<>();
        checkPreviousPlan(previousPlan, errors);
        failIfAny(errors);
    }

    private void failIfAny(List<String> errors) {
        if (!errors.isEmpty()) {
            logger.warn("!!! Rejecting planning input with {} error(s): {}", errors.size(), errors);
            throw new ValidationException(errors);
        }
    }

    private void checkEntities(List<Child> children, List<Teacher> teachers, List<Tandem> tandems, List<String> errors) {
        if (children == null) errors.add("Children list must not be null.");
        if (teachers == null) errors.add("Teachers list must not be null.");
        if (tandems == null) errors.add("Tandems list must not be null.");

        Set<String> teacherIds = new HashSet<>();
        if (teachers != null) {
            for (Teacher teacher : teachers) {
                if (teacher == null) {
                    errors.add("Teachers list contains a null entry.");
                    continue;
                }
                if (isBlank(teacher.id())) {
                    errors.add("Teacher id must not be blank (name: " + teacher.name() + ").");
                } else if (!teacherIds.add(teacher.id())) {
                    errors.add("Duplicate teacher id '" + teacher.id() + "'.");
                }
                checkAvailability("Teacher '" + teacher.id() + "'", teacher.availability(), errors);
            }
        }

        Set<String> childIds = new HashSet<>();
        if (children != null) {
            for (Child child : children) {
                if (child == null) {
                    errors.add("Children list contains a null entry.");
                    continue;
                }
                if (isBlank(child.id())) {
                    errors.add("Child id must not be blank (name: " + child.name() + ").");
                } else if (!childIds.add(child.id())) {
                    errors.add("Duplicate child id '" + child.id() + "'.");
                }
                checkAvailability("Child '" + child.id() + "'", child.availability(), errors);
                for (String preferred : child.preferredTeacherIds()) {
                    if (isBlank(preferred)) {
                        errors.add("Child '" + child.id() + "' lists a blank preferred teacher id.");
                    } else if (!teacherIds.contains(preferred)) {
                        logger.warn("Child '{}' prefers unknown teacher '{}'; the preference can never be met.", child.id(), preferred);
                    }
                }
            }
        }

        if (tandems != null) {
            Map<String, Tandem> pairedWith = new HashMap<>();
            for (Tandem tandem : tandems) {
                if (tandem == null) {
                    errors.add("Tandems list contains a null entry.");
                    continue;
                }
                if (isBlank(tandem.childA()) || isBlank(tandem.childB())) {
                    errors.add("Tandem " + tandem + " must name two children.");
                    continue;
                }
                if (tandem.childA().equals(tandem.childB())) {
                    errors.add("Tandem " + tandem + " pairs child '" + tandem.childA() + "' with itself.");
                    continue;
                }
                for (String member : List.of(tandem.childA(), tandem.childB())) {
                    if (!childIds.contains(member)) {
                        errors.add("Tandem " + tandem + " references unknown child '" + member + "'.");
                    }
                    Tandem previous = pairedWith.putIfAbsent(member, tandem);
                    if (previous != null) {
                        errors.add("Child '" + member + "' is already paired in tandem " + previous + ".");
                    }
                }
                if (tandem.hasPreferredTeacher() && !teacherIds.contains(tandem.preferredTeacherId())) {
                    logger.warn("Tandem {} prefers unknown teacher '{}'; the preference can never be met.", tandem, tandem.preferredTeacherId());
                }
                if (tandem.priority() < Tandem.MIN_PRIORITY || tandem.priority() > Tandem.MAX_PRIORITY) {
                    errors.add("Tandem " + tandem + " priority must be between " + Tandem.MIN_PRIORITY
                            + " and " + Tandem.MAX_PRIORITY + ", was " + tandem.priority() + ".");
                } else if (tandem.priority() < Tandem.LOW_PRIORITY_THRESHOLD) {
                    logger.warn("Tandem {} has low priority {}; it may not be scheduled together.", tandem, tandem.priority());
                }
            }
        }
    }

    private void checkAvailability(String owner, Set<TimeSlot> availability, List<String> errors) {
        if (availability == null) {
            errors.add(owner + " has no availability list.");
            return;
        }
        for (TimeSlot slot : availability) {
            if (slot == null) {
                errors.add(owner + " has a null availability entry.");
            } else if (slot.weekday() == null || slot.startTime() == null) {
                errors.add(owner + " has an incomplete availability entry " + slot + ".");
            } else if (!SlotGrid.WEEKDAYS.contains(slot.weekday())) {
                errors.add(owner + " is available on a weekend: " + slot + ".");
            } else if (!grid.contains(slot)) {
                errors.add(owner + " availability " + slot + " is off the raster or outside "
                        + grid.getDayStart() + "-" + grid.getDayEnd() + ".");
            }
        }
    }

    private void checkWeights(WeightConfig weights, List<String> errors) {
        if (weights == null) {
            errors.add("Weights must not be null.");
            return;
        }
        checkWeight("preferred_teacher", weights.preferredTeacher(), errors);
        checkWeight("priority_early_slot", weights.priorityEarlySlot(), errors);
        checkWeight("tandem_fulfilled", weights.tandemFulfilled(), errors);
        checkWeight("teacher_pause_respected", weights.teacherPauseRespected(), errors);
        checkWeight("preserve_existing_plan", weights.preserveExistingPlan(), errors);
    }

    private void checkWeight(String name, double value, List<String> errors) {
        if (!Double.isFinite(value) || value < 0) {
            errors.add("Weight " + name + " must be a non-negative number, was " + value + ".");
        }
    }

    private void checkPreviousPlan(PreviousPlan previousPlan, List<String> errors) {
        if (previousPlan == null) return;
        checkAssignments("Previous plan", previousPlan.assignments(), errors);
    }

    private void checkAssignments(String owner, List<Assignment> assignments, List<String> errors) {
        if (assignments == null) {
            errors.add(owner + " must list its assignments.");
            return;
        }
        Set<String> seen = new HashSet<>();
        for (Assignment assignment : assignments) {
            if (assignment == null || isBlank(assignment.childId()) || isBlank(assignment.teacherId())
                    || assignment.weekday() == null || assignment.startTime() == null) {
                errors.add(owner + " contains an incomplete assignment " + assignment + ".");
                continue;
            }
            if (!seen.add(assignment.childId())) {
                errors.add(owner + " lists child '" + assignment.childId() + "' more than once.");
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
