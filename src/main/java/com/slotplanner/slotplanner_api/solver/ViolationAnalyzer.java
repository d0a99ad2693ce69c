package com.slotplanner.slotplanner_api.solver;

import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import com.slotplanner.slotplanner_api.model.Assignment;
import com.slotplanner.slotplanner_api.model.Child;
import com.slotplanner.slotplanner_api.model.Session;
import com.slotplanner.slotplanner_api.model.Tandem;
import com.slotplanner.slotplanner_api.model.Teacher;
import com.slotplanner.slotplanner_api.model.Violation;
import com.slotplanner.slotplanner_api.model.ViolationKind;

/**
 * Lists the goals a finished assignment leaves unmet. Reads the assignment only; never re-solves.
 * <p>
 * Order: per child in id order (unassigned, preferred teacher, early slot), then tandems in
 * declaration order, then back-to-back sessions per teacher in id and slot order.
 */
public class ViolationAnalyzer {

    private final SlotGrid grid;

    public ViolationAnalyzer(SlotGrid grid) {
        this.grid = grid;
    }

    public List<Violation> analyze(List<Assignment> assignments, List<Child> children, List<Teacher> teachers,
                                   List<Tandem> tandems) {
        Map<String, Assignment> byChild = new HashMap<>();
        assignments.forEach(a -> byChild.put(a.childId(), a));
        Set<String> knownTeachers = new HashSet<>();
        teachers.forEach(t -> knownTeachers.add(t.id()));
        List<Violation> violations = new ArrayList<>();

        List<Child> sortedChildren = new ArrayList<>(children);
        sortedChildren.sort(Comparator.comparing(Child::id));
        for (Child child : sortedChildren) {
            Assignment assignment = byChild.get(child.id());
            if (assignment == null) {
                violations.add(new Violation(ViolationKind.UNASSIGNED_CHILD, List.of(child.id()),
                        "Child '" + child.id() + "' could not be scheduled"));
                continue;
            }
            child.firstPreference()
                    .filter(preferred -> !preferred.equals(assignment.teacherId()))
                    .ifPresent(preferred -> violations.add(new Violation(ViolationKind.PREFERRED_TEACHER_UNMET,
                            List.of(child.id(), assignment.teacherId()),
                            "Child '" + child.id() + "' is with teacher '" + assignment.teacherId()
                                    + "' instead of preferred teacher '" + preferred + "'"
                                    + (knownTeachers.contains(preferred) ? "" : " (no such teacher)"))));
            if (child.earlyPreferred() && !grid.isEarly(assignment.slot())) {
                violations.add(new Violation(ViolationKind.EARLY_PREFERENCE_UNMET, List.of(child.id()),
                        "Child '" + child.id() + "' prefers an early slot but starts " + assignment.slot()
                                + " (not before " + grid.getEarlyCutoff() + ")"));
            }
        }

        for (Tandem tandem : tandems) {
            Assignment a = byChild.get(tandem.childA());
            Assignment b = byChild.get(tandem.childB());
            if (a == null || !a.samePlacementAs(b)) {
                violations.add(new Violation(ViolationKind.TANDEM_UNFULFILLED, List.of(tandem.childA(), tandem.childB()),
                        "Tandem '" + tandem.childA() + "' + '" + tandem.childB() + "' does not share a session"));
            } else if (tandem.hasPreferredTeacher() && !tandem.preferredTeacherId().equals(a.teacherId())) {
                violations.add(new Violation(ViolationKind.PREFERRED_TEACHER_UNMET,
                        List.of(tandem.childA(), tandem.childB(), a.teacherId()),
                        "Tandem '" + tandem.childA() + "' + '" + tandem.childB() + "' is with teacher '" + a.teacherId()
                                + "' instead of preferred teacher '" + tandem.preferredTeacherId() + "'"));
            }
        }

        Map<String, List<Session>> byTeacher = new TreeMap<>();
        for (Session session : SessionGrouper.group(assignments, tandems)) {
            byTeacher.computeIfAbsent(session.teacherId(), key -> new ArrayList<>()).add(session);
        }
        for (Map.Entry<String, List<Session>> entry : byTeacher.entrySet()) {
            List<Session> sessions = entry.getValue();
            for (int i = 1; i < sessions.size(); i++) {
                Session previous = sessions.get(i - 1);
                Session current = sessions.get(i);
                if (previous.slot().equals(current.slot())) continue;
                if (previous.slot().weekday() == current.slot().weekday()
                        && ChronoUnit.MINUTES.between(previous.slot().startTime(), current.slot().startTime())
                        < SlotGrid.SESSION_MINUTES + SlotGrid.RASTER_MINUTES) {
                    violations.add(new Violation(ViolationKind.TEACHER_PAUSE_VIOLATED, List.of(entry.getKey()),
                            "Teacher '" + entry.getKey() + "' has back-to-back sessions at " + previous.slot()
                                    + " and " + current.slot()));
                }
            }
        }
        return violations;
    }
}
