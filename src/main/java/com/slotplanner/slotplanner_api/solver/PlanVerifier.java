package com.slotplanner.slotplanner_api.solver;

import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.slotplanner.slotplanner_api.exception.SolverFaultException;
import com.slotplanner.slotplanner_api.model.Assignment;
import com.slotplanner.slotplanner_api.model.Child;
import com.slotplanner.slotplanner_api.model.Session;
import com.slotplanner.slotplanner_api.model.SingleOccupantSession;
import com.slotplanner.slotplanner_api.model.Tandem;
import com.slotplanner.slotplanner_api.model.TandemOccupantSession;
import com.slotplanner.slotplanner_api.model.Teacher;
import com.slotplanner.slotplanner_api.model.TimeSlot;

/**
 * Re-checks every hard rule on a finished assignment. A breach here is a solver bug, reported as
 * {@link SolverFaultException}.
 */
public class PlanVerifier {

    private static final Logger logger = LoggerFactory.getLogger(PlanVerifier.class);

    private final SlotGrid grid;

    public PlanVerifier(SlotGrid grid) {
        this.grid = grid;
    }

    public void verify(List<Assignment> assignments, List<Child> children, List<Teacher> teachers, List<Tandem> tandems) {
        List<String> problems = findProblems(assignments, children, teachers, tandems);
        if (!problems.isEmpty()) {
            logger.error("!!! Plan verification failed with {} problem(s): {}", problems.size(), problems);
            throw new SolverFaultException("Solver produced an invalid plan: " + String.join("; ", problems));
        }
    }

    public List<String> findProblems(List<Assignment> assignments, List<Child> children, List<Teacher> teachers,
                                     List<Tandem> tandems) {
        List<String> problems = new ArrayList<>();
        Map<String, Child> childById = new HashMap<>();
        children.forEach(c -> childById.put(c.id(), c));
        Map<String, Teacher> teacherById = new HashMap<>();
        teachers.forEach(t -> teacherById.put(t.id(), t));

        Set<String> seen = new HashSet<>();
        for (Assignment assignment : assignments) {
            if (!seen.add(assignment.childId())) {
                problems.add("child '" + assignment.childId() + "' is assigned more than once");
            }
            if (!childById.containsKey(assignment.childId())) {
                problems.add("unknown child '" + assignment.childId() + "'");
            }
            if (!teacherById.containsKey(assignment.teacherId())) {
                problems.add("unknown teacher '" + assignment.teacherId() + "'");
            }
            if (!grid.contains(assignment.slot()) || !grid.isStartPosition(grid.positionOf(assignment.slot()))) {
                problems.add("child '" + assignment.childId() + "' starts at " + assignment.slot() + ", which cannot hold a session");
            }
        }
        if (!problems.isEmpty()) return problems;

        List<Session> sessions = SessionGrouper.group(assignments, tandems);
        Map<String, List<Session>> byTeacher = new HashMap<>();
        for (Session session : sessions) {
            byTeacher.computeIfAbsent(session.teacherId(), key -> new ArrayList<>()).add(session);
            Teacher teacher = teacherById.get(session.teacherId());
            if (session instanceof SingleOccupantSession) {
                SingleOccupantSession single = (SingleOccupantSession) session;
                checkAvailability(single.slot(), teacher, childById.get(single.childId()), problems);
            } else if (session instanceof TandemOccupantSession) {
                TandemOccupantSession pair = (TandemOccupantSession) session;
                checkAvailability(pair.slot(), teacher, childById.get(pair.childA()), problems);
                checkAvailability(pair.slot(), teacher, childById.get(pair.childB()), problems);
            }
        }

        for (List<Session> teacherSessions : byTeacher.values()) {
            // grouped sessions arrive in slot order per teacher
            for (int i = 1; i < teacherSessions.size(); i++) {
                Session previous = teacherSessions.get(i - 1);
                Session current = teacherSessions.get(i);
                if (overlaps(previous.slot(), current.slot())) {
                    problems.add("teacher '" + current.teacherId() + "' has overlapping sessions " + previous.childIds()
                            + " at " + previous.slot() + " and " + current.childIds() + " at " + current.slot());
                }
            }
        }
        return problems;
    }

    private void checkAvailability(TimeSlot start, Teacher teacher, Child child, List<String> problems) {
        for (int i = 0; i < SlotGrid.SESSION_TICKS; i++) {
            TimeSlot tick = start.plusMinutes(i * SlotGrid.RASTER_MINUTES);
            if (!teacher.availability().contains(tick)) {
                problems.add("teacher '" + teacher.id() + "' is not available at " + tick);
            }
            if (!child.availability().contains(tick)) {
                problems.add("child '" + child.id() + "' is not available at " + tick);
            }
        }
    }

    private static boolean overlaps(TimeSlot earlier, TimeSlot later) {
        return earlier.weekday() == later.weekday()
                && ChronoUnit.MINUTES.between(earlier.startTime(), later.startTime()) < SlotGrid.SESSION_MINUTES;
    }
}
