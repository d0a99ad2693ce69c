package com.slotplanner.slotplanner_api.solver;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.slotplanner.slotplanner_api.model.Assignment;
import com.slotplanner.slotplanner_api.model.Session;
import com.slotplanner.slotplanner_api.model.SingleOccupantSession;
import com.slotplanner.slotplanner_api.model.Tandem;
import com.slotplanner.slotplanner_api.model.TandemOccupantSession;
import com.slotplanner.slotplanner_api.model.TimeSlot;

/**
 * Folds assignments that share a teacher and start into {@link Session}s, ordered by teacher id
 * and slot. Two children sharing a start become a tandem session only if they form a declared
 * tandem; any other crowd is returned as separate single sessions for the verifier to reject.
 */
public final class SessionGrouper {

    private SessionGrouper() {}

    public static List<Session> group(List<Assignment> assignments, List<Tandem> tandems) {
        List<Assignment> sorted = new ArrayList<>(assignments);
        sorted.sort(Comparator.comparing(Assignment::teacherId)
                .thenComparing(Assignment::slot)
                .thenComparing(Assignment::childId));

        Map<String, List<Assignment>> byPlacement = new LinkedHashMap<>();
        for (Assignment assignment : sorted) {
            byPlacement.computeIfAbsent(assignment.teacherId() + "@" + assignment.slot(), key -> new ArrayList<>())
                    .add(assignment);
        }

        List<Session> sessions = new ArrayList<>();
        for (List<Assignment> group : byPlacement.values()) {
            Assignment first = group.get(0);
            TimeSlot slot = first.slot();
            Tandem tandem = group.size() == 2 ? findTandem(tandems, group.get(0).childId(), group.get(1).childId()) : null;
            if (tandem != null) {
                sessions.add(new TandemOccupantSession(first.teacherId(), slot, tandem,
                        group.get(0).childId(), group.get(1).childId()));
            } else {
                for (Assignment assignment : group) {
                    sessions.add(new SingleOccupantSession(assignment.teacherId(), slot, assignment.childId()));
                }
            }
        }
        return sessions;
    }

    public static Tandem findTandem(List<Tandem> tandems, String childA, String childB) {
        for (Tandem tandem : tandems) {
            if (tandem.contains(childA) && tandem.contains(childB) && !Objects.equals(childA, childB)) {
                return tandem;
            }
        }
        return null;
    }
}
