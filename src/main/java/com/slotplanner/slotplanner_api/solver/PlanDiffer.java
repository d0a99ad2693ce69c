package com.slotplanner.slotplanner_api.solver;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import com.slotplanner.slotplanner_api.model.Assignment;
import com.slotplanner.slotplanner_api.model.DiffEntry;
import com.slotplanner.slotplanner_api.model.DiffKind;
import com.slotplanner.slotplanner_api.model.PreviousPlan;

public class PlanDiffer {

    /** One entry per child present in either side, in child id order. */
    public List<DiffEntry> diff(List<Assignment> current, PreviousPlan previous) {
        Map<String, Assignment> now = index(current);
        Map<String, Assignment> before = index(previous == null ? List.of() : previous.assignments());
        Set<String> childIds = new TreeSet<>(now.keySet());
        childIds.addAll(before.keySet());

        List<DiffEntry> entries = new ArrayList<>();
        for (String childId : childIds) {
            Assignment oldOne = before.get(childId);
            Assignment newOne = now.get(childId);
            DiffKind kind;
            if (oldOne == null) {
                kind = DiffKind.ADDED;
            } else if (newOne == null) {
                kind = DiffKind.REMOVED;
            } else if (oldOne.samePlacementAs(newOne)) {
                kind = DiffKind.UNCHANGED;
            } else {
                kind = DiffKind.CHANGED;
            }
            entries.add(new DiffEntry(childId, kind, oldOne, newOne));
        }
        return entries;
    }

    /** Children whose teacher and start are the same on both sides. */
    public Set<String> unchangedChildren(List<Assignment> current, PreviousPlan previous) {
        Set<String> unchanged = new TreeSet<>();
        for (DiffEntry entry : diff(current, previous)) {
            if (entry.kind() == DiffKind.UNCHANGED) unchanged.add(entry.childId());
        }
        return unchanged;
    }

    private static Map<String, Assignment> index(List<Assignment> assignments) {
        Map<String, Assignment> byChild = new TreeMap<>();
        assignments.forEach(a -> byChild.put(a.childId(), a));
        return byChild;
    }
}
