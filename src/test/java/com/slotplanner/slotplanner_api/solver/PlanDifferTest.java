package com.slotplanner.slotplanner_api.solver;

import static org.junit.jupiter.api.Assertions.*;

import java.time.DayOfWeek;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.slotplanner.slotplanner_api.model.Assignment;
import com.slotplanner.slotplanner_api.model.DiffEntry;
import com.slotplanner.slotplanner_api.model.DiffKind;
import com.slotplanner.slotplanner_api.model.PreviousPlan;
import com.slotplanner.slotplanner_api.model.TimeSlot;

class PlanDifferTest {

    private final PlanDiffer differ = new PlanDiffer();

    private static final TimeSlot MON_8 = TimeSlot.of(DayOfWeek.MONDAY, 8, 0);
    private static final TimeSlot MON_9 = TimeSlot.of(DayOfWeek.MONDAY, 9, 0);

    @Test
    void classifiesEveryChildOnEitherSide() {
        List<Assignment> current = List.of(
                Assignment.of("D", "T1", MON_8),
                Assignment.of("A", "T1", MON_9),
                Assignment.of("B", "T2", MON_8));
        PreviousPlan previous = new PreviousPlan(List.of(
                Assignment.of("A", "T1", MON_9),
                Assignment.of("B", "T1", MON_8),
                Assignment.of("C", "T2", MON_9)));

        List<DiffEntry> diff = differ.diff(current, previous);

        assertEquals(List.of("A", "B", "C", "D"), diff.stream().map(DiffEntry::childId).toList());
        assertEquals(List.of(DiffKind.UNCHANGED, DiffKind.CHANGED, DiffKind.REMOVED, DiffKind.ADDED),
                diff.stream().map(DiffEntry::kind).toList());
        assertNull(diff.get(2).current());
        assertNull(diff.get(3).previous());
        assertEquals("T1", diff.get(1).previous().teacherId());
        assertEquals("T2", diff.get(1).current().teacherId());
    }

    @Test
    void emptyPreviousPlanMarksEverythingAdded() {
        List<DiffEntry> diff = differ.diff(List.of(Assignment.of("A", "T1", MON_8)), PreviousPlan.empty());

        assertEquals(1, diff.size());
        assertEquals(DiffKind.ADDED, diff.get(0).kind());
    }

    @Test
    void unchangedChildrenIgnoresMovedOnes() {
        List<Assignment> current = List.of(Assignment.of("A", "T1", MON_8), Assignment.of("B", "T1", MON_9));
        PreviousPlan previous = new PreviousPlan(List.of(Assignment.of("A", "T1", MON_8), Assignment.of("B", "T2", MON_9)));

        assertEquals(Set.of("A"), differ.unchangedChildren(current, previous));
    }
}
