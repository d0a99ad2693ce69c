package com.slotplanner.slotplanner_api.solver;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.slotplanner.slotplanner_api.model.Child;
import com.slotplanner.slotplanner_api.model.Tandem;
import com.slotplanner.slotplanner_api.model.Teacher;

/**
 * Turns validated entities into a {@link FeasibleSpace}. A (child, teacher, start) triple is a
 * candidate only when both the child and the teacher are available on all three ticks of the
 * session. Teacher commitments are left to the search.
 */
public class ConstraintEncoder {

    private static final Logger logger = LoggerFactory.getLogger(ConstraintEncoder.class);

    private final SlotGrid grid;

    public ConstraintEncoder(SlotGrid grid) {
        this.grid = grid;
    }

    public FeasibleSpace encode(List<Child> children, List<Teacher> teachers, List<Tandem> tandems) {
        List<Child> sortedChildren = new ArrayList<>(children);
        sortedChildren.sort(Comparator.comparing(Child::id));
        List<Teacher> sortedTeachers = new ArrayList<>(teachers);
        sortedTeachers.sort(Comparator.comparing(Teacher::id));

        List<BitSet> teacherBits = new ArrayList<>();
        for (Teacher teacher : sortedTeachers) {
            teacherBits.add(grid.positionsOf(teacher.availability()));
        }

        List<List<Candidate>> candidates = new ArrayList<>();
        for (int c = 0; c < sortedChildren.size(); c++) {
            Child child = sortedChildren.get(c);
            BitSet childBits = grid.positionsOf(child.availability());
            List<Candidate> list = new ArrayList<>();
            for (int t = 0; t < sortedTeachers.size(); t++) {
                BitSet both = (BitSet) childBits.clone();
                both.and(teacherBits.get(t));
                for (int p = both.nextSetBit(0); p >= 0; p = both.nextSetBit(p + 1)) {
                    if (grid.coversSession(both, p)) {
                        list.add(new Candidate(c, list.size(), t, p));
                    }
                }
            }
            if (list.isEmpty()) {
                logger.info("@@@ Child '{}' has no legal session with any teacher.", child.id());
            }
            candidates.add(list);
        }

        FeasibleSpace space = new FeasibleSpace(grid, sortedChildren, sortedTeachers, tandems, candidates);
        logger.info("@@@ Encoded {}", space);
        return space;
    }
}
