package com.slotplanner.slotplanner_api.solver;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.slotplanner.slotplanner_api.model.Assignment;
import com.slotplanner.slotplanner_api.model.Child;
import com.slotplanner.slotplanner_api.model.Tandem;
import com.slotplanner.slotplanner_api.model.Teacher;

/**
 * Indexed view of one planning problem: children and teachers sorted by id, tandems in
 * declaration order, and per child the legal candidates in (teacher id, slot order).
 * Immutable once built; every search gets its own {@link TeacherCalendar}.
 */
public final class FeasibleSpace {

    private final SlotGrid grid;
    private final List<Child> children;
    private final List<Teacher> teachers;
    private final List<Tandem> tandems;
    private final Map<String, Integer> childIndex;
    private final Map<String, Integer> teacherIndex;
    private final int[] partner;
    private final int[] tandemOf;
    private final List<List<Candidate>> candidates;

    FeasibleSpace(SlotGrid grid, List<Child> children, List<Teacher> teachers, List<Tandem> tandems,
                  List<List<Candidate>> candidates) {
        this.grid = grid;
        this.children = List.copyOf(children);
        this.teachers = List.copyOf(teachers);
        this.tandems = List.copyOf(tandems);
        this.childIndex = indexChildren(this.children);
        this.teacherIndex = indexTeachers(this.teachers);
        this.partner = new int[this.children.size()];
        this.tandemOf = new int[this.children.size()];
        Arrays.fill(partner, -1);
        Arrays.fill(tandemOf, -1);
        for (int t = 0; t < this.tandems.size(); t++) {
            int a = childIndex.get(this.tandems.get(t).childA());
            int b = childIndex.get(this.tandems.get(t).childB());
            partner[a] = b;
            partner[b] = a;
            tandemOf[a] = t;
            tandemOf[b] = t;
        }
        List<List<Candidate>> frozen = new ArrayList<>(candidates.size());
        for (List<Candidate> list : candidates) {
            frozen.add(Collections.unmodifiableList(new ArrayList<>(list)));
        }
        this.candidates = Collections.unmodifiableList(frozen);
    }

    private static Map<String, Integer> indexChildren(List<Child> children) {
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < children.size(); i++) index.put(children.get(i).id(), i);
        return index;
    }

    private static Map<String, Integer> indexTeachers(List<Teacher> teachers) {
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < teachers.size(); i++) index.put(teachers.get(i).id(), i);
        return index;
    }

    public SlotGrid grid() { return grid; }
    public List<Child> children() { return children; }
    public List<Teacher> teachers() { return teachers; }
    public List<Tandem> tandems() { return tandems; }
    public int childCount() { return children.size(); }
    public int teacherCount() { return teachers.size(); }

    public Child child(int index) { return children.get(index); }
    public Teacher teacher(int index) { return teachers.get(index); }

    /** Index of a child id, or -1 if unknown. */
    public int indexOfChild(String childId) {
        return childIndex.getOrDefault(childId, -1);
    }

    /** Index of a teacher id, or -1 if unknown. */
    public int indexOfTeacher(String teacherId) {
        return teacherId == null ? -1 : teacherIndex.getOrDefault(teacherId, -1);
    }

    public List<Candidate> candidatesOf(int child) {
        return candidates.get(child);
    }

    public int candidateCount() {
        return candidates.stream().mapToInt(List::size).sum();
    }

    /** Tandem partner of a child, or -1. */
    public int partnerOf(int child) {
        return partner[child];
    }

    /** Index into {@link #tandems()} of the child's tandem, or -1. */
    public int tandemOf(int child) {
        return tandemOf[child];
    }

    /** The candidate of {@code child} at the given placement, or {@code null} if it is not legal. */
    public Candidate candidateAt(int child, int teacher, int position) {
        for (Candidate candidate : candidates.get(child)) {
            if (candidate.teacher() == teacher && candidate.position() == position) return candidate;
        }
        return null;
    }

    public TeacherCalendar newCalendar() {
        return new TeacherCalendar(this);
    }

    public Assignment toAssignment(Candidate candidate) {
        return Assignment.of(children.get(candidate.child()).id(), teachers.get(candidate.teacher()).id(),
                grid.slotAt(candidate.position()));
    }

    /** Assignments of the placed candidates, in child id order. */
    public List<Assignment> toAssignments(Candidate[] placed) {
        List<Assignment> assignments = new ArrayList<>();
        for (Candidate candidate : placed) {
            if (candidate != null) assignments.add(toAssignment(candidate));
        }
        return assignments;
    }

    @Override
    public String toString() {
        return "FeasibleSpace[children=" + children.size() + ", teachers=" + teachers.size()
                + ", tandems=" + tandems.size() + ", candidates=" + candidateCount() + "]";
    }
}
