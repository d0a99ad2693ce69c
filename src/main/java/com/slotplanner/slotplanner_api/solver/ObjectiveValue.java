package com.slotplanner.slotplanner_api.solver;

/**
 * Lexicographic search value: coverage first, fixed-point score second.
 */
public record ObjectiveValue(int coverage, long score) implements Comparable<ObjectiveValue> {

    public static final ObjectiveValue ZERO = new ObjectiveValue(0, 0L);

    @Override
    public int compareTo(ObjectiveValue other) {
        int byCoverage = Integer.compare(coverage, other.coverage);
        return byCoverage != 0 ? byCoverage : Long.compare(score, other.score);
    }
}
