package com.slotplanner.slotplanner_api.solver;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Scalar score over candidate assignments, in fixed point ({@link #SCALE} units per weight point).
 * <p>
 * Per-candidate credits (preferred teacher, early slot, preserved placement) are precomputed.
 * Tandem and pause credits depend on several placements and are evaluated on demand.
 */
public final class Objective {

    public static final long SCALE = 1_000_000L;

    private final FeasibleSpace space;
    private final long[][] preferredCredit;
    private final long[][] earlyCredit;
    private final long[][] preserveCredit;
    private final long[][] candidateCredit;
    private final int[][] creditOrder;
    private final long preferredUnit;
    private final long[] tandemCredit;
    private final int[] tandemPreferredTeacher;
    private final long pauseCredit;

    Objective(FeasibleSpace space,
              long[][] preferredCredit,
              long[][] earlyCredit,
              long[][] preserveCredit,
              int[][] creditOrder,
              long preferredUnit,
              long[] tandemCredit,
              int[] tandemPreferredTeacher,
              long pauseCredit) {
        this.space = space;
        this.preferredCredit = preferredCredit;
        this.earlyCredit = earlyCredit;
        this.preserveCredit = preserveCredit;
        this.creditOrder = creditOrder;
        this.preferredUnit = preferredUnit;
        this.tandemCredit = tandemCredit;
        this.tandemPreferredTeacher = tandemPreferredTeacher;
        this.pauseCredit = pauseCredit;
        this.candidateCredit = new long[preferredCredit.length][];
        for (int c = 0; c < preferredCredit.length; c++) {
            candidateCredit[c] = new long[preferredCredit[c].length];
            for (int k = 0; k < preferredCredit[c].length; k++) {
                candidateCredit[c][k] = preferredCredit[c][k] + earlyCredit[c][k] + preserveCredit[c][k];
            }
        }
    }

    public static long scale(double weight, double credit) {
        return Math.round(weight * credit * SCALE);
    }

    public static double unscale(long value) {
        return (double) value / SCALE;
    }

    public FeasibleSpace space() {
        return space;
    }

    public long preferredCredit(Candidate candidate) {
        return preferredCredit[candidate.child()][candidate.ordinal()];
    }

    public long earlyCredit(Candidate candidate) {
        return earlyCredit[candidate.child()][candidate.ordinal()];
    }

    public long preserveCredit(Candidate candidate) {
        return preserveCredit[candidate.child()][candidate.ordinal()];
    }

    /** Sum of the three per-candidate terms. */
    public long candidateCredit(Candidate candidate) {
        return candidateCredit[candidate.child()][candidate.ordinal()];
    }

    /** Candidate ordinals of a child, highest per-candidate credit first, ties by ordinal. */
    public int[] creditOrder(int child) {
        return creditOrder[child];
    }

    /** Priority-scaled credit for fulfilling tandem {@code tandem} with teacher {@code teacher}, preferred extra included. */
    public long tandemBonus(int tandem, int teacher) {
        return tandemCredit[tandem] + (tandemPreferredTeacher[tandem] == teacher ? preferredUnit : 0L);
    }

    public long maxTandemBonus(int tandem) {
        return tandemCredit[tandem] + (tandemPreferredTeacher[tandem] >= 0 ? preferredUnit : 0L);
    }

    public long pauseCredit() {
        return pauseCredit;
    }

    public boolean rewardsPauses() {
        return pauseCredit > 0;
    }

    public ObjectiveValue value(Candidate[] placed) {
        return tally(placed).value();
    }

    public ObjectiveTally tally(Candidate[] placed) {
        int coverage = 0;
        long preferred = 0;
        long early = 0;
        long preserve = 0;
        for (Candidate candidate : placed) {
            if (candidate == null) continue;
            coverage++;
            preferred += preferredCredit(candidate);
            early += earlyCredit(candidate);
            preserve += preserveCredit(candidate);
        }

        long tandem = 0;
        for (int t = 0; t < space.tandems().size(); t++) {
            int a = space.indexOfChild(space.tandems().get(t).childA());
            int b = space.indexOfChild(space.tandems().get(t).childB());
            if (placed[a] != null && placed[a].samePlacementAs(placed[b])) {
                tandem += tandemCredit[t];
                if (tandemPreferredTeacher[t] == placed[a].teacher()) {
                    preferred += preferredUnit;
                }
            }
        }

        long pause = pausePairs(placed) * pauseCredit;
        return new ObjectiveTally(coverage, preferred, early, tandem, pause, preserve);
    }

    /** Consecutive same-day session pairs per teacher separated by at least one free tick. */
    int pausePairs(Candidate[] placed) {
        List<TreeSet<Integer>> starts = new ArrayList<>();
        for (int t = 0; t < space.teacherCount(); t++) starts.add(new TreeSet<>());
        for (Candidate candidate : placed) {
            if (candidate != null) starts.get(candidate.teacher()).add(candidate.position());
        }
        SlotGrid grid = space.grid();
        int pairs = 0;
        for (TreeSet<Integer> teacherStarts : starts) {
            Integer previous = null;
            for (Integer start : teacherStarts) {
                if (previous != null
                        && grid.dayIndexOf(previous) == grid.dayIndexOf(start)
                        && start - previous > SlotGrid.SESSION_TICKS) {
                    pairs++;
                }
                previous = start;
            }
        }
        return pairs;
    }
}
