package com.slotplanner.slotplanner_api.solver;

import java.util.Arrays;
import java.util.BitSet;

/**
 * Mutable occupancy of one search: which raster positions each teacher has committed, how many
 * children sit in each started session, and which candidate every child currently holds.
 * Not thread-safe; each search worker builds its own.
 */
public final class TeacherCalendar {

    private final FeasibleSpace space;
    private final BitSet[] occupied;
    private final int[][] occupants;
    private final Candidate[] placed;

    TeacherCalendar(FeasibleSpace space) {
        this.space = space;
        int positions = space.grid().positionCount();
        this.occupied = new BitSet[space.teacherCount()];
        this.occupants = new int[space.teacherCount()][positions];
        for (int t = 0; t < occupied.length; t++) {
            occupied[t] = new BitSet(positions);
        }
        this.placed = new Candidate[space.childCount()];
    }

    /**
     * A child may start a fresh session where the teacher's three ticks are free, or join an
     * already started session whose only occupant is its tandem partner.
     */
    public boolean canPlace(Candidate candidate) {
        if (placed[candidate.child()] != null) return false;
        int teacher = candidate.teacher();
        int start = candidate.position();
        int count = occupants[teacher][start];
        if (count > 0) {
            int partner = space.partnerOf(candidate.child());
            return count == 1 && partner >= 0 && candidate.samePlacementAs(placed[partner]);
        }
        BitSet bits = occupied[teacher];
        for (int i = 0; i < SlotGrid.SESSION_TICKS; i++) {
            if (bits.get(start + i)) return false;
        }
        return true;
    }

    /** True if placing the candidate would join its partner's session. */
    public boolean joinsPartner(Candidate candidate) {
        return occupants[candidate.teacher()][candidate.position()] > 0;
    }

    public void place(Candidate candidate) {
        int teacher = candidate.teacher();
        int start = candidate.position();
        if (occupants[teacher][start]++ == 0) {
            occupied[teacher].set(start, start + SlotGrid.SESSION_TICKS);
        }
        placed[candidate.child()] = candidate;
    }

    public void remove(Candidate candidate) {
        int teacher = candidate.teacher();
        int start = candidate.position();
        if (--occupants[teacher][start] == 0) {
            occupied[teacher].clear(start, start + SlotGrid.SESSION_TICKS);
        }
        placed[candidate.child()] = null;
    }

    public Candidate placementOf(int child) {
        return placed[child];
    }

    public Candidate[] snapshot() {
        return Arrays.copyOf(placed, placed.length);
    }
}
