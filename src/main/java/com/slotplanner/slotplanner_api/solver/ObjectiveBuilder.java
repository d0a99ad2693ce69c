package com.slotplanner.slotplanner_api.solver;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.slotplanner.slotplanner_api.model.Assignment;
import com.slotplanner.slotplanner_api.model.Child;
import com.slotplanner.slotplanner_api.model.PreviousPlan;
import com.slotplanner.slotplanner_api.model.Tandem;
import com.slotplanner.slotplanner_api.model.WeightConfig;

public class ObjectiveBuilder {

    private static final Logger logger = LoggerFactory.getLogger(ObjectiveBuilder.class);

    public Objective build(FeasibleSpace space, WeightConfig weights, PreviousPlan previousPlan) {
        SlotGrid grid = space.grid();
        PreviousPlan previous = previousPlan == null ? PreviousPlan.empty() : previousPlan;
        int n = space.childCount();
        long[][] preferred = new long[n][];
        long[][] early = new long[n][];
        long[][] preserve = new long[n][];
        int[][] order = new int[n][];

        long preferredUnit = Objective.scale(weights.preferredTeacher(), 1.0);
        long preserveUnit = Objective.scale(weights.preserveExistingPlan(), 1.0);

        for (int c = 0; c < n; c++) {
            Child child = space.child(c);
            List<Candidate> candidates = space.candidatesOf(c);
            int firstChoice = child.firstPreference().map(space::indexOfTeacher).orElse(-1);
            Optional<Assignment> kept = previous.find(child.id());
            int keptTeacher = kept.map(a -> space.indexOfTeacher(a.teacherId())).orElse(-1);
            int keptPosition = kept.filter(a -> grid.contains(a.slot())).map(a -> grid.positionOf(a.slot())).orElse(-1);

            preferred[c] = new long[candidates.size()];
            early[c] = new long[candidates.size()];
            preserve[c] = new long[candidates.size()];
            for (Candidate candidate : candidates) {
                int k = candidate.ordinal();
                if (candidate.teacher() == firstChoice) {
                    preferred[c][k] = preferredUnit;
                }
                if (child.earlyPreferred()) {
                    early[c][k] = Objective.scale(weights.priorityEarlySlot(), grid.earliness(candidate.position()));
                }
                if (candidate.teacher() == keptTeacher && candidate.position() == keptPosition) {
                    preserve[c][k] = preserveUnit;
                }
            }
            final int ci = c;
            order[c] = IntStream.range(0, candidates.size())
                    .boxed()
                    .sorted(Comparator.<Integer>comparingLong(k -> -(preferred[ci][k] + early[ci][k] + preserve[ci][k]))
                            .thenComparingInt(k -> k))
                    .mapToInt(Integer::intValue)
                    .toArray();
        }

        int[] tandemPreferredTeacher = new int[space.tandems().size()];
        long[] tandemCredit = new long[space.tandems().size()];
        Arrays.fill(tandemPreferredTeacher, -1);
        for (int t = 0; t < tandemPreferredTeacher.length; t++) {
            Tandem tandem = space.tandems().get(t);
            tandemCredit[t] = Objective.scale(weights.tandemFulfilled(), tandem.priorityFactor());
            if (tandem.hasPreferredTeacher()) {
                tandemPreferredTeacher[t] = space.indexOfTeacher(tandem.preferredTeacherId());
            }
        }

        logger.info("@@@ Objective weights: preferred={}, early={}, tandem={}, pause={}, preserve={}",
                weights.preferredTeacher(), weights.priorityEarlySlot(), weights.tandemFulfilled(),
                weights.teacherPauseRespected(), weights.preserveExistingPlan());

        return new Objective(space, preferred, early, preserve, order, preferredUnit,
                tandemCredit,
                tandemPreferredTeacher,
                Objective.scale(weights.teacherPauseRespected(), 1.0));
    }
}
