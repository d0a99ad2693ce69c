package com.slotplanner.slotplanner_api.solver;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.slotplanner.slotplanner_api.model.TimeSlot;
import com.slotplanner.slotplanner_api.solver.domain.ChildSession;
import com.slotplanner.slotplanner_api.solver.domain.Placement;
import com.slotplanner.slotplanner_api.solver.domain.SessionSolution;
import com.slotplanner.slotplanner_api.solver.domain.Timeslot;

import ai.timefold.solver.core.api.score.buildin.hardmediumsoftlong.HardMediumSoftLongScore;
import ai.timefold.solver.core.api.solver.Solver;
import ai.timefold.solver.core.api.solver.SolverFactory;
import ai.timefold.solver.core.config.solver.EnvironmentMode;
import ai.timefold.solver.core.config.solver.SolverConfig;
import ai.timefold.solver.core.config.solver.termination.TerminationConfig;

/**
 * Local search backend on Timefold Solver. Never proves optimality, so it always ends in
 * {@link SearchState#FEASIBLE_TIME_LIMITED}. Runs in reproducible mode with the configured seed;
 * any hard-constraint residue in the best solution is repaired greedily in child id order.
 */
public class TimefoldSearch implements SearchBackend {

    private static final Logger logger = LoggerFactory.getLogger(TimefoldSearch.class);

    private static final Duration MIN_LIMIT = Duration.ofMillis(1);

    @Override
    public String name() {
        return "timefold";
    }

    @Override
    public SearchResult findBest(FeasibleSpace space, Objective objective, SearchLimits limits, SearchMonitor monitor) {
        monitor.enter(SearchState.BOUNDING);
        SessionSolution problem = buildProblem(space, objective);
        Candidate[] placed = new Candidate[space.childCount()];

        if (problem.getSessions().isEmpty() || monitor.isCancelled()) {
            logger.info("@@@ Nothing to search (entities: {}, cancelled: {}).", problem.getSessions().size(), monitor.isCancelled());
            monitor.finish(SearchState.FEASIBLE_TIME_LIMITED);
            return new SearchResult(placed, SearchState.FEASIBLE_TIME_LIMITED, ObjectiveValue.ZERO, 0L);
        }

        Solver<SessionSolution> solver = SolverFactory.<SessionSolution>create(solverConfig(limits, monitor)).buildSolver();
        int entityCount = problem.getSessions().size();
        solver.addEventListener(event -> {
            HardMediumSoftLongScore score = (HardMediumSoftLongScore) event.getNewBestScore();
            if (score.hardScore() == 0) {
                monitor.improved(new ObjectiveValue(entityCount + (int) score.mediumScore(), score.softScore()));
            }
            if (monitor.isCancelled()) {
                solver.terminateEarly();
            }
        });
        Runnable cancelHook = solver::terminateEarly;
        monitor.onCancel(cancelHook);
        monitor.enter(SearchState.BRANCHING);

        SessionSolution best;
        try {
            best = solver.solve(problem);
        } finally {
            monitor.removeCancelHook(cancelHook);
        }
        logger.info("@@@ Timefold finished with score {}", best.getScore());

        TeacherCalendar calendar = space.newCalendar();
        List<ChildSession> sessions = new ArrayList<>(best.getSessions());
        sessions.sort(Comparator.comparingInt(ChildSession::getChildIndex));
        for (ChildSession session : sessions) {
            Placement placement = session.getPlacement();
            if (placement == null) continue;
            if (calendar.canPlace(placement.getCandidate())) {
                calendar.place(placement.getCandidate());
            } else {
                logger.warn("!!! Dropping conflicting placement {} for child '{}'", placement, session.getChildId());
            }
        }
        placed = calendar.snapshot();

        ObjectiveValue value = objective.value(placed);
        monitor.improved(value);
        monitor.finish(SearchState.FEASIBLE_TIME_LIMITED);
        return new SearchResult(placed, SearchState.FEASIBLE_TIME_LIMITED, value, 0L);
    }

    SolverConfig solverConfig(SearchLimits limits, SearchMonitor monitor) {
        Duration remaining = monitor.remaining();
        Duration budget = toMillis(remaining.compareTo(limits.timeLimit()) < 0 ? remaining : limits.timeLimit());
        TerminationConfig termination = new TerminationConfig()
                .withSpentLimit(budget)
                .withUnimprovedSpentLimit(toMillis(budget.dividedBy(4)));
        if (limits.nodeLimit() > 0) {
            termination.setStepCountLimit((int) Math.min(limits.nodeLimit(), Integer.MAX_VALUE));
        }
        return new SolverConfig()
                .withSolutionClass(SessionSolution.class)
                .withEntityClasses(ChildSession.class)
                .withConstraintProviderClass(SessionConstraintProvider.class)
                .withEnvironmentMode(EnvironmentMode.REPRODUCIBLE)
                .withRandomSeed(limits.randomSeed())
                .withTerminationConfig(termination);
    }

    /** Timefold only accepts whole milliseconds. */
    static Duration toMillis(Duration duration) {
        Duration truncated = duration.truncatedTo(ChronoUnit.MILLIS);
        return truncated.compareTo(MIN_LIMIT) < 0 ? MIN_LIMIT : truncated;
    }

    SessionSolution buildProblem(FeasibleSpace space, Objective objective) {
        SlotGrid grid = space.grid();
        Map<Integer, Timeslot> timeslots = new HashMap<>();
        List<ChildSession> sessions = new ArrayList<>();
        for (int c = 0; c < space.childCount(); c++) {
            List<Candidate> candidates = space.candidatesOf(c);
            if (candidates.isEmpty()) continue;
            List<Placement> placements = new ArrayList<>(candidates.size());
            for (Candidate candidate : candidates) {
                Timeslot timeslot = timeslots.computeIfAbsent(candidate.position(), position -> {
                    TimeSlot slot = grid.slotAt(position);
                    return new Timeslot((long) position, slot.weekday(), slot.startTime(),
                            slot.startTime().plusMinutes(SlotGrid.SESSION_MINUTES),
                            grid.dayIndexOf(position), grid.tickOf(position));
                });
                placements.add(new Placement(candidate, space.teacher(candidate.teacher()).id(), timeslot));
            }
            int tandem = space.tandemOf(c);
            String groupKey = tandem >= 0 ? "tandem:" + tandem : "solo:" + space.child(c).id();
            sessions.add(new ChildSession(space.child(c).id(), c, groupKey, tandem, objective, placements));
        }
        List<Timeslot> facts = new ArrayList<>(timeslots.values());
        facts.sort(Comparator.comparing(Timeslot::getId));
        return new SessionSolution(facts, sessions);
    }
}
