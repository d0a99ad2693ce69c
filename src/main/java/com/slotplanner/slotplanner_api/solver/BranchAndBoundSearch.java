package com.slotplanner.slotplanner_api.solver;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.slotplanner.slotplanner_api.exception.SolverFaultException;

/**
 * Exact depth-first branch and bound.
 * <p>
 * Children are decided in id order; each child tries its candidates in (teacher id, slot order)
 * and then "unassigned". Depth-first order is therefore the lexicographic order of the sorted
 * assignment lists, and keeping the first of several equal-valued solutions yields the
 * lexicographically smallest one.
 * <p>
 * With more than one worker the root child's options are split into branches. A branch only
 * prunes an equal-valued subtree against an incumbent from itself or an earlier branch, so the
 * optimum returned does not depend on the worker count.
 */
public class BranchAndBoundSearch implements SearchBackend {

    private static final Logger logger = LoggerFactory.getLogger(BranchAndBoundSearch.class);
    static final int CHECK_INTERVAL = 256;

    @Override
    public String name() {
        return "branch-and-bound";
    }

    @Override
    public SearchResult findBest(FeasibleSpace space, Objective objective, SearchLimits limits, SearchMonitor monitor) {
        monitor.enter(SearchState.BOUNDING);
        Incumbent incumbent = new Incumbent(space.childCount());
        if (space.childCount() == 0) {
            monitor.finish(SearchState.OPTIMAL);
            return new SearchResult(new Candidate[0], SearchState.OPTIMAL, ObjectiveValue.ZERO, 0L);
        }

        monitor.enter(SearchState.BRANCHING);
        boolean complete = limits.parallelism() <= 1
                ? new Worker(space, objective, monitor, incumbent, space.newCalendar(), 0).run()
                : runParallel(space, objective, monitor, incumbent, limits.parallelism());

        SearchState terminal = complete ? SearchState.OPTIMAL : SearchState.FEASIBLE_TIME_LIMITED;
        Best best = incumbent.best;
        monitor.improved(best.value);
        monitor.finish(terminal);
        logger.info("@@@ Branch and bound finished: {} after {} nodes, coverage {}, score {}",
                terminal, monitor.nodesExplored(), best.value.coverage(), Objective.unscale(best.value.score()));
        return new SearchResult(best.placed.clone(), terminal, best.value, monitor.nodesExplored());
    }

    private boolean runParallel(FeasibleSpace space, Objective objective, SearchMonitor monitor,
                                Incumbent incumbent, int parallelism) {
        List<Candidate> rootOptions = space.candidatesOf(0);
        int branches = rootOptions.size() + 1;
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(parallelism, branches), new WorkerThreadFactory());
        logger.info("@@@ Splitting root into {} branches over {} workers.", branches, Math.min(parallelism, branches));
        try {
            List<Future<Boolean>> futures = new ArrayList<>(branches);
            for (int b = 0; b < branches; b++) {
                final int branch = b;
                futures.add(pool.submit(() -> {
                    Worker worker = new Worker(space, objective, monitor, incumbent, space.newCalendar(), branch);
                    return branch < rootOptions.size() ? worker.runFrom(rootOptions.get(branch)) : worker.runUnassignedRoot();
                }));
            }
            boolean complete = true;
            for (Future<Boolean> future : futures) {
                complete &= future.get();
            }
            return complete;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("!!! Interrupted while waiting for search workers; returning best so far.");
            return false;
        } catch (ExecutionException e) {
            logger.error("!!! Search worker failed: {}", e.getCause().getMessage(), e.getCause());
            throw new SolverFaultException("Search worker failed: " + e.getCause().getMessage(), e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    private record Best(ObjectiveValue value, int branch, Candidate[] placed) {}

    /** Best complete assignment seen so far, shared by all workers. */
    private static final class Incumbent {

        private volatile Best best;

        Incumbent(int childCount) {
            // the empty assignment is always feasible
            this.best = new Best(ObjectiveValue.ZERO, Integer.MAX_VALUE, new Candidate[childCount]);
        }

        boolean prunes(ObjectiveValue bound, int branch) {
            Best current = best;
            int cmp = bound.compareTo(current.value);
            return cmp < 0 || (cmp == 0 && current.branch <= branch);
        }

        synchronized boolean offer(ObjectiveValue value, int branch, TeacherCalendar calendar) {
            Best current = best;
            int cmp = value.compareTo(current.value);
            if (cmp > 0 || (cmp == 0 && branch < current.branch)) {
                best = new Best(value, branch, calendar.snapshot());
                return true;
            }
            return false;
        }
    }

    private static final class Worker {

        private final FeasibleSpace space;
        private final Objective objective;
        private final SearchMonitor monitor;
        private final Incumbent incumbent;
        private final TeacherCalendar calendar;
        private final int branch;
        private final int childCount;

        private int coverage;
        private long score;
        private int sessions;
        private long pendingNodes;
        private boolean stopped;

        Worker(FeasibleSpace space, Objective objective, SearchMonitor monitor, Incumbent incumbent,
               TeacherCalendar calendar, int branch) {
            this.space = space;
            this.objective = objective;
            this.monitor = monitor;
            this.incumbent = incumbent;
            this.calendar = calendar;
            this.branch = branch;
            this.childCount = space.childCount();
        }

        boolean run() {
            search(0);
            return finish();
        }

        boolean runFrom(Candidate rootOption) {
            apply(rootOption);
            search(1);
            return finish();
        }

        boolean runUnassignedRoot() {
            search(1);
            return finish();
        }

        private boolean finish() {
            monitor.addNodes(pendingNodes);
            pendingNodes = 0;
            return !stopped;
        }

        private void search(int depth) {
            if (stopped) return;
            if (++pendingNodes >= CHECK_INTERVAL) {
                monitor.addNodes(pendingNodes);
                pendingNodes = 0;
                if (monitor.shouldStop() || Thread.currentThread().isInterrupted()) {
                    stopped = true;
                    return;
                }
                monitor.maybeReport();
            }

            if (depth == childCount) {
                ObjectiveValue value = leafValue();
                if (incumbent.offer(value, branch, calendar)) {
                    monitor.improved(value);
                }
                return;
            }
            if (incumbent.prunes(bound(depth), branch)) return;

            for (Candidate candidate : space.candidatesOf(depth)) {
                if (!calendar.canPlace(candidate)) continue;
                long delta = apply(candidate);
                search(depth + 1);
                undo(candidate, delta);
                if (stopped) return;
            }
            search(depth + 1);
        }

        private long apply(Candidate candidate) {
            long delta = objective.candidateCredit(candidate);
            if (calendar.joinsPartner(candidate)) {
                delta += objective.tandemBonus(space.tandemOf(candidate.child()), candidate.teacher());
            } else {
                sessions++;
            }
            calendar.place(candidate);
            coverage++;
            score += delta;
            return delta;
        }

        private void undo(Candidate candidate, long delta) {
            calendar.remove(candidate);
            if (!calendar.joinsPartner(candidate)) {
                sessions--;
            }
            coverage--;
            score -= delta;
        }

        private ObjectiveValue leafValue() {
            long pause = objective.rewardsPauses()
                    ? objective.pausePairs(calendar.snapshot()) * objective.pauseCredit()
                    : 0L;
            return new ObjectiveValue(coverage, score + pause);
        }

        /** Optimistic value of any completion of the current partial assignment. */
        private ObjectiveValue bound(int depth) {
            int boundCoverage = coverage;
            long boundScore = score;
            int placeable = 0;
            for (int child = depth; child < childCount; child++) {
                Candidate best = bestPlaceable(child);
                if (best == null) continue;
                placeable++;
                boundCoverage++;
                boundScore += objective.candidateCredit(best);

                int tandem = space.tandemOf(child);
                if (tandem < 0) continue;
                int partner = space.partnerOf(child);
                if (partner > child) {
                    boundScore += objective.maxTandemBonus(tandem);
                } else if (partner < depth) {
                    Candidate partnerPlacement = calendar.placementOf(partner);
                    if (partnerPlacement != null) {
                        Candidate join = space.candidateAt(child, partnerPlacement.teacher(), partnerPlacement.position());
                        if (join != null && calendar.canPlace(join)) {
                            boundScore += objective.tandemBonus(tandem, join.teacher());
                        }
                    }
                }
            }
            if (objective.rewardsPauses()) {
                // n sessions leave at most n - 1 consecutive pairs
                boundScore += (long) Math.max(0, sessions + placeable - 1) * objective.pauseCredit();
            }
            return new ObjectiveValue(boundCoverage, boundScore);
        }

        private Candidate bestPlaceable(int child) {
            List<Candidate> candidates = space.candidatesOf(child);
            for (int ordinal : objective.creditOrder(child)) {
                Candidate candidate = candidates.get(ordinal);
                if (calendar.canPlace(candidate)) return candidate;
            }
            return null;
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "bnb-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
