package com.slotplanner.slotplanner_api.solver;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared handle between a running search and its caller: cooperative cancellation, the deadline,
 * the node budget and throttled progress reporting. One monitor per solve.
 */
public class SearchMonitor {

    private static final Logger logger = LoggerFactory.getLogger(SearchMonitor.class);

    private static final Duration LONGEST_DEADLINE = Duration.ofNanos(Long.MAX_VALUE);

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Runnable> cancelHooks = new CopyOnWriteArrayList<>();
    private final AtomicLong nodes = new AtomicLong();
    private final AtomicLong lastReportNanos = new AtomicLong();
    private final SolveProgressListener listener;
    private final long progressIntervalNanos;

    private volatile long startNanos = System.nanoTime();
    private volatile long deadlineNanos = Long.MAX_VALUE;
    private volatile boolean hasDeadline;
    private volatile long nodeLimit;
    private volatile SearchState state = SearchState.UNEXPLORED;
    private volatile ObjectiveValue best = ObjectiveValue.ZERO;

    public SearchMonitor() {
        this(SolveProgressListener.none(), Duration.ofSeconds(1));
    }

    public SearchMonitor(SolveProgressListener listener, Duration progressInterval) {
        this.listener = listener;
        this.progressIntervalNanos = progressInterval.toNanos();
    }

    public void start(SearchLimits limits) {
        startNanos = System.nanoTime();
        lastReportNanos.set(startNanos);
        if (limits.timeLimit().compareTo(LONGEST_DEADLINE) > 0) {
            // not representable in nanoseconds, so the search runs without a deadline
            deadlineNanos = Long.MAX_VALUE;
            hasDeadline = false;
        } else {
            deadlineNanos = startNanos + limits.timeLimit().toNanos();
            hasDeadline = true;
        }
        nodeLimit = limits.nodeLimit();
        nodes.set(0);
        best = ObjectiveValue.ZERO;
        state = SearchState.UNEXPLORED;
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            logger.info("@@@ Cancellation requested after {} ms.", elapsed().toMillis());
            for (Runnable hook : cancelHooks) {
                hook.run();
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /** Runs {@code hook} on cancellation, or right away if already cancelled. */
    public void onCancel(Runnable hook) {
        cancelHooks.add(hook);
        if (cancelled.get()) hook.run();
    }

    public void removeCancelHook(Runnable hook) {
        cancelHooks.remove(hook);
    }

    public boolean isPastDeadline() {
        return hasDeadline && System.nanoTime() - deadlineNanos >= 0;
    }

    public boolean isOverNodeBudget() {
        long limit = nodeLimit;
        return limit > 0 && nodes.get() >= limit;
    }

    public boolean shouldStop() {
        return isCancelled() || isPastDeadline() || isOverNodeBudget();
    }

    public Duration remaining() {
        if (!hasDeadline) return LONGEST_DEADLINE;
        return Duration.ofNanos(Math.max(0L, deadlineNanos - System.nanoTime()));
    }

    public long addNodes(long count) {
        return nodes.addAndGet(count);
    }

    public long nodesExplored() {
        return nodes.get();
    }

    public void enter(SearchState next) {
        state = next;
    }

    public SearchState state() {
        return state;
    }

    public void improved(ObjectiveValue value) {
        best = value;
        maybeReport();
    }

    /** Emits a progress notification if the interval has elapsed. */
    public void maybeReport() {
        long now = System.nanoTime();
        long last = lastReportNanos.get();
        if (now - last >= progressIntervalNanos && lastReportNanos.compareAndSet(last, now)) {
            report();
        }
    }

    public void finish(SearchState terminal) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Search cannot finish in state " + terminal);
        }
        state = terminal;
        report();
    }

    public Duration elapsed() {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    public SolveProgress progress() {
        ObjectiveValue value = best;
        return new SolveProgress(state, elapsed(), value.coverage(), Objective.unscale(value.score()), nodes.get());
    }

    private void report() {
        try {
            listener.onProgress(progress());
        } catch (RuntimeException e) {
            logger.warn("!!! Progress listener failed: {}", e.getMessage(), e);
        }
    }
}
