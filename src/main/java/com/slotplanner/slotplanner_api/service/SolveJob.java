package com.slotplanner.slotplanner_api.service;

import java.time.Duration;
import java.time.Instant;

import com.slotplanner.slotplanner_api.model.Plan;
import com.slotplanner.slotplanner_api.solver.SearchMonitor;

import ai.timefold.solver.core.api.solver.SolverStatus;

/**
 * In-memory record of one asynchronous solve.
 */
public class SolveJob {

    private final String problemId;
    private final SearchMonitor monitor;
    private final Instant submittedAt = Instant.now();
    private volatile SolverStatus status = SolverStatus.SOLVING_SCHEDULED;
    private volatile Plan plan;
    private volatile RuntimeException failure;
    private volatile Instant finishedAt;

    public SolveJob(String problemId, SearchMonitor monitor) {
        this.problemId = problemId;
        this.monitor = monitor;
    }

    public String getProblemId() { return problemId; }
    public SearchMonitor getMonitor() { return monitor; }
    public Instant getSubmittedAt() { return submittedAt; }
    public SolverStatus getStatus() { return status; }
    public Plan getPlan() { return plan; }
    public RuntimeException getFailure() { return failure; }
    public Instant getFinishedAt() { return finishedAt; }

    public boolean isFinished() {
        return plan != null || failure != null;
    }

    /** Finished and left unfetched for longer than {@code retention}. */
    public boolean isExpired(Instant now, Duration retention) {
        Instant finished = finishedAt;
        return finished != null && !finished.plus(retention).isAfter(now);
    }

    void markActive() {
        status = SolverStatus.SOLVING_ACTIVE;
    }

    void complete(Plan result) {
        finishedAt = Instant.now();
        plan = result;
        status = SolverStatus.NOT_SOLVING;
    }

    void fail(RuntimeException error) {
        finishedAt = Instant.now();
        failure = error;
        status = SolverStatus.NOT_SOLVING;
    }
}
