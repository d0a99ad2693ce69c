package com.slotplanner.slotplanner_api.service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.slotplanner.slotplanner_api.dto.DiffRequest;
import com.slotplanner.slotplanner_api.dto.ExplainRequest;
import com.slotplanner.slotplanner_api.dto.SolveRequest;
import com.slotplanner.slotplanner_api.exception.JobInProgressException;
import com.slotplanner.slotplanner_api.exception.SolverFaultException;
import com.slotplanner.slotplanner_api.model.DiffEntry;
import com.slotplanner.slotplanner_api.model.Plan;
import com.slotplanner.slotplanner_api.model.PlanningProblem;
import com.slotplanner.slotplanner_api.model.Violation;
import com.slotplanner.slotplanner_api.solver.PlanningEngine;
import com.slotplanner.slotplanner_api.solver.SearchMonitor;

import ai.timefold.solver.core.api.solver.SolverStatus;

/**
 * Runs solves synchronously or as background jobs. A finished job is kept until its plan is
 * fetched, cancelled or left unfetched for longer than the retention period.
 */
@Service
public class SchedulingService {
    private static final Logger logger = LoggerFactory.getLogger(SchedulingService.class);

    private final PlanningEngine planningEngine;
    private final ExecutorService solveExecutor;
    private final Duration retention;
    private final ConcurrentMap<String, SolveJob> jobs = new ConcurrentHashMap<>();

    public SchedulingService(PlanningEngine planningEngine,
                             @Qualifier("solveExecutor") ExecutorService solveExecutor,
                             @Value("${slotplanner.jobs.retention:PT1H}") Duration retention) {
        this.planningEngine = planningEngine;
        this.solveExecutor = solveExecutor;
        this.retention = retention;
        logger.info("Finished jobs are kept for at most {} unless fetched.", retention);
    }

    public Plan solve(SolveRequest request) {
        PlanningProblem problem = request.toProblem();
        Duration timeLimit = timeLimitOf(request);
        logger.info("Received synchronous solve request (limit {}).", timeLimit);
        SearchMonitor monitor = planningEngine.newMonitor(progress ->
                logger.debug("@@@ sync solve: {} after {} ms, coverage {}, score {}",
                        progress.state(), progress.elapsed().toMillis(), progress.bestCoverage(), progress.bestScore()));
        return planningEngine.solve(problem, timeLimit, monitor);
    }

    /** Validates up front, then schedules the solve; returns the job's problem id. */
    public String submit(SolveRequest request) {
        PlanningProblem problem = request.toProblem();
        Duration timeLimit = timeLimitOf(request);
        planningEngine.validate(problem, timeLimit);
        evictExpired();

        String problemId = UUID.randomUUID().toString();
        SearchMonitor monitor = planningEngine.newMonitor(progress ->
                logger.debug("@@@ [{}] {} after {} ms, coverage {}, score {}",
                        problemId, progress.state(), progress.elapsed().toMillis(), progress.bestCoverage(), progress.bestScore()));
        SolveJob job = new SolveJob(problemId, monitor);
        jobs.put(problemId, job);
        try {
            solveExecutor.submit(() -> runJob(job, problem, timeLimit));
        } catch (RejectedExecutionException e) {
            jobs.remove(problemId);
            logger.error("!!! Solve executor rejected job {}", problemId, e);
            throw new SolverFaultException("Solve executor is not accepting jobs.", e);
        }
        logger.info("Scheduled solve job {} (limit {}).", problemId, timeLimit);
        return problemId;
    }

    private void runJob(SolveJob job, PlanningProblem problem, Duration timeLimit) {
        job.markActive();
        logger.info("@@@ Job {} started.", job.getProblemId());
        try {
            Plan plan = planningEngine.solve(problem, timeLimit, job.getMonitor());
            job.complete(plan);
            logger.info("@@@ Job {} finished with status {}.", job.getProblemId(), plan.status());
        } catch (RuntimeException e) {
            logger.error("!!! Job {} failed: {}", job.getProblemId(), e.getMessage(), e);
            job.fail(e);
        }
    }

    public SolverStatus getSolverStatus(String problemId) {
        SolveJob job = jobs.get(problemId);
        return job == null ? SolverStatus.NOT_SOLVING : job.getStatus();
    }

    public SolveJob getJob(String problemId) {
        SolveJob job = jobs.get(problemId);
        if (job == null) {
            throw new NoSuchElementException("No solve job with id " + problemId + ".");
        }
        return job;
    }

    /** The finished plan, handed out once; fails while the job is still running. */
    public Plan getPlan(String problemId) {
        SolveJob job = getJob(problemId);
        if (!job.isFinished()) {
            throw new JobInProgressException("Solve job " + problemId + " is still " + job.getStatus() + ".");
        }
        jobs.remove(problemId, job);
        logger.info("Job {} fetched and released.", problemId);
        if (job.getFailure() != null) {
            throw job.getFailure();
        }
        return job.getPlan();
    }

    /** Drops finished jobs nobody fetched within the retention period. */
    public int evictExpired() {
        Instant now = Instant.now();
        int evicted = 0;
        for (SolveJob job : jobs.values()) {
            if (job.isExpired(now, retention) && jobs.remove(job.getProblemId(), job)) {
                evicted++;
                logger.info("Evicted unfetched job {} (finished {}).", job.getProblemId(), job.getFinishedAt());
            }
        }
        return evicted;
    }

    public int retainedJobCount() {
        return jobs.size();
    }

    /**
     * Requests cancellation of a running job, or discards a finished one.
     *
     * @return true if a running job was asked to stop
     */
    public boolean cancel(String problemId) {
        SolveJob job = getJob(problemId);
        if (job.isFinished()) {
            jobs.remove(problemId);
            logger.info("Discarded finished job {}.", problemId);
            return false;
        }
        job.getMonitor().cancel();
        logger.warn("Cancellation requested for job {} (submitted {}).", problemId, job.getSubmittedAt());
        return true;
    }

    public long activeJobCount() {
        return jobs.values().stream().filter(job -> !job.isFinished()).count();
    }

    public List<Violation> explain(ExplainRequest request) {
        return planningEngine.explain(request.assignments(), request.children(), request.teachers(),
                request.tandems() == null ? List.of() : request.tandems());
    }

    public List<DiffEntry> diff(DiffRequest request) {
        return planningEngine.diff(request.assignments(), request.previousPlan());
    }

    private Duration timeLimitOf(SolveRequest request) {
        if (request.timeLimitSeconds() == null) {
            return planningEngine.getSettings().defaultTimeLimit();
        }
        return Duration.ofSeconds(request.timeLimitSeconds());
    }
}
