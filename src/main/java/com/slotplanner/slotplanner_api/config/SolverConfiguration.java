package com.slotplanner.slotplanner_api.config;

import java.time.Duration;
import java.time.LocalTime;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.slotplanner.slotplanner_api.solver.BranchAndBoundSearch;
import com.slotplanner.slotplanner_api.solver.PlanningEngine;
import com.slotplanner.slotplanner_api.solver.SearchBackend;
import com.slotplanner.slotplanner_api.solver.SlotGrid;
import com.slotplanner.slotplanner_api.solver.SolverSettings;
import com.slotplanner.slotplanner_api.solver.TimefoldSearch;

/**
 * Wires the planning core from {@code slotplanner.*} properties.
 */
@Configuration
public class SolverConfiguration {

    @Bean
    public SlotGrid slotGrid(@Value("${slotplanner.grid.day-start:07:00}") String dayStart,
                             @Value("${slotplanner.grid.day-end:20:00}") String dayEnd,
                             @Value("${slotplanner.grid.early-cutoff:12:00}") String earlyCutoff) {
        return new SlotGrid(LocalTime.parse(dayStart), LocalTime.parse(dayEnd), LocalTime.parse(earlyCutoff));
    }

    @Bean
    public SolverSettings solverSettings(@Value("${slotplanner.solver.default-time-limit:PT30S}") String defaultTimeLimit,
                                         @Value("${slotplanner.solver.node-limit:0}") long nodeLimit,
                                         @Value("${slotplanner.solver.parallelism:1}") int parallelism,
                                         @Value("${slotplanner.solver.random-seed:42}") long randomSeed,
                                         @Value("${slotplanner.solver.progress-interval:PT1S}") String progressInterval) {
        return new SolverSettings(Duration.parse(defaultTimeLimit), nodeLimit, parallelism, randomSeed,
                Duration.parse(progressInterval));
    }

    @Bean
    public SearchBackend searchBackend(@Value("${slotplanner.solver.backend:branch-and-bound}") String backend) {
        switch (backend.trim().toLowerCase()) {
            case "branch-and-bound":
                return new BranchAndBoundSearch();
            case "timefold":
                return new TimefoldSearch();
            default:
                throw new IllegalArgumentException("Unknown solver backend '" + backend
                        + "'; expected branch-and-bound or timefold.");
        }
    }

    @Bean
    public PlanningEngine planningEngine(SlotGrid slotGrid, SearchBackend searchBackend, SolverSettings solverSettings) {
        return new PlanningEngine(slotGrid, searchBackend, solverSettings);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService solveExecutor(@Value("${slotplanner.jobs.pool-size:2}") int poolSize) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "solve-job-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(Math.max(1, poolSize), threadFactory);
    }
}
