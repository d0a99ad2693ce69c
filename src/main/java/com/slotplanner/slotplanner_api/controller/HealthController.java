package com.slotplanner.slotplanner_api.controller;

import java.util.HashMap;
import java.util.Map;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.slotplanner.slotplanner_api.service.SchedulingService;
import com.slotplanner.slotplanner_api.solver.PlanningEngine;

/**
 * Health check endpoint with the active solver configuration
 */
@RestController
@RequestMapping("/api/health")
public class HealthController {

    private final PlanningEngine planningEngine;
    private final SchedulingService schedulingService;

    @Value("${cors.allowed-origins:not-set}")
    private String corsOrigins;

    public HealthController(PlanningEngine planningEngine, SchedulingService schedulingService) {
        this.planningEngine = planningEngine;
        this.schedulingService = schedulingService;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> healthCheck() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("service", "slotplanner-api");

        Map<String, Object> solver = new HashMap<>();
        solver.put("backend", planningEngine.getBackend().name());
        solver.put("parallelism", planningEngine.getSettings().parallelism());
        solver.put("defaultTimeLimit", planningEngine.getSettings().defaultTimeLimit().toString());
        solver.put("activeJobs", schedulingService.activeJobCount());
        solver.put("retainedJobs", schedulingService.retainedJobCount());
        health.put("solver", solver);

        Map<String, Object> grid = new HashMap<>();
        grid.put("dayStart", planningEngine.getGrid().getDayStart().toString());
        grid.put("dayEnd", planningEngine.getGrid().getDayEnd().toString());
        grid.put("earlyCutoff", planningEngine.getGrid().getEarlyCutoff().toString());
        health.put("grid", grid);

        Map<String, Object> config = new HashMap<>();
        config.put("corsOrigins", corsOrigins);
        health.put("config", config);

        return ResponseEntity.ok(health);
    }
}
