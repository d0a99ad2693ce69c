package com.slotplanner.slotplanner_api.controller;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import com.slotplanner.slotplanner_api.solver.PlanningEngine;

/**
 * Root endpoint to provide API information
 */
@RestController
public class RootController {

    private final PlanningEngine planningEngine;

    public RootController(PlanningEngine planningEngine) {
        this.planningEngine = planningEngine;
    }

    @GetMapping("/")
    public ResponseEntity<Map<String, Object>> root() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("POST /api/plans/solve", "solve and wait for the plan");
        endpoints.put("POST /api/plans/jobs", "start an asynchronous solve");
        endpoints.put("GET /api/plans/jobs/{problemId}/status", "poll a job");
        endpoints.put("GET /api/plans/jobs/{problemId}", "fetch a finished plan");
        endpoints.put("DELETE /api/plans/jobs/{problemId}", "cancel or discard a job");
        endpoints.put("POST /api/plans/explain", "list unmet goals of an assignment");
        endpoints.put("POST /api/plans/diff", "compare an assignment with a previous plan");
        endpoints.put("GET /api/health", "health and solver setup");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", "slotplanner-api");
        body.put("status", "running");
        body.put("backend", planningEngine.getBackend().name());
        body.put("grid", planningEngine.getGrid().toString());
        body.put("endpoints", endpoints);
        return ResponseEntity.ok(body);
    }
}
