package com.slotplanner.slotplanner_api.controller;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.slotplanner.slotplanner_api.dto.DiffRequest;
import com.slotplanner.slotplanner_api.dto.ExplainRequest;
import com.slotplanner.slotplanner_api.dto.JobStatusResponse;
import com.slotplanner.slotplanner_api.dto.SolveRequest;
import com.slotplanner.slotplanner_api.model.DiffEntry;
import com.slotplanner.slotplanner_api.model.Plan;
import com.slotplanner.slotplanner_api.model.Violation;
import com.slotplanner.slotplanner_api.service.SchedulingService;
import com.slotplanner.slotplanner_api.service.SolveJob;
import com.slotplanner.slotplanner_api.solver.SolveProgress;

@RestController
@RequestMapping("/api/plans")
public class PlanController {

    private static final Logger logger = LoggerFactory.getLogger(PlanController.class);

    private final SchedulingService schedulingService;

    public PlanController(SchedulingService schedulingService) {
        this.schedulingService = schedulingService;
    }

    @PostMapping("/solve")
    public ResponseEntity<Plan> solve(@RequestBody SolveRequest request) {
        logger.info(">>> Received /solve request.");
        return ResponseEntity.ok(schedulingService.solve(request));
    }

    @PostMapping("/jobs")
    public ResponseEntity<?> submit(@RequestBody SolveRequest request) {
        logger.info(">>> Received solve job submission.");
        String problemId = schedulingService.submit(request);
        logger.info(">>> Submitted job with problemId: {}", problemId);
        return ResponseEntity.accepted().body(Map.of(
                "message", "Scheduling process started.",
                "problemId", problemId
        ));
    }

    @GetMapping("/jobs/{problemId}/status")
    public ResponseEntity<JobStatusResponse> status(@PathVariable String problemId) {
        logger.debug(">>> Received status check request for problemId: {}", problemId);
        SolveJob job = schedulingService.getJob(problemId);
        SolveProgress progress = job.getMonitor().progress();
        return ResponseEntity.ok(new JobStatusResponse(problemId, job.getStatus().name(), progress.state().name(),
                progress.bestCoverage(), progress.bestScore(), progress.elapsed().toMillis()));
    }

    @GetMapping("/jobs/{problemId}")
    public ResponseEntity<Plan> result(@PathVariable String problemId) {
        logger.info(">>> Received result request for problemId: {}", problemId);
        return ResponseEntity.ok(schedulingService.getPlan(problemId));
    }

    @DeleteMapping("/jobs/{problemId}")
    public ResponseEntity<?> cancel(@PathVariable String problemId) {
        logger.warn(">>> Received cancel request for problemId: {}", problemId);
        boolean running = schedulingService.cancel(problemId);
        return ResponseEntity.ok(Map.of(
                "message", running ? "Cancellation requested." : "Finished job discarded.",
                "problemId", problemId
        ));
    }

    @PostMapping("/explain")
    public ResponseEntity<List<Violation>> explain(@RequestBody ExplainRequest request) {
        logger.info(">>> Received /explain request.");
        return ResponseEntity.ok(schedulingService.explain(request));
    }

    @PostMapping("/diff")
    public ResponseEntity<List<DiffEntry>> diff(@RequestBody DiffRequest request) {
        logger.info(">>> Received /diff request.");
        return ResponseEntity.ok(schedulingService.diff(request));
    }
}
