package com.slotplanner.slotplanner_api.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import com.slotplanner.slotplanner_api.solver.PlanningEngine;
import com.slotplanner.slotplanner_api.solver.SolverSettings;

/**
 * Logs the effective planning configuration on application startup
 */
@Component
public class SolverSettingsLogger implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(SolverSettingsLogger.class);

    private final PlanningEngine planningEngine;

    @Value("${slotplanner.jobs.pool-size:2}")
    private int poolSize;

    public SolverSettingsLogger(PlanningEngine planningEngine) {
        this.planningEngine = planningEngine;
    }

    @Override
    public void run(String... args) {
        SolverSettings settings = planningEngine.getSettings();
        logger.info("=== SOLVER CONFIGURATION CHECK ===");
        logger.info("Grid: {}", planningEngine.getGrid());
        logger.info("Backend: {}", planningEngine.getBackend().name());
        logger.info("Default time limit: {}", settings.defaultTimeLimit());
        logger.info("Parallelism: {} | Node limit: {} | Random seed: {}",
                settings.parallelism(), settings.nodeLimit(), settings.randomSeed());
        logger.info("Async job workers: {}", poolSize);

        if (settings.nodeLimit() > 0 && settings.parallelism() > 1) {
            logger.warn("✗ Node limit with {} workers is not deterministic; use parallelism 1 for reproducible budgets.",
                    settings.parallelism());
        }
        if (settings.defaultTimeLimit().isNegative() || settings.defaultTimeLimit().isZero()) {
            logger.error("✗ Default time limit must be positive; solve requests without a limit will be rejected.");
            logger.error("=== SOLVER CONFIGURATION: FAILED ===");
            return;
        }
        logger.info("=== SOLVER CONFIGURATION: OK ===");
    }
}
