package com.slotplanner.slotplanner_api.solver;

import java.time.Duration;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.slotplanner.slotplanner_api.model.Assignment;
import com.slotplanner.slotplanner_api.model.Child;
import com.slotplanner.slotplanner_api.model.DiffEntry;
import com.slotplanner.slotplanner_api.model.Plan;
import com.slotplanner.slotplanner_api.model.PlanningProblem;
import com.slotplanner.slotplanner_api.model.PreviousPlan;
import com.slotplanner.slotplanner_api.model.Tandem;
import com.slotplanner.slotplanner_api.model.Teacher;
import com.slotplanner.slotplanner_api.model.Violation;
import com.slotplanner.slotplanner_api.validation.PlanningInputValidator;

/**
 * Entry point of the planning core: validate, encode, search, verify, analyse, diff, assemble.
 * Holds no per-solve state, so one instance serves concurrent solves.
 */
public class PlanningEngine {

    private static final Logger logger = LoggerFactory.getLogger(PlanningEngine.class);

    private final SlotGrid grid;
    private final SearchBackend backend;
    private final SolverSettings settings;
    private final PlanningInputValidator validator;
    private final ConstraintEncoder encoder;
    private final ObjectiveBuilder objectiveBuilder;
    private final PlanVerifier verifier;
    private final ViolationAnalyzer analyzer;
    private final PlanDiffer differ;
    private final ResultAssembler assembler;

    public PlanningEngine(SlotGrid grid, SearchBackend backend, SolverSettings settings) {
        this.grid = grid;
        this.backend = backend;
        this.settings = settings;
        this.validator = new PlanningInputValidator(grid);
        this.encoder = new ConstraintEncoder(grid);
        this.objectiveBuilder = new ObjectiveBuilder();
        this.verifier = new PlanVerifier(grid);
        this.analyzer = new ViolationAnalyzer(grid);
        this.differ = new PlanDiffer();
        this.assembler = new ResultAssembler();
    }

    public SlotGrid getGrid() { return grid; }
    public SearchBackend getBackend() { return backend; }
    public SolverSettings getSettings() { return settings; }

    public Plan solve(PlanningProblem problem) {
        return solve(problem, settings.defaultTimeLimit());
    }

    public Plan solve(PlanningProblem problem, Duration timeLimit) {
        return solve(problem, timeLimit, newMonitor(SolveProgressListener.none()));
    }

    public SearchMonitor newMonitor(SolveProgressListener listener) {
        return new SearchMonitor(listener, settings.progressInterval());
    }

    /** Throws {@link com.slotplanner.slotplanner_api.exception.ValidationException} on broken input. */
    public void validate(PlanningProblem problem, Duration timeLimit) {
        validator.validate(problem, timeLimit);
    }

    public Plan solve(PlanningProblem problem, Duration timeLimit, SearchMonitor monitor) {
        long started = System.nanoTime();
        validator.validate(problem, timeLimit);
        logger.info(">>> Solving {} children, {} teachers, {} tandems with {} (limit {})",
                problem.children().size(), problem.teachers().size(), problem.tandems().size(), backend.name(), timeLimit);

        FeasibleSpace space = encoder.encode(problem.children(), problem.teachers(), problem.tandems());
        PreviousPlan previous = problem.previousPlanOrEmpty();
        Objective objective = objectiveBuilder.build(space, problem.weights(), previous);

        SearchLimits limits = new SearchLimits(timeLimit, settings.nodeLimit(), settings.parallelism(), settings.randomSeed());
        monitor.start(limits);
        SearchResult result = backend.findBest(space, objective, limits, monitor);

        List<Assignment> assignments = space.toAssignments(result.assignment());
        verifier.verify(assignments, problem.children(), problem.teachers(), problem.tandems());

        ObjectiveTally tally = objective.tally(result.assignment());
        List<Violation> violations = analyzer.analyze(assignments, problem.children(), problem.teachers(), problem.tandems());
        List<DiffEntry> diff = problem.previousPlan() == null ? List.of() : differ.diff(assignments, previous);
        if (problem.previousPlan() != null) {
            logger.info(">>> Kept {} of {} previous placements.",
                    differ.unchangedChildren(assignments, previous).size(), previous.assignments().size());
        }

        Plan plan = assembler.assemble(assignments, result.status(), space.childCount(),
                Duration.ofNanos(System.nanoTime() - started), tally.toBreakdown(), violations, diff);
        logger.info(">>> Plan ready: status {}, {}/{} children assigned, score {}, {} violation(s), {} ms",
                plan.status(), assignments.size(), space.childCount(), plan.score().total(),
                violations.size(), plan.runtimeMillis());
        return plan;
    }

    public List<Violation> explain(List<Assignment> assignments, List<Child> children, List<Teacher> teachers,
                                   List<Tandem> tandems) {
        validator.validateEntities(children, teachers, tandems);
        validator.validateAssignments(assignments);
        return analyzer.analyze(assignments, children, teachers, tandems);
    }

    public List<Violation> explain(Plan plan, List<Child> children, List<Teacher> teachers, List<Tandem> tandems) {
        return explain(plan.assignments(), children, teachers, tandems);
    }

    public List<DiffEntry> diff(List<Assignment> assignments, PreviousPlan previousPlan) {
        validator.validateAssignments(assignments);
        validator.validatePreviousPlan(previousPlan);
        return differ.diff(assignments, previousPlan);
    }
}
