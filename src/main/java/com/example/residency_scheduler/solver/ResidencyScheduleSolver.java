package com.example.residency_scheduler.solver;

import com.example.residency_scheduler.catalog.RuleCatalog;
import com.example.residency_scheduler.catalog.StationRule;
import com.example.residency_scheduler.catalog.SyllabusRuleSet;
import com.example.residency_scheduler.config.SolverSettings;
import com.example.residency_scheduler.conflict.ConflictExplainer;
import com.example.residency_scheduler.conflict.ConflictReport;
import com.example.residency_scheduler.entities.Trainee;
import com.example.residency_scheduler.enums.ResolveStatus;
import com.example.residency_scheduler.exception.UnauthorizedActionException;
import com.example.residency_scheduler.leave.LeaveEvent;
import com.example.residency_scheduler.leave.LeaveProcessor;
import com.example.residency_scheduler.leave.SyllabusTarget;
import com.example.residency_scheduler.schedule.ScheduleState;
import com.example.residency_scheduler.schedule.ScheduleValidator;
import com.example.residency_scheduler.schedule.ValidationResult;
import com.google.ortools.Loader;
import com.google.ortools.sat.CpSolver;
import com.google.ortools.sat.CpSolverStatus;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves a program's schedule with CP-SAT in two phases sharing one budget of deterministic time.
 * A per-trainee seed comes first; if it already keeps every station in one block it is optimal and
 * returned as is, otherwise it hints both phases.
 * <ol>
 *   <li>Hard rules plus strict continuity: each non-splittable station is one block.</li>
 *   <li>Hard rules only; continuity survives as the minimised number of block starts.</li>
 * </ol>
 * Phase 1 gets half of what the seed leaves; when it ends undecided phase 2 gets the rest.
 * Hard rules are never relaxed. Infeasibility after phase 2 is handed to the conflict explainer.
 */
@Slf4j
public class ResidencyScheduleSolver {
    // part of the budget spent seeding one trainee at a time before the full model
    static final double SEED_SHARE = 0.3;

    private final RuleCatalog catalog;
    private final SolverSettings settings;
    private final LeaveProcessor leaveProcessor = new LeaveProcessor();
    private final PreSolveChecker preSolveChecker = new PreSolveChecker();
    private final ScheduleValidator validator = new ScheduleValidator();
    private final ConflictExplainer explainer;
    private final ScheduleSeeder seeder;

    public ResidencyScheduleSolver(RuleCatalog catalog, SolverSettings settings) {
        Loader.loadNativeLibraries();
        this.catalog = catalog;
        this.settings = settings;
        this.explainer = new ConflictExplainer(settings);
        this.seeder = new ScheduleSeeder(settings);
    }

    public SyllabusRuleSet ruleSetFor(ResolveRequest request) {
        if (request.getRuleSetVersion() != null) {
            return catalog.byVersion(request.getRuleSetVersion());
        }
        return catalog.effectiveRuleSet(request.getCurrentMonth().atDay(1));
    }

    public ResolveResult solve(ResolveRequest request, SolveHandle handle) {
        if (request.getCurrentMonth() == null) {
            throw new IllegalArgumentException("The current month must be supplied with every resolve");
        }
        long started = System.nanoTime();
        Duration budget = request.getTimeBudget() != null ? request.getTimeBudget() : settings.getTimeBudget();
        SyllabusRuleSet ruleSet = ruleSetFor(request);

        Map<String, SyllabusTarget> targets = targetsFor(request, ruleSet);
        checkOverrides(request, ruleSet);

        log.info("Resolving {}: {} trainees, rules {}, current month {}, {} anchors, {} leave events, budget {}",
            request.getProgramId(), request.getRoster().size(), ruleSet.getVersion(), request.getCurrentMonth(),
            request.getAnchors().size(), request.getLeaveEvents().size(), budget);

        Optional<ConflictReport> anchorConflict = preSolveChecker.check(request, ruleSet, targets);
        if (anchorConflict.isPresent()) {
            return ResolveResult.infeasible(ruleSet.getVersion(), anchorConflict.get(), 0, elapsedSeconds(started));
        }

        ProblemInstance instance = ProblemInstance.build(request, ruleSet, targets);
        log.debug("{} fixed cells before search", instance.fixedCellCount());

        SearchAllowance allowance = new SearchAllowance(budget);
        ScheduleState fallback = null;
        if (!allowance.isExhausted()) {
            SearchAllowance seedShare = new SearchAllowance(allowance.remaining() * SEED_SHARE);
            ScheduleSeeder.Seed seed = seeder.seed(instance, seedShare, handle);
            allowance = new SearchAllowance(allowance.remaining() - seedShare.getSpent());
            if (seed.isComplete()) {
                ValidationResult validation = validator.validate(seed.getState(), ruleSet, request.getCurrentMonth());
                if (validation.isValid() && seed.isSingleBlocks()) {
                    log.info("Seed for {} keeps every station in one block", request.getProgramId());
                    return complete(ResolveStatus.VALID, instance, seed.getState(), 1, started);
                }
                if (validation.isValid()) {
                    fallback = seed.getState();
                }
            }
        }

        for (int phase = 1; phase <= 2; phase++) {
            double limit = phase == 1 ? allowance.remaining() / 2 : allowance.remaining();
            if (limit <= 0 || handle.isCancelled()) {
                log.info("Resolve of {} stopped before phase {}", request.getProgramId(), phase);
                return timedOut(instance, fallback, phase, started);
            }
            boolean strict = phase == 1;
            log.info("Phase {}: hard constraints + {} continuity", phase, strict ? "strict" : "relaxed");
            ScheduleModelBuilder builder = ScheduleModelBuilder.forSearch(instance, strict).build();
            if (fallback != null) {
                builder.hint(fallback);
            }
            log.info("Phase {} model: {} variables, {} constraints", phase, builder.variableCount(), builder.constraintCount());

            CpSolver solver = CpSolverFactory.create(settings, limit, settings.getSearchWorkers());
            ImprovementCallback callback = new ImprovementCallback(request.getProgramId(), phase, handle);
            if (!handle.attach(solver)) {
                return timedOut(instance, fallback, phase, started);
            }
            CpSolverStatus status;
            try {
                status = solver.solve(builder.getModel(), callback);
            } finally {
                handle.detach();
            }
            allowance.charge(solver);
            log.info("Phase {} finished: {} after {} deterministic s, {} solutions", phase, status,
                String.format("%.2f", solver.response().getDeterministicTime()), callback.getSolutionCount());

            switch (status) {
                case OPTIMAL:
                    return complete(ResolveStatus.VALID, instance, builder.extract(solver), phase, started);
                case FEASIBLE:
                    return complete(ResolveStatus.TIMEOUT, instance, builder.extract(solver), phase, started);
                case INFEASIBLE:
                    continue;
                case UNKNOWN:
                    if (phase == 1 && !handle.isCancelled()) {
                        log.info("Phase 1 of {} undecided within its share, relaxing continuity", request.getProgramId());
                        continue;
                    }
                    return timedOut(instance, fallback, phase, started);
                default:
                    log.error("CP-SAT rejected the model for {}: {}", request.getProgramId(), solver.responseStats());
                    throw new IllegalStateException("Invalid schedule model: " + status);
            }
        }

        ConflictReport report = explainer.explain(instance);
        log.warn("Resolve of {} infeasible: {} ({})", request.getProgramId(), report.getPrimaryReason(), report.getSummary());
        return ResolveResult.infeasible(ruleSet.getVersion(), report, 2, elapsedSeconds(started));
    }

    private Map<String, SyllabusTarget> targetsFor(ResolveRequest request, SyllabusRuleSet ruleSet) {
        Set<String> rosterIds = new HashSet<>();
        request.getRoster().forEach(trainee -> rosterIds.add(trainee.getId()));
        for (LeaveEvent event : request.getLeaveEvents()) {
            if (!rosterIds.contains(event.getTraineeId())) {
                throw new IllegalArgumentException("Leave reported for unknown trainee " + event.getTraineeId());
            }
        }
        Map<String, SyllabusTarget> targets = new LinkedHashMap<>();
        for (Trainee trainee : request.getRoster()) {
            targets.put(trainee.getId(), leaveProcessor.targetFor(trainee, request.getLeaveEvents(), ruleSet));
        }
        return targets;
    }

    private void checkOverrides(ResolveRequest request, SyllabusRuleSet ruleSet) {
        for (CapacityOverride override : request.getOverrides()) {
            if (override.getActor() == null || !override.getActor().getRole().canForceOverride()) {
                throw new UnauthorizedActionException(
                    override.getActor() == null ? "anonymous" : override.getActor().getId(),
                    override.getActor() == null ? null : override.getActor().getRole(),
                    "force a capacity override for " + override.getStation().getDisplayName());
            }
            if (override.getJustification() == null || override.getJustification().isBlank()) {
                throw new IllegalArgumentException("A capacity override needs a justification: " + override.key());
            }
            StationRule rule = ruleSet.getCapacityRules().stream()
                .filter(candidate -> candidate.getStation() == override.getStation())
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No capacity rule for " + override.getStation()));
            if (override.getRelaxedMinimum() < 0 || override.getRelaxedMinimum() > rule.getMinOccupancy()) {
                throw new IllegalArgumentException(String.format("Override of %s must relax the minimum %d, got %d",
                    override.key(), rule.getMinOccupancy(), override.getRelaxedMinimum()));
            }
        }
    }

    private ResolveResult complete(ResolveStatus status, ProblemInstance instance, ScheduleState solved, int phase, long started) {
        ValidationResult validation = validator.validate(solved, instance.getRuleSet(), instance.getCurrentMonth());
        if (!validation.isValid()) {
            log.error("Solver output for {} breaks hard rules:\n{}", instance.getProgramId(), validation.summary());
            throw new IllegalStateException("Solver produced an invalid schedule for " + instance.getProgramId());
        }
        return ResolveResult.builder()
            .status(status)
            .state(solved)
            .capacitySummary(solved.capacitySummary(instance.getRuleSet()))
            .complete(true)
            .ruleSetVersion(instance.getRuleSet().getVersion())
            .phase(phase)
            .wallTimeSeconds(elapsedSeconds(started))
            .warnings(List.copyOf(validation.getWarnings()))
            .build();
    }

    /** Out of budget: the seed if it already met every hard rule, otherwise a partial state. */
    private ResolveResult timedOut(ProblemInstance instance, ScheduleState fallback, int phase, long started) {
        if (fallback != null) {
            return complete(ResolveStatus.TIMEOUT, instance, fallback, phase, started);
        }
        return partial(instance, phase, started);
    }

    /** Nothing found in time: only the fixed cells are filled, and the state is flagged incomplete. */
    private ResolveResult partial(ProblemInstance instance, int phase, long started) {
        ScheduleState fixedOnly = instance.getState().copy();
        return ResolveResult.builder()
            .status(ResolveStatus.TIMEOUT)
            .state(fixedOnly)
            .capacitySummary(fixedOnly.capacitySummary(instance.getRuleSet()))
            .complete(false)
            .ruleSetVersion(instance.getRuleSet().getVersion())
            .phase(phase)
            .wallTimeSeconds(elapsedSeconds(started))
            .warnings(List.of(String.format("No complete schedule within budget; %d cells unassigned",
                fixedOnly.unassignedCount())))
            .build();
    }

    private static double elapsedSeconds(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000_000.0;
    }
}
