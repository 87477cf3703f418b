package com.example.residency_scheduler.conflict;

import com.example.residency_scheduler.catalog.RuleEvaluator;
import com.example.residency_scheduler.config.SolverSettings;
import com.example.residency_scheduler.entities.Trainee;
import com.example.residency_scheduler.enums.ReasonCode;
import com.example.residency_scheduler.schedule.Assignment;
import com.example.residency_scheduler.solver.ConstraintGroup;
import com.example.residency_scheduler.solver.CpSolverFactory;
import com.example.residency_scheduler.solver.ProblemInstance;
import com.example.residency_scheduler.solver.ScheduleModelBuilder;
import com.example.residency_scheduler.solver.SearchAllowance;
import com.google.ortools.sat.BoolVar;
import com.google.ortools.sat.CpSolver;
import com.google.ortools.sat.CpSolverStatus;
import com.google.ortools.sat.Literal;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Explains an infeasible instance. Static counting checks come first; otherwise the diagnosis model
 * is solved under one assumption literal per rule group, the returned core is shrunk by deletion
 * until every remaining group is needed, and the survivors become the report. Running out of the
 * diagnosis budget keeps the core found so far, flagged as not minimal.
 */
@Slf4j
public class ConflictExplainer {
    private final SolverSettings settings;
    private final StaticConflictScanner scanner = new StaticConflictScanner();

    public ConflictExplainer(SolverSettings settings) {
        this.settings = settings;
    }

    public ConflictReport explain(ProblemInstance instance) {
        SearchAllowance allowance = new SearchAllowance(settings.getDiagnosisBudget());

        ConflictReport scanned = scanner.scan(instance).orElse(null);
        if (scanned != null) {
            return scanned;
        }

        ScheduleModelBuilder builder = ScheduleModelBuilder.forDiagnosis(instance).build();
        List<BoolVar> core = new ArrayList<>(builder.getAssumptionLiterals());
        log.debug("Diagnosing {} over {} rule groups", instance.getProgramId(), core.size());

        CpSolver solver = newSolver(allowance);
        if (solver == null) {
            return ConflictReport.diagnosisTimeout("No diagnosis budget left for " + instance.getProgramId());
        }
        CpSolverStatus status = solveUnder(builder, core, solver, allowance);
        if (status != CpSolverStatus.INFEASIBLE) {
            log.warn("Diagnosis model for {} ended {}, no unsatisfiable subset found", instance.getProgramId(), status);
            return ConflictReport.diagnosisTimeout("No unsatisfiable subset found within the diagnosis budget ("
                + status + ")");
        }
        List<BoolVar> firstCore = restrict(core, solver.sufficientAssumptionsForInfeasibility());
        if (firstCore.isEmpty()) {
            CpSolver background = newSolver(allowance);
            if (background != null && solveUnder(builder, List.of(), background, allowance) == CpSolverStatus.INFEASIBLE) {
                return fixedCellConflict(instance);
            }
        } else {
            core = firstCore;
        }

        boolean minimal = true;
        int i = 0;
        while (i < core.size()) {
            CpSolver trial = newSolver(allowance);
            if (trial == null) {
                minimal = false;
                break;
            }
            List<BoolVar> without = new ArrayList<>(core);
            without.remove(i);
            CpSolverStatus trialStatus = solveUnder(builder, without, trial, allowance);
            if (trialStatus == CpSolverStatus.INFEASIBLE) {
                List<BoolVar> smaller = restrict(without, trial.sufficientAssumptionsForInfeasibility());
                core = smaller.isEmpty() ? without : smaller;
                if (core.isEmpty()) {
                    return fixedCellConflict(instance);
                }
                if (!smaller.isEmpty() && smaller.size() < without.size()) {
                    i = 0;
                }
            } else if (trialStatus == CpSolverStatus.FEASIBLE || trialStatus == CpSolverStatus.OPTIMAL) {
                i++;
            } else {
                minimal = false;
                break;
            }
        }

        List<ConflictTuple> tuples = new ArrayList<>();
        for (BoolVar literal : core) {
            tuples.addAll(toTuples(instance, builder.groupOf(literal)));
        }
        log.debug("Diagnosis of {}: {} groups, minimal={}", instance.getProgramId(), tuples.size(), minimal);
        return ConflictReport.of(tuples, minimal);
    }

    private CpSolverStatus solveUnder(ScheduleModelBuilder builder, List<BoolVar> assumptions, CpSolver solver,
                                      SearchAllowance allowance) {
        builder.getModel().clearAssumptions();
        builder.getModel().addAssumptions(assumptions.toArray(new Literal[0]));
        CpSolverStatus status = solver.solve(builder.getModel());
        allowance.charge(solver);
        return status;
    }

    private List<BoolVar> restrict(List<BoolVar> literals, List<Integer> coreIndices) {
        Set<Integer> indices = new HashSet<>(coreIndices);
        List<BoolVar> kept = new ArrayList<>();
        for (BoolVar literal : literals) {
            if (indices.contains(literal.getIndex())) {
                kept.add(literal);
            }
        }
        return kept;
    }

    private CpSolver newSolver(SearchAllowance allowance) {
        if (allowance.isExhausted()) {
            return null;
        }
        // cores are only reported by a single worker
        return CpSolverFactory.create(settings, allowance.remaining(), 1);
    }

    /**
     * A trainee group concerns the trainee's whole row, so its month stays open. A capacity group
     * becomes one row per trainee who could hold a pool station that month.
     */
    private List<ConflictTuple> toTuples(ProblemInstance instance, ConstraintGroup group) {
        String description = group.getRule() != null ? group.getRule().describe() : group.getKind().name();
        ReasonCode reason = group.getRule() != null ? RuleEvaluator.reasonFor(group.getRule()) : ReasonCode.DURATION_UNMET;
        if (group.getOrdinal() >= 0) {
            Trainee trainee = instance.trainee(group.getOrdinal());
            return List.of(new ConflictTuple(trainee.getId(), null, null, group.getStation(), reason, description));
        }
        List<ConflictTuple> rows = new ArrayList<>();
        for (int t = 0; t < instance.traineeCount(); t++) {
            int m = instance.trainee(t).monthIndexOf(group.getMonth());
            if (m < 0 || m >= instance.length(t)) {
                continue;
            }
            if (instance.domain(t, m, false).stream().anyMatch(group.getRule()::poolContains)) {
                rows.add(new ConflictTuple(instance.trainee(t).getId(), m, group.getMonth(), group.getStation(),
                    reason, description));
            }
        }
        if (rows.isEmpty()) {
            rows.add(new ConflictTuple(null, null, group.getMonth(), group.getStation(), reason, description));
        }
        return rows;
    }

    /** The fixed cells alone admit no completion; every rule group could be dropped. */
    private ConflictReport fixedCellConflict(ProblemInstance instance) {
        List<ConflictTuple> tuples = new ArrayList<>();
        for (Assignment anchor : instance.getState().getAnchors()) {
            Trainee trainee = instance.trainee(instance.getState().ordinalOf(anchor.getTraineeId()));
            tuples.add(new ConflictTuple(anchor.getTraineeId(), anchor.getMonthIndex(),
                trainee.calendarMonth(anchor.getMonthIndex()), anchor.getStation(), ReasonCode.ANCHOR_CONFLICT,
                "fixed cells admit no complete schedule"));
        }
        if (tuples.isEmpty()) {
            tuples.add(new ConflictTuple(null, null, null, null, ReasonCode.ANCHOR_CONFLICT,
                "elapsed and leave months admit no complete schedule"));
        }
        return ConflictReport.of(tuples, false);
    }
}
