package com.example.residency_scheduler.service;

import com.example.residency_scheduler.catalog.RuleCatalog;
import com.example.residency_scheduler.catalog.SyllabusRuleSet;
import com.example.residency_scheduler.conflict.ConflictReport;
import com.example.residency_scheduler.schedule.Assignment;
import com.example.residency_scheduler.schedule.ScheduleState;
import com.example.residency_scheduler.solver.MoveValidator;
import com.example.residency_scheduler.solver.ResidencyScheduleSolver;
import com.example.residency_scheduler.solver.ResolveRequest;
import com.example.residency_scheduler.solver.ResolveResult;
import com.example.residency_scheduler.solver.SolveHandle;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import java.time.YearMonth;
import java.util.Optional;

/**
 * The two engine operations. Holds no program state: every call is determined by its arguments
 * and the immutable rule catalog.
 */
@Slf4j
@Service
public class ScheduleEngine {
    private final ResidencyScheduleSolver solver;
    private final RuleCatalog catalog;
    private final MoveValidator moveValidator = new MoveValidator();

    public ScheduleEngine(ResidencyScheduleSolver solver, RuleCatalog catalog) {
        this.solver = solver;
        this.catalog = catalog;
    }

    public ResolveResult resolve(ResolveRequest request) {
        return resolve(request, new SolveHandle());
    }

    public ResolveResult resolve(ResolveRequest request, SolveHandle handle) {
        return solver.solve(request, handle);
    }

    /**
     * Checks a single cell change against {@code state}, which is left untouched.
     *
     * @return empty when the move is acceptable, otherwise the conflicts it would cause
     */
    public Optional<ConflictReport> validateMove(ScheduleState state, Assignment move, YearMonth currentMonth) {
        if (currentMonth == null) {
            throw new IllegalArgumentException("The current month must be supplied with every move check");
        }
        SyllabusRuleSet ruleSet = catalog.byVersion(state.getRuleSetVersion());
        Optional<ConflictReport> report = moveValidator.validate(state, ruleSet, move, currentMonth);
        report.ifPresent(conflict -> log.debug("Move {} rejected: {}", move, conflict.getSummary()));
        return report;
    }
}
