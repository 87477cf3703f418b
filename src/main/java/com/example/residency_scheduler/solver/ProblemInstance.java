package com.example.residency_scheduler.solver;

import com.example.residency_scheduler.catalog.RuleEvaluator;
import com.example.residency_scheduler.catalog.StationRule;
import com.example.residency_scheduler.catalog.SyllabusRuleSet;
import com.example.residency_scheduler.entities.Trainee;
import com.example.residency_scheduler.enums.CellOrigin;
import com.example.residency_scheduler.enums.StationCode;
import com.example.residency_scheduler.leave.SyllabusTarget;
import com.example.residency_scheduler.schedule.Assignment;
import com.example.residency_scheduler.schedule.ScheduleState;
import com.example.residency_scheduler.schedule.StationMonth;

import lombok.Getter;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A resolve after input checks: the bound rule set, per-trainee targets, and a schedule state with
 * every fixed cell (elapsed, leave, anchored) already written. Everything the model builders and
 * the conflict scanner need to agree on is answered here.
 */
@Getter
public class ProblemInstance {
    private final String programId;
    private final SyllabusRuleSet ruleSet;
    private final YearMonth currentMonth;
    private final ScheduleState state;
    private final CellOrigin[][] origins;
    private final List<List<StationCode>> candidates;
    private final Map<StationMonth, Integer> minimumOverrides;

    private ProblemInstance(String programId, SyllabusRuleSet ruleSet, YearMonth currentMonth, ScheduleState state,
                            CellOrigin[][] origins, Map<StationMonth, Integer> minimumOverrides) {
        this.programId = programId;
        this.ruleSet = ruleSet;
        this.currentMonth = currentMonth;
        this.state = state;
        this.origins = origins;
        this.minimumOverrides = minimumOverrides;
        this.candidates = new ArrayList<>();
        for (int t = 0; t < state.traineeCount(); t++) {
            // station order fixes variable order, and with it the search
            List<StationCode> stations = new ArrayList<>(state.target(t).getRequiredMonths().keySet());
            Collections.sort(stations);
            candidates.add(Collections.unmodifiableList(stations));
        }
    }

    /** Assumes the inputs already passed {@link PreSolveChecker}. */
    public static ProblemInstance build(ResolveRequest request, SyllabusRuleSet ruleSet, Map<String, SyllabusTarget> targets) {
        ScheduleState state = new ScheduleState(request.getProgramId(), ruleSet.getVersion(), request.getRoster(), targets);
        CellOrigin[][] origins = new CellOrigin[state.traineeCount()][];
        ScheduleState committed = request.getCurrentState();

        for (int t = 0; t < state.traineeCount(); t++) {
            Trainee trainee = state.trainee(t);
            origins[t] = new CellOrigin[state.length(t)];
            for (int m = 0; m < state.length(t); m++) {
                origins[t][m] = CellOrigin.FREE;
                StationCode past = committedPast(committed, trainee, m, request.getCurrentMonth());
                if (past != null) {
                    state.assign(t, m, past);
                    origins[t][m] = CellOrigin.PAST;
                }
            }
            for (Map.Entry<Integer, StationCode> leave : state.target(t).getLeaveMonths().entrySet()) {
                if (origins[t][leave.getKey()] == CellOrigin.FREE) {
                    state.assign(t, leave.getKey(), leave.getValue());
                    origins[t][leave.getKey()] = CellOrigin.LEAVE;
                }
            }
        }
        for (Assignment anchor : request.getAnchors()) {
            int t = state.ordinalOf(anchor.getTraineeId());
            if (origins[t][anchor.getMonthIndex()] == CellOrigin.FREE) {
                state.assign(t, anchor.getMonthIndex(), anchor.getStation());
                origins[t][anchor.getMonthIndex()] = CellOrigin.ANCHOR;
            }
        }

        Map<StationMonth, Integer> overrides = new HashMap<>();
        for (CapacityOverride override : request.getOverrides()) {
            overrides.put(override.key(), override.getRelaxedMinimum());
        }
        state.setAnchors(request.getAnchors());
        state.setMinimumOverrides(overrides);
        return new ProblemInstance(request.getProgramId(), ruleSet, request.getCurrentMonth(), state, origins,
            Collections.unmodifiableMap(overrides));
    }

    /** The committed station of an elapsed cell, or null when that cell is not immutable. */
    static StationCode committedPast(ScheduleState committed, Trainee trainee, int monthIndex, YearMonth currentMonth) {
        if (committed == null || !committed.hasTrainee(trainee.getId())) {
            return null;
        }
        if (trainee.calendarMonth(monthIndex).isAfter(currentMonth)) {
            return null;
        }
        int ordinal = committed.ordinalOf(trainee.getId());
        if (monthIndex >= committed.length(ordinal)) {
            return null;
        }
        return committed.station(ordinal, monthIndex);
    }

    public int traineeCount() {
        return state.traineeCount();
    }

    public Trainee trainee(int ordinal) {
        return state.trainee(ordinal);
    }

    public SyllabusTarget target(int ordinal) {
        return state.target(ordinal);
    }

    public int length(int ordinal) {
        return state.length(ordinal);
    }

    public boolean isFixed(int ordinal, int monthIndex) {
        return origins[ordinal][monthIndex] != CellOrigin.FREE;
    }

    public CellOrigin origin(int ordinal, int monthIndex) {
        return origins[ordinal][monthIndex];
    }

    public List<StationCode> candidates(int ordinal) {
        return candidates.get(ordinal);
    }

    public boolean windowAllows(int ordinal, int monthIndex, StationCode station) {
        return ruleSet.windowFor(station)
            .map(window -> window.allowsCell(monthIndex, state.calendarMonth(ordinal, monthIndex), length(ordinal)))
            .orElse(true);
    }

    /**
     * Stations a cell may take. A fixed cell has exactly its fixed station. With windows applied, a
     * free cell loses every windowed station whose window excludes it.
     */
    public List<StationCode> domain(int ordinal, int monthIndex, boolean applyWindows) {
        if (isFixed(ordinal, monthIndex)) {
            return List.of(state.station(ordinal, monthIndex));
        }
        if (!applyWindows) {
            return candidates(ordinal);
        }
        List<StationCode> domain = new ArrayList<>();
        for (StationCode station : candidates(ordinal)) {
            if (windowAllows(ordinal, monthIndex, station)) {
                domain.add(station);
            }
        }
        return domain;
    }

    public int minimumFor(StationRule capacityRule, YearMonth month) {
        return minimumOverrides.getOrDefault(new StationMonth(capacityRule.getStation(), month), capacityRule.getMinOccupancy());
    }

    /** Calendar months, ascending, in which a capacity rule binds. */
    public List<YearMonth> boundedMonths(StationRule capacityRule) {
        List<YearMonth> months = new ArrayList<>();
        YearMonth start = state.getCapacity().getHorizonStart();
        for (int offset = 0; offset < state.getCapacity().getHorizonMonths(); offset++) {
            YearMonth month = start.plusMonths(offset);
            if (RuleEvaluator.isBoundedMonth(capacityRule, state, month, currentMonth)) {
                months.add(month);
            }
        }
        return months;
    }

    public int fixedCellCount() {
        int count = 0;
        for (CellOrigin[] row : origins) {
            for (CellOrigin origin : row) {
                if (origin != CellOrigin.FREE) {
                    count++;
                }
            }
        }
        return count;
    }
}
