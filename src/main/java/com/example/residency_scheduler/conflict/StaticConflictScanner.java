package com.example.residency_scheduler.conflict;

import com.example.residency_scheduler.catalog.RuleEvaluator;
import com.example.residency_scheduler.catalog.StationRule;
import com.example.residency_scheduler.entities.Trainee;
import com.example.residency_scheduler.enums.ReasonCode;
import com.example.residency_scheduler.enums.RuleKind;
import com.example.residency_scheduler.enums.StationCode;
import com.example.residency_scheduler.leave.SyllabusTarget;
import com.example.residency_scheduler.solver.ProblemInstance;

import lombok.extern.slf4j.Slf4j;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Counting checks that prove infeasibility from a single rule. Any finding involves one rule only,
 * so it is minimal without a core search. Checks run cheapest first and stop at the first finding.
 */
@Slf4j
public class StaticConflictScanner {

    public Optional<ConflictReport> scan(ProblemInstance instance) {
        List<ConflictTuple> finding = asList(checkCellCounts(instance));
        if (finding.isEmpty()) {
            finding = asList(checkWindowAllowLists(instance));
        }
        if (finding.isEmpty()) {
            finding = asList(checkDurationReach(instance));
        }
        if (finding.isEmpty()) {
            finding = checkCapacityReach(instance);
        }
        if (finding.isEmpty()) {
            finding = asList(checkFixedSequences(instance));
        }
        if (finding.isEmpty()) {
            return Optional.empty();
        }
        log.debug("Static scan of {} found {}", instance.getProgramId(), finding);
        return Optional.of(ConflictReport.of(finding, true));
    }

    private static List<ConflictTuple> asList(Optional<ConflictTuple> finding) {
        return finding.map(List::of).orElse(List.of());
    }

    private Optional<ConflictTuple> checkCellCounts(ProblemInstance instance) {
        for (int t = 0; t < instance.traineeCount(); t++) {
            SyllabusTarget target = instance.target(t);
            if (target.totalRequired() != target.getLengthMonths()) {
                return Optional.of(new ConflictTuple(target.getTraineeId(), null, null, null, ReasonCode.DURATION_UNMET,
                    String.format("syllabus durations add up to %d months, program is %d months",
                        target.totalRequired(), target.getLengthMonths())));
            }
        }
        return Optional.empty();
    }

    private Optional<ConflictTuple> checkWindowAllowLists(ProblemInstance instance) {
        for (StationRule window : instance.getRuleSet().rulesOf(RuleKind.CALENDAR_WINDOW)) {
            StationCode station = window.getStation();
            for (int t = 0; t < instance.traineeCount(); t++) {
                int required = instance.target(t).required(station);
                if (required == 0) {
                    continue;
                }
                int allowed = 0;
                for (int m = 0; m < instance.length(t); m++) {
                    if (instance.domain(t, m, true).contains(station)) {
                        allowed++;
                    }
                }
                if (allowed < required) {
                    return Optional.of(new ConflictTuple(instance.trainee(t).getId(), null, null, station,
                        ReasonCode.SYLLABUS_WINDOW_MISSED, String.format("%s needs %d months, only %d open months fit %s",
                            station.getDisplayName(), required, allowed, window.describe())));
                }
            }
        }
        return Optional.empty();
    }

    private Optional<ConflictTuple> checkDurationReach(ProblemInstance instance) {
        for (int t = 0; t < instance.traineeCount(); t++) {
            for (StationCode station : instance.candidates(t)) {
                int required = instance.target(t).required(station);
                int reachable = 0;
                for (int m = 0; m < instance.length(t); m++) {
                    if (instance.domain(t, m, true).contains(station)) {
                        reachable++;
                    }
                }
                if (reachable < required) {
                    return Optional.of(new ConflictTuple(instance.trainee(t).getId(), null, null, station,
                        ReasonCode.DURATION_UNMET, String.format("%s needs %d months, only %d months can hold it",
                            station.getDisplayName(), required, reachable)));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Months ascending, so the earliest unreachable month is the one reported: one row per trainee
     * who could join the pool that month, or a single open row when nobody can.
     */
    private List<ConflictTuple> checkCapacityReach(ProblemInstance instance) {
        YearMonth start = instance.getState().getCapacity().getHorizonStart();
        int horizon = instance.getState().getCapacity().getHorizonMonths();
        for (int offset = 0; offset < horizon; offset++) {
            YearMonth month = start.plusMonths(offset);
            for (StationRule rule : instance.getRuleSet().getCapacityRules()) {
                if (!RuleEvaluator.isBoundedMonth(rule, instance.getState(), month, instance.getCurrentMonth())) {
                    continue;
                }
                Map<String, Integer> possible = new LinkedHashMap<>();
                Map<String, Integer> forced = new LinkedHashMap<>();
                for (int t = 0; t < instance.traineeCount(); t++) {
                    Trainee trainee = instance.trainee(t);
                    int m = trainee.monthIndexOf(month);
                    if (m < 0 || m >= instance.length(t)) {
                        continue;
                    }
                    boolean canJoin = instance.domain(t, m, true).stream().anyMatch(rule::poolContains);
                    if (canJoin) {
                        possible.put(trainee.getId(), m);
                        if (instance.isFixed(t, m)) {
                            forced.put(trainee.getId(), m);
                        }
                    }
                }
                int minimum = instance.minimumFor(rule, month);
                if (possible.size() < minimum || forced.size() > rule.getMaxOccupancy()) {
                    boolean understaffed = possible.size() < minimum;
                    String detail = understaffed
                        ? String.format("needs at least %d, only %d trainees can be placed there", minimum, possible.size())
                        : String.format("allows at most %d, %d trainees are fixed there", rule.getMaxOccupancy(), forced.size());
                    String message = rule.describe() + " in " + month + " " + detail;
                    Map<String, Integer> involved = understaffed ? possible : forced;
                    List<ConflictTuple> rows = new ArrayList<>();
                    involved.forEach((traineeId, monthIndex) -> rows.add(new ConflictTuple(traineeId, monthIndex, month,
                        rule.getStation(), ReasonCode.CAPACITY_EXCEEDED, message)));
                    if (rows.isEmpty()) {
                        rows.add(new ConflictTuple(null, null, month, rule.getStation(), ReasonCode.CAPACITY_EXCEEDED, message));
                    }
                    return rows;
                }
            }
        }
        return List.of();
    }

    private Optional<ConflictTuple> checkFixedSequences(ProblemInstance instance) {
        for (StationRule rule : instance.getRuleSet().getSequenceRules()) {
            for (int t = 0; t < instance.traineeCount(); t++) {
                if (instance.target(t).required(rule.getPredecessor()) == 0
                        || instance.target(t).required(rule.getStation()) == 0) {
                    continue;
                }
                int lastFixedPredecessor = -1;
                int firstFixedDependent = -1;
                for (int m = 0; m < instance.length(t); m++) {
                    if (!instance.isFixed(t, m)) {
                        continue;
                    }
                    StationCode station = instance.getState().station(t, m);
                    if (station == rule.getPredecessor()) {
                        lastFixedPredecessor = m;
                    } else if (station == rule.getStation() && firstFixedDependent < 0) {
                        firstFixedDependent = m;
                    }
                }
                if (lastFixedPredecessor >= 0 && firstFixedDependent >= 0 && lastFixedPredecessor >= firstFixedDependent) {
                    Trainee trainee = instance.trainee(t);
                    return Optional.of(new ConflictTuple(trainee.getId(), firstFixedDependent,
                        trainee.calendarMonth(firstFixedDependent), rule.getStation(), ReasonCode.SEQUENCE_VIOLATION,
                        String.format("%s is fixed at month %d, after %s fixed at month %d", rule.getStation().getDisplayName(),
                            firstFixedDependent, rule.getPredecessor().getDisplayName(), lastFixedPredecessor)));
                }
            }
        }
        return Optional.empty();
    }
}
