package com.example.residency_scheduler.catalog;

import com.example.residency_scheduler.entities.Trainee;
import com.example.residency_scheduler.enums.ReasonCode;
import com.example.residency_scheduler.enums.StationCode;
import com.example.residency_scheduler.leave.SyllabusTarget;
import com.example.residency_scheduler.schedule.ScheduleState;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks station rules against a schedule state. Every rule kind is interpreted here and nowhere
 * else, so the validator, single-move checks and the conflict scanner all agree on what a rule means.
 */
public final class RuleEvaluator {

    private RuleEvaluator() {
    }

    public static List<RuleViolation> evaluateAll(SyllabusRuleSet ruleSet, ScheduleState state, YearMonth currentMonth) {
        List<RuleViolation> violations = new ArrayList<>();
        for (StationRule rule : ruleSet.getRules()) {
            violations.addAll(evaluate(rule, state, currentMonth));
        }
        return violations;
    }

    /**
     * @param currentMonth capacity bounds are checked only for calendar months strictly after it;
     *                     null checks the whole horizon
     */
    public static List<RuleViolation> evaluate(StationRule rule, ScheduleState state, YearMonth currentMonth) {
        switch (rule.getKind()) {
            case DURATION:
                return evaluateDuration(rule, state);
            case CAPACITY:
                return evaluateCapacity(rule, state, currentMonth);
            case SEQUENCE:
                return evaluateSequence(rule, state);
            case CALENDAR_WINDOW:
                return evaluateWindow(rule, state);
            default:
                throw new IllegalArgumentException("Unknown rule kind " + rule.getKind());
        }
    }

    public static ReasonCode reasonFor(StationRule rule) {
        switch (rule.getKind()) {
            case DURATION:
                return ReasonCode.DURATION_UNMET;
            case CAPACITY:
                return ReasonCode.CAPACITY_EXCEEDED;
            case SEQUENCE:
                return ReasonCode.SEQUENCE_VIOLATION;
            case CALENDAR_WINDOW:
                return ReasonCode.SYLLABUS_WINDOW_MISSED;
            default:
                throw new IllegalArgumentException("Unknown rule kind " + rule.getKind());
        }
    }

    private static List<RuleViolation> evaluateDuration(StationRule rule, ScheduleState state) {
        List<RuleViolation> violations = new ArrayList<>();
        StationCode station = rule.getStation();
        for (int t = 0; t < state.traineeCount(); t++) {
            int required = state.target(t).required(station);
            int assigned = state.count(t, station);
            if (assigned != required) {
                String traineeId = state.trainee(t).getId();
                violations.add(new RuleViolation(ReasonCode.DURATION_UNMET, rule, traineeId, null, null, station,
                    String.format("%s has %d months of %s, needs %d", traineeId, assigned, station.getDisplayName(), required)));
            }
        }
        return violations;
    }

    private static List<RuleViolation> evaluateCapacity(StationRule rule, ScheduleState state, YearMonth currentMonth) {
        List<RuleViolation> violations = new ArrayList<>();
        YearMonth horizonStart = state.getCapacity().getHorizonStart();
        for (int offset = 0; offset < state.getCapacity().getHorizonMonths(); offset++) {
            YearMonth month = horizonStart.plusMonths(offset);
            if (!isBoundedMonth(rule, state, month, currentMonth)) {
                continue;
            }
            int occupied = state.occupancy(rule.getPool(), month);
            int minimum = state.minimumFor(rule.getStation(), month, rule.getMinOccupancy());
            if (occupied < minimum || occupied > rule.getMaxOccupancy()) {
                violations.add(new RuleViolation(ReasonCode.CAPACITY_EXCEEDED, rule, null, null, month, rule.getStation(),
                    String.format("%s in %s has %d, allowed %s", rule.getStation().getDisplayName(), month, occupied,
                        bounds(minimum, rule.getMaxOccupancy()))));
            }
        }
        return violations;
    }

    private static List<RuleViolation> evaluateSequence(StationRule rule, ScheduleState state) {
        List<RuleViolation> violations = new ArrayList<>();
        for (int t = 0; t < state.traineeCount(); t++) {
            SyllabusTarget target = state.target(t);
            if (target.required(rule.getPredecessor()) == 0 || target.required(rule.getStation()) == 0) {
                continue;
            }
            int lastPredecessor = lastIndexOf(state, t, rule.getPredecessor());
            int firstDependent = firstIndexOf(state, t, rule.getStation());
            if (lastPredecessor < 0 || firstDependent < 0) {
                continue;
            }
            boolean holds = rule.isImmediate() ? lastPredecessor + 1 == firstDependent : lastPredecessor < firstDependent;
            if (!holds) {
                String traineeId = state.trainee(t).getId();
                violations.add(new RuleViolation(ReasonCode.SEQUENCE_VIOLATION, rule, traineeId, firstDependent,
                    state.calendarMonth(t, firstDependent), rule.getStation(),
                    String.format("%s: %s (last month %d) must come %s before %s (first month %d)", traineeId,
                        rule.getPredecessor().getDisplayName(), lastPredecessor, rule.isImmediate() ? "immediately" : "strictly",
                        rule.getStation().getDisplayName(), firstDependent)));
            }
        }
        return violations;
    }

    private static List<RuleViolation> evaluateWindow(StationRule rule, ScheduleState state) {
        List<RuleViolation> violations = new ArrayList<>();
        int stationId = rule.getStation().id();
        for (int t = 0; t < state.traineeCount(); t++) {
            int length = state.length(t);
            for (int m = 0; m < length; m++) {
                if (state.stationId(t, m) != stationId) {
                    continue;
                }
                YearMonth month = state.calendarMonth(t, m);
                if (!rule.allowsCell(m, month, length)) {
                    String traineeId = state.trainee(t).getId();
                    violations.add(new RuleViolation(ReasonCode.SYLLABUS_WINDOW_MISSED, rule, traineeId, m, month,
                        rule.getStation(), String.format("%s month %d (%s) is outside %s", traineeId, m, month, rule.describe())));
                }
            }
        }
        return violations;
    }

    /**
     * Whether a capacity pool is bounded in the given month: strictly after the current month and
     * with at least one trainee on the roster who could be placed in the pool then.
     */
    public static boolean isBoundedMonth(StationRule rule, ScheduleState state, YearMonth month, YearMonth currentMonth) {
        if (currentMonth != null && !month.isAfter(currentMonth)) {
            return false;
        }
        for (int t = 0; t < state.traineeCount(); t++) {
            if (couldOccupy(rule, state.trainee(t), state.target(t), state.trainee(t).monthIndexOf(month))) {
                return true;
            }
        }
        return false;
    }

    public static boolean couldOccupy(StationRule capacityRule, Trainee trainee, SyllabusTarget target, int monthIndex) {
        if (monthIndex < 0 || monthIndex >= target.getLengthMonths()) {
            return false;
        }
        for (StationCode station : capacityRule.getPool()) {
            if (station.isOpenTo(trainee.getDepartment()) && target.required(station) > 0) {
                return true;
            }
        }
        return false;
    }

    public static int firstIndexOf(ScheduleState state, int ordinal, StationCode station) {
        for (int m = 0; m < state.length(ordinal); m++) {
            if (state.stationId(ordinal, m) == station.id()) {
                return m;
            }
        }
        return -1;
    }

    public static int lastIndexOf(ScheduleState state, int ordinal, StationCode station) {
        for (int m = state.length(ordinal) - 1; m >= 0; m--) {
            if (state.stationId(ordinal, m) == station.id()) {
                return m;
            }
        }
        return -1;
    }

    static String bounds(int min, int max) {
        return "[" + min + "," + (max == StationRule.UNBOUNDED ? "inf" : String.valueOf(max)) + "]";
    }
}
