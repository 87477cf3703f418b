package com.example.residency_scheduler.solver;

import com.example.residency_scheduler.catalog.RuleEvaluator;
import com.example.residency_scheduler.catalog.RuleViolation;
import com.example.residency_scheduler.catalog.StationRule;
import com.example.residency_scheduler.catalog.SyllabusRuleSet;
import com.example.residency_scheduler.conflict.ConflictReport;
import com.example.residency_scheduler.conflict.ConflictTuple;
import com.example.residency_scheduler.entities.Trainee;
import com.example.residency_scheduler.enums.ReasonCode;
import com.example.residency_scheduler.enums.StationCode;
import com.example.residency_scheduler.leave.SyllabusTarget;
import com.example.residency_scheduler.schedule.Assignment;
import com.example.residency_scheduler.schedule.ScheduleState;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Checks one proposed cell change against a committed state without touching it. Totals are not
 * checked: a single move always shifts a month from one station to another, so duration is
 * restored only by the next resolve.
 */
public class MoveValidator {

    public Optional<ConflictReport> validate(ScheduleState state, SyllabusRuleSet ruleSet, Assignment move, YearMonth currentMonth) {
        if (move.getStation() == null) {
            throw new IllegalArgumentException("Proposed move without a station: " + move);
        }
        int t = state.ordinalOf(move.getTraineeId());
        int m = move.getMonthIndex();
        if (m < 0 || m >= state.length(t)) {
            throw new IllegalArgumentException(String.format("Month %d is outside %s's %d-month program",
                m, move.getTraineeId(), state.length(t)));
        }
        Trainee trainee = state.trainee(t);
        SyllabusTarget target = state.target(t);
        StationCode station = move.getStation();
        StationCode previous = state.station(t, m);
        YearMonth month = trainee.calendarMonth(m);
        List<ConflictTuple> conflicts = new ArrayList<>();

        if (!station.isOpenTo(trainee.getDepartment())) {
            conflicts.add(anchorConflict(trainee, m, station, station.getDisplayName() + " is reserved for department "
                + station.getDepartment() + ", trainee is in department " + trainee.getDepartment()));
        } else if (station.isLeave() || target.required(station) == 0) {
            conflicts.add(anchorConflict(trainee, m, station, station.getDisplayName() + " is not part of this trainee's syllabus"));
        }
        if (!month.isAfter(currentMonth) && previous != null && previous != station) {
            conflicts.add(anchorConflict(trainee, m, station, "elapsed month is committed as " + previous.getDisplayName()));
        }
        if (target.isLeaveMonth(m) && target.getLeaveMonths().get(m) != station) {
            conflicts.add(anchorConflict(trainee, m, station, "month is reported as " + target.getLeaveMonths().get(m).getDisplayName()));
        }
        for (Assignment anchor : state.getAnchors()) {
            if (anchor.getTraineeId().equals(trainee.getId()) && anchor.getMonthIndex() == m && anchor.getStation() != station) {
                conflicts.add(anchorConflict(trainee, m, station, "month is anchored to " + anchor.getStation().getDisplayName()));
            }
        }
        if (!conflicts.isEmpty()) {
            return Optional.of(ConflictReport.of(conflicts, true));
        }
        if (previous == station) {
            return Optional.empty();
        }

        ruleSet.windowFor(station)
            .filter(window -> !window.allowsCell(m, month, state.length(t)))
            .ifPresent(window -> conflicts.add(new ConflictTuple(trainee.getId(), m, month, station,
                ReasonCode.SYLLABUS_WINDOW_MISSED, window.describe())));

        if (month.isAfter(currentMonth)) {
            checkCapacity(state, ruleSet, trainee, m, month, previous, station, conflicts);
        }

        ScheduleState moved = state.copy();
        moved.assign(t, m, station);
        for (StationRule rule : ruleSet.getSequenceRules()) {
            if (rule.getStation() != station && rule.getPredecessor() != station
                    && rule.getStation() != previous && rule.getPredecessor() != previous) {
                continue;
            }
            for (RuleViolation violation : RuleEvaluator.evaluate(rule, moved, currentMonth)) {
                if (trainee.getId().equals(violation.getTraineeId())) {
                    conflicts.add(new ConflictTuple(trainee.getId(), m, month, station, ReasonCode.SEQUENCE_VIOLATION,
                        violation.getMessage()));
                }
            }
        }
        return conflicts.isEmpty() ? Optional.empty() : Optional.of(ConflictReport.of(conflicts, true));
    }

    private void checkCapacity(ScheduleState state, SyllabusRuleSet ruleSet, Trainee trainee, int m, YearMonth month,
                               StationCode previous, StationCode station, List<ConflictTuple> conflicts) {
        for (StationRule rule : ruleSet.getCapacityRules()) {
            boolean joins = rule.poolContains(station) && (previous == null || !rule.poolContains(previous));
            boolean leaves = previous != null && rule.poolContains(previous) && !rule.poolContains(station);
            int occupied = state.occupancy(rule.getPool(), month);
            if (joins && occupied + 1 > rule.getMaxOccupancy()) {
                conflicts.add(new ConflictTuple(trainee.getId(), m, month, rule.getStation(), ReasonCode.CAPACITY_EXCEEDED,
                    String.format("%s would have %d in %s", rule.describe(), occupied + 1, month)));
            }
            int minimum = state.minimumFor(rule.getStation(), month, rule.getMinOccupancy());
            if (leaves && occupied - 1 < minimum) {
                conflicts.add(new ConflictTuple(trainee.getId(), m, month, rule.getStation(), ReasonCode.CAPACITY_EXCEEDED,
                    String.format("%s would drop to %d in %s", rule.describe(), occupied - 1, month)));
            }
        }
    }

    private ConflictTuple anchorConflict(Trainee trainee, int monthIndex, StationCode station, String rule) {
        return new ConflictTuple(trainee.getId(), monthIndex, trainee.calendarMonth(monthIndex), station,
            ReasonCode.ANCHOR_CONFLICT, rule);
    }
}
