package com.example.residency_scheduler.schedule;

import com.example.residency_scheduler.catalog.RuleEvaluator;
import com.example.residency_scheduler.catalog.SyllabusRuleSet;
import com.example.residency_scheduler.entities.Trainee;
import com.example.residency_scheduler.enums.StationCode;
import com.example.residency_scheduler.leave.SyllabusTarget;

import lombok.extern.slf4j.Slf4j;

import java.time.YearMonth;

/**
 * Full check of a schedule state: every cell filled, department scoping, pinned leave months,
 * then every catalog rule. Broken continuity of a non-splittable station is only a warning.
 */
@Slf4j
public class ScheduleValidator {

    public ValidationResult validate(ScheduleState state, SyllabusRuleSet ruleSet, YearMonth currentMonth) {
        ValidationResult result = new ValidationResult();
        validateStructure(state, result);
        RuleEvaluator.evaluateAll(ruleSet, state, currentMonth).forEach(result::addViolation);
        validateContinuity(state, ruleSet, result);
        log.debug("Validated {}: {} errors, {} violations, {} warnings", state, result.getErrors().size(),
            result.getViolations().size(), result.getWarnings().size());
        return result;
    }

    private void validateStructure(ScheduleState state, ValidationResult result) {
        for (int t = 0; t < state.traineeCount(); t++) {
            Trainee trainee = state.trainee(t);
            SyllabusTarget target = state.target(t);
            int unassigned = 0;
            for (int m = 0; m < state.length(t); m++) {
                StationCode station = state.station(t, m);
                StationCode leave = target.getLeaveMonths().get(m);
                if (station == null) {
                    unassigned++;
                } else if (leave != null && station != leave) {
                    result.addError(String.format("%s: month %d is %s leave but holds %s",
                        trainee.getId(), m, leave.getDisplayName(), station.getDisplayName()));
                } else if (leave == null && station.isLeave()) {
                    result.addError(String.format("%s: month %d holds %s without a reported leave",
                        trainee.getId(), m, station.getDisplayName()));
                } else if (!station.isOpenTo(trainee.getDepartment())) {
                    result.addError(String.format("%s: assigned to %s but belongs to department %s",
                        trainee.getId(), station.getDisplayName(), trainee.getDepartment()));
                }
            }
            if (unassigned > 0) {
                result.addError(String.format("%s: only %d/%d months assigned",
                    trainee.getId(), state.length(t) - unassigned, state.length(t)));
            }
        }
    }

    private void validateContinuity(ScheduleState state, SyllabusRuleSet ruleSet, ValidationResult result) {
        for (int t = 0; t < state.traineeCount(); t++) {
            for (StationCode station : ruleSet.stationsFor(state.trainee(t))) {
                if (ruleSet.isSplittable(station)) {
                    continue;
                }
                int blocks = blockCount(state, t, station);
                if (blocks > 1) {
                    result.addWarning(String.format("%s: %s is split into %d blocks",
                        state.trainee(t).getId(), station.getDisplayName(), blocks));
                }
            }
        }
    }

    public static int blockCount(ScheduleState state, int ordinal, StationCode station) {
        int blocks = 0;
        int previous = StationCode.UNASSIGNED;
        for (int m = 0; m < state.length(ordinal); m++) {
            int current = state.stationId(ordinal, m);
            if (current == station.id() && previous != station.id()) {
                blocks++;
            }
            previous = current;
        }
        return blocks;
    }
}
