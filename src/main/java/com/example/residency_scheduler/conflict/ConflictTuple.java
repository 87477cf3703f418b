package com.example.residency_scheduler.conflict;

import com.example.residency_scheduler.catalog.RuleViolation;
import com.example.residency_scheduler.enums.ReasonCode;
import com.example.residency_scheduler.enums.StationCode;

import lombok.Value;

import java.time.YearMonth;

/**
 * One (trainee, month, station, rule) element of a conflict. A null month means the rule concerns
 * the trainee's whole residency, as a duration or sequence does. A null trainee appears only on a
 * capacity row no trainee could fill, or on a conflict of the fixed cells as a whole.
 */
@Value
public class ConflictTuple {
    String traineeId;
    Integer monthIndex;
    YearMonth calendarMonth;
    StationCode station;
    ReasonCode reason;
    String rule;

    public static ConflictTuple from(RuleViolation violation) {
        return new ConflictTuple(violation.getTraineeId(), violation.getMonthIndex(), violation.getCalendarMonth(),
            violation.getStation(), violation.getReason(), violation.getMessage());
    }

    @Override
    public String toString() {
        StringBuilder text = new StringBuilder(reason.name()).append(" ");
        if (traineeId != null) {
            text.append(traineeId);
            if (monthIndex != null) {
                text.append(" month ").append(monthIndex);
            }
            text.append(" ");
        }
        if (calendarMonth != null) {
            text.append("(").append(calendarMonth).append(") ");
        }
        if (station != null) {
            text.append(station.getDisplayName()).append(": ");
        }
        return text.append(rule).toString();
    }
}
