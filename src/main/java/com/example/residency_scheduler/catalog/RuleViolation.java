package com.example.residency_scheduler.catalog;

import com.example.residency_scheduler.enums.ReasonCode;
import com.example.residency_scheduler.enums.StationCode;

import lombok.Value;

import java.time.YearMonth;

/** A broken rule at a concrete coordinate. Capacity violations carry no trainee or month index. */
@Value
public class RuleViolation {
    ReasonCode reason;
    StationRule rule;
    String traineeId;
    Integer monthIndex;
    YearMonth calendarMonth;
    StationCode station;
    String message;

    @Override
    public String toString() {
        return reason + ": " + message;
    }
}
