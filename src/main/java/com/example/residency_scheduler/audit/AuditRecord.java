package com.example.residency_scheduler.audit;

import com.example.residency_scheduler.enums.AuditEntryType;
import com.example.residency_scheduler.enums.StationCode;

import lombok.Builder;
import lombok.Value;

import java.time.YearMonth;

/** What the engine hands to the audit log. The log stamps the time itself. */
@Value
@Builder
public class AuditRecord {
    String programId;
    AuditEntryType type;
    Actor actor;
    String traineeId;
    Integer monthIndex;
    YearMonth calendarMonth;
    StationCode priorStation;
    StationCode newStation;
    String justification;
    String detail;
}
