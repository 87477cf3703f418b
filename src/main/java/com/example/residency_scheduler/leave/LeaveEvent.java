package com.example.residency_scheduler.leave;

import com.example.residency_scheduler.audit.Actor;
import com.example.residency_scheduler.enums.LeaveClassification;
import com.example.residency_scheduler.enums.LeaveType;

import lombok.Builder;
import lombok.Value;

import java.time.YearMonth;

@Value
@Builder
public class LeaveEvent {
    String traineeId;
    LeaveType type;
    YearMonth start;
    int durationMonths;
    LeaveClassification classification;
    Actor reportedBy;

    public YearMonth lastMonth() {
        return start.plusMonths(durationMonths - 1L);
    }
}
