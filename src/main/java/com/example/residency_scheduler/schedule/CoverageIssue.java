package com.example.residency_scheduler.schedule;

import com.example.residency_scheduler.enums.CoverageIssueType;
import com.example.residency_scheduler.enums.Severity;
import com.example.residency_scheduler.enums.StationCode;

import lombok.Value;

import java.time.YearMonth;
import java.util.List;

@Value
public class CoverageIssue {
    CoverageIssueType type;
    Severity severity;
    YearMonth month;
    StationCode station;
    int occupancy;
    // the violated bound: the minimum for understaffing, the maximum for overstaffing
    int bound;
    List<String> traineeIds;

    public int gap() {
        return Math.abs(bound - occupancy);
    }
}
