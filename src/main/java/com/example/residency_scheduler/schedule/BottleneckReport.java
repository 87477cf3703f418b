package com.example.residency_scheduler.schedule;

import com.example.residency_scheduler.enums.Severity;

import lombok.Value;

import java.time.YearMonth;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Value
public class BottleneckReport {
    YearMonth from;
    YearMonth to;
    List<CoverageIssue> issues;

    public long criticalCount() {
        return issues.stream().filter(issue -> issue.getSeverity() == Severity.CRITICAL).count();
    }

    public long warningCount() {
        return issues.stream().filter(issue -> issue.getSeverity() == Severity.WARNING).count();
    }

    public boolean isClear() {
        return issues.isEmpty();
    }

    public Map<YearMonth, Long> issuesPerMonth() {
        Map<YearMonth, Long> perMonth = new TreeMap<>();
        issues.forEach(issue -> perMonth.merge(issue.getMonth(), 1L, Long::sum));
        return perMonth;
    }
}
