package com.example.residency_scheduler.schedule;

import com.example.residency_scheduler.catalog.StationRule;
import com.example.residency_scheduler.catalog.SyllabusRuleSet;
import com.example.residency_scheduler.enums.CoverageIssueType;
import com.example.residency_scheduler.enums.Severity;
import com.example.residency_scheduler.enums.StationCode;

import lombok.extern.slf4j.Slf4j;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

/**
 * Forward capacity forecast over a committed schedule. Looks at the months after the current
 * month and reports every capacity pool outside its bounds.
 */
@Slf4j
public class BottleneckAnalyzer {
    private final int lookaheadMonths;

    public BottleneckAnalyzer(int lookaheadMonths) {
        if (lookaheadMonths < 1) {
            throw new IllegalArgumentException("Lookahead must be at least one month");
        }
        this.lookaheadMonths = lookaheadMonths;
    }

    public BottleneckReport forecast(ScheduleState state, SyllabusRuleSet ruleSet, YearMonth currentMonth) {
        YearMonth from = currentMonth.plusMonths(1);
        YearMonth to = currentMonth.plusMonths(lookaheadMonths);
        List<CoverageIssue> issues = new ArrayList<>();
        for (YearMonth month = from; !month.isAfter(to); month = month.plusMonths(1)) {
            for (StationRule rule : ruleSet.getCapacityRules()) {
                analyze(state, rule, month, issues);
            }
        }
        BottleneckReport report = new BottleneckReport(from, to, issues);
        if (!report.isClear()) {
            log.info("Capacity forecast {}..{} for {}: {} critical, {} warnings",
                from, to, state.getProgramId(), report.criticalCount(), report.warningCount());
        }
        return report;
    }

    private void analyze(ScheduleState state, StationRule rule, YearMonth month, List<CoverageIssue> issues) {
        int occupied = state.occupancy(rule.getPool(), month);
        int minimum = state.minimumFor(rule.getStation(), month, rule.getMinOccupancy());
        if (occupied == 0 && minimum > 0) {
            issues.add(new CoverageIssue(CoverageIssueType.NO_COVERAGE, Severity.CRITICAL, month, rule.getStation(),
                0, minimum, List.of()));
        } else if (occupied < minimum) {
            issues.add(new CoverageIssue(CoverageIssueType.UNDERSTAFFED, Severity.WARNING, month, rule.getStation(),
                occupied, minimum, traineesAt(state, rule, month)));
        } else if (occupied > rule.getMaxOccupancy()) {
            issues.add(new CoverageIssue(CoverageIssueType.OVERSTAFFED, Severity.WARNING, month, rule.getStation(),
                occupied, rule.getMaxOccupancy(), traineesAt(state, rule, month)));
        }
    }

    private List<String> traineesAt(ScheduleState state, StationRule rule, YearMonth month) {
        List<String> ids = new ArrayList<>();
        for (int t = 0; t < state.traineeCount(); t++) {
            int m = state.trainee(t).monthIndexOf(month);
            if (m < 0 || m >= state.length(t)) {
                continue;
            }
            StationCode station = state.station(t, m);
            if (station != null && rule.poolContains(station)) {
                ids.add(state.trainee(t).getId());
            }
        }
        return ids;
    }
}
