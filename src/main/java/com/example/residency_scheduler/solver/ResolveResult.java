package com.example.residency_scheduler.solver;

import com.example.residency_scheduler.conflict.ConflictReport;
import com.example.residency_scheduler.enums.ResolveStatus;
import com.example.residency_scheduler.schedule.CapacitySummary;
import com.example.residency_scheduler.schedule.ScheduleState;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Terminal outcome of a resolve. A VALID state satisfies every hard rule. A TIMEOUT state is either
 * complete and hard-feasible but not proven optimal, or, when nothing was found in time, holds only
 * the fixed cells and {@code complete} is false. INFEASIBLE carries a conflict report and no state.
 */
@Value
@Builder
public class ResolveResult {
    ResolveStatus status;
    ScheduleState state;
    CapacitySummary capacitySummary;
    ConflictReport conflictReport;
    boolean complete;
    String ruleSetVersion;
    int phase;
    double wallTimeSeconds;
    List<String> warnings;

    public boolean isCommittable() {
        return status == ResolveStatus.VALID || (status == ResolveStatus.TIMEOUT && complete);
    }

    static ResolveResult infeasible(String ruleSetVersion, ConflictReport report, int phase, double wallTimeSeconds) {
        return ResolveResult.builder()
            .status(ResolveStatus.INFEASIBLE)
            .conflictReport(report)
            .complete(false)
            .ruleSetVersion(ruleSetVersion)
            .phase(phase)
            .wallTimeSeconds(wallTimeSeconds)
            .warnings(List.of())
            .build();
    }
}
