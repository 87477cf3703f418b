package com.example.residency_scheduler.solver;

import com.example.residency_scheduler.audit.Actor;
import com.example.residency_scheduler.entities.Trainee;
import com.example.residency_scheduler.leave.LeaveEvent;
import com.example.residency_scheduler.schedule.Assignment;
import com.example.residency_scheduler.schedule.ScheduleState;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.time.YearMonth;
import java.util.List;

/**
 * Everything one resolve depends on. The current month is always explicit; a null rule set version
 * binds to the version effective on the first day of the current month, and a null time budget to
 * the configured default.
 */
@Value
@Builder(toBuilder = true)
public class ResolveRequest {
    String programId;
    // last committed state, null for a program never resolved
    ScheduleState currentState;
    @Singular("trainee")
    List<Trainee> roster;
    String ruleSetVersion;
    @Singular
    List<Assignment> anchors;
    @Singular
    List<LeaveEvent> leaveEvents;
    @Singular
    List<CapacityOverride> overrides;
    YearMonth currentMonth;
    Duration timeBudget;
    Actor requestedBy;
}
