package com.example.residency_scheduler.service;

import com.example.residency_scheduler.audit.AuditLog;
import com.example.residency_scheduler.audit.AuditRecord;
import com.example.residency_scheduler.catalog.DefaultSyllabus;
import com.example.residency_scheduler.catalog.RuleCatalog;
import com.example.residency_scheduler.config.SolverSettings;
import com.example.residency_scheduler.conflict.ConflictReport;
import com.example.residency_scheduler.conflict.ConflictTuple;
import com.example.residency_scheduler.entities.Trainee;
import com.example.residency_scheduler.enums.AuditEntryType;
import com.example.residency_scheduler.enums.Department;
import com.example.residency_scheduler.enums.LeaveClassification;
import com.example.residency_scheduler.enums.LeaveType;
import com.example.residency_scheduler.enums.ReasonCode;
import com.example.residency_scheduler.enums.ResolveStatus;
import com.example.residency_scheduler.enums.StationCode;
import com.example.residency_scheduler.exception.ResolveInProgressException;
import com.example.residency_scheduler.leave.LeaveEvent;
import com.example.residency_scheduler.schedule.Assignment;
import com.example.residency_scheduler.schedule.ScheduleState;
import com.example.residency_scheduler.solver.CapacityOverride;
import com.example.residency_scheduler.solver.ResolveRequest;
import com.example.residency_scheduler.solver.ResolveResult;
import com.example.residency_scheduler.solver.SolveHandle;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.YearMonth;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.example.residency_scheduler.ScheduleFixtures.COORDINATOR;
import static com.example.residency_scheduler.ScheduleFixtures.DIRECTOR;
import static com.example.residency_scheduler.ScheduleFixtures.SEPTEMBER_2022;
import static com.example.residency_scheduler.ScheduleFixtures.filledState;
import static com.example.residency_scheduler.ScheduleFixtures.modelA;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ProgramScheduleServiceTest {
    private static final YearMonth CURRENT = SEPTEMBER_2022.minusMonths(1);

    private final Trainee alice = modelA("alice", Department.A, SEPTEMBER_2022);
    private ScheduleEngine engine;
    private AuditLog auditLog;
    private ProgramScheduleService service;

    @BeforeEach
    void setUp() {
        engine = mock(ScheduleEngine.class);
        auditLog = mock(AuditLog.class);
        SolverSettings settings = SolverSettings.defaults().toBuilder().lockWait(Duration.ofMillis(200)).build();
        service = new ProgramScheduleService(engine, RuleCatalog.withDefaultSyllabus(), auditLog, settings);
    }

    @Test
    void validResultIsCommittedAndAudited() {
        ScheduleState solved = filledState("p-1", DefaultSyllabus.ruleSet(), alice);
        when(engine.resolve(any(ResolveRequest.class), any(SolveHandle.class))).thenReturn(valid(solved));
        LeaveEvent leave = sickLeave();

        service.resolve(request()
            .anchor(new Assignment("alice", 10, StationCode.BIRTH))
            .override(new CapacityOverride(StationCode.BIRTH, YearMonth.of(2023, 7), 0, "ward closed for refit", DIRECTOR))
            .leaveEvent(leave)
            .build());

        assertThat(service.committedState("p-1")).get()
            .satisfies(state -> assertThat(state.sameAssignments(solved)).isTrue());
        ArgumentCaptor<AuditRecord> records = ArgumentCaptor.forClass(AuditRecord.class);
        verify(auditLog, times(3)).append(records.capture());
        assertThat(records.getAllValues()).extracting(AuditRecord::getType).containsExactly(
            AuditEntryType.MANUAL_ASSIGNMENT, AuditEntryType.CAPACITY_OVERRIDE, AuditEntryType.LEAVE_REPORTED);
        AuditRecord manual = records.getAllValues().get(0);
        assertThat(manual.getActor()).isEqualTo(DIRECTOR);
        assertThat(manual.getCalendarMonth()).isEqualTo(YearMonth.of(2023, 7));
        assertThat(manual.getPriorStation()).isNull();
        assertThat(manual.getNewStation()).isEqualTo(StationCode.BIRTH);
        assertThat(records.getAllValues().get(1).getJustification()).isEqualTo("ward closed for refit");
        assertThat(records.getAllValues().get(2).getActor()).isEqualTo(COORDINATOR);
    }

    @Test
    void committedStateIsPassedToTheNextResolveAndUnchangedAnchorsAreNotAudited() {
        ScheduleState solved = filledState("p-1", DefaultSyllabus.ruleSet(), alice);
        when(engine.resolve(any(ResolveRequest.class), any(SolveHandle.class))).thenReturn(valid(solved));
        LeaveEvent leave = sickLeave();
        service.resolve(request().leaveEvent(leave).build());

        // Birth already holds month 10, the leave was reported before
        service.resolve(request().anchor(new Assignment("alice", 10, StationCode.BIRTH)).leaveEvent(leave).build());

        ArgumentCaptor<ResolveRequest> requests = ArgumentCaptor.forClass(ResolveRequest.class);
        verify(engine, times(2)).resolve(requests.capture(), any(SolveHandle.class));
        assertThat(requests.getAllValues().get(0).getCurrentState()).isNull();
        assertThat(requests.getAllValues().get(1).getCurrentState())
            .isNotSameAs(solved)
            .satisfies(state -> assertThat(state.sameAssignments(solved)).isTrue());
        verify(auditLog, times(1)).append(any(AuditRecord.class));
    }

    @Test
    void editingTheReturnedStateDoesNotReachTheCommittedOne() {
        ScheduleState solved = filledState("p-1", DefaultSyllabus.ruleSet(), alice);
        StationCode first = solved.station(0, 0);
        when(engine.resolve(any(ResolveRequest.class), any(SolveHandle.class))).thenReturn(valid(solved));

        ResolveResult result = service.resolve(request().build());
        result.getState().assign(0, 0, StationCode.HRP_B);

        assertThat(service.committedState("p-1")).get()
            .satisfies(state -> assertThat(state.station(0, 0)).isEqualTo(first));
    }

    @Test
    void infeasibleResultLeavesCommittedStateAlone() {
        ConflictReport report = ConflictReport.single(new ConflictTuple("alice", 4, null, StationCode.HRP_B,
            ReasonCode.ANCHOR_CONFLICT, "department"));
        when(engine.resolve(any(ResolveRequest.class), any(SolveHandle.class))).thenReturn(ResolveResult.builder()
            .status(ResolveStatus.INFEASIBLE)
            .conflictReport(report)
            .warnings(List.of())
            .build());

        ResolveResult result = service.resolve(request().anchor(new Assignment("alice", 4, StationCode.HRP_B)).build());

        assertThat(result.getStatus()).isEqualTo(ResolveStatus.INFEASIBLE);
        assertThat(service.committedState("p-1")).isEmpty();
        verify(auditLog, never()).append(any(AuditRecord.class));
    }

    @Test
    void cancelledResolveIsNotCommitted() {
        ScheduleState solved = filledState("p-1", DefaultSyllabus.ruleSet(), alice);
        when(engine.resolve(any(ResolveRequest.class), any(SolveHandle.class))).thenReturn(valid(solved));
        SolveHandle handle = new SolveHandle();
        handle.cancel();

        service.resolve(request().build(), handle);

        assertThat(service.committedState("p-1")).isEmpty();
    }

    @Test
    void secondResolveOfTheSameProgramWaitsThenGivesUp() throws Exception {
        ScheduleState solved = filledState("p-1", DefaultSyllabus.ruleSet(), alice);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(engine.resolve(any(ResolveRequest.class), any(SolveHandle.class))).thenAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return valid(solved);
        });

        CompletableFuture<ResolveResult> first = CompletableFuture.supplyAsync(() -> service.resolve(request().build()));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> service.resolve(request().build()))
            .isInstanceOf(ResolveInProgressException.class)
            .hasMessageContaining("p-1");

        release.countDown();
        assertThat(first.get(5, TimeUnit.SECONDS).getStatus()).isEqualTo(ResolveStatus.VALID);
    }

    @Test
    void moveChecksNeedACommittedSchedule() {
        assertThatThrownBy(() -> service.validateMove("p-1", new Assignment("alice", 1, StationCode.IVF), CURRENT))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("No committed schedule");
    }

    @Test
    void importedStateServesMoveChecksAndForecasts() {
        ScheduleState imported = filledState("p-1", DefaultSyllabus.ruleSet(), alice);
        service.importCommitted("p-1", imported, List.of());
        Assignment move = new Assignment("alice", 20, StationCode.HRP_B);

        service.validateMove("p-1", move, CURRENT);

        verify(engine).validateMove(any(ScheduleState.class), any(Assignment.class), any(YearMonth.class));
        assertThat(service.forecastBottlenecks("p-1", CURRENT).isClear()).isTrue();
        assertThat(service.committedState("p-1")).get().isNotSameAs(imported);
    }

    @Test
    void importForAnotherProgramIsRejected() {
        ScheduleState other = filledState("p-2", DefaultSyllabus.ruleSet(), alice);

        assertThatThrownBy(() -> service.importCommitted("p-1", other, List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private ResolveRequest.ResolveRequestBuilder request() {
        return ResolveRequest.builder()
            .programId("p-1")
            .trainee(alice)
            .currentMonth(CURRENT)
            .requestedBy(DIRECTOR);
    }

    private LeaveEvent sickLeave() {
        return LeaveEvent.builder()
            .traineeId("alice")
            .type(LeaveType.SICK)
            .start(YearMonth.of(2025, 2))
            .durationMonths(1)
            .classification(LeaveClassification.EXTENSION)
            .reportedBy(COORDINATOR)
            .build();
    }

    private static ResolveResult valid(ScheduleState state) {
        return ResolveResult.builder()
            .status(ResolveStatus.VALID)
            .state(state)
            .complete(true)
            .ruleSetVersion(state.getRuleSetVersion())
            .phase(1)
            .warnings(List.of())
            .build();
    }
}
