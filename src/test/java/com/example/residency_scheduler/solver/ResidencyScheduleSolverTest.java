package com.example.residency_scheduler.solver;

import com.example.residency_scheduler.catalog.DefaultSyllabus;
import com.example.residency_scheduler.catalog.RuleCatalog;
import com.example.residency_scheduler.catalog.StationRule;
import com.example.residency_scheduler.catalog.SyllabusRuleSet;
import com.example.residency_scheduler.config.SolverSettings;
import com.example.residency_scheduler.conflict.ConflictReport;
import com.example.residency_scheduler.conflict.ConflictTuple;
import com.example.residency_scheduler.entities.Trainee;
import com.example.residency_scheduler.enums.Department;
import com.example.residency_scheduler.enums.LeaveClassification;
import com.example.residency_scheduler.enums.LeaveType;
import com.example.residency_scheduler.enums.ReasonCode;
import com.example.residency_scheduler.enums.ResolveStatus;
import com.example.residency_scheduler.enums.RuleKind;
import com.example.residency_scheduler.enums.StationCode;
import com.example.residency_scheduler.exception.UnauthorizedActionException;
import com.example.residency_scheduler.leave.LeaveEvent;
import com.example.residency_scheduler.schedule.Assignment;
import com.example.residency_scheduler.schedule.ScheduleState;
import com.example.residency_scheduler.schedule.ScheduleValidator;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Month;
import java.time.YearMonth;

import static com.example.residency_scheduler.ScheduleFixtures.COORDINATOR;
import static com.example.residency_scheduler.ScheduleFixtures.DIRECTOR;
import static com.example.residency_scheduler.ScheduleFixtures.modelA;
import static com.example.residency_scheduler.ScheduleFixtures.modelB;
import static com.example.residency_scheduler.ScheduleFixtures.variant;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResidencyScheduleSolverTest {
    private static final YearMonth START = YearMonth.of(2023, 9);
    private static final YearMonth BEFORE_START = START.minusMonths(1);
    private static final Duration BUDGET = Duration.ofSeconds(30);

    private RuleCatalog catalog;
    private ResidencyScheduleSolver solver;
    private Trainee alice;

    @BeforeEach
    void setUp() {
        catalog = RuleCatalog.withDefaultSyllabus();
        SolverSettings settings = SolverSettings.defaults().toBuilder().diagnosisBudget(Duration.ofSeconds(10)).build();
        solver = new ResidencyScheduleSolver(catalog, settings);
        alice = modelA("alice", Department.A, START);
    }

    @Test
    void singleModelATraineeGetsACompleteValidSchedule() {
        ResolveResult result = solver.solve(request(BEFORE_START).build(), new SolveHandle());

        assertThat(result.getStatus()).isEqualTo(ResolveStatus.VALID);
        assertThat(result.isComplete()).isTrue();
        assertThat(result.getRuleSetVersion()).isEqualTo(DefaultSyllabus.VERSION);
        ScheduleState state = result.getState();
        assertThat(state.length(0)).isEqualTo(72);
        assertThat(state.isComplete()).isTrue();
        for (StationCode station : DefaultSyllabus.ruleSet().stationsFor(alice)) {
            assertThat(state.count(0, station)).as(station.name()).isEqualTo(state.target(0).required(station));
        }
        int stageA = indexOf(state, StationCode.STAGE_A);
        assertThat(stageA).isBetween(36, 54);
        assertThat(alice.calendarMonth(stageA).getMonth()).isEqualTo(Month.JUNE);
        assertThat(new ScheduleValidator().validate(state, DefaultSyllabus.ruleSet(), BEFORE_START).isValid()).isTrue();
        assertThat(result.getCapacitySummary().outOfBounds()).isEmpty();
    }

    @Test
    void anchorsSurviveTheResolve() {
        ResolveResult result = solver.solve(request(BEFORE_START)
            .anchor(new Assignment("alice", 4, StationCode.IVF))
            .anchor(new Assignment("alice", 45, StationCode.STAGE_A))
            .build(), new SolveHandle());

        assertThat(result.isCommittable()).isTrue();
        assertThat(result.getState().station("alice", 4)).isEqualTo(StationCode.IVF);
        assertThat(result.getState().station("alice", 45)).isEqualTo(StationCode.STAGE_A);
        assertThat(result.getState().station("alice", 44)).isEqualTo(StationCode.ROTATION_A);
    }

    @Test
    void elapsedMonthsKeepTheirCommittedStations() {
        ScheduleState first = solver.solve(request(BEFORE_START).build(), new SolveHandle()).getState();
        int supervisor = indexOf(first, StationCode.MATERNITY_ER_SUPERVISOR);
        int moved = supervisor == 50 ? 52 : 50;
        YearMonth oneYearIn = START.plusMonths(11);

        ResolveResult second = solver.solve(request(oneYearIn)
            .currentState(first)
            .anchor(new Assignment("alice", moved, StationCode.MATERNITY_ER_SUPERVISOR))
            .build(), new SolveHandle());

        assertThat(second.isCommittable()).isTrue();
        for (int m = 0; m <= 11; m++) {
            assertThat(second.getState().station("alice", m)).as("month %d", m).isEqualTo(first.station("alice", m));
        }
        assertThat(second.getState().station("alice", moved)).isEqualTo(StationCode.MATERNITY_ER_SUPERVISOR);
    }

    @Test
    void identicalInputsGiveIdenticalSchedules() {
        ResolveRequest request = request(BEFORE_START)
            .trainee(modelA("bea", Department.B, START.plusMonths(6)))
            .build();

        ResolveResult first = solver.solve(request, new SolveHandle());
        ResolveResult second = solver.solve(request, new SolveHandle());

        assertThat(second.getStatus()).isEqualTo(first.getStatus());
        assertThat(second.getState().sameAssignments(first.getState())).isTrue();
    }

    @Test
    void cohortOfTwelveIsSolvedWithinTheDefaultBudget() {
        ResidencyScheduleSolver defaults = new ResidencyScheduleSolver(catalog, SolverSettings.defaults());
        ResolveRequest request = cohortRequest().build();

        ResolveResult result = defaults.solve(request, new SolveHandle());

        assertThat(result.getStatus()).isEqualTo(ResolveStatus.VALID);
        assertThat(result.isComplete()).isTrue();
        assertThat(result.getState().traineeCount()).isEqualTo(12);
        assertThat(new ScheduleValidator().validate(result.getState(), DefaultSyllabus.ruleSet(), BEFORE_START).isValid())
            .isTrue();
        assertThat(result.getCapacitySummary().outOfBounds()).isEmpty();
    }

    @Test
    void budgetCutOffIsTheSameOnEveryRun() {
        ResolveRequest request = cohortRequest().timeBudget(Duration.ofSeconds(1)).build();

        ResolveResult first = solver.solve(request, new SolveHandle());
        ResolveResult second = solver.solve(request, new SolveHandle());
        ResolveResult third = solver.solve(request, new SolveHandle());

        assertThat(second.getStatus()).isEqualTo(first.getStatus());
        assertThat(third.getStatus()).isEqualTo(first.getStatus());
        assertThat(second.isComplete()).isEqualTo(first.isComplete());
        assertThat(second.getPhase()).isEqualTo(first.getPhase());
        assertThat(second.getState().sameAssignments(first.getState())).isTrue();
        assertThat(third.getState().sameAssignments(first.getState())).isTrue();
    }

    @Test
    void withinSyllabusLeaveLengthensTheProgramAndPinsLeaveMonths() {
        LeaveEvent leave = LeaveEvent.builder()
            .traineeId("alice")
            .type(LeaveType.UNPAID)
            .start(YearMonth.of(2025, 1))
            .durationMonths(8)
            .classification(LeaveClassification.WITHIN_SYLLABUS)
            .reportedBy(COORDINATOR)
            .build();

        ResolveResult result = solver.solve(request(BEFORE_START).leaveEvent(leave).build(), new SolveHandle());

        assertThat(result.isCommittable()).isTrue();
        ScheduleState state = result.getState();
        assertThat(state.length(0)).isEqualTo(74);
        for (int m = 16; m < 24; m++) {
            assertThat(state.station(0, m)).isEqualTo(StationCode.UNPAID_LEAVE);
        }
        assertThat(state.count(0, StationCode.DEPARTMENT)).isEqualTo(8);
    }

    @Test
    void unreachableCapacityFloorIsReportedWithStationAndMonth() {
        SyllabusRuleSet tight = variant("tight-birth",
            rule -> rule.getKind() == RuleKind.CAPACITY && rule.getStation() == StationCode.BIRTH,
            StationRule.capacity(2, 2, StationCode.BIRTH));
        catalog.publish(tight);

        ResolveResult result = solver.solve(request(BEFORE_START).ruleSetVersion("tight-birth").build(), new SolveHandle());

        assertThat(result.getStatus()).isEqualTo(ResolveStatus.INFEASIBLE);
        assertThat(result.getState()).isNull();
        ConflictReport report = result.getConflictReport();
        assertThat(report.getPrimaryReason()).isEqualTo(ReasonCode.CAPACITY_EXCEEDED);
        assertThat(report.tuplesWith(ReasonCode.CAPACITY_EXCEEDED)).first().satisfies(tuple -> {
            assertThat(tuple.getStation()).isEqualTo(StationCode.BIRTH);
            assertThat(tuple.getCalendarMonth()).isEqualTo(START);
        });
    }

    @Test
    void departmentBAnchorStopsBeforeSearch() {
        ResolveResult result = solver.solve(request(BEFORE_START)
            .anchor(new Assignment("alice", 7, StationCode.HRP_B))
            .build(), new SolveHandle());

        assertThat(result.getStatus()).isEqualTo(ResolveStatus.INFEASIBLE);
        assertThat(result.getPhase()).isZero();
        assertThat(result.getConflictReport().getTuples()).extracting(ConflictTuple::getStation)
            .containsExactly(StationCode.HRP_B);
    }

    @Test
    void exhaustedBudgetReturnsOnlyFixedCells() {
        ResolveResult result = solver.solve(request(BEFORE_START)
            .anchor(new Assignment("alice", 0, StationCode.ORIENTATION))
            .timeBudget(Duration.ZERO)
            .build(), new SolveHandle());

        assertThat(result.getStatus()).isEqualTo(ResolveStatus.TIMEOUT);
        assertThat(result.isComplete()).isFalse();
        assertThat(result.isCommittable()).isFalse();
        assertThat(result.getState().station("alice", 0)).isEqualTo(StationCode.ORIENTATION);
        assertThat(result.getState().unassignedCount()).isEqualTo(71);
    }

    @Test
    void cancelledHandleStopsBeforeSearching() {
        SolveHandle handle = new SolveHandle();
        handle.cancel();

        ResolveResult result = solver.solve(request(BEFORE_START).build(), handle);

        assertThat(result.getStatus()).isEqualTo(ResolveStatus.TIMEOUT);
        assertThat(result.isComplete()).isFalse();
    }

    @Test
    void overridesNeedADirectorAndAJustification() {
        YearMonth month = START.plusMonths(3);
        ResolveRequest byCoordinator = request(BEFORE_START)
            .override(new CapacityOverride(StationCode.BIRTH, month, 0, "staff shortage", COORDINATOR))
            .build();
        ResolveRequest unjustified = request(BEFORE_START)
            .override(new CapacityOverride(StationCode.BIRTH, month, 0, " ", DIRECTOR))
            .build();

        assertThatThrownBy(() -> solver.solve(byCoordinator, new SolveHandle()))
            .isInstanceOf(UnauthorizedActionException.class);
        assertThatThrownBy(() -> solver.solve(unjustified, new SolveHandle()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("justification");
    }

    @Test
    void currentMonthIsMandatory() {
        assertThatThrownBy(() -> solver.solve(request(null).build(), new SolveHandle()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    /** Six trainees per department, both tracks, starts spread over a year. */
    private ResolveRequest.ResolveRequestBuilder cohortRequest() {
        ResolveRequest.ResolveRequestBuilder request = ResolveRequest.builder()
            .programId("p-1")
            .currentMonth(BEFORE_START)
            .requestedBy(DIRECTOR);
        for (int i = 0; i < 12; i++) {
            Department department = i % 2 == 0 ? Department.A : Department.B;
            YearMonth start = START.plusMonths(i);
            String id = "t" + (i + 1);
            request.trainee(i % 3 == 2 ? modelB(id, department, start) : modelA(id, department, start));
        }
        return request;
    }

    private ResolveRequest.ResolveRequestBuilder request(YearMonth currentMonth) {
        return ResolveRequest.builder()
            .programId("p-1")
            .trainee(alice)
            .currentMonth(currentMonth)
            .timeBudget(BUDGET)
            .requestedBy(DIRECTOR);
    }

    private static int indexOf(ScheduleState state, StationCode station) {
        int t = 0;
        for (int m = 0; m < state.length(t); m++) {
            if (state.station(t, m) == station) {
                return m;
            }
        }
        return -1;
    }
}
