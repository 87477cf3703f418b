package com.example.residency_scheduler.service;

import com.example.residency_scheduler.catalog.DefaultSyllabus;
import com.example.residency_scheduler.catalog.RuleCatalog;
import com.example.residency_scheduler.catalog.StationRule;
import com.example.residency_scheduler.catalog.SyllabusRuleSet;
import com.example.residency_scheduler.conflict.ConflictReport;
import com.example.residency_scheduler.conflict.ConflictTuple;
import com.example.residency_scheduler.entities.Trainee;
import com.example.residency_scheduler.enums.Department;
import com.example.residency_scheduler.enums.ReasonCode;
import com.example.residency_scheduler.enums.RuleKind;
import com.example.residency_scheduler.enums.StationCode;
import com.example.residency_scheduler.schedule.Assignment;
import com.example.residency_scheduler.schedule.ScheduleState;
import com.example.residency_scheduler.solver.ResidencyScheduleSolver;
import com.example.residency_scheduler.solver.ResolveRequest;
import com.example.residency_scheduler.solver.ResolveResult;
import com.example.residency_scheduler.solver.SolveHandle;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.YearMonth;
import java.util.List;
import java.util.Optional;

import static com.example.residency_scheduler.ScheduleFixtures.SEPTEMBER_2022;
import static com.example.residency_scheduler.ScheduleFixtures.filledState;
import static com.example.residency_scheduler.ScheduleFixtures.modelA;
import static com.example.residency_scheduler.ScheduleFixtures.variant;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ScheduleEngineTest {
    private static final YearMonth ONE_YEAR_IN = SEPTEMBER_2022.plusMonths(11);

    private final Trainee alice = modelA("alice", Department.A, SEPTEMBER_2022);
    private RuleCatalog catalog;
    private ResidencyScheduleSolver solver;
    private ScheduleEngine engine;
    private ScheduleState committed;

    @BeforeEach
    void setUp() {
        catalog = RuleCatalog.withDefaultSyllabus();
        solver = mock(ResidencyScheduleSolver.class);
        engine = new ScheduleEngine(solver, catalog);
        committed = filledState("p-1", DefaultSyllabus.ruleSet(), alice);
    }

    @Test
    void otherDepartmentStationIsAnAnchorConflictNamingMonthAndStation() {
        Optional<ConflictReport> report = engine.validateMove(committed, new Assignment("alice", 20, StationCode.HRP_B), ONE_YEAR_IN);

        assertThat(report).isPresent();
        assertThat(report.get().getPrimaryReason()).isEqualTo(ReasonCode.ANCHOR_CONFLICT);
        ConflictTuple tuple = report.get().getTuples().get(0);
        assertThat(tuple.getMonthIndex()).isEqualTo(20);
        assertThat(tuple.getCalendarMonth()).isEqualTo(YearMonth.of(2024, 5));
        assertThat(tuple.getStation()).isEqualTo(StationCode.HRP_B);
    }

    @Test
    void unchangedCellIsAccepted() {
        assertThat(engine.validateMove(committed, new Assignment("alice", 20, StationCode.MATERNITY_ER), ONE_YEAR_IN)).isEmpty();
    }

    @Test
    void elapsedMonthsCannotBeChanged() {
        Optional<ConflictReport> report = engine.validateMove(committed, new Assignment("alice", 3, StationCode.BIRTH), ONE_YEAR_IN);

        assertThat(report).get().satisfies(found -> {
            assertThat(found.getPrimaryReason()).isEqualTo(ReasonCode.ANCHOR_CONFLICT);
            assertThat(found.getSummary()).contains("committed as HRP A");
        });
    }

    @Test
    void anchoredCellsCannotBeChanged() {
        committed.setAnchors(List.of(new Assignment("alice", 30, StationCode.GYNECOLOGY_DAY)));

        Optional<ConflictReport> report = engine.validateMove(committed, new Assignment("alice", 30, StationCode.IVF), ONE_YEAR_IN);

        assertThat(report).get().satisfies(found -> assertThat(found.getSummary()).contains("anchored to Gynecology Day"));
    }

    @Test
    void stageAOutsideJuneMissesItsWindow() {
        Optional<ConflictReport> report = engine.validateMove(committed, new Assignment("alice", 46, StationCode.STAGE_A), ONE_YEAR_IN);

        assertThat(report).get().satisfies(found -> {
            assertThat(found.getPrimaryReason()).isEqualTo(ReasonCode.SYLLABUS_WINDOW_MISSED);
            assertThat(found.getTuples()).singleElement()
                .satisfies(tuple -> assertThat(tuple.getCalendarMonth()).isEqualTo(YearMonth.of(2026, 7)));
        });
    }

    @Test
    void breakingAnImmediateSequenceIsReported() {
        Optional<ConflictReport> report = engine.validateMove(committed, new Assignment("alice", 44, StationCode.IVF), ONE_YEAR_IN);

        assertThat(report).get().satisfies(found -> {
            assertThat(found.getPrimaryReason()).isEqualTo(ReasonCode.SEQUENCE_VIOLATION);
            assertThat(found.getSummary()).contains("Rotation A");
        });
    }

    @Test
    void joiningAFullStationExceedsCapacity() {
        SyllabusRuleSet single = variant("single-hrp",
            rule -> rule.getKind() == RuleKind.CAPACITY && rule.getStation() == StationCode.HRP_A,
            StationRule.capacity(0, 1, StationCode.HRP_A));
        catalog.publish(single);
        Trainee bea = modelA("bea", Department.A, SEPTEMBER_2022.plusMonths(12));
        ScheduleState state = filledState("p-1", single, alice, bea);

        // bea is at HRP A in November 2023, alice at Gynecology A (index 14)
        Optional<ConflictReport> report = engine.validateMove(state, new Assignment("alice", 14, StationCode.HRP_A),
            SEPTEMBER_2022.minusMonths(1));

        assertThat(report).get().satisfies(found -> {
            assertThat(found.getPrimaryReason()).isEqualTo(ReasonCode.CAPACITY_EXCEEDED);
            assertThat(found.getTuples()).extracting(ConflictTuple::getStation).contains(StationCode.HRP_A);
            assertThat(found.getTuples()).extracting(ConflictTuple::getCalendarMonth).contains(YearMonth.of(2023, 11));
        });
    }

    @Test
    void leavingAStationBelowItsFloorExceedsCapacity() {
        SyllabusRuleSet floored = variant("birth-floor",
            rule -> rule.getKind() == RuleKind.CAPACITY && rule.getStation() == StationCode.BIRTH,
            StationRule.capacity(1, 4, StationCode.BIRTH));
        catalog.publish(floored);
        ScheduleState state = filledState("p-1", floored, alice);

        Optional<ConflictReport> report = engine.validateMove(state, new Assignment("alice", 8, StationCode.IVF),
            SEPTEMBER_2022.minusMonths(1));

        assertThat(report).get().satisfies(found -> assertThat(found.getSummary()).contains("would drop to 0"));
    }

    @Test
    void validationNeverTouchesTheCommittedState() {
        ScheduleState before = committed.copy();

        engine.validateMove(committed, new Assignment("alice", 44, StationCode.IVF), ONE_YEAR_IN);

        assertThat(committed.sameAssignments(before)).isTrue();
    }

    @Test
    void monthOutsideTheProgramIsMalformed() {
        assertThatThrownBy(() -> engine.validateMove(committed, new Assignment("alice", 72, StationCode.IVF), ONE_YEAR_IN))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("72-month");
    }

    @Test
    void resolveDelegatesToTheSolver() {
        ResolveRequest request = ResolveRequest.builder().programId("p-1").trainee(alice).currentMonth(ONE_YEAR_IN).build();
        ResolveResult expected = ResolveResult.builder().build();
        when(solver.solve(same(request), any(SolveHandle.class))).thenReturn(expected);

        assertThat(engine.resolve(request)).isSameAs(expected);
        verify(solver).solve(same(request), any(SolveHandle.class));
    }
}
