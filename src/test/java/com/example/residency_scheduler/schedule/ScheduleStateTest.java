package com.example.residency_scheduler.schedule;

import com.example.residency_scheduler.catalog.DefaultSyllabus;
import com.example.residency_scheduler.catalog.SyllabusRuleSet;
import com.example.residency_scheduler.entities.Trainee;
import com.example.residency_scheduler.enums.Department;
import com.example.residency_scheduler.enums.StationCode;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.YearMonth;
import java.util.List;
import java.util.Map;

import static com.example.residency_scheduler.ScheduleFixtures.SEPTEMBER_2022;
import static com.example.residency_scheduler.ScheduleFixtures.filledState;
import static com.example.residency_scheduler.ScheduleFixtures.modelA;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScheduleStateTest {
    private final SyllabusRuleSet ruleSet = DefaultSyllabus.ruleSet();
    private Trainee alice;
    private Trainee bruno;
    private ScheduleState state;

    @BeforeEach
    void setUp() {
        alice = modelA("alice", Department.A, SEPTEMBER_2022);
        bruno = modelA("bruno", Department.B, SEPTEMBER_2022.plusMonths(1));
        state = filledState("p-1", ruleSet, bruno, alice);
    }

    @Test
    void rosterIsOrderedById() {
        assertThat(state.getTrainees()).extracting(Trainee::getId).containsExactly("alice", "bruno");
        assertThat(state.ordinalOf("bruno")).isEqualTo(1);
        assertThat(state.isComplete()).isTrue();
    }

    @Test
    void occupancyFollowsCalendarMonthsNotIndices() {
        // alice is at Birth from index 8 (May 2023), bruno from index 8 of an October start (June 2023)
        assertThat(state.occupancy(StationCode.BIRTH, YearMonth.of(2023, 5))).isEqualTo(1);
        assertThat(state.occupancy(StationCode.BIRTH, YearMonth.of(2023, 6))).isEqualTo(2);
        assertThat(state.occupancy(List.of(StationCode.HRP_A, StationCode.HRP_B), YearMonth.of(2022, 12))).isEqualTo(2);
    }

    @Test
    void reassigningMovesOccupancy() {
        YearMonth may2023 = alice.calendarMonth(8);
        state.assign(state.ordinalOf("alice"), 8, StationCode.IVF);

        assertThat(state.occupancy(StationCode.BIRTH, may2023)).isZero();
        assertThat(state.occupancy(StationCode.IVF, may2023)).isEqualTo(1);

        state.assign(new Assignment("alice", 8, null));
        assertThat(state.occupancy(StationCode.IVF, may2023)).isZero();
        assertThat(state.unassignedCount()).isEqualTo(1);
    }

    @Test
    void copiesAreIndependent() {
        ScheduleState copy = state.copy();
        copy.assign(0, 0, StationCode.IVF);

        assertThat(state.station("alice", 0)).isEqualTo(StationCode.ORIENTATION);
        assertThat(state.occupancy(StationCode.IVF, SEPTEMBER_2022)).isZero();
        assertThat(copy.occupancy(StationCode.IVF, SEPTEMBER_2022)).isEqualTo(1);
        assertThat(copy.sameAssignments(state)).isFalse();
        assertThat(state.copy().sameAssignments(state)).isTrue();
    }

    @Test
    void monthsOutsideTheHorizonAreEmpty() {
        assertThat(state.occupancy(StationCode.ORIENTATION, YearMonth.of(2010, 1))).isZero();
        assertThat(state.getCapacity().inHorizon(YearMonth.of(2028, 9))).isTrue();
        assertThat(state.getCapacity().inHorizon(YearMonth.of(2028, 10))).isFalse();
    }

    @Test
    void unknownTraineeIsRejected() {
        assertThatThrownBy(() -> state.ordinalOf("nobody"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("nobody");
    }

    @Test
    void capacitySummaryAppliesMinimumOverrides() {
        YearMonth june2023 = YearMonth.of(2023, 6);
        state.setMinimumOverrides(Map.of(new StationMonth(StationCode.BIRTH, june2023), 1));

        CapacitySummary summary = state.capacitySummary(ruleSet);

        StationMonthLoad birth = summary.load(StationCode.BIRTH, june2023).orElseThrow();
        assertThat(birth.getOccupancy()).isEqualTo(2);
        assertThat(birth.getMinOccupancy()).isEqualTo(1);
        assertThat(birth.getMaxOccupancy()).isEqualTo(4);
        assertThat(birth.withinBounds()).isTrue();
        assertThat(summary.outOfBounds()).isEmpty();
    }
}
