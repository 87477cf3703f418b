package com.example.residency_scheduler.schedule;

import com.example.residency_scheduler.catalog.DefaultSyllabus;
import com.example.residency_scheduler.catalog.RuleViolation;
import com.example.residency_scheduler.catalog.SyllabusRuleSet;
import com.example.residency_scheduler.entities.Trainee;
import com.example.residency_scheduler.enums.Department;
import com.example.residency_scheduler.enums.ReasonCode;
import com.example.residency_scheduler.enums.StationCode;

import org.junit.jupiter.api.Test;

import java.time.YearMonth;

import static com.example.residency_scheduler.ScheduleFixtures.SEPTEMBER_2022;
import static com.example.residency_scheduler.ScheduleFixtures.filledState;
import static com.example.residency_scheduler.ScheduleFixtures.modelA;
import static org.assertj.core.api.Assertions.assertThat;

class ScheduleValidatorTest {
    private static final YearMonth BEFORE_START = SEPTEMBER_2022.minusMonths(1);

    private final SyllabusRuleSet ruleSet = DefaultSyllabus.ruleSet();
    private final ScheduleValidator validator = new ScheduleValidator();
    private final Trainee alice = modelA("alice", Department.A, SEPTEMBER_2022);

    @Test
    void handBuiltTimelinePassesWithSplitDepartmentWarning() {
        ValidationResult result = validator.validate(filledState("p-1", ruleSet, alice), ruleSet, BEFORE_START);

        assertThat(result.isValid()).as(result.summary()).isTrue();
        assertThat(result.getWarnings()).singleElement().asString().contains("Department", "2 blocks");
        assertThat(ScheduleValidator.blockCount(filledState("p-1", ruleSet, alice), 0, StationCode.DEPARTMENT)).isEqualTo(2);
    }

    @Test
    void stageAOutsideJuneMissesItsWindow() {
        ScheduleState state = filledState("p-1", ruleSet, alice);
        // swap Stage A (June) with the ER supervisor month after it
        state.assign(0, 45, StationCode.MATERNITY_ER_SUPERVISOR);
        state.assign(0, 46, StationCode.STAGE_A);

        ValidationResult result = validator.validate(state, ruleSet, BEFORE_START);

        assertThat(result.isValid()).isFalse();
        assertThat(result.getViolations()).extracting(RuleViolation::getReason)
            .contains(ReasonCode.SYLLABUS_WINDOW_MISSED, ReasonCode.SEQUENCE_VIOLATION);
        assertThat(result.getViolations())
            .filteredOn(violation -> violation.getReason() == ReasonCode.SYLLABUS_WINDOW_MISSED)
            .singleElement()
            .satisfies(violation -> {
                assertThat(violation.getMonthIndex()).isEqualTo(46);
                assertThat(violation.getCalendarMonth()).isEqualTo(YearMonth.of(2026, 7));
            });
    }

    @Test
    void otherDepartmentStationIsAnError() {
        ScheduleState state = filledState("p-1", ruleSet, alice);
        state.assign(0, 2, StationCode.HRP_B);

        ValidationResult result = validator.validate(state, ruleSet, BEFORE_START);

        assertThat(result.getErrors()).anySatisfy(error -> assertThat(error).contains("HRP B", "department A"));
        assertThat(result.getViolations()).extracting(RuleViolation::getReason).contains(ReasonCode.DURATION_UNMET);
    }

    @Test
    void emptyCellsAreReported() {
        ScheduleState state = filledState("p-1", ruleSet, alice);
        state.assign(0, 10, null);

        ValidationResult result = validator.validate(state, ruleSet, BEFORE_START);

        assertThat(result.getErrors()).anySatisfy(error -> assertThat(error).contains("71/72"));
    }

    @Test
    void capacityIsOnlyCheckedAfterTheCurrentMonth() {
        Trainee bea = modelA("bea", Department.A, SEPTEMBER_2022);
        Trainee cleo = modelA("cleo", Department.A, SEPTEMBER_2022);
        ScheduleState crowded = filledState("p-1", ruleSet, alice, bea, cleo);

        ValidationResult upcoming = validator.validate(crowded, ruleSet, BEFORE_START);
        ValidationResult elapsed = validator.validate(crowded, ruleSet, YearMonth.of(2028, 8));

        assertThat(upcoming.getViolations())
            .filteredOn(violation -> violation.getReason() == ReasonCode.CAPACITY_EXCEEDED)
            .extracting(RuleViolation::getStation)
            .contains(StationCode.HRP_A, StationCode.GYNECOLOGY_A, StationCode.MATERNITY_ER_SUPERVISOR);
        assertThat(elapsed.getViolations()).isEmpty();
    }
}
