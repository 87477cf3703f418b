package com.example.residency_scheduler.solver;

import com.example.residency_scheduler.catalog.StationRule;
import com.example.residency_scheduler.enums.RuleKind;
import com.example.residency_scheduler.enums.StationCode;

import lombok.Value;

import java.time.YearMonth;

/**
 * A block of model constraints switched on by one assumption literal when the model is built for
 * diagnosis. Trainee-scoped groups carry the trainee ordinal; capacity groups carry the month.
 */
@Value
public class ConstraintGroup {
    RuleKind kind;
    StationRule rule;
    int ordinal;
    StationCode station;
    YearMonth month;

    static ConstraintGroup forTrainee(RuleKind kind, StationRule rule, int ordinal, StationCode station) {
        return new ConstraintGroup(kind, rule, ordinal, station, null);
    }

    static ConstraintGroup forMonth(StationRule rule, YearMonth month) {
        return new ConstraintGroup(RuleKind.CAPACITY, rule, -1, rule.getStation(), month);
    }

    String literalName() {
        return "a_" + kind + "_" + (ordinal >= 0 ? ordinal : month) + "_" + station;
    }
}
