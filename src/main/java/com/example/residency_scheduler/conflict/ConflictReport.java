package com.example.residency_scheduler.conflict;

import com.example.residency_scheduler.enums.ReasonCode;

import lombok.Value;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Mutually unsatisfiable constraints with the reason a human should look at first. When
 * {@code minimal} is false the set is the first one found, not a proven minimal one.
 */
@Value
public class ConflictReport {
    ReasonCode primaryReason;
    List<ConflictTuple> tuples;
    boolean minimal;
    String summary;

    public static ConflictReport of(List<ConflictTuple> tuples, boolean minimal) {
        if (tuples.isEmpty()) {
            throw new IllegalArgumentException("A conflict report needs at least one tuple");
        }
        ReasonCode primary = tuples.stream()
            .map(ConflictTuple::getReason)
            .min(Comparator.comparingInt(ReasonCode::getPriority))
            .orElseThrow();
        String summary = tuples.stream().map(ConflictTuple::toString).collect(Collectors.joining("; "));
        return new ConflictReport(primary, List.copyOf(tuples), minimal, summary);
    }

    public static ConflictReport single(ConflictTuple tuple) {
        return of(List.of(tuple), true);
    }

    public static ConflictReport diagnosisTimeout(String detail) {
        return new ConflictReport(ReasonCode.DIAGNOSIS_TIMEOUT, List.of(), false, detail);
    }

    public List<ConflictTuple> tuplesWith(ReasonCode reason) {
        return tuples.stream().filter(tuple -> tuple.getReason() == reason).collect(Collectors.toList());
    }
}
