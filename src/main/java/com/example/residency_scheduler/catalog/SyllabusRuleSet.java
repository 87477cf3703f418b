package com.example.residency_scheduler.catalog;

import com.example.residency_scheduler.entities.Trainee;
import com.example.residency_scheduler.enums.RuleKind;
import com.example.residency_scheduler.enums.StationCode;
import com.example.residency_scheduler.enums.Track;

import lombok.Getter;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, versioned snapshot of every station rule effective over a date range. A solve binds
 * to exactly one instance for its whole run.
 */
@Getter
public final class SyllabusRuleSet {
    private final String version;
    private final LocalDate effectiveFrom;
    // inclusive; null means open-ended
    private final LocalDate effectiveTo;
    private final List<StationRule> rules;
    private final StationCode rotationAllotmentStation;
    private final int withinSyllabusLeaveCap;

    private final Map<StationCode, StationRule> durationRules = new EnumMap<>(StationCode.class);
    private final Map<StationCode, StationRule> windowRules = new EnumMap<>(StationCode.class);
    private final List<StationRule> capacityRules = new ArrayList<>();
    private final List<StationRule> sequenceRules = new ArrayList<>();

    public SyllabusRuleSet(String version, LocalDate effectiveFrom, LocalDate effectiveTo, List<StationRule> rules,
                           StationCode rotationAllotmentStation, int withinSyllabusLeaveCap) {
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("Rule set version cannot be blank");
        }
        if (effectiveFrom == null) {
            throw new IllegalArgumentException("Rule set " + version + " needs an effective-from date");
        }
        if (effectiveTo != null && effectiveTo.isBefore(effectiveFrom)) {
            throw new IllegalArgumentException("Rule set " + version + " ends before it starts");
        }
        this.version = version;
        this.effectiveFrom = effectiveFrom;
        this.effectiveTo = effectiveTo;
        this.rules = List.copyOf(rules);
        this.rotationAllotmentStation = rotationAllotmentStation;
        this.withinSyllabusLeaveCap = withinSyllabusLeaveCap;

        for (StationRule rule : this.rules) {
            switch (rule.getKind()) {
                case DURATION:
                    if (rule.getStation().isLeave()) {
                        throw new IllegalArgumentException("Leave stations have no syllabus duration: " + rule.getStation());
                    }
                    if (durationRules.put(rule.getStation(), rule) != null) {
                        throw new IllegalArgumentException("Duplicate duration rule for " + rule.getStation());
                    }
                    break;
                case CALENDAR_WINDOW:
                    if (windowRules.put(rule.getStation(), rule) != null) {
                        throw new IllegalArgumentException("Duplicate calendar window for " + rule.getStation());
                    }
                    break;
                case CAPACITY:
                    capacityRules.add(rule);
                    break;
                case SEQUENCE:
                    sequenceRules.add(rule);
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported rule kind " + rule.getKind());
            }
        }
        if (!durationRules.containsKey(rotationAllotmentStation)) {
            throw new IllegalArgumentException("Rotation allotment station " + rotationAllotmentStation + " has no duration rule");
        }
    }

    public boolean covers(LocalDate date) {
        return !date.isBefore(effectiveFrom) && (effectiveTo == null || !date.isAfter(effectiveTo));
    }

    public int requiredMonths(Track track, StationCode station) {
        StationRule rule = durationRules.get(station);
        return rule == null ? 0 : rule.monthsFor(track);
    }

    public boolean isSplittable(StationCode station) {
        StationRule rule = durationRules.get(station);
        return rule == null || rule.isSplittable();
    }

    /** Department scoping plus a non-zero syllabus duration for the trainee's track. */
    public boolean isEligible(Trainee trainee, StationCode station) {
        return !station.isLeave()
            && station.isOpenTo(trainee.getDepartment())
            && requiredMonths(trainee.getTrack(), station) > 0;
    }

    public List<StationCode> stationsFor(Trainee trainee) {
        List<StationCode> stations = new ArrayList<>();
        for (StationCode station : durationRules.keySet()) {
            if (isEligible(trainee, station)) {
                stations.add(station);
            }
        }
        return stations;
    }

    public Optional<StationRule> durationFor(StationCode station) {
        return Optional.ofNullable(durationRules.get(station));
    }

    public Optional<StationRule> windowFor(StationCode station) {
        return Optional.ofNullable(windowRules.get(station));
    }

    public List<StationRule> getCapacityRules() {
        return Collections.unmodifiableList(capacityRules);
    }

    public List<StationRule> getSequenceRules() {
        return Collections.unmodifiableList(sequenceRules);
    }

    public List<StationRule> rulesOf(RuleKind kind) {
        List<StationRule> matching = new ArrayList<>();
        for (StationRule rule : rules) {
            if (rule.getKind() == kind) {
                matching.add(rule);
            }
        }
        return matching;
    }

    @Override
    public String toString() {
        return "SyllabusRuleSet[" + version + ", " + effectiveFrom + ".." + (effectiveTo == null ? "" : effectiveTo) + "]";
    }
}
