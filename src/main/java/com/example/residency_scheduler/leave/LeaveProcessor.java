package com.example.residency_scheduler.leave;

import com.example.residency_scheduler.catalog.StationRule;
import com.example.residency_scheduler.catalog.SyllabusRuleSet;
import com.example.residency_scheduler.entities.Trainee;
import com.example.residency_scheduler.enums.LeaveClassification;
import com.example.residency_scheduler.enums.RuleKind;
import com.example.residency_scheduler.enums.StationCode;
import com.example.residency_scheduler.exception.UnauthorizedActionException;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns reported leave into a revised syllabus target. Within-syllabus leave is taken out of the
 * rotation allotment up to the rule set's cap, shared by all of a trainee's within-syllabus leaves;
 * anything beyond the cap, and all extension leave, lengthens the program. Leave months become
 * pinned cells holding the leave station.
 */
@Slf4j
public class LeaveProcessor {

    public SyllabusTarget baseline(Trainee trainee, SyllabusRuleSet ruleSet) {
        Map<StationCode, Integer> required = new EnumMap<>(StationCode.class);
        for (StationRule rule : ruleSet.rulesOf(RuleKind.DURATION)) {
            if (ruleSet.isEligible(trainee, rule.getStation())) {
                required.put(rule.getStation(), rule.monthsFor(trainee.getTrack()));
            }
        }
        return SyllabusTarget.builder()
            .traineeId(trainee.getId())
            .lengthMonths(trainee.getTrack().getBaseMonths())
            .requiredMonths(Collections.unmodifiableMap(required))
            .leaveMonths(Collections.emptyMap())
            .rotationAllotment(required.getOrDefault(ruleSet.getRotationAllotmentStation(), 0))
            .withinSyllabusDeducted(0)
            .extensionMonths(0)
            .build();
    }

    /** Baseline target with every leave of the trainee applied in start order. */
    public SyllabusTarget targetFor(Trainee trainee, List<LeaveEvent> leaveEvents, SyllabusRuleSet ruleSet) {
        List<LeaveEvent> own = new ArrayList<>();
        for (LeaveEvent event : leaveEvents) {
            if (trainee.getId().equals(event.getTraineeId())) {
                own.add(event);
            }
        }
        own.sort(Comparator.comparing(LeaveEvent::getStart));
        SyllabusTarget target = baseline(trainee, ruleSet);
        for (LeaveEvent event : own) {
            target = apply(target, trainee, event, ruleSet);
        }
        return target;
    }

    public SyllabusTarget apply(SyllabusTarget current, Trainee trainee, LeaveEvent event, SyllabusRuleSet ruleSet) {
        if (event.getReportedBy() == null || !event.getReportedBy().getRole().canReportLeave()) {
            throw new UnauthorizedActionException(
                event.getReportedBy() == null ? "anonymous" : event.getReportedBy().getId(),
                event.getReportedBy() == null ? null : event.getReportedBy().getRole(),
                "report leave for " + event.getTraineeId());
        }
        if (!trainee.getId().equals(event.getTraineeId())) {
            throw new IllegalArgumentException("Leave for " + event.getTraineeId() + " applied to " + trainee.getId());
        }
        if (event.getDurationMonths() < 1) {
            throw new IllegalArgumentException("Leave duration must be at least one month: " + event.getDurationMonths());
        }
        int firstIndex = trainee.monthIndexOf(event.getStart());
        if (firstIndex < 0) {
            throw new IllegalArgumentException(String.format("Leave for %s starts %s, before training starts %s",
                trainee.getId(), event.getStart(), trainee.startMonth()));
        }

        int length = current.getLengthMonths();
        int allotment = current.getRotationAllotment();
        int deducted = current.getWithinSyllabusDeducted();
        int extension = current.getExtensionMonths();
        int duration = event.getDurationMonths();

        if (event.getClassification() == LeaveClassification.WITHIN_SYLLABUS) {
            int deduct = Math.min(duration, Math.min(ruleSet.getWithinSyllabusLeaveCap() - deducted, allotment));
            deduct = Math.max(deduct, 0);
            allotment -= deduct;
            deducted += deduct;
            length += duration - deduct;
            extension += duration - deduct;
        } else {
            length += duration;
            extension += duration;
        }

        Map<Integer, StationCode> leaveMonths = new TreeMap<>(current.getLeaveMonths());
        for (int m = firstIndex; m < firstIndex + duration; m++) {
            if (m >= length) {
                throw new IllegalArgumentException(String.format("Leave for %s runs past month %d, the end of training",
                    trainee.getId(), length - 1));
            }
            if (leaveMonths.put(m, event.getType().getStation()) != null) {
                throw new IllegalArgumentException(String.format("Leave for %s overlaps an earlier leave at month %d",
                    trainee.getId(), m));
            }
        }

        Map<StationCode, Integer> required = new EnumMap<>(StationCode.class);
        required.putAll(current.getRequiredMonths());
        StationCode allotmentStation = ruleSet.getRotationAllotmentStation();
        if (allotment > 0) {
            required.put(allotmentStation, allotment);
        } else {
            required.remove(allotmentStation);
        }

        log.info("Leave {} for {} ({} months from {}): length {} -> {}, {} allotment {} -> {}",
            event.getClassification(), trainee.getId(), duration, event.getStart(), current.getLengthMonths(), length,
            allotmentStation.getDisplayName(), current.getRotationAllotment(), allotment);

        return current.toBuilder()
            .lengthMonths(length)
            .requiredMonths(Collections.unmodifiableMap(required))
            .leaveMonths(Collections.unmodifiableMap(leaveMonths))
            .rotationAllotment(allotment)
            .withinSyllabusDeducted(deducted)
            .extensionMonths(extension)
            .build();
    }
}
