package com.example.residency_scheduler.solver;

import com.example.residency_scheduler.catalog.StationRule;
import com.example.residency_scheduler.catalog.SyllabusRuleSet;
import com.example.residency_scheduler.conflict.ConflictReport;
import com.example.residency_scheduler.conflict.ConflictTuple;
import com.example.residency_scheduler.entities.Trainee;
import com.example.residency_scheduler.enums.ReasonCode;
import com.example.residency_scheduler.enums.StationCode;
import com.example.residency_scheduler.leave.SyllabusTarget;
import com.example.residency_scheduler.schedule.Assignment;
import com.example.residency_scheduler.schedule.ScheduleState;

import lombok.extern.slf4j.Slf4j;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Rejects anchors and leave that contradict each other, the elapsed past or the syllabus before any
 * model is built. Every finding is an {@link ReasonCode#ANCHOR_CONFLICT}.
 */
@Slf4j
public class PreSolveChecker {

    public Optional<ConflictReport> check(ResolveRequest request, SyllabusRuleSet ruleSet, Map<String, SyllabusTarget> targets) {
        Map<String, Trainee> roster = new HashMap<>();
        request.getRoster().forEach(trainee -> roster.put(trainee.getId(), trainee));
        YearMonth currentMonth = request.getCurrentMonth();
        ScheduleState committed = request.getCurrentState();
        List<ConflictTuple> conflicts = new ArrayList<>();

        // (trainee -> month -> station) for every cell fixed so far
        Map<String, Map<Integer, StationCode>> fixed = new TreeMap<>();

        for (Trainee trainee : roster.values()) {
            SyllabusTarget target = targets.get(trainee.getId());
            Map<Integer, StationCode> cells = fixed.computeIfAbsent(trainee.getId(), id -> new TreeMap<>());
            checkCommittedRow(committed, trainee, target, currentMonth, cells, conflicts);
            for (Map.Entry<Integer, StationCode> leave : target.getLeaveMonths().entrySet()) {
                int m = leave.getKey();
                StationCode past = ProblemInstance.committedPast(committed, trainee, m, currentMonth);
                if (past != null && past != leave.getValue()) {
                    conflicts.add(tuple(trainee, m, leave.getValue(),
                        "leave rewrites elapsed month that holds " + past.getDisplayName()));
                } else {
                    cells.put(m, leave.getValue());
                }
            }
        }

        Map<String, Assignment> anchorByCell = new HashMap<>();
        for (Assignment anchor : request.getAnchors()) {
            Trainee trainee = roster.get(anchor.getTraineeId());
            if (trainee == null) {
                throw new IllegalArgumentException("Anchor for unknown trainee " + anchor.getTraineeId());
            }
            if (anchor.getStation() == null) {
                throw new IllegalArgumentException("Anchor without a station: " + anchor);
            }
            SyllabusTarget target = targets.get(trainee.getId());
            checkAnchor(anchor, trainee, target, ruleSet, committed, currentMonth, anchorByCell,
                fixed.get(trainee.getId()), conflicts);
        }

        for (Trainee trainee : roster.values()) {
            checkFixedCounts(trainee, targets.get(trainee.getId()), fixed.get(trainee.getId()), conflicts);
        }

        if (conflicts.isEmpty()) {
            return Optional.empty();
        }
        conflicts.sort((a, b) -> a.toString().compareTo(b.toString()));
        log.warn("Resolve of {} rejected before search: {} anchor conflicts", request.getProgramId(), conflicts.size());
        return Optional.of(ConflictReport.of(conflicts, true));
    }

    private void checkCommittedRow(ScheduleState committed, Trainee trainee, SyllabusTarget target, YearMonth currentMonth,
                                   Map<Integer, StationCode> cells, List<ConflictTuple> conflicts) {
        if (committed == null || !committed.hasTrainee(trainee.getId())) {
            return;
        }
        int ordinal = committed.ordinalOf(trainee.getId());
        for (int m = 0; m < committed.length(ordinal); m++) {
            StationCode past = ProblemInstance.committedPast(committed, trainee, m, currentMonth);
            if (past == null) {
                continue;
            }
            if (m >= target.getLengthMonths()) {
                conflicts.add(tuple(trainee, m, past,
                    "elapsed month lies beyond the revised " + target.getLengthMonths() + "-month program"));
            } else {
                cells.put(m, past);
            }
        }
    }

    private void checkAnchor(Assignment anchor, Trainee trainee, SyllabusTarget target, SyllabusRuleSet ruleSet,
                             ScheduleState committed, YearMonth currentMonth, Map<String, Assignment> anchorByCell,
                             Map<Integer, StationCode> cells, List<ConflictTuple> conflicts) {
        int m = anchor.getMonthIndex();
        StationCode station = anchor.getStation();
        if (m < 0 || m >= target.getLengthMonths()) {
            conflicts.add(tuple(trainee, m, station, "anchor outside the " + target.getLengthMonths() + "-month program"));
            return;
        }
        Assignment other = anchorByCell.putIfAbsent(anchor.getTraineeId() + "#" + m, anchor);
        if (other != null && other.getStation() != station) {
            conflicts.add(tuple(trainee, m, station, "also anchored to " + other.getStation().getDisplayName()));
            return;
        }
        if (!station.isOpenTo(trainee.getDepartment())) {
            conflicts.add(tuple(trainee, m, station, station.getDisplayName() + " is reserved for department "
                + station.getDepartment() + ", trainee is in department " + trainee.getDepartment()));
            return;
        }
        StationCode leave = target.getLeaveMonths().get(m);
        if (leave != null && leave != station) {
            conflicts.add(tuple(trainee, m, station, "month is reported as " + leave.getDisplayName()));
            return;
        }
        if (leave == null && (station.isLeave() || target.required(station) == 0)) {
            conflicts.add(tuple(trainee, m, station, station.getDisplayName() + " is not part of this trainee's syllabus"));
            return;
        }
        StationCode past = ProblemInstance.committedPast(committed, trainee, m, currentMonth);
        if (past != null && past != station) {
            conflicts.add(tuple(trainee, m, station, "elapsed month is committed as " + past.getDisplayName()));
            return;
        }
        Optional<StationRule> window = ruleSet.windowFor(station);
        if (window.isPresent() && !window.get().allowsCell(m, trainee.calendarMonth(m), target.getLengthMonths())) {
            conflicts.add(tuple(trainee, m, station, "anchor breaks " + window.get().describe()));
            return;
        }
        cells.put(m, station);
    }

    private void checkFixedCounts(Trainee trainee, SyllabusTarget target, Map<Integer, StationCode> cells,
                                  List<ConflictTuple> conflicts) {
        Map<StationCode, List<Integer>> byStation = new EnumMap<>(StationCode.class);
        cells.forEach((m, station) -> byStation.computeIfAbsent(station, s -> new ArrayList<>()).add(m));
        byStation.forEach((station, months) -> {
            int required = target.required(station);
            if (months.size() > required) {
                int m = months.get(months.size() - 1);
                conflicts.add(tuple(trainee, m, station, String.format("%d fixed months of %s, syllabus allows %d",
                    months.size(), station.getDisplayName(), required)));
            }
        });
    }

    private ConflictTuple tuple(Trainee trainee, int monthIndex, StationCode station, String rule) {
        YearMonth calendar = monthIndex >= 0 ? trainee.calendarMonth(monthIndex) : null;
        return new ConflictTuple(trainee.getId(), monthIndex, calendar, station, ReasonCode.ANCHOR_CONFLICT, rule);
    }
}
