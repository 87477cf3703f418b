package com.example.residency_scheduler.schedule;

import com.example.residency_scheduler.catalog.SyllabusRuleSet;
import com.example.residency_scheduler.entities.Trainee;
import com.example.residency_scheduler.enums.StationCode;
import com.example.residency_scheduler.leave.SyllabusTarget;

import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Dense assignment matrix addressed by (trainee ordinal, month index). Ordinals follow trainee id
 * order; each row is as long as that trainee's target length. Cells hold station ids, or
 * {@link StationCode#UNASSIGNED}.
 * <p>
 * Not thread-safe. A committed instance is never written again; resolves work on a {@link #copy()}.
 */
public final class ScheduleState {
    private final String programId;
    private final String ruleSetVersion;
    private final List<Trainee> trainees;
    private final Map<String, Integer> ordinals;
    private final SyllabusTarget[] targets;
    private final int[][] cells;
    private final CapacityTracker capacity;
    private List<Assignment> anchors = List.of();
    private Map<StationMonth, Integer> minimumOverrides = Map.of();

    public ScheduleState(String programId, String ruleSetVersion, Collection<Trainee> roster,
                         Map<String, SyllabusTarget> targetsById) {
        this.programId = programId;
        this.ruleSetVersion = ruleSetVersion;
        List<Trainee> sorted = new ArrayList<>(roster);
        sorted.sort(Comparator.comparing(Trainee::getId));
        this.trainees = Collections.unmodifiableList(sorted);
        this.ordinals = new HashMap<>();
        this.targets = new SyllabusTarget[sorted.size()];
        this.cells = new int[sorted.size()][];

        YearMonth horizonStart = null;
        YearMonth horizonEnd = null;
        for (int t = 0; t < sorted.size(); t++) {
            Trainee trainee = sorted.get(t);
            if (ordinals.put(trainee.getId(), t) != null) {
                throw new IllegalArgumentException("Duplicate trainee on roster: " + trainee.getId());
            }
            SyllabusTarget target = targetsById.get(trainee.getId());
            if (target == null) {
                throw new IllegalArgumentException("No syllabus target for trainee " + trainee.getId());
            }
            targets[t] = target;
            cells[t] = new int[target.getLengthMonths()];
            Arrays.fill(cells[t], StationCode.UNASSIGNED);

            YearMonth first = trainee.startMonth();
            YearMonth last = trainee.calendarMonth(target.getLengthMonths() - 1);
            horizonStart = horizonStart == null || first.isBefore(horizonStart) ? first : horizonStart;
            horizonEnd = horizonEnd == null || last.isAfter(horizonEnd) ? last : horizonEnd;
        }
        if (horizonStart == null) {
            this.capacity = new CapacityTracker(YearMonth.of(2000, 1), 0);
        } else {
            this.capacity = new CapacityTracker(horizonStart,
                (int) horizonStart.until(horizonEnd, ChronoUnit.MONTHS) + 1);
        }
    }

    private ScheduleState(ScheduleState source) {
        this.programId = source.programId;
        this.ruleSetVersion = source.ruleSetVersion;
        this.trainees = source.trainees;
        this.ordinals = source.ordinals;
        this.targets = source.targets.clone();
        this.cells = new int[source.cells.length][];
        for (int t = 0; t < source.cells.length; t++) {
            this.cells[t] = source.cells[t].clone();
        }
        this.capacity = source.capacity.copy();
        this.anchors = source.anchors;
        this.minimumOverrides = source.minimumOverrides;
    }

    public ScheduleState copy() {
        return new ScheduleState(this);
    }

    public String getProgramId() {
        return programId;
    }

    public String getRuleSetVersion() {
        return ruleSetVersion;
    }

    public List<Trainee> getTrainees() {
        return trainees;
    }

    public int traineeCount() {
        return trainees.size();
    }

    public Trainee trainee(int ordinal) {
        return trainees.get(ordinal);
    }

    public boolean hasTrainee(String traineeId) {
        return ordinals.containsKey(traineeId);
    }

    public int ordinalOf(String traineeId) {
        Integer ordinal = ordinals.get(traineeId);
        if (ordinal == null) {
            throw new IllegalArgumentException("Trainee not on this schedule: " + traineeId);
        }
        return ordinal;
    }

    public SyllabusTarget target(int ordinal) {
        return targets[ordinal];
    }

    public Map<String, SyllabusTarget> targetsById() {
        Map<String, SyllabusTarget> byId = new LinkedHashMap<>();
        for (int t = 0; t < targets.length; t++) {
            byId.put(trainees.get(t).getId(), targets[t]);
        }
        return byId;
    }

    public int length(int ordinal) {
        return cells[ordinal].length;
    }

    public YearMonth calendarMonth(int ordinal, int monthIndex) {
        return trainees.get(ordinal).calendarMonth(monthIndex);
    }

    public int stationId(int ordinal, int monthIndex) {
        return cells[ordinal][monthIndex];
    }

    public StationCode station(int ordinal, int monthIndex) {
        return StationCode.fromId(cells[ordinal][monthIndex]);
    }

    public StationCode station(String traineeId, int monthIndex) {
        return station(ordinalOf(traineeId), monthIndex);
    }

    /** Writes one cell and keeps the capacity counters in step. A null station clears the cell. */
    public void assign(int ordinal, int monthIndex, StationCode station) {
        int previous = cells[ordinal][monthIndex];
        int next = station == null ? StationCode.UNASSIGNED : station.id();
        if (previous == next) {
            return;
        }
        YearMonth month = calendarMonth(ordinal, monthIndex);
        if (previous != StationCode.UNASSIGNED) {
            capacity.decrement(previous, month);
        }
        if (next != StationCode.UNASSIGNED) {
            capacity.increment(next, month);
        }
        cells[ordinal][monthIndex] = next;
    }

    public void assign(Assignment assignment) {
        assign(ordinalOf(assignment.getTraineeId()), assignment.getMonthIndex(), assignment.getStation());
    }

    public int[] row(int ordinal) {
        return cells[ordinal].clone();
    }

    public int count(int ordinal, StationCode station) {
        int count = 0;
        for (int cell : cells[ordinal]) {
            if (cell == station.id()) {
                count++;
            }
        }
        return count;
    }

    public int unassignedCount() {
        int count = 0;
        for (int[] row : cells) {
            for (int cell : row) {
                if (cell == StationCode.UNASSIGNED) {
                    count++;
                }
            }
        }
        return count;
    }

    public boolean isComplete() {
        return unassignedCount() == 0;
    }

    public CapacityTracker getCapacity() {
        return capacity;
    }

    public int occupancy(StationCode station, YearMonth month) {
        return capacity.occupancy(station, month);
    }

    public int occupancy(Collection<StationCode> pool, YearMonth month) {
        return capacity.occupancy(pool, month);
    }

    public CapacitySummary capacitySummary(SyllabusRuleSet ruleSet) {
        return capacity.summary(ruleSet, minimumOverrides);
    }

    public List<Assignment> getAnchors() {
        return anchors;
    }

    public void setAnchors(Collection<Assignment> anchors) {
        List<Assignment> sorted = new ArrayList<>(anchors);
        Collections.sort(sorted);
        this.anchors = Collections.unmodifiableList(sorted);
    }

    public Map<StationMonth, Integer> getMinimumOverrides() {
        return minimumOverrides;
    }

    public void setMinimumOverrides(Map<StationMonth, Integer> minimumOverrides) {
        this.minimumOverrides = Collections.unmodifiableMap(new HashMap<>(minimumOverrides));
    }

    /** The minimum for a capacity pool in one month, after any applied override. */
    public int minimumFor(StationCode poolStation, YearMonth month, int ruleMinimum) {
        return minimumOverrides.getOrDefault(new StationMonth(poolStation, month), ruleMinimum);
    }

    /** Matrix equality: same roster order, same rows. Anchors and overrides are not compared. */
    public boolean sameAssignments(ScheduleState other) {
        if (other == null || !trainees.stream().map(Trainee::getId).collect(Collectors.toList())
                .equals(other.trainees.stream().map(Trainee::getId).collect(Collectors.toList()))) {
            return false;
        }
        for (int t = 0; t < cells.length; t++) {
            if (!Arrays.equals(cells[t], other.cells[t])) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return String.format("ScheduleState[%s, rules %s, %d trainees, %d unassigned]",
            programId, ruleSetVersion, trainees.size(), unassignedCount());
    }
}
