package com.example.residency_scheduler.schedule;

import com.example.residency_scheduler.catalog.StationRule;
import com.example.residency_scheduler.catalog.SyllabusRuleSet;
import com.example.residency_scheduler.enums.StationCode;

import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Occupancy counters per (station, calendar month), kept current by every cell write of the
 * owning {@link ScheduleState}. Reads are constant time.
 */
public final class CapacityTracker {
    private final YearMonth horizonStart;
    private final int horizonMonths;
    // [station id][months since horizon start]
    private final int[][] counts;

    CapacityTracker(YearMonth horizonStart, int horizonMonths) {
        this.horizonStart = horizonStart;
        this.horizonMonths = horizonMonths;
        this.counts = new int[StationCode.count()][horizonMonths];
    }

    private CapacityTracker(CapacityTracker source) {
        this.horizonStart = source.horizonStart;
        this.horizonMonths = source.horizonMonths;
        this.counts = new int[source.counts.length][];
        for (int s = 0; s < source.counts.length; s++) {
            this.counts[s] = source.counts[s].clone();
        }
    }

    CapacityTracker copy() {
        return new CapacityTracker(this);
    }

    void increment(int stationId, YearMonth month) {
        counts[stationId][offset(month)]++;
    }

    void decrement(int stationId, YearMonth month) {
        int offset = offset(month);
        if (counts[stationId][offset] == 0) {
            throw new IllegalStateException("Occupancy underflow for " + StationCode.fromId(stationId) + " in " + month);
        }
        counts[stationId][offset]--;
    }

    private int offset(YearMonth month) {
        int offset = (int) horizonStart.until(month, ChronoUnit.MONTHS);
        if (offset < 0 || offset >= horizonMonths) {
            throw new IllegalArgumentException(month + " is outside the schedule horizon starting " + horizonStart);
        }
        return offset;
    }

    public boolean inHorizon(YearMonth month) {
        int offset = (int) horizonStart.until(month, ChronoUnit.MONTHS);
        return offset >= 0 && offset < horizonMonths;
    }

    public int occupancy(StationCode station, YearMonth month) {
        if (!inHorizon(month)) {
            return 0;
        }
        return counts[station.id()][offset(month)];
    }

    public int occupancy(Collection<StationCode> pool, YearMonth month) {
        int total = 0;
        for (StationCode station : pool) {
            total += occupancy(station, month);
        }
        return total;
    }

    public YearMonth getHorizonStart() {
        return horizonStart;
    }

    public int getHorizonMonths() {
        return horizonMonths;
    }

    /**
     * One load row per capacity pool and per uncapped station with anyone on it, for every month
     * of the horizon. Minimum overrides keyed by the pool's first station are applied.
     */
    public CapacitySummary summary(SyllabusRuleSet ruleSet, Map<StationMonth, Integer> minimumOverrides) {
        Set<StationCode> capped = EnumSet.noneOf(StationCode.class);
        for (StationRule rule : ruleSet.getCapacityRules()) {
            capped.addAll(rule.getPool());
        }
        List<StationMonthLoad> loads = new ArrayList<>();
        for (int offset = 0; offset < horizonMonths; offset++) {
            YearMonth month = horizonStart.plusMonths(offset);
            for (StationRule rule : ruleSet.getCapacityRules()) {
                int minimum = minimumOverrides.getOrDefault(new StationMonth(rule.getStation(), month), rule.getMinOccupancy());
                loads.add(new StationMonthLoad(month, rule.getPool(), occupancy(rule.getPool(), month),
                    minimum, rule.getMaxOccupancy()));
            }
            for (StationCode station : StationCode.values()) {
                int occupied = counts[station.id()][offset];
                if (!capped.contains(station) && occupied > 0) {
                    loads.add(new StationMonthLoad(month, List.of(station), occupied, 0, StationRule.UNBOUNDED));
                }
            }
        }
        return new CapacitySummary(horizonStart, horizonMonths, loads);
    }
}
