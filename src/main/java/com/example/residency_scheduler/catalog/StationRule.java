package com.example.residency_scheduler.catalog;

import com.example.residency_scheduler.enums.RuleKind;
import com.example.residency_scheduler.enums.StationCode;
import com.example.residency_scheduler.enums.Track;

import lombok.Builder;
import lombok.Value;

import java.time.Month;
import java.time.YearMonth;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A single declarative station rule. The {@link RuleKind} tag decides which fields are
 * meaningful; {@link RuleEvaluator} is the one place that interprets them.
 */
@Value
@Builder
public class StationRule {
    RuleKind kind;

    // DURATION: subject station. SEQUENCE: dependent station. CALENDAR_WINDOW: windowed station.
    StationCode station;

    // DURATION
    Map<Track, Integer> months;
    boolean splittable;

    // CAPACITY
    List<StationCode> pool;
    int minOccupancy;
    int maxOccupancy;

    // SEQUENCE
    StationCode predecessor;
    boolean immediate;

    // CALENDAR_WINDOW
    Set<Month> allowedMonths;
    Integer earliestMonthIndex;
    Integer latestMonthIndex;
    Integer minMonthsFromEnd;
    Integer maxMonthsFromEnd;

    public static final int UNBOUNDED = Integer.MAX_VALUE;

    public static StationRule duration(StationCode station, int modelAMonths, int modelBMonths, boolean splittable) {
        Map<Track, Integer> months = new EnumMap<>(Track.class);
        months.put(Track.MODEL_A, modelAMonths);
        months.put(Track.MODEL_B, modelBMonths);
        return StationRule.builder()
            .kind(RuleKind.DURATION)
            .station(station)
            .months(Collections.unmodifiableMap(months))
            .splittable(splittable)
            .build();
    }

    public static StationRule capacity(int min, int max, StationCode... pool) {
        if (pool.length == 0) {
            throw new IllegalArgumentException("Capacity rule needs at least one station");
        }
        if (min < 0 || max < min) {
            throw new IllegalArgumentException(String.format("Invalid capacity bounds [%d,%d]", min, max));
        }
        return StationRule.builder()
            .kind(RuleKind.CAPACITY)
            .station(pool[0])
            .pool(List.of(pool))
            .minOccupancy(min)
            .maxOccupancy(max)
            .build();
    }

    public static StationRule sequence(StationCode predecessor, StationCode dependent, boolean immediate) {
        if (predecessor == dependent) {
            throw new IllegalArgumentException("A station cannot precede itself: " + dependent);
        }
        return StationRule.builder()
            .kind(RuleKind.SEQUENCE)
            .station(dependent)
            .predecessor(predecessor)
            .immediate(immediate)
            .build();
    }

    public static StationRule monthIndexWindow(StationCode station, Integer earliestMonthIndex, Integer latestMonthIndex, Month... allowed) {
        return StationRule.builder()
            .kind(RuleKind.CALENDAR_WINDOW)
            .station(station)
            .allowedMonths(toSet(allowed))
            .earliestMonthIndex(earliestMonthIndex)
            .latestMonthIndex(latestMonthIndex)
            .build();
    }

    public static StationRule endRelativeWindow(StationCode station, Integer minMonthsFromEnd, Integer maxMonthsFromEnd, Month... allowed) {
        return StationRule.builder()
            .kind(RuleKind.CALENDAR_WINDOW)
            .station(station)
            .allowedMonths(toSet(allowed))
            .minMonthsFromEnd(minMonthsFromEnd)
            .maxMonthsFromEnd(maxMonthsFromEnd)
            .build();
    }

    private static Set<Month> toSet(Month... allowed) {
        if (allowed.length == 0) {
            return Collections.unmodifiableSet(EnumSet.allOf(Month.class));
        }
        return Collections.unmodifiableSet(EnumSet.copyOf(Arrays.asList(allowed)));
    }

    public int monthsFor(Track track) {
        Integer value = months == null ? null : months.get(track);
        return value == null ? 0 : value;
    }

    /**
     * Calendar-window predicate for one cell of a trainee's timeline. "Months from end" counts
     * the final month of the program as 1.
     */
    public boolean allowsCell(int monthIndex, YearMonth calendarMonth, int programLength) {
        if (allowedMonths != null && !allowedMonths.contains(calendarMonth.getMonth())) {
            return false;
        }
        if (earliestMonthIndex != null && monthIndex < earliestMonthIndex) {
            return false;
        }
        if (latestMonthIndex != null && monthIndex > latestMonthIndex) {
            return false;
        }
        int monthsFromEnd = programLength - monthIndex;
        if (minMonthsFromEnd != null && monthsFromEnd < minMonthsFromEnd) {
            return false;
        }
        return maxMonthsFromEnd == null || monthsFromEnd <= maxMonthsFromEnd;
    }

    public boolean poolContains(StationCode candidate) {
        return candidate != null && pool != null && pool.contains(candidate);
    }

    public String describe() {
        switch (kind) {
            case DURATION:
                return String.format("%s for %s months", station.getDisplayName(), months);
            case CAPACITY:
                return String.format("occupancy of %s within [%d,%s]",
                    pool.stream().map(StationCode::getDisplayName).collect(Collectors.joining("+")),
                    minOccupancy, maxOccupancy == UNBOUNDED ? "inf" : String.valueOf(maxOccupancy));
            case SEQUENCE:
                return String.format("%s %s before %s", predecessor.getDisplayName(),
                    immediate ? "immediately" : "strictly", station.getDisplayName());
            case CALENDAR_WINDOW:
                StringBuilder text = new StringBuilder(station.getDisplayName()).append(" only in ").append(allowedMonths);
                if (earliestMonthIndex != null || latestMonthIndex != null) {
                    text.append(String.format(", month %s-%s of training",
                        earliestMonthIndex == null ? "0" : earliestMonthIndex,
                        latestMonthIndex == null ? "end" : latestMonthIndex));
                }
                if (minMonthsFromEnd != null || maxMonthsFromEnd != null) {
                    text.append(String.format(", %s-%s months before the end",
                        minMonthsFromEnd == null ? "1" : minMonthsFromEnd,
                        maxMonthsFromEnd == null ? "any" : maxMonthsFromEnd));
                }
                return text.toString();
            default:
                throw new IllegalStateException("Unknown rule kind " + kind);
        }
    }
}
