package com.example.residency_scheduler.schedule;

import com.example.residency_scheduler.catalog.StationRule;
import com.example.residency_scheduler.enums.StationCode;

import lombok.Value;

import java.time.YearMonth;
import java.util.List;
import java.util.stream.Collectors;

@Value
public class StationMonthLoad {
    YearMonth month;
    List<StationCode> pool;
    int occupancy;
    int minOccupancy;
    int maxOccupancy;

    public boolean withinBounds() {
        return occupancy >= minOccupancy && occupancy <= maxOccupancy;
    }

    public String poolName() {
        return pool.stream().map(StationCode::getDisplayName).collect(Collectors.joining("+"));
    }

    @Override
    public String toString() {
        return String.format("%s %s: %d in [%d,%s]", month, poolName(), occupancy, minOccupancy,
            maxOccupancy == StationRule.UNBOUNDED ? "inf" : String.valueOf(maxOccupancy));
    }
}
