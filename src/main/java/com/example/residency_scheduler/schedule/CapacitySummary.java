package com.example.residency_scheduler.schedule;

import com.example.residency_scheduler.enums.StationCode;

import lombok.Value;

import java.time.YearMonth;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/** Per-station, per-month headcount handed back with every resolve outcome. */
@Value
public class CapacitySummary {
    YearMonth horizonStart;
    int horizonMonths;
    List<StationMonthLoad> loads;

    public Optional<StationMonthLoad> load(StationCode station, YearMonth month) {
        return loads.stream()
            .filter(load -> load.getMonth().equals(month) && load.getPool().contains(station))
            .findFirst();
    }

    public List<StationMonthLoad> outOfBounds() {
        return loads.stream().filter(load -> !load.withinBounds()).collect(Collectors.toList());
    }
}
