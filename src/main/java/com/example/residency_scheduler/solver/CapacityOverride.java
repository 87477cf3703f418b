package com.example.residency_scheduler.solver;

import com.example.residency_scheduler.audit.Actor;
import com.example.residency_scheduler.enums.StationCode;
import com.example.residency_scheduler.schedule.StationMonth;

import lombok.Value;

import java.time.YearMonth;

/**
 * A forced relaxation of one capacity minimum for one calendar month. The station names the
 * capacity pool by its first station.
 */
@Value
public class CapacityOverride {
    StationCode station;
    YearMonth month;
    int relaxedMinimum;
    String justification;
    Actor actor;

    public StationMonth key() {
        return new StationMonth(station, month);
    }
}
