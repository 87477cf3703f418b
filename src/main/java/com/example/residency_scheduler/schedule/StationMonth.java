package com.example.residency_scheduler.schedule;

import com.example.residency_scheduler.enums.StationCode;

import lombok.Value;

import java.time.YearMonth;

@Value
public class StationMonth {
    StationCode station;
    YearMonth month;

    @Override
    public String toString() {
        return station.getDisplayName() + "@" + month;
    }
}
