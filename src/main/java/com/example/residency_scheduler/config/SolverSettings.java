package com.example.residency_scheduler.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder(toBuilder = true)
public class SolverSettings {
    Duration timeBudget;
    Duration diagnosisBudget;
    int searchWorkers;
    int randomSeed;
    boolean logSearchProgress;
    Duration lockWait;
    int coverageLookaheadMonths;
    Duration jobRetention;
    int finishedJobLimit;
    boolean staffingFloors;

    public static SolverSettings defaults() {
        return SolverSettings.builder()
            .timeBudget(Duration.ofSeconds(10))
            .diagnosisBudget(Duration.ofSeconds(2))
            .searchWorkers(4)
            .randomSeed(42)
            .logSearchProgress(false)
            .lockWait(Duration.ofSeconds(30))
            .coverageLookaheadMonths(12)
            .jobRetention(Duration.ofHours(1))
            .finishedJobLimit(100)
            .staffingFloors(false)
            .build();
    }
}
