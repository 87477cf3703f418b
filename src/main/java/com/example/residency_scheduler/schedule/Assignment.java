package com.example.residency_scheduler.schedule;

import com.example.residency_scheduler.enums.StationCode;

import lombok.Value;

/**
 * One (trainee, month index) cell set to a station. Used for anchors and for proposed single-cell
 * moves.
 */
@Value
public class Assignment implements Comparable<Assignment> {
    String traineeId;
    int monthIndex;
    StationCode station;

    @Override
    public int compareTo(Assignment other) {
        int byTrainee = traineeId.compareTo(other.traineeId);
        if (byTrainee != 0) {
            return byTrainee;
        }
        int byMonth = Integer.compare(monthIndex, other.monthIndex);
        return byMonth != 0 ? byMonth : station.compareTo(other.station);
    }

    @Override
    public String toString() {
        return traineeId + "[" + monthIndex + "]=" + station;
    }
}
