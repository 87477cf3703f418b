package com.example.residency_scheduler.leave;

import com.example.residency_scheduler.enums.StationCode;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Per-trainee duration targets after leave has been applied. This is what the solver fits months
 * into; it never assigns stations itself.
 */
@Value
@Builder(toBuilder = true)
public class SyllabusTarget {
    String traineeId;
    int lengthMonths;
    // non-leave stations only, zero entries omitted
    Map<StationCode, Integer> requiredMonths;
    // month index -> leave station, pinned before search
    Map<Integer, StationCode> leaveMonths;
    int rotationAllotment;
    int withinSyllabusDeducted;
    int extensionMonths;

    public int required(StationCode station) {
        if (station.isLeave()) {
            int count = 0;
            for (StationCode leave : leaveMonths.values()) {
                if (leave == station) {
                    count++;
                }
            }
            return count;
        }
        return requiredMonths.getOrDefault(station, 0);
    }

    public boolean isLeaveMonth(int monthIndex) {
        return leaveMonths.containsKey(monthIndex);
    }

    public int totalRequired() {
        int total = leaveMonths.size();
        for (int months : requiredMonths.values()) {
            total += months;
        }
        return total;
    }
}
