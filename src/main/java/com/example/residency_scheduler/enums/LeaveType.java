package com.example.residency_scheduler.enums;

import lombok.Getter;

@Getter
public enum LeaveType {
  MATERNITY(StationCode.MATERNITY_LEAVE),
  UNPAID(StationCode.UNPAID_LEAVE),
  SICK(StationCode.SICK_LEAVE);

  private final StationCode station;

  LeaveType(StationCode station) {
      this.station = station;
  }
}
