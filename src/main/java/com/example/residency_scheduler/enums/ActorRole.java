package com.example.residency_scheduler.enums;

public enum ActorRole {
  PROGRAM_DIRECTOR,
  COORDINATOR,
  RESIDENT;

  public boolean canReportLeave() {
      return this == PROGRAM_DIRECTOR || this == COORDINATOR;
  }

  public boolean canForceOverride() {
      return this == PROGRAM_DIRECTOR;
  }
}
