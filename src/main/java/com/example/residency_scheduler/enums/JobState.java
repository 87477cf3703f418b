package com.example.residency_scheduler.enums;

public enum JobState {
  RUNNING,
  DONE,
  FAILED,
  CANCELLED
}
