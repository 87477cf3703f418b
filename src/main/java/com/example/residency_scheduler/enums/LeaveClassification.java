package com.example.residency_scheduler.enums;

public enum LeaveClassification {
  /** Deducted from the rotation allotment, up to the per-trainee cap. */
  WITHIN_SYLLABUS,
  /** Pushes the completion date out by the full duration. */
  EXTENSION
}
