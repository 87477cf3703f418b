package com.example.residency_scheduler.enums;

import lombok.Getter;

/**
 * Why a set of constraints cannot be satisfied together. Lower priority value wins when a
 * report has to name a single primary reason.
 */
@Getter
public enum ReasonCode {
  ANCHOR_CONFLICT(0),
  CAPACITY_EXCEEDED(1),
  SYLLABUS_WINDOW_MISSED(2),
  SEQUENCE_VIOLATION(3),
  DURATION_UNMET(4),
  DIAGNOSIS_TIMEOUT(5);

  private final int priority;

  ReasonCode(int priority) {
      this.priority = priority;
  }
}
