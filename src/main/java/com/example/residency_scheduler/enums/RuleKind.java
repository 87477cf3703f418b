package com.example.residency_scheduler.enums;

public enum RuleKind {
  DURATION,
  CAPACITY,
  SEQUENCE,
  CALENDAR_WINDOW
}
