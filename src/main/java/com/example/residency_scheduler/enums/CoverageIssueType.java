package com.example.residency_scheduler.enums;

public enum CoverageIssueType {
  UNDERSTAFFED,
  OVERSTAFFED,
  NO_COVERAGE
}
