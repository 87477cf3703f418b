package com.example.residency_scheduler.enums;

public enum Severity {
  CRITICAL,
  WARNING
}
