package com.example.residency_scheduler.enums;

public enum AuditEntryType {
  MANUAL_ASSIGNMENT,
  CAPACITY_OVERRIDE,
  LEAVE_REPORTED
}
