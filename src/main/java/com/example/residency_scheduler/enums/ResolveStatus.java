package com.example.residency_scheduler.enums;

public enum ResolveStatus {
  VALID,
  INFEASIBLE,
  TIMEOUT
}
