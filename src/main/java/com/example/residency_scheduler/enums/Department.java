package com.example.residency_scheduler.enums;

public enum Department {
  A,
  B
}
