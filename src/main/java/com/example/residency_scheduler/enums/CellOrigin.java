package com.example.residency_scheduler.enums;

/** Why a cell is fixed before search, or FREE when the solver decides it. */
public enum CellOrigin {
  FREE,
  PAST,
  LEAVE,
  ANCHOR
}
