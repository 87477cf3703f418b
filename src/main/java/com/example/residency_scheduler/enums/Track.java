package com.example.residency_scheduler.enums;

import lombok.Getter;

@Getter
public enum Track {
  MODEL_A(72),
  MODEL_B(66);

  private final int baseMonths;

  Track(int baseMonths) {
      this.baseMonths = baseMonths;
  }
}
