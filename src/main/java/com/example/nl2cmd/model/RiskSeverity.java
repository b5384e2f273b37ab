package com.example.nl2cmd.model;

/** Ordered from most to least severe. */
public enum RiskSeverity {
  CRITICAL,
  HIGH,
  MEDIUM,
  LOW;

  public boolean isMoreSevereThan(RiskSeverity other) {
    return other == null || this.ordinal() < other.ordinal();
  }
}
