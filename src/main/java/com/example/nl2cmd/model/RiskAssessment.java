package com.example.nl2cmd.model;

import lombok.Value;

import java.util.List;

@Value
public class RiskAssessment {
  RiskSeverity severity;
  List<RiskMatch> matches;

  public RiskAssessment(RiskSeverity severity, List<RiskMatch> matches) {
    this.severity = severity;
    this.matches = matches == null ? List.of() : List.copyOf(matches);
  }

  public boolean isRisky() {
    return !matches.isEmpty();
  }

  public static RiskAssessment safe() {
    return new RiskAssessment(null, List.of());
  }
}
