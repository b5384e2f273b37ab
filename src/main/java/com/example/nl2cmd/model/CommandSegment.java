package com.example.nl2cmd.model;

import lombok.Value;

@Value
public class CommandSegment {
  int order;
  String sourceText;
  ArbitrationDecision resolution;

  public CommandSegment(int order, String sourceText, ArbitrationDecision resolution) {
    if (order < 1) {
      throw new IllegalArgumentException("segment order starts at 1");
    }
    this.order = order;
    this.sourceText = sourceText;
    this.resolution = resolution;
  }

  public boolean isSuccess() {
    return resolution != null && resolution.isSuccess();
  }
}
