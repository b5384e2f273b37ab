package com.example.nl2cmd.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ResolutionMethod {
  ML,
  TEMPLATE,
  FUZZY,
  PROBLEM_DIAGNOSIS,
  RULE;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
