package com.example.nl2cmd.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MatchSource {
  FUZZY_MATCH,
  PROBLEM_DIAGNOSIS;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
