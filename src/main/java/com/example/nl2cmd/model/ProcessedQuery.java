package com.example.nl2cmd.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Normalized, tokenized view of a raw query. Derived once per query and never mutated.
 */
@Value
@Builder
public class ProcessedQuery {
  String original;
  String normalized;
  @Singular List<String> keywords;
  @Singular Set<String> actions;
  @Singular Set<String> targets;
  @Singular Set<String> modifiers;
  @Singular Map<String, String> parameters;

  @JsonProperty("valid")
  public boolean isValid() {
    return !keywords.isEmpty();
  }

  public Optional<String> parameter(String name) {
    return Optional.ofNullable(parameters.get(name));
  }

  public static ProcessedQuery invalid(String original) {
    return ProcessedQuery.builder()
        .original(original)
        .normalized("")
        .build();
  }
}
