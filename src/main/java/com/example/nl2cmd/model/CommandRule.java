package com.example.nl2cmd.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/** Exact rule: every keyword must occur as a whole word for the command to apply. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CommandRule(List<String> keywords, String command) {

  public CommandRule {
    keywords = keywords == null ? List.of() : List.copyOf(keywords);
  }
}
