package com.example.nl2cmd.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** One curated query to command pair from the training dataset. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CommandRecord(String query, String intent, String command) {

  public boolean isComplete() {
    return query != null && !query.isBlank() && command != null && !command.isBlank();
  }
}
