package com.example.nl2cmd.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true, fluent = false)
public class StepLog {
  private String name;
  private String note;
  private Instant at;

  public static StepLog of(String name, String note) {
    return new StepLog(name, note, Instant.now());
  }
}
