package com.example.nl2cmd.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder(toBuilder = true)
public class CommandAnalysis {
  String query;
  String intent;
  String action;
  @Singular List<String> targets;
  @Singular Map<String, String> parameters;
  NestedOperation nestedOperation;

  public boolean isVersionControl() {
    return intent != null && intent.startsWith("git_");
  }
}
