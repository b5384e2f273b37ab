package com.example.nl2cmd.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BestMatch {
  String command;
  MatchSource source;
  String explanation;
  String intent;
  String matchedQuery;
  String category;
  String problem;
}
