package com.example.nl2cmd.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SegmentResponse {
  int order;
  String query;
  boolean success;
  String command;
  String method;
  double confidence;
  String error;
}
