package com.example.nl2cmd.response;

import com.example.nl2cmd.model.ResolutionStatus;
import com.example.nl2cmd.model.RiskAssessment;
import com.example.nl2cmd.model.StepLog;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true, fluent = false)
public class ResolveResponse {
  private String query;
  private String os;
  private ResolutionStatus status;

  private String command;
  private double confidence;
  private String method;
  private String intent;
  private String explanation;
  private boolean fallback;
  private String warning;

  private boolean multiCommand;
  private List<SegmentResponse> segments;
  private RiskAssessment risk;

  private List<StepLog> steps;
  private List<String> notices;
  private List<String> errors;
}
