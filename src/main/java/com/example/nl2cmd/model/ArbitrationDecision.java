package com.example.nl2cmd.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of arbitrating one query: the chosen candidate, the rejected candidates kept as
 * fallback material and the audit trail of the cascade stages.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ArbitrationDecision {
  String query;
  CandidateResolution chosen;
  @Singular("rejectedCandidate") List<CandidateResolution> rejected;
  boolean fallbackUsed;
  String warning;
  ResolutionError error;
  String errorMessage;
  @Singular List<StepLog> steps;

  public boolean isSuccess() {
    return chosen != null && chosen.hasCommand();
  }

  @JsonIgnore
  public String getCommand() {
    return isSuccess() ? chosen.getCommand() : null;
  }

  @JsonIgnore
  public ResolutionMethod getMethod() {
    return chosen == null ? null : chosen.getMethod();
  }

  public double getConfidence() {
    return isSuccess() ? chosen.getConfidence() : 0.0;
  }

  public ResolutionStatus getStatus() {
    if (!isSuccess()) {
      return ResolutionStatus.UNRESOLVED;
    }
    return fallbackUsed ? ResolutionStatus.FALLBACK : ResolutionStatus.RESOLVED;
  }
}
