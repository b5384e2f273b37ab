package com.example.nl2cmd.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Combined similarity and diagnosis result. {@code confidence} is on a 0-100 scale.
 */
@Value
@Builder
public class SmartSearchResult {
  @Singular List<SimilarityMatch> similarityMatches;
  @Singular List<DiagnosisResult> diagnoses;
  BestMatch bestMatch;
  int confidence;

  public boolean hasBestMatch() {
    return bestMatch != null;
  }
}
