package com.example.nl2cmd.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.Map;
import java.util.Objects;

/**
 * Command proposal produced by one resolution strategy.
 *
 * <p>A candidate without a command always carries a confidence of zero and is never usable,
 * whatever the producing strategy reported.
 */
@Getter
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CandidateResolution {

  private final ResolutionMethod method;
  private final String command;
  private final double confidence;
  private final boolean success;
  private final String intent;
  private final String explanation;
  private final String error;
  private final Map<String, Object> metadata;

  @Builder(toBuilder = true)
  private CandidateResolution(ResolutionMethod method,
                              String command,
                              double confidence,
                              boolean success,
                              String intent,
                              String explanation,
                              String error,
                              @Singular("meta") Map<String, Object> metadata) {
    this.method = Objects.requireNonNull(method, "method");
    boolean hasCommand = command != null && !command.isBlank();
    this.command = hasCommand ? command : null;
    this.confidence = hasCommand ? clamp(confidence) : 0.0;
    this.success = hasCommand && success;
    this.intent = intent;
    this.explanation = explanation;
    this.error = error;
    this.metadata = metadata;
  }

  public static CandidateResolution failed(ResolutionMethod method, String error) {
    return CandidateResolution.builder()
        .method(method)
        .success(false)
        .error(error)
        .build();
  }

  public boolean hasCommand() {
    return command != null;
  }

  private static double clamp(double value) {
    if (Double.isNaN(value)) {
      return 0.0;
    }
    return Math.max(0.0, Math.min(1.0, value));
  }
}
