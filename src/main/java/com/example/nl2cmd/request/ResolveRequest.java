package com.example.nl2cmd.request;

import jakarta.validation.constraints.NotBlank;
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
public class ResolveRequest {
  @NotBlank private String query;

  /** {@code windows} or {@code linux}; the configured family applies when absent. */
  private String os;

  /** Restricts the cascade to {@code ml}, {@code fuzzy} or {@code rule}. */
  private String method;
}
