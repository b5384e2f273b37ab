package com.example.nl2cmd.model;

import lombok.Value;

import java.util.List;

/**
 * Ordered segments of a (possibly compound) request. The chained command exists only when
 * every segment resolved, and the chain is only as confident as its weakest segment.
 */
@Value
public class CommandChain {

  public static final String SEPARATOR = " && ";

  String query;
  boolean multiCommand;
  List<CommandSegment> segments;
  String chainedCommand;

  public CommandChain(String query, boolean multiCommand, List<CommandSegment> segments) {
    this.query = query;
    this.multiCommand = multiCommand;
    this.segments = List.copyOf(segments);
    this.chainedCommand = chain(this.segments);
  }

  public boolean isSuccess() {
    return chainedCommand != null;
  }

  public double getConfidence() {
    if (!isSuccess()) {
      return 0.0;
    }
    return segments.stream()
        .mapToDouble(s -> s.getResolution().getConfidence())
        .min()
        .orElse(0.0);
  }

  /**
   * {@code null} on success; a failed compound request reports a partial chain failure, a failed
   * single request reports its own error.
   */
  public ResolutionError getError() {
    if (isSuccess()) {
      return null;
    }
    if (multiCommand) {
      return ResolutionError.PARTIAL_CHAIN_FAILURE;
    }
    return segments.isEmpty() ? ResolutionError.NO_RESOLUTION : segments.get(0).getResolution().getError();
  }

  public int getCommandCount() {
    return segments.size();
  }

  public boolean isFallbackUsed() {
    return segments.stream().anyMatch(s -> s.getResolution().isFallbackUsed());
  }

  private static String chain(List<CommandSegment> segments) {
    if (segments.isEmpty() || !segments.stream().allMatch(CommandSegment::isSuccess)) {
      return null;
    }
    StringBuilder sb = new StringBuilder();
    for (CommandSegment segment : segments) {
      if (sb.length() > 0) {
        sb.append(SEPARATOR);
      }
      sb.append(segment.getResolution().getCommand());
    }
    return sb.toString();
  }
}
