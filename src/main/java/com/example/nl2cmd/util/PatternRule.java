package com.example.nl2cmd.util;

import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Declarative rule pairing a compiled pattern with the extractor applied to its first match.
 */
public record PatternRule<T>(Pattern pattern, Function<Matcher, T> extractor) {

  public PatternRule {
    Objects.requireNonNull(pattern, "pattern");
    Objects.requireNonNull(extractor, "extractor");
  }

  /** Case-insensitive rule yielding capture group {@code group}. */
  public static PatternRule<String> group(String regex, int group) {
    return new PatternRule<>(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), m -> m.group(group));
  }

  /** Case-insensitive rule yielding capture group 1. */
  public static PatternRule<String> group1(String regex) {
    return group(regex, 1);
  }

  /** Case-insensitive rule yielding a constant value when the pattern is found. */
  public static <T> PatternRule<T> constant(String regex, T value) {
    return new PatternRule<>(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), m -> value);
  }
}
