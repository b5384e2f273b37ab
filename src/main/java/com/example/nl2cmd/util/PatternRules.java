package com.example.nl2cmd.util;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * The single matching loop over ordered {@link PatternRule} tables.
 */
public final class PatternRules {

  private PatternRules() {}

  /** Returns the extracted value of the first rule that matches, skipping blank extractions. */
  public static <T> Optional<T> firstMatch(List<PatternRule<T>> rules, String text) {
    if (text == null || rules == null) {
      return Optional.empty();
    }
    for (PatternRule<T> rule : rules) {
      Matcher m = rule.pattern().matcher(text);
      if (m.find()) {
        T value = rule.extractor().apply(m);
        if (value instanceof String s && s.isBlank()) {
          continue;
        }
        if (value != null) {
          return Optional.of(value);
        }
      }
    }
    return Optional.empty();
  }

  /** First key (in table order) whose rule list matches. */
  public static <K> Optional<K> firstMatchingKey(Map<K, ? extends List<? extends PatternRule<?>>> table, String text) {
    if (text == null || table == null) {
      return Optional.empty();
    }
    for (Map.Entry<K, ? extends List<? extends PatternRule<?>>> entry : table.entrySet()) {
      for (PatternRule<?> rule : entry.getValue()) {
        if (rule.pattern().matcher(text).find()) {
          return Optional.of(entry.getKey());
        }
      }
    }
    return Optional.empty();
  }

  /** Applies {@link #firstMatch} per family, keeping only families that produced a value. */
  public static Map<String, String> extractAll(Map<String, List<PatternRule<String>>> families, String text) {
    Map<String, String> out = new LinkedHashMap<>();
    families.forEach((name, rules) -> firstMatch(rules, text).ifPresent(v -> out.put(name, v)));
    return out;
  }
}
