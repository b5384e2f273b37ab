package com.example.nl2cmd.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

/**
 * Troubleshooting category: keyword phrases that hint at the category and curated
 * problem/solution entries keyed by OS family ({@code windows}, {@code linux}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProblemCategory(String name, List<String> keywords, Map<String, List<ProblemEntry>> entries) {

  public ProblemCategory {
    keywords = keywords == null ? List.of() : List.copyOf(keywords);
    entries = entries == null ? Map.of() : Map.copyOf(entries);
  }

  public List<ProblemEntry> entriesFor(OsFamily os) {
    List<ProblemEntry> list = entries.get(os.key());
    return list == null ? List.of() : list;
  }
}
