package com.example.nl2cmd.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Carries the user supplied query through the validation stages. Validators can replace the
 * processed query and attach user facing notices.
 */
public class ValidationContext {

  private final String rawInput;
  private String processedInput;
  private final List<String> notices = new ArrayList<>();

  public ValidationContext(String rawInput) {
    this.rawInput = rawInput;
    this.processedInput = rawInput;
  }

  public String getRawInput() {
    return rawInput;
  }

  public String getProcessedInput() {
    return processedInput;
  }

  public void setProcessedInput(String processedInput) {
    this.processedInput = processedInput;
  }

  /** Adds a user visible notice emitted during validation. */
  public void addNotice(String notice) {
    notices.add(Objects.requireNonNull(notice, "notice"));
  }

  public List<String> getNotices() {
    return Collections.unmodifiableList(notices);
  }
}
