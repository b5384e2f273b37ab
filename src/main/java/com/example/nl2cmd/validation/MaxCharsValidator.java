package com.example.nl2cmd.validation;

import com.example.nl2cmd.config.Nl2CmdProperties;
import java.util.Objects;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Ensures the processed query does not exceed a maximum length. */
@Component
public class MaxCharsValidator implements Validator {

  private final int maxChars;

  @Autowired
  public MaxCharsValidator(Nl2CmdProperties properties) {
    this(properties.getInput().getMaxChars());
  }

  public MaxCharsValidator(int maxChars) {
    if (maxChars <= 0) {
      throw new IllegalArgumentException("maxChars must be positive");
    }
    this.maxChars = maxChars;
  }

  @Override
  public ValidationStage stage() {
    return ValidationStage.LIMIT;
  }

  @Override
  public void validate(ValidationContext context) {
    String processed = Objects.requireNonNullElse(context.getProcessedInput(), "");
    if (processed.length() <= maxChars) {
      context.setProcessedInput(processed);
      return;
    }

    String truncated = processed.substring(0, maxChars);
    context.setProcessedInput(truncated);
    context.addNotice(
        String.format("Query truncated to %d characters to satisfy platform limits.", maxChars));
  }
}
