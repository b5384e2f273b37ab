package com.example.nl2cmd.validation;

import java.util.Objects;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Replaces line breaks and other control characters with spaces so that a query cannot smuggle
 * extra lines into a generated command.
 */
@Component
public class ControlCharacterValidator implements Validator {

  private static final Pattern CONTROL = Pattern.compile("\\p{Cntrl}+");

  @Override
  public ValidationStage stage() {
    return ValidationStage.SANITIZE;
  }

  @Override
  public void validate(ValidationContext context) {
    String processed = Objects.requireNonNullElse(context.getProcessedInput(), "");
    String cleaned = CONTROL.matcher(processed).replaceAll(" ").strip();
    if (cleaned.equals(processed)) {
      return;
    }
    if (cleaned.isEmpty()) {
      throw new ValidationException("Query must contain printable characters.");
    }
    context.setProcessedInput(cleaned);
    context.addNotice("Control characters were replaced with spaces.");
  }
}
