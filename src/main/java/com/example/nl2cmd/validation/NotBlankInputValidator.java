package com.example.nl2cmd.validation;

import org.springframework.stereotype.Component;

/** Validates that the query is not null or blank. */
@Component
public class NotBlankInputValidator implements Validator {

  @Override
  public ValidationStage stage() {
    return ValidationStage.INPUT;
  }

  @Override
  public void validate(ValidationContext context) {
    String rawInput = context.getRawInput();
    if (rawInput == null || rawInput.trim().isEmpty()) {
      throw new ValidationException("Query must not be blank.");
    }
    context.setProcessedInput(rawInput.strip());
  }
}
