package com.example.nl2cmd.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class NotBlankInputValidatorTest {

  private final NotBlankInputValidator validator = new NotBlankInputValidator();

  @Test
  void shouldRejectBlankInput() {
    ValidationContext context = new ValidationContext("   ");

    assertThatThrownBy(() -> validator.validate(context))
        .isInstanceOf(ValidationException.class)
        .hasMessage("Query must not be blank.");
  }

  @Test
  void shouldRejectNullInput() {
    assertThatThrownBy(() -> validator.validate(new ValidationContext(null)))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void shouldStripSurroundingWhitespace() {
    ValidationContext context = new ValidationContext("  list files ");

    validator.validate(context);

    assertThat(context.getProcessedInput()).isEqualTo("list files");
    assertThat(context.getRawInput()).isEqualTo("  list files ");
  }
}
