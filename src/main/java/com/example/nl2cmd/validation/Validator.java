package com.example.nl2cmd.validation;

/** Contract for validation steps applied to a raw query before resolution. */
public interface Validator {

  /** The stage in which the validator should be executed. */
  ValidationStage stage();

  /** Applies the validation logic and optionally mutates the provided context. */
  void validate(ValidationContext context);
}
