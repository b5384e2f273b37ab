package com.example.nl2cmd.validation;

/** Identifies when a validator runs; stages execute in declaration order. */
public enum ValidationStage {
  /** Rejects input that cannot be resolved at all. */
  INPUT,
  /** Cleans input that would otherwise leak into generated commands. */
  SANITIZE,
  /** Enforces size limits on the cleaned input. */
  LIMIT
}
