package com.example.nl2cmd.model;

/** Terminal error kinds surfaced to callers. */
public enum ResolutionError {
  /** Empty or stop-word-only query; no strategy was attempted. */
  INVALID_INPUT,
  /** Every stage was exhausted without a usable candidate. */
  NO_RESOLUTION,
  /** One or more segments of a multi-command request did not resolve. */
  PARTIAL_CHAIN_FAILURE
}
