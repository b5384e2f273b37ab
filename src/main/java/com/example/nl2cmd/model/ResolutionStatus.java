package com.example.nl2cmd.model;

public enum ResolutionStatus {
  RESOLVED,
  FALLBACK,
  UNRESOLVED
}
