package com.example.nl2cmd.model;

public record RiskMatch(String keyword, RiskSeverity severity, String explanation, String alternative) {}
