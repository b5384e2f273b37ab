package com.example.nl2cmd.model;

public record DiagnosisResult(String command,
                              String explanation,
                              String category,
                              String problem,
                              int relevance) {}
