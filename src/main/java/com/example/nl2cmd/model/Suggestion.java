package com.example.nl2cmd.model;

/** Alternative command offered to the user, best first. */
public record Suggestion(String command, double confidence, ResolutionMethod method, String intent) {}
