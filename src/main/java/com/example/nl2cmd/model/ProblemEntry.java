package com.example.nl2cmd.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProblemEntry(String problem, String solution, String explanation) {}
