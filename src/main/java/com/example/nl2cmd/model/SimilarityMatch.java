package com.example.nl2cmd.model;

public record SimilarityMatch(String matchedKey, int score, IndexedCommand info) {}
