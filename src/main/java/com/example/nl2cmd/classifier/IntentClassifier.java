package com.example.nl2cmd.classifier;

import com.example.nl2cmd.model.OsFamily;

import java.util.List;
import java.util.Optional;

/**
 * Pluggable intent classifier consulted before the deterministic strategies. Implementations are
 * built once at startup and must be safe for concurrent use.
 */
public interface IntentClassifier {

    String name();

    /** Whether a model is loaded and predictions can be made. */
    boolean isAvailable();

    Prediction predict(String normalizedQuery);

    /** Command associated with an intent label for one OS family, if the label is known there. */
    Optional<String> labelToCommand(String label, OsFamily os);

    /** The {@code n} most likely labels, best first. */
    List<Prediction.LabelScore> topPredictions(String normalizedQuery, int n);
}
