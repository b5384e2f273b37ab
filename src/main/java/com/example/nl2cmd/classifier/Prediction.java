package com.example.nl2cmd.classifier;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/** Best label plus the confidence assigned to every known label. */
public record Prediction(String label, Map<String, Double> confidencePerLabel) {

    public Prediction {
        confidencePerLabel = confidencePerLabel == null ? Map.of() : Map.copyOf(confidencePerLabel);
    }

    public static Prediction none() {
        return new Prediction(null, Map.of());
    }

    public double confidence() {
        if (label == null) {
            return 0.0;
        }
        return confidencePerLabel.getOrDefault(label, 0.0);
    }

    public List<LabelScore> ranked(int n) {
        return confidencePerLabel.entrySet().stream()
                .map(e -> new LabelScore(e.getKey(), e.getValue()))
                .sorted(Comparator.comparingDouble(LabelScore::confidence).reversed()
                        .thenComparing(LabelScore::label))
                .limit(Math.max(0, n))
                .toList();
    }

    public record LabelScore(String label, double confidence) {}
}
