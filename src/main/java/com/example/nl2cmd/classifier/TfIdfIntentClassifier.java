package com.example.nl2cmd.classifier;

import com.example.nl2cmd.dao.CommandDatasetDao;
import com.example.nl2cmd.model.CommandRecord;
import com.example.nl2cmd.model.OsFamily;
import com.example.nl2cmd.normalizer.QueryNormalizer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Nearest-centroid classifier over TF-IDF vectors of the curated dataset queries.
 *
 * <p>Each intent is represented by the normalized mean of its training vectors. The confidence of a
 * label is the cosine similarity between the query vector and the label centroid, so it lies in
 * {@code [0, 1]}.
 */
@Slf4j
public class TfIdfIntentClassifier implements IntentClassifier {

    private static final String NAME = "tfidf";

    private final Map<String, Double> idf;
    private final Map<String, Map<String, Double>> centroids;
    private final Map<OsFamily, Map<String, String>> commandsByLabel;

    public TfIdfIntentClassifier(CommandDatasetDao datasetDao) {
        List<CommandRecord> training = new ArrayList<>();
        Map<OsFamily, Map<String, String>> commands = new EnumMap<>(OsFamily.class);
        for (OsFamily os : OsFamily.values()) {
            Map<String, String> byLabel = new LinkedHashMap<>();
            for (CommandRecord record : datasetDao.findByOs(os)) {
                if (record.intent() == null || record.intent().isBlank()) {
                    continue;
                }
                training.add(record);
                byLabel.putIfAbsent(record.intent(), record.command());
            }
            commands.put(os, Collections.unmodifiableMap(byLabel));
        }
        this.commandsByLabel = Collections.unmodifiableMap(commands);
        this.idf = Collections.unmodifiableMap(computeIdf(training));
        this.centroids = Collections.unmodifiableMap(computeCentroids(training, idf));
        log.info("TF-IDF intent classifier trained: labels={}, vocabulary={}", centroids.size(), idf.size());
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return !centroids.isEmpty();
    }

    @Override
    public Prediction predict(String normalizedQuery) {
        Map<String, Double> vector = vectorize(tokens(normalizedQuery), idf);
        if (vector.isEmpty() || centroids.isEmpty()) {
            return Prediction.none();
        }

        Map<String, Double> scores = new LinkedHashMap<>();
        String best = null;
        double bestScore = -1.0;
        for (Map.Entry<String, Map<String, Double>> entry : centroids.entrySet()) {
            double score = dot(vector, entry.getValue());
            scores.put(entry.getKey(), score);
            if (score > bestScore) {
                bestScore = score;
                best = entry.getKey();
            }
        }
        return new Prediction(bestScore > 0 ? best : null, scores);
    }

    @Override
    public Optional<String> labelToCommand(String label, OsFamily os) {
        if (label == null || os == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(commandsByLabel.getOrDefault(os, Map.of()).get(label));
    }

    @Override
    public List<Prediction.LabelScore> topPredictions(String normalizedQuery, int n) {
        return predict(normalizedQuery).ranked(n).stream()
                .filter(s -> s.confidence() > 0)
                .toList();
    }

    private static List<String> tokens(String text) {
        String normalized = QueryNormalizer.normalizeText(text);
        if (normalized.isEmpty()) {
            return List.of();
        }
        return List.of(normalized.split(" "));
    }

    private static Map<String, Double> computeIdf(List<CommandRecord> training) {
        Map<String, Integer> documentFrequency = new HashMap<>();
        for (CommandRecord record : training) {
            for (String token : new HashSet<>(tokens(record.query()))) {
                documentFrequency.merge(token, 1, Integer::sum);
            }
        }
        int documents = training.size();
        Map<String, Double> out = new HashMap<>();
        // Smoothed idf keeps terms present in every document above zero.
        documentFrequency.forEach((token, df) ->
                out.put(token, Math.log((1.0 + documents) / (1.0 + df)) + 1.0));
        return out;
    }

    private static Map<String, Map<String, Double>> computeCentroids(List<CommandRecord> training,
                                                                     Map<String, Double> idf) {
        Map<String, Map<String, Double>> sums = new LinkedHashMap<>();
        Set<String> seenQueries = new HashSet<>();
        for (CommandRecord record : training) {
            // Records shared by several OS families are counted once.
            if (!seenQueries.add(record.intent() + '\u0000' + record.query())) {
                continue;
            }
            Map<String, Double> vector = vectorize(tokens(record.query()), idf);
            Map<String, Double> sum = sums.computeIfAbsent(record.intent(), k -> new HashMap<>());
            vector.forEach((token, weight) -> sum.merge(token, weight, Double::sum));
        }
        Map<String, Map<String, Double>> out = new LinkedHashMap<>();
        sums.forEach((label, sum) -> {
            Map<String, Double> normalized = normalize(sum);
            if (!normalized.isEmpty()) {
                out.put(label, Collections.unmodifiableMap(normalized));
            }
        });
        return out;
    }

    private static Map<String, Double> vectorize(List<String> tokens, Map<String, Double> idf) {
        Map<String, Double> tf = new HashMap<>();
        for (String token : tokens) {
            if (idf.containsKey(token)) {
                tf.merge(token, 1.0, Double::sum);
            }
        }
        Map<String, Double> weighted = new HashMap<>();
        tf.forEach((token, count) -> weighted.put(token, count * idf.get(token)));
        return normalize(weighted);
    }

    private static Map<String, Double> normalize(Map<String, Double> vector) {
        double norm = 0.0;
        for (double v : vector.values()) {
            norm += v * v;
        }
        if (norm == 0.0) {
            return new HashMap<>();
        }
        double length = Math.sqrt(norm);
        Map<String, Double> out = new HashMap<>();
        vector.forEach((token, v) -> out.put(token, v / length));
        return out;
    }

    private static double dot(Map<String, Double> a, Map<String, Double> b) {
        Map<String, Double> small = a.size() <= b.size() ? a : b;
        Map<String, Double> large = small == a ? b : a;
        double sum = 0.0;
        for (Map.Entry<String, Double> e : small.entrySet()) {
            Double other = large.get(e.getKey());
            if (other != null) {
                sum += e.getValue() * other;
            }
        }
        return Math.min(1.0, sum);
    }
}
