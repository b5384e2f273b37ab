package com.example.nl2cmd.matcher;

import com.example.nl2cmd.config.Nl2CmdProperties;
import com.example.nl2cmd.dao.CommandDatasetDao;
import com.example.nl2cmd.dao.ProblemCatalogDao;
import com.example.nl2cmd.model.BestMatch;
import com.example.nl2cmd.model.CommandRecord;
import com.example.nl2cmd.model.DiagnosisResult;
import com.example.nl2cmd.model.IndexedCommand;
import com.example.nl2cmd.model.MatchSource;
import com.example.nl2cmd.model.OsFamily;
import com.example.nl2cmd.model.ProblemCategory;
import com.example.nl2cmd.model.ProblemEntry;
import com.example.nl2cmd.model.SimilarityMatch;
import com.example.nl2cmd.model.SmartSearchResult;
import com.example.nl2cmd.normalizer.QueryNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Typo-tolerant lookup over the curated dataset combined with keyword-driven problem diagnosis.
 *
 * <p>The similarity index maps each case-folded training query to its intent and the command for
 * every OS family that defines one. The first record seen for a {@code (query, os)} pair wins.
 */
@Slf4j
@Component
public class ApproximateMatcher {

    private static final int DIAGNOSIS_LIMIT = 3;
    private static final int DIAGNOSIS_BASE_CONFIDENCE = 75;
    private static final int DIAGNOSIS_STEP = 5;
    private static final int DIAGNOSIS_MAX_CONFIDENCE = 90;
    private static final int STRONG_DIAGNOSIS_RELEVANCE = 2;

    private final Map<String, IndexedCommand> index;
    private final List<CompiledCategory> categories;
    private final int searchThreshold;
    private final int searchLimit;
    private final int highConfidenceScore;

    public ApproximateMatcher(CommandDatasetDao datasetDao,
                              ProblemCatalogDao problemCatalogDao,
                              Nl2CmdProperties properties) {
        Nl2CmdProperties.Matcher cfg = properties.getMatcher();
        this.index = cfg.isEnabled() ? buildIndex(datasetDao) : Map.of();
        this.categories = cfg.isEnabled() ? compile(problemCatalogDao.findAll()) : List.of();
        this.searchThreshold = cfg.getSearchThreshold();
        this.searchLimit = cfg.getSearchLimit();
        this.highConfidenceScore = cfg.getHighConfidenceScore();
        log.info("Approximate matcher ready: indexedQueries={}, problemCategories={}",
                index.size(), categories.size());
    }

    public boolean isAvailable() {
        return !index.isEmpty() || !categories.isEmpty();
    }

    /**
     * Scores every indexed query against {@code query}. Results are ordered by score descending
     * (index order breaks ties), filtered by {@code threshold} and truncated to {@code limit}.
     */
    public List<SimilarityMatch> search(String query, int threshold, int limit) {
        return search(query, threshold, limit, null);
    }

    /** Same as {@link #search(String, int, int)} restricted to entries with a command for {@code os}. */
    public List<SimilarityMatch> search(String query, int threshold, int limit, OsFamily os) {
        if (query == null || query.isBlank() || limit <= 0 || index.isEmpty()) {
            return List.of();
        }
        String needle = query.toLowerCase(Locale.ROOT).trim();

        List<SimilarityMatch> scored = new ArrayList<>();
        for (Map.Entry<String, IndexedCommand> entry : index.entrySet()) {
            if (os != null && entry.getValue().commandFor(os).isEmpty()) {
                continue;
            }
            int score = SimilarityScorer.weightedRatio(needle, entry.getKey());
            if (score >= threshold) {
                scored.add(new SimilarityMatch(entry.getKey(), score, entry.getValue()));
            }
        }
        scored.sort(Comparator.comparingInt(SimilarityMatch::score).reversed());
        return scored.size() > limit ? List.copyOf(scored.subList(0, limit)) : List.copyOf(scored);
    }

    /**
     * Maps a problem description to curated fixes. Relevance is the number of category keyword
     * phrases present in the query plus the number of words shared with the entry's problem text.
     * Entries sharing no word with the query are dropped.
     */
    public List<DiagnosisResult> diagnose(String query, OsFamily os) {
        if (query == null || query.isBlank() || categories.isEmpty()) {
            return List.of();
        }
        String normalized = QueryNormalizer.normalizeText(query);
        Set<String> queryWords = words(normalized);

        List<DiagnosisResult> results = new ArrayList<>();
        for (CompiledCategory category : categories) {
            int keywordMatches = category.countKeywordMatches(normalized);
            if (keywordMatches == 0) {
                continue;
            }
            for (ProblemEntry entry : category.source().entriesFor(os)) {
                if (entry == null || entry.problem() == null || entry.solution() == null) {
                    continue;
                }
                Set<String> shared = words(QueryNormalizer.normalizeText(entry.problem()));
                shared.retainAll(queryWords);
                if (shared.isEmpty()) {
                    continue;
                }
                results.add(new DiagnosisResult(
                        entry.solution(),
                        entry.explanation(),
                        category.source().name(),
                        entry.problem(),
                        shared.size() + keywordMatches));
            }
        }

        // List.sort is stable: equal relevance keeps catalog order.
        results.sort(Comparator.comparingInt(DiagnosisResult::relevance).reversed());
        return results.size() > DIAGNOSIS_LIMIT
                ? List.copyOf(results.subList(0, DIAGNOSIS_LIMIT))
                : List.copyOf(results);
    }

    /**
     * Runs similarity search and diagnosis and picks the best of both. A strong diagnosis wins
     * unless a similarity match scores higher; otherwise a high-scoring similarity match wins;
     * otherwise whichever is present, diagnosis first.
     */
    public SmartSearchResult smartSearch(String query, OsFamily os) {
        List<SimilarityMatch> similar = search(query, searchThreshold, searchLimit, os);
        List<DiagnosisResult> diagnoses = diagnose(query, os);

        SmartSearchResult.SmartSearchResultBuilder result = SmartSearchResult.builder()
                .similarityMatches(similar)
                .diagnoses(diagnoses);

        SimilarityMatch topMatch = similar.isEmpty() ? null : similar.get(0);
        DiagnosisResult topDiagnosis = diagnoses.isEmpty() ? null : diagnoses.get(0);

        if (topDiagnosis != null && topDiagnosis.relevance() >= STRONG_DIAGNOSIS_RELEVANCE) {
            int diagnosisConfidence = diagnosisConfidence(topDiagnosis);
            if (topMatch == null || diagnosisConfidence >= topMatch.score()) {
                log.debug("smartSearch: diagnosis '{}' wins with {}", topDiagnosis.problem(), diagnosisConfidence);
                return result.bestMatch(fromDiagnosis(topDiagnosis))
                        .confidence(diagnosisConfidence)
                        .build();
            }
        }

        if (topMatch != null && topMatch.score() >= highConfidenceScore) {
            return result.bestMatch(fromSimilarity(topMatch, os))
                    .confidence(topMatch.score())
                    .build();
        }
        if (topDiagnosis != null) {
            return result.bestMatch(fromDiagnosis(topDiagnosis))
                    .confidence(diagnosisConfidence(topDiagnosis))
                    .build();
        }
        if (topMatch != null) {
            return result.bestMatch(fromSimilarity(topMatch, os))
                    .confidence(topMatch.score())
                    .build();
        }
        return result.build();
    }

    private static int diagnosisConfidence(DiagnosisResult diagnosis) {
        return Math.min(DIAGNOSIS_MAX_CONFIDENCE,
                DIAGNOSIS_BASE_CONFIDENCE + DIAGNOSIS_STEP * diagnosis.relevance());
    }

    private static BestMatch fromDiagnosis(DiagnosisResult diagnosis) {
        return BestMatch.builder()
                .command(diagnosis.command())
                .source(MatchSource.PROBLEM_DIAGNOSIS)
                .explanation(diagnosis.explanation())
                .category(diagnosis.category())
                .problem(diagnosis.problem())
                .build();
    }

    private static BestMatch fromSimilarity(SimilarityMatch match, OsFamily os) {
        IndexedCommand info = match.info();
        return BestMatch.builder()
                .command(info.commandFor(os).orElse(null))
                .source(MatchSource.FUZZY_MATCH)
                .intent(info.getIntent())
                .matchedQuery(match.matchedKey())
                .build();
    }

    private static Set<String> words(String normalized) {
        if (normalized.isEmpty()) {
            return new HashSet<>();
        }
        return new HashSet<>(Arrays.asList(normalized.split(" ")));
    }

    private static Map<String, IndexedCommand> buildIndex(CommandDatasetDao datasetDao) {
        Map<String, String> intents = new LinkedHashMap<>();
        Map<String, Map<OsFamily, String>> commands = new LinkedHashMap<>();

        for (OsFamily os : OsFamily.values()) {
            for (CommandRecord record : datasetDao.findByOs(os)) {
                String key = record.query().toLowerCase(Locale.ROOT).trim();
                intents.putIfAbsent(key, record.intent());
                commands.computeIfAbsent(key, k -> new EnumMap<>(OsFamily.class))
                        .putIfAbsent(os, record.command());
            }
        }

        Map<String, IndexedCommand> out = new LinkedHashMap<>();
        commands.forEach((key, perOs) -> out.put(key, new IndexedCommand(intents.get(key), perOs)));
        return Collections.unmodifiableMap(out);
    }

    private static List<CompiledCategory> compile(List<ProblemCategory> source) {
        List<CompiledCategory> out = new ArrayList<>();
        for (ProblemCategory category : source) {
            List<Pattern> patterns = new ArrayList<>();
            for (String keyword : category.keywords()) {
                String phrase = QueryNormalizer.normalizeText(keyword);
                if (!phrase.isEmpty()) {
                    patterns.add(Pattern.compile("\\b" + Pattern.quote(phrase) + "\\b"));
                }
            }
            out.add(new CompiledCategory(category, List.copyOf(patterns)));
        }
        return List.copyOf(out);
    }

    private record CompiledCategory(ProblemCategory source, List<Pattern> keywordPatterns) {

        int countKeywordMatches(String normalizedQuery) {
            int count = 0;
            for (Pattern pattern : keywordPatterns) {
                if (pattern.matcher(normalizedQuery).find()) {
                    count++;
                }
            }
            return count;
        }
    }
}
