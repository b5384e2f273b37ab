package com.example.nl2cmd.service;

import com.example.nl2cmd.classifier.IntentClassifier;
import com.example.nl2cmd.classifier.Prediction;
import com.example.nl2cmd.config.Nl2CmdProperties;
import com.example.nl2cmd.matcher.ApproximateMatcher;
import com.example.nl2cmd.model.ArbitrationDecision;
import com.example.nl2cmd.model.CandidateResolution;
import com.example.nl2cmd.model.OsFamily;
import com.example.nl2cmd.model.ProcessedQuery;
import com.example.nl2cmd.model.ResolutionError;
import com.example.nl2cmd.model.ResolutionMethod;
import com.example.nl2cmd.model.SimilarityMatch;
import com.example.nl2cmd.model.StepLog;
import com.example.nl2cmd.model.Suggestion;
import com.example.nl2cmd.normalizer.QueryNormalizer;
import com.example.nl2cmd.strategy.ResolutionStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.support.AopUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Runs the resolution cascade for a single query.
 *
 * <p>Stages run in a fixed order and the first accepted candidate is returned:
 * classifier, template, approximate match, exact rule. When nothing is accepted, the most
 * confident classifier or approximate-match candidate that carries a command is promoted with a
 * warning. Template candidates never take part in that fallback.
 */
@Slf4j
@Service
public class ResolutionArbitrator {

    static final String INVALID_INPUT_MESSAGE = "Invalid or empty query";
    static final String NO_RESOLUTION_MESSAGE =
            "No matching command found. Try rephrasing or use --help for examples.";

    private static final String STEP_NORMALIZE = "normalize";
    private static final String STEP_FALLBACK = "fallback";

    private final QueryNormalizer normalizer;
    private final Map<ResolutionMethod, ResolutionStrategy> strategies;
    private final IntentClassifier classifier;
    private final ApproximateMatcher matcher;
    private final Nl2CmdProperties.Resolver thresholds;
    private final int similarityThreshold;

    public ResolutionArbitrator(QueryNormalizer normalizer,
                                List<ResolutionStrategy> strategies,
                                Optional<IntentClassifier> classifier,
                                Optional<ApproximateMatcher> matcher,
                                Nl2CmdProperties properties) {
        this.normalizer = normalizer;
        Map<ResolutionMethod, ResolutionStrategy> byMethod = new EnumMap<>(ResolutionMethod.class);
        for (ResolutionStrategy strategy : strategies) {
            ResolutionStrategy previous = byMethod.putIfAbsent(strategy.method(), strategy);
            if (previous != null) {
                log.warn("Ignoring strategy {} ({}): {} already serves {}",
                        strategy.name(), AopUtils.getTargetClass(strategy).getSimpleName(),
                        previous.name(), strategy.method());
            }
        }
        this.strategies = byMethod;
        this.classifier = classifier.orElse(null);
        this.matcher = matcher.orElse(null);
        this.thresholds = properties.getResolver();
        this.similarityThreshold = properties.getMatcher().getSearchThreshold();
    }

    public ArbitrationDecision resolve(String query, OsFamily os) {
        return resolve(query, os, null);
    }

    /**
     * @param forcedMethod {@code ml}, {@code fuzzy} or {@code rule} restricts which optional stages
     *                     run; {@code null} runs the whole cascade
     */
    public ArbitrationDecision resolve(String query, OsFamily os, ResolutionMethod forcedMethod) {
        ArbitrationDecision.ArbitrationDecisionBuilder decision = ArbitrationDecision.builder().query(query);

        ProcessedQuery processed = normalizer.normalize(query);
        if (!processed.isValid()) {
            decision.step(StepLog.of(STEP_NORMALIZE, "invalid"));
            return decision.error(ResolutionError.INVALID_INPUT)
                    .errorMessage(INVALID_INPUT_MESSAGE)
                    .build();
        }
        decision.step(StepLog.of(STEP_NORMALIZE, "keywords=" + processed.getKeywords()));

        List<CandidateResolution> rejected = new ArrayList<>();
        CandidateResolution mlBackup = null;
        CandidateResolution fuzzyBackup = null;

        if (forcedMethod != ResolutionMethod.RULE && forcedMethod != ResolutionMethod.FUZZY) {
            Optional<CandidateResolution> ml = runStage(ResolutionMethod.ML, processed, os, decision);
            if (ml.isPresent()) {
                if (accepted(ml.get(), thresholds.getClassifierThreshold())) {
                    return chosen(decision, ml.get(), rejected);
                }
                mlBackup = ml.get();
                rejected.add(mlBackup);
            }
        }

        Optional<CandidateResolution> template = runStage(ResolutionMethod.TEMPLATE, processed, os, decision);
        if (template.isPresent()) {
            if (accepted(template.get(), thresholds.getTemplateThreshold())) {
                return chosen(decision, template.get(), rejected);
            }
            rejected.add(template.get());
        }

        if (forcedMethod != ResolutionMethod.RULE && forcedMethod != ResolutionMethod.ML) {
            Optional<CandidateResolution> fuzzy = runStage(ResolutionMethod.FUZZY, processed, os, decision);
            if (fuzzy.isPresent()) {
                if (accepted(fuzzy.get(), thresholds.getFuzzyThreshold())) {
                    return chosen(decision, fuzzy.get(), rejected);
                }
                fuzzyBackup = fuzzy.get();
                rejected.add(fuzzyBackup);
            }
        }

        if (forcedMethod != ResolutionMethod.ML && forcedMethod != ResolutionMethod.FUZZY) {
            Optional<CandidateResolution> rule = runStage(ResolutionMethod.RULE, processed, os, decision);
            if (rule.isPresent()) {
                if (rule.get().isSuccess()) {
                    return chosen(decision, rule.get(), rejected);
                }
                rejected.add(rule.get());
            }
        }

        CandidateResolution backup = bestBackup(mlBackup, fuzzyBackup);
        if (backup != null) {
            rejected.remove(backup);
            String warning = String.format(Locale.ROOT, "Low confidence (%.1f%%), please verify",
                    backup.getConfidence() * 100.0);
            decision.step(StepLog.of(STEP_FALLBACK, backup.getMethod().wireName()));
            log.debug("Promoting {} fallback for '{}': {}", backup.getMethod(), query, backup.getCommand());
            return decision.chosen(backup)
                    .rejected(rejected)
                    .fallbackUsed(true)
                    .warning(warning)
                    .build();
        }

        decision.step(StepLog.of(STEP_FALLBACK, "none"));
        return decision.rejected(rejected)
                .error(ResolutionError.NO_RESOLUTION)
                .errorMessage(NO_RESOLUTION_MESSAGE)
                .build();
    }

    /**
     * Alternatives for a query: a matching rule first, then classifier predictions, then the
     * closest dataset queries. Duplicate commands are reported once.
     */
    public List<Suggestion> suggestions(String query, OsFamily os, int n) {
        if (n <= 0) {
            return List.of();
        }
        ProcessedQuery processed = normalizer.normalize(query);
        if (!processed.isValid()) {
            return List.of();
        }

        List<Suggestion> out = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();

        ResolutionStrategy rule = strategies.get(ResolutionMethod.RULE);
        if (rule != null) {
            CandidateResolution candidate = guarded(rule, processed, os);
            if (candidate.isSuccess() && seen.add(candidate.getCommand())) {
                out.add(new Suggestion(candidate.getCommand(), 1.0, ResolutionMethod.RULE, "rule_based"));
            }
        }

        if (classifier != null && classifier.isAvailable()) {
            try {
                for (Prediction.LabelScore score : classifier.topPredictions(processed.getNormalized(), n)) {
                    classifier.labelToCommand(score.label(), os)
                            .filter(seen::add)
                            .ifPresent(cmd -> out.add(new Suggestion(cmd, score.confidence(), ResolutionMethod.ML, score.label())));
                }
            } catch (RuntimeException ex) {
                log.warn("Classifier {} failed while suggesting for '{}': {}", classifier.name(), query, ex.getMessage());
            }
        }

        if (matcher != null && matcher.isAvailable()) {
            for (SimilarityMatch match : matcher.search(query, similarityThreshold, n, os)) {
                match.info().commandFor(os)
                        .filter(seen::add)
                        .ifPresent(cmd -> out.add(new Suggestion(cmd, match.score() / 100.0,
                                ResolutionMethod.FUZZY, match.info().getIntent())));
            }
        }

        return out.size() > n ? List.copyOf(out.subList(0, n)) : List.copyOf(out);
    }

    private Optional<CandidateResolution> runStage(ResolutionMethod method,
                                                   ProcessedQuery processed,
                                                   OsFamily os,
                                                   ArbitrationDecision.ArbitrationDecisionBuilder decision) {
        ResolutionStrategy strategy = strategies.get(method);
        if (strategy == null || !strategy.isAvailable()) {
            decision.step(StepLog.of(method.wireName(), "unavailable"));
            return Optional.empty();
        }
        CandidateResolution candidate = guarded(strategy, processed, os);
        decision.step(StepLog.of(strategy.name(), describe(candidate)));
        log.debug("Stage {} for '{}': {}", strategy.name(), processed.getOriginal(), describe(candidate));
        return Optional.of(candidate);
    }

    private static CandidateResolution guarded(ResolutionStrategy strategy, ProcessedQuery processed, OsFamily os) {
        try {
            CandidateResolution candidate = strategy.resolve(processed, os);
            return candidate == null
                    ? CandidateResolution.failed(strategy.method(), strategy.name() + " returned no candidate")
                    : candidate;
        } catch (RuntimeException ex) {
            log.warn("Strategy {} failed: {}", strategy.name(), ex.getMessage());
            return CandidateResolution.failed(strategy.method(), strategy.name() + " failed: " + ex.getMessage());
        }
    }

    private static boolean accepted(CandidateResolution candidate, double threshold) {
        return candidate.isSuccess() && candidate.getConfidence() >= threshold;
    }

    private static ArbitrationDecision chosen(ArbitrationDecision.ArbitrationDecisionBuilder decision,
                                              CandidateResolution candidate,
                                              List<CandidateResolution> rejected) {
        return decision.chosen(candidate).rejected(rejected).build();
    }

    private static CandidateResolution bestBackup(CandidateResolution mlBackup, CandidateResolution fuzzyBackup) {
        CandidateResolution best = null;
        for (CandidateResolution candidate : new CandidateResolution[] {mlBackup, fuzzyBackup}) {
            if (candidate == null || !candidate.hasCommand()) {
                continue;
            }
            if (best == null || candidate.getConfidence() > best.getConfidence()) {
                best = candidate;
            }
        }
        return best;
    }

    private static String describe(CandidateResolution candidate) {
        if (!candidate.hasCommand()) {
            return "failed: " + candidate.getError();
        }
        return String.format(Locale.ROOT, "%s %.2f %s",
                candidate.isSuccess() ? "ok" : "weak", candidate.getConfidence(), candidate.getCommand());
    }
}
