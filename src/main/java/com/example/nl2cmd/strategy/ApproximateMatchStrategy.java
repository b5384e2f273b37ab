package com.example.nl2cmd.strategy;

import com.example.nl2cmd.matcher.ApproximateMatcher;
import com.example.nl2cmd.model.BestMatch;
import com.example.nl2cmd.model.CandidateResolution;
import com.example.nl2cmd.model.MatchSource;
import com.example.nl2cmd.model.OsFamily;
import com.example.nl2cmd.model.ProcessedQuery;
import com.example.nl2cmd.model.ResolutionMethod;
import com.example.nl2cmd.model.SmartSearchResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Wraps {@link ApproximateMatcher#smartSearch}. The candidate method reflects whether the
 * similarity index or the diagnosis catalog produced the command.
 */
@Slf4j
@Component
public class ApproximateMatchStrategy implements ResolutionStrategy {

    private static final String NAME = "approximate-match";

    private final ApproximateMatcher matcher;

    public ApproximateMatchStrategy(ApproximateMatcher matcher) {
        this.matcher = matcher;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ResolutionMethod method() {
        return ResolutionMethod.FUZZY;
    }

    @Override
    public boolean isAvailable() {
        return matcher.isAvailable();
    }

    @Override
    public CandidateResolution resolve(ProcessedQuery query, OsFamily os) {
        try {
            SmartSearchResult result = matcher.smartSearch(query.getOriginal(), os);
            if (!result.hasBestMatch()) {
                return CandidateResolution.failed(ResolutionMethod.FUZZY, "No fuzzy matches found");
            }
            BestMatch best = result.getBestMatch();
            CandidateResolution.CandidateResolutionBuilder candidate = CandidateResolution.builder()
                    .method(best.getSource() == MatchSource.FUZZY_MATCH
                            ? ResolutionMethod.FUZZY
                            : ResolutionMethod.PROBLEM_DIAGNOSIS)
                    .command(best.getCommand())
                    .confidence(result.getConfidence() / 100.0)
                    .success(true)
                    .intent(best.getIntent() == null ? "unknown" : best.getIntent())
                    .explanation(best.getExplanation());
            if (best.getMatchedQuery() != null) {
                candidate.meta("matchedQuery", best.getMatchedQuery());
            }
            if (best.getCategory() != null) {
                candidate.meta("category", best.getCategory());
            }
            return candidate.build();
        } catch (RuntimeException ex) {
            log.warn("Approximate matching failed for '{}': {}", query.getOriginal(), ex.getMessage());
            return CandidateResolution.failed(ResolutionMethod.FUZZY, "Fuzzy search failed: " + ex.getMessage());
        }
    }
}
