package com.example.nl2cmd.strategy;

import com.example.nl2cmd.model.CandidateResolution;
import com.example.nl2cmd.model.OsFamily;
import com.example.nl2cmd.model.ProcessedQuery;
import com.example.nl2cmd.model.ResolutionMethod;
import com.example.nl2cmd.rule.RuleMatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class RuleStrategy implements ResolutionStrategy {

    private static final String NAME = "rule";
    private static final double RULE_CONFIDENCE = 1.0;

    private final RuleMatcher ruleMatcher;

    public RuleStrategy(RuleMatcher ruleMatcher) {
        this.ruleMatcher = ruleMatcher;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ResolutionMethod method() {
        return ResolutionMethod.RULE;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public CandidateResolution resolve(ProcessedQuery query, OsFamily os) {
        try {
            String command = ruleMatcher.match(query.getOriginal(), os);
            if (RuleMatcher.isNoOpPlaceholder(command)) {
                return CandidateResolution.failed(ResolutionMethod.RULE, "No rule matched");
            }
            return CandidateResolution.builder()
                    .method(ResolutionMethod.RULE)
                    .command(command)
                    .confidence(RULE_CONFIDENCE)
                    .success(true)
                    .intent("rule_based")
                    .build();
        } catch (RuntimeException ex) {
            log.warn("Rule matching failed for '{}': {}", query.getOriginal(), ex.getMessage());
            return CandidateResolution.failed(ResolutionMethod.RULE, "Rule matching failed: " + ex.getMessage());
        }
    }
}
