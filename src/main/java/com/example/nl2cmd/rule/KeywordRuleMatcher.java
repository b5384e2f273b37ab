package com.example.nl2cmd.rule;

import com.example.nl2cmd.dao.CommandRuleDao;
import com.example.nl2cmd.model.CommandRule;
import com.example.nl2cmd.model.OsFamily;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * First rule whose keywords all occur as whole words in the lowercased query wins.
 */
@Slf4j
@Component
public class KeywordRuleMatcher implements RuleMatcher {

    private final Map<OsFamily, List<CompiledRule>> rules;

    public KeywordRuleMatcher(CommandRuleDao ruleDao) {
        Map<OsFamily, List<CompiledRule>> compiled = new EnumMap<>(OsFamily.class);
        for (OsFamily os : OsFamily.values()) {
            List<CompiledRule> list = new ArrayList<>();
            for (CommandRule rule : ruleDao.findByOs(os)) {
                list.add(CompiledRule.of(rule));
            }
            compiled.put(os, List.copyOf(list));
        }
        this.rules = Collections.unmodifiableMap(compiled);
    }

    @Override
    public String match(String query, OsFamily os) {
        if (query == null || query.isBlank() || os == null) {
            return NO_MATCH_PLACEHOLDER;
        }
        String lower = query.toLowerCase(Locale.ROOT);
        for (CompiledRule rule : rules.get(os)) {
            if (rule.matches(lower)) {
                log.debug("Rule {} matched '{}'", rule.source().keywords(), query);
                return rule.source().command();
            }
        }
        return NO_MATCH_PLACEHOLDER;
    }

    private record CompiledRule(CommandRule source, List<Pattern> patterns) {

        static CompiledRule of(CommandRule rule) {
            List<Pattern> patterns = rule.keywords().stream()
                    .map(k -> Pattern.compile("\\b" + Pattern.quote(k.toLowerCase(Locale.ROOT).trim()) + "\\b"))
                    .toList();
            return new CompiledRule(rule, patterns);
        }

        boolean matches(String lowerQuery) {
            return !patterns.isEmpty() && patterns.stream().allMatch(p -> p.matcher(lowerQuery).find());
        }
    }
}
