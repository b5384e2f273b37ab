package com.example.nl2cmd.dao;

import com.example.nl2cmd.config.Nl2CmdProperties;
import com.example.nl2cmd.model.CommandRule;
import com.example.nl2cmd.model.OsFamily;
import com.example.nl2cmd.util.JsonResources;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Repository
public class JsonCommandRuleDao implements CommandRuleDao {

    private final Map<OsFamily, List<CommandRule>> rulesByOs;

    @Autowired
    public JsonCommandRuleDao(ResourceLoader resourceLoader, Nl2CmdProperties properties) {
        this(load(resourceLoader, properties.getDataset().getRules()));
    }

    private JsonCommandRuleDao(Map<OsFamily, List<CommandRule>> rulesByOs) {
        Map<OsFamily, List<CommandRule>> copy = new EnumMap<>(OsFamily.class);
        rulesByOs.forEach((os, rules) -> copy.put(os, rules.stream()
                .filter(r -> r != null && !r.keywords().isEmpty() && r.command() != null)
                .toList()));
        this.rulesByOs = Collections.unmodifiableMap(copy);
    }

    public static JsonCommandRuleDao of(Map<OsFamily, List<CommandRule>> rulesByOs) {
        return new JsonCommandRuleDao(rulesByOs);
    }

    @Override
    public List<CommandRule> findByOs(OsFamily os) {
        return rulesByOs.getOrDefault(os, List.of());
    }

    private static Map<OsFamily, List<CommandRule>> load(ResourceLoader loader, String location) {
        Map<OsFamily, List<CommandRule>> out = new EnumMap<>(OsFamily.class);
        Optional<RuleBundle> bundle;
        try {
            bundle = JsonResources.read(loader, location, RuleBundle.class);
        } catch (IOException ex) {
            log.warn("Failed to load command rules from {}: {}", location, ex.getMessage());
            return out;
        }
        bundle.ifPresentOrElse(b -> {
            out.put(OsFamily.WINDOWS, b.windows == null ? List.of() : b.windows);
            out.put(OsFamily.LINUX, b.linux == null ? List.of() : b.linux);
            log.info("Loaded command rules from {}: windows={}, linux={}",
                    location, out.get(OsFamily.WINDOWS).size(), out.get(OsFamily.LINUX).size());
        }, () -> log.warn("Command rules {} not found; rule matching will only return placeholders", location));
        return out;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class RuleBundle {
        public List<CommandRule> windows;
        public List<CommandRule> linux;
    }
}
