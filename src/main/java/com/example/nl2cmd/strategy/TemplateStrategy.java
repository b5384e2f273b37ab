package com.example.nl2cmd.strategy;

import com.example.nl2cmd.model.CandidateResolution;
import com.example.nl2cmd.model.CommandAnalysis;
import com.example.nl2cmd.model.OsFamily;
import com.example.nl2cmd.model.ProcessedQuery;
import com.example.nl2cmd.model.ResolutionMethod;
import com.example.nl2cmd.template.CommandTemplateEngine;
import com.example.nl2cmd.template.ParameterExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class TemplateStrategy implements ResolutionStrategy {

    private static final String NAME = "template";

    private final ParameterExtractor extractor;
    private final CommandTemplateEngine engine;

    public TemplateStrategy(ParameterExtractor extractor, CommandTemplateEngine engine) {
        this.extractor = extractor;
        this.engine = engine;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ResolutionMethod method() {
        return ResolutionMethod.TEMPLATE;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public CandidateResolution resolve(ProcessedQuery query, OsFamily os) {
        try {
            CommandAnalysis analysis = extractor.analyze(query.getOriginal());
            return engine.generate(analysis, os);
        } catch (RuntimeException ex) {
            log.warn("Template generation failed for '{}': {}", query.getOriginal(), ex.getMessage());
            return CandidateResolution.failed(ResolutionMethod.TEMPLATE, "Template generation failed: " + ex.getMessage());
        }
    }
}
