package com.example.nl2cmd.template;

import com.example.nl2cmd.model.CandidateResolution;
import com.example.nl2cmd.model.CommandAnalysis;
import com.example.nl2cmd.model.NestedOperation;
import com.example.nl2cmd.model.OsFamily;
import com.example.nl2cmd.model.ParameterNames;
import com.example.nl2cmd.model.ResolutionMethod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds a command from a {@link CommandAnalysis} by filling the first template registered for the
 * derived template key.
 */
@Slf4j
@Component
public class CommandTemplateEngine {

    static final double TEMPLATE_CONFIDENCE = 0.95;
    static final String NESTED_KEY = "create_nested";

    private static final Map<String, String> VERSION_CONTROL_DEFAULTS = Map.of(
            ParameterNames.MESSAGE, "Update",
            ParameterNames.BRANCHNAME, "new-branch",
            ParameterNames.FILENAME, ".",
            ParameterNames.URL, "",
            "branch", "main",
            "tagname", "v1.0",
            "name", "Your Name",
            "email", "your.email@example.com"
    );

    private final CommandTemplateCatalog catalog;

    public CommandTemplateEngine(CommandTemplateCatalog catalog) {
        this.catalog = catalog;
    }

    public CandidateResolution generate(CommandAnalysis analysis, OsFamily os) {
        Optional<String> key = templateKey(analysis);
        if (key.isEmpty()) {
            return CandidateResolution.failed(ResolutionMethod.TEMPLATE, "No template key for query");
        }

        Optional<String> template = catalog.find(key.get(), os);
        if (template.isEmpty()) {
            return CandidateResolution.failed(ResolutionMethod.TEMPLATE, "No template for " + key.get());
        }

        Optional<String> command = TemplateFiller.fill(template.get(), variables(analysis));
        if (command.isEmpty()) {
            log.debug("Template {} is missing parameters for '{}'", key.get(), analysis.getQuery());
            return CandidateResolution.failed(ResolutionMethod.TEMPLATE, "Missing parameters for " + key.get());
        }

        return CandidateResolution.builder()
                .method(ResolutionMethod.TEMPLATE)
                .command(command.get())
                .confidence(TEMPLATE_CONFIDENCE)
                .success(true)
                .intent(analysis.getIntent())
                .explanation("Generated from template " + key.get())
                .meta("templateKey", key.get())
                .meta("parameters", Map.copyOf(analysis.getParameters()))
                .build();
    }

    static Optional<String> templateKey(CommandAnalysis analysis) {
        String intent = analysis.getIntent();
        if (intent == null) {
            return Optional.empty();
        }
        if (analysis.isVersionControl()) {
            return Optional.of(intent);
        }
        if (analysis.getNestedOperation() != null) {
            return Optional.of(NESTED_KEY);
        }
        List<String> targets = analysis.getTargets();
        if (targets.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(intent + "_" + targets.get(0));
    }

    private static Map<String, String> variables(CommandAnalysis analysis) {
        Map<String, String> vars = new LinkedHashMap<>(analysis.getParameters());
        if (analysis.isVersionControl()) {
            VERSION_CONTROL_DEFAULTS.forEach(vars::putIfAbsent);
        }
        NestedOperation nested = analysis.getNestedOperation();
        if (nested != null) {
            vars.put(ParameterNames.FOLDERNAME, nested.parentName());
            vars.put(ParameterNames.FILENAME, nested.childName());
        }
        return vars;
    }
}
