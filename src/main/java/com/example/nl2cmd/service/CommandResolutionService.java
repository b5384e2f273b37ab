package com.example.nl2cmd.service;

import com.example.nl2cmd.matcher.ApproximateMatcher;
import com.example.nl2cmd.model.ArbitrationDecision;
import com.example.nl2cmd.model.CandidateResolution;
import com.example.nl2cmd.model.CommandChain;
import com.example.nl2cmd.model.CommandSegment;
import com.example.nl2cmd.model.DiagnosisResult;
import com.example.nl2cmd.model.OsFamily;
import com.example.nl2cmd.model.ResolutionMethod;
import com.example.nl2cmd.model.ResolutionStatus;
import com.example.nl2cmd.model.StepLog;
import com.example.nl2cmd.model.Suggestion;
import com.example.nl2cmd.request.ResolveRequest;
import com.example.nl2cmd.response.ResolveResponse;
import com.example.nl2cmd.response.SegmentResponse;
import com.example.nl2cmd.risk.RiskAssessor;
import com.example.nl2cmd.validation.ValidationContext;
import com.example.nl2cmd.validation.ValidationException;
import com.example.nl2cmd.validation.ValidationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Request entry point: validates the query, picks the OS family, resolves single or compound
 * requests and attaches the risk assessment of the final command.
 */
@Slf4j
@Service
public class CommandResolutionService {

    private static final Map<String, ResolutionMethod> FORCEABLE_METHODS = Map.of(
            "ml", ResolutionMethod.ML,
            "fuzzy", ResolutionMethod.FUZZY,
            "rule", ResolutionMethod.RULE
    );
    private static final String PARTIAL_FAILURE_MESSAGE = "Unable to resolve every part of the request.";

    private final ValidationService validationService;
    private final MultiCommandOrchestrator orchestrator;
    private final ResolutionArbitrator arbitrator;
    private final ApproximateMatcher matcher;
    private final RiskAssessor riskAssessor;
    private final OsFamily defaultOsFamily;

    public CommandResolutionService(ValidationService validationService,
                                    MultiCommandOrchestrator orchestrator,
                                    ResolutionArbitrator arbitrator,
                                    ApproximateMatcher matcher,
                                    RiskAssessor riskAssessor,
                                    OsFamily defaultOsFamily) {
        this.validationService = validationService;
        this.orchestrator = orchestrator;
        this.arbitrator = arbitrator;
        this.matcher = matcher;
        this.riskAssessor = riskAssessor;
        this.defaultOsFamily = defaultOsFamily;
    }

    public Mono<ResolveResponse> resolve(ResolveRequest request) {
        return Mono.fromCallable(() -> resolveNow(request));
    }

    public Mono<List<DiagnosisResult>> diagnose(String query, String os) {
        return Mono.fromCallable(() -> {
            ValidationContext validation = validationService.validate(query);
            return matcher.diagnose(validation.getProcessedInput(), selectOs(os));
        });
    }

    public Mono<List<Suggestion>> suggest(String query, String os, int n) {
        return Mono.fromCallable(() -> {
            ValidationContext validation = validationService.validate(query);
            return arbitrator.suggestions(validation.getProcessedInput(), selectOs(os), n);
        });
    }

    public OsFamily selectOs(String requested) {
        if (requested == null || requested.isBlank()) {
            return defaultOsFamily;
        }
        try {
            return OsFamily.fromKey(requested);
        } catch (IllegalArgumentException ex) {
            throw new ValidationException("Unsupported os '" + requested + "'. Use windows or linux.");
        }
    }

    ResolveResponse resolveNow(ResolveRequest request) {
        if (request == null) {
            throw new ValidationException("Request body is required.");
        }
        ValidationContext validation = validationService.validate(request.getQuery());
        OsFamily os = selectOs(request.getOs());
        ResolutionMethod forced = selectMethod(request.getMethod());

        CommandChain chain = orchestrator.process(validation.getProcessedInput(), os, forced);
        ResolveResponse response = chain.isMultiCommand()
                ? fromChain(chain)
                : fromDecision(chain.getSegments().get(0).getResolution());

        response.setQuery(validation.getProcessedInput());
        response.setOs(os.key());
        response.setMultiCommand(chain.isMultiCommand());
        response.setSegments(segments(chain));
        response.setSteps(steps(chain));
        response.setNotices(List.copyOf(validation.getNotices()));
        if (response.getCommand() != null) {
            response.setRisk(riskAssessor.assessRisk(response.getCommand()));
        }

        log.info("Resolved '{}' on {}: status={}, method={}, confidence={}",
                response.getQuery(), os.key(), response.getStatus(), response.getMethod(), response.getConfidence());
        return response;
    }

    private static ResolutionMethod selectMethod(String method) {
        if (method == null || method.isBlank()) {
            return null;
        }
        ResolutionMethod forced = FORCEABLE_METHODS.get(method.trim().toLowerCase(Locale.ROOT));
        if (forced == null) {
            throw new ValidationException("Unsupported method '" + method + "'. Use ml, fuzzy or rule.");
        }
        return forced;
    }

    private static ResolveResponse fromDecision(ArbitrationDecision decision) {
        CandidateResolution chosen = decision.isSuccess() ? decision.getChosen() : null;
        return ResolveResponse.builder()
                .status(decision.getStatus())
                .command(decision.getCommand())
                .confidence(decision.getConfidence())
                .method(chosen == null ? null : chosen.getMethod().wireName())
                .intent(chosen == null ? null : chosen.getIntent())
                .explanation(chosen == null ? null : chosen.getExplanation())
                .fallback(decision.isFallbackUsed())
                .warning(decision.getWarning())
                .errors(decision.getErrorMessage() == null ? List.of() : List.of(decision.getErrorMessage()))
                .build();
    }

    private static ResolveResponse fromChain(CommandChain chain) {
        List<String> errors = new ArrayList<>();
        if (!chain.isSuccess()) {
            errors.add(PARTIAL_FAILURE_MESSAGE);
            for (CommandSegment segment : chain.getSegments()) {
                if (!segment.isSuccess()) {
                    errors.add("Step " + segment.getOrder() + " ('" + segment.getSourceText() + "'): "
                            + segment.getResolution().getErrorMessage());
                }
            }
        }

        ResolutionStatus status = !chain.isSuccess()
                ? ResolutionStatus.UNRESOLVED
                : chain.isFallbackUsed() ? ResolutionStatus.FALLBACK : ResolutionStatus.RESOLVED;

        List<String> warnings = chain.getSegments().stream()
                .map(s -> s.getResolution().getWarning())
                .filter(Objects::nonNull)
                .toList();

        return ResolveResponse.builder()
                .status(status)
                .command(chain.getChainedCommand())
                .confidence(chain.getConfidence())
                .fallback(chain.isFallbackUsed())
                .warning(warnings.isEmpty() ? null : String.join("; ", warnings))
                .errors(errors)
                .build();
    }

    private static List<SegmentResponse> segments(CommandChain chain) {
        List<SegmentResponse> out = new ArrayList<>();
        for (CommandSegment segment : chain.getSegments()) {
            ArbitrationDecision decision = segment.getResolution();
            out.add(SegmentResponse.builder()
                    .order(segment.getOrder())
                    .query(segment.getSourceText())
                    .success(segment.isSuccess())
                    .command(decision.getCommand())
                    .method(decision.isSuccess() ? decision.getMethod().wireName() : null)
                    .confidence(decision.getConfidence())
                    .error(decision.getErrorMessage())
                    .build());
        }
        return out;
    }

    private static List<StepLog> steps(CommandChain chain) {
        List<StepLog> out = new ArrayList<>();
        for (CommandSegment segment : chain.getSegments()) {
            for (StepLog step : segment.getResolution().getSteps()) {
                String name = chain.isMultiCommand() ? segment.getOrder() + ":" + step.getName() : step.getName();
                out.add(new StepLog(name, step.getNote(), step.getAt()));
            }
        }
        return out;
    }
}
