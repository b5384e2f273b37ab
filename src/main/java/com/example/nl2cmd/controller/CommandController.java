package com.example.nl2cmd.controller;

import com.example.nl2cmd.request.ResolveRequest;
import com.example.nl2cmd.response.DiagnosisResponse;
import com.example.nl2cmd.response.ResolveResponse;
import com.example.nl2cmd.response.SuggestionResponse;
import com.example.nl2cmd.service.CommandResolutionService;
import com.example.nl2cmd.validation.ValidationException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.support.WebExchangeBindException;
import reactor.core.publisher.Mono;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/v1/commands")
@Tag(name = "Command resolution", description = "Translate natural-language requests into shell commands")
@RequiredArgsConstructor
public class CommandController {

    private static final int DEFAULT_SUGGESTIONS = 3;

    private final CommandResolutionService resolutionService;

    @PostMapping("/resolve")
    @Operation(
            summary = "Resolve a request into a shell command",
            description = "Runs the resolution cascade (chaining compound requests) and returns the command with its risk assessment."
    )
    public Mono<ResponseEntity<ResolveResponse>> resolve(@Valid @RequestBody ResolveRequest req) {
        return resolutionService.resolve(req)
                .map(ResponseEntity::ok)
                .onErrorResume(ValidationException.class, ex ->
                        Mono.just(ResponseEntity.badRequest().body(ResolveResponse.builder()
                                .notices(List.of())
                                .errors(List.copyOf(ex.getReasons()))
                                .build())))
                .onErrorResume(ex -> {
                    log.error("Unexpected failure while resolving command", ex);
                    return Mono.just(ResponseEntity.internalServerError().body(ResolveResponse.builder()
                            .notices(List.of())
                            .errors(List.of(unexpectedMessage(ex)))
                            .build()));
                });
    }

    @GetMapping("/diagnose")
    @Operation(summary = "Diagnose a problem description", description = "Returns up to three curated fixes for the OS family.")
    public Mono<ResponseEntity<DiagnosisResponse>> diagnose(@RequestParam("q") String query,
                                                            @RequestParam(value = "os", required = false) String os) {
        return resolutionService.diagnose(query, os)
                .map(results -> ResponseEntity.ok(DiagnosisResponse.builder()
                        .query(query)
                        .os(resolutionService.selectOs(os).key())
                        .results(results)
                        .errors(List.of())
                        .build()))
                .onErrorResume(ValidationException.class, ex ->
                        Mono.just(ResponseEntity.badRequest().body(DiagnosisResponse.builder()
                                .query(query)
                                .results(List.of())
                                .errors(List.copyOf(ex.getReasons()))
                                .build())))
                .onErrorResume(ex -> {
                    log.error("Unexpected failure while diagnosing problem", ex);
                    return Mono.just(ResponseEntity.internalServerError().body(DiagnosisResponse.builder()
                            .query(query)
                            .results(List.of())
                            .errors(List.of(unexpectedMessage(ex)))
                            .build()));
                });
    }

    @GetMapping("/suggest")
    @Operation(summary = "Suggest alternative commands", description = "Rule match first, then classifier predictions, then the closest dataset queries.")
    public Mono<ResponseEntity<SuggestionResponse>> suggest(@RequestParam("q") String query,
                                                            @RequestParam(value = "os", required = false) String os,
                                                            @RequestParam(value = "n", required = false) Integer n) {
        int limit = n == null ? DEFAULT_SUGGESTIONS : n;
        return resolutionService.suggest(query, os, limit)
                .map(suggestions -> ResponseEntity.ok(SuggestionResponse.builder()
                        .query(query)
                        .os(resolutionService.selectOs(os).key())
                        .suggestions(suggestions)
                        .errors(List.of())
                        .build()))
                .onErrorResume(ValidationException.class, ex ->
                        Mono.just(ResponseEntity.badRequest().body(SuggestionResponse.builder()
                                .query(query)
                                .suggestions(List.of())
                                .errors(List.copyOf(ex.getReasons()))
                                .build())))
                .onErrorResume(ex -> {
                    log.error("Unexpected failure while suggesting commands", ex);
                    return Mono.just(ResponseEntity.internalServerError().body(SuggestionResponse.builder()
                            .query(query)
                            .suggestions(List.of())
                            .errors(List.of(unexpectedMessage(ex)))
                            .build()));
                });
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ResolveResponse> invalidBody(WebExchangeBindException ex) {
        List<String> errors = ex.getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .toList();
        return ResponseEntity.badRequest().body(ResolveResponse.builder()
                .notices(List.of())
                .errors(errors)
                .build());
    }

    private static String unexpectedMessage(Throwable ex) {
        String detail = ex.getMessage();
        return (detail == null || detail.isBlank())
                ? "Unexpected error occurred."
                : "Unexpected error: " + detail;
    }
}
