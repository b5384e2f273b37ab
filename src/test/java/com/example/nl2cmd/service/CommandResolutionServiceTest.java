package com.example.nl2cmd.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.nl2cmd.config.Nl2CmdProperties;
import com.example.nl2cmd.dao.JsonCommandDatasetDao;
import com.example.nl2cmd.dao.JsonCommandRuleDao;
import com.example.nl2cmd.dao.JsonProblemCatalogDao;
import com.example.nl2cmd.matcher.ApproximateMatcher;
import com.example.nl2cmd.model.CommandRecord;
import com.example.nl2cmd.model.CommandRule;
import com.example.nl2cmd.model.DiagnosisResult;
import com.example.nl2cmd.model.OsFamily;
import com.example.nl2cmd.model.ProblemCategory;
import com.example.nl2cmd.model.ProblemEntry;
import com.example.nl2cmd.model.ResolutionStatus;
import com.example.nl2cmd.model.RiskSeverity;
import com.example.nl2cmd.model.StepLog;
import com.example.nl2cmd.model.Suggestion;
import com.example.nl2cmd.normalizer.QueryNormalizer;
import com.example.nl2cmd.request.ResolveRequest;
import com.example.nl2cmd.response.ResolveResponse;
import com.example.nl2cmd.response.SegmentResponse;
import com.example.nl2cmd.risk.PatternRiskAssessor;
import com.example.nl2cmd.rule.KeywordRuleMatcher;
import com.example.nl2cmd.strategy.ApproximateMatchStrategy;
import com.example.nl2cmd.strategy.ClassifierStrategy;
import com.example.nl2cmd.strategy.RuleStrategy;
import com.example.nl2cmd.strategy.TemplateStrategy;
import com.example.nl2cmd.template.CommandTemplateCatalog;
import com.example.nl2cmd.template.CommandTemplateEngine;
import com.example.nl2cmd.template.ParameterExtractor;
import com.example.nl2cmd.validation.ControlCharacterValidator;
import com.example.nl2cmd.validation.MaxCharsValidator;
import com.example.nl2cmd.validation.NotBlankInputValidator;
import com.example.nl2cmd.validation.ValidationException;
import com.example.nl2cmd.validation.ValidationService;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

class CommandResolutionServiceTest {

  private CommandResolutionService service;

  @BeforeEach
  void setUp() {
    Nl2CmdProperties properties = new Nl2CmdProperties();
    ApproximateMatcher matcher = new ApproximateMatcher(
        JsonCommandDatasetDao.of(Map.of(
            OsFamily.WINDOWS, List.of(new CommandRecord("list all files", "list_files", "dir")),
            OsFamily.LINUX, List.of(new CommandRecord("list all files", "list_files", "ls -la")))),
        JsonProblemCatalogDao.of(List.of(new ProblemCategory(
            "network",
            List.of("network", "internet", "wifi", "not working"),
            Map.of("windows", List.of(new ProblemEntry("internet not working",
                "ipconfig /release && ipconfig /renew && ipconfig /flushdns",
                "Reset network connection and flush DNS")))))),
        properties);
    KeywordRuleMatcher rules = new KeywordRuleMatcher(JsonCommandRuleDao.of(Map.of(
        OsFamily.WINDOWS, List.of(new CommandRule(List.of("hostname"), "hostname")))));

    ResolutionArbitrator arbitrator = new ResolutionArbitrator(
        new QueryNormalizer(),
        List.of(
            new ClassifierStrategy(Optional.empty(), properties),
            new TemplateStrategy(new ParameterExtractor(), new CommandTemplateEngine(CommandTemplateCatalog.builtIn())),
            new ApproximateMatchStrategy(matcher),
            new RuleStrategy(rules)),
        Optional.empty(),
        Optional.of(matcher),
        properties);

    ValidationService validation = new ValidationService(List.of(
        new MaxCharsValidator(120), new ControlCharacterValidator(), new NotBlankInputValidator()));

    service = new CommandResolutionService(validation, new MultiCommandOrchestrator(arbitrator), arbitrator,
        matcher, new PatternRiskAssessor(), OsFamily.WINDOWS);
  }

  private ResolveResponse resolve(ResolveRequest request) {
    return service.resolve(request).block();
  }

  @Test
  void resolvesTypoThroughApproximateMatch() {
    ResolveResponse response = resolve(new ResolveRequest().setQuery("lst all files").setOs("linux"));

    assertThat(response.getStatus()).isEqualTo(ResolutionStatus.RESOLVED);
    assertThat(response.getCommand()).isEqualTo("ls -la");
    assertThat(response.getMethod()).isEqualTo("fuzzy");
    assertThat(response.getOs()).isEqualTo("linux");
    assertThat(response.isMultiCommand()).isFalse();
    assertThat(response.getSegments()).hasSize(1);
    assertThat(response.getRisk().isRisky()).isFalse();
    assertThat(response.getErrors()).isEmpty();
  }

  @Test
  void diagnosesProblemDescriptions() {
    ResolveResponse response = resolve(new ResolveRequest().setQuery("internet not wrking"));

    assertThat(response.getOs()).isEqualTo("windows");
    assertThat(response.getMethod()).isEqualTo("problem_diagnosis");
    assertThat(response.getCommand()).startsWith("ipconfig /release");
    assertThat(response.getConfidence()).isEqualTo(0.9);
    assertThat(response.getExplanation()).isEqualTo("Reset network connection and flush DNS");
  }

  @Test
  void chainsCompoundRequests() {
    ResolveResponse response = resolve(new ResolveRequest()
        .setQuery("create a folder named proj and then create a file named notes.txt inside the folder")
        .setOs("windows"));

    assertThat(response.getStatus()).isEqualTo(ResolutionStatus.RESOLVED);
    assertThat(response.isMultiCommand()).isTrue();
    assertThat(response.getCommand()).isEqualTo("mkdir proj && echo. > proj\\notes.txt");
    assertThat(response.getSegments()).extracting(SegmentResponse::getCommand)
        .containsExactly("mkdir proj", "echo. > proj\\notes.txt");
    assertThat(response.getSteps()).extracting(StepLog::getName).contains("1:template", "2:template");
  }

  @Test
  void reportsEveryFailedSegment() {
    ResolveResponse response = resolve(new ResolveRequest()
        .setQuery("create a folder named proj and then delete the moon")
        .setOs("linux"));

    assertThat(response.getStatus()).isEqualTo(ResolutionStatus.UNRESOLVED);
    assertThat(response.getCommand()).isNull();
    assertThat(response.getRisk()).isNull();
    assertThat(response.getErrors()).containsExactly(
        "Unable to resolve every part of the request.",
        "Step 2 ('delete the moon'): " + ResolutionArbitrator.NO_RESOLUTION_MESSAGE);
  }

  @Test
  void attachesRiskAssessment() {
    ResolveResponse response = resolve(new ResolveRequest().setQuery("delete the file named secrets.txt"));

    assertThat(response.getCommand()).isEqualTo("del secrets.txt");
    assertThat(response.getRisk().getSeverity()).isEqualTo(RiskSeverity.MEDIUM);
  }

  @Test
  void forcedRuleMethodUsesRuleStage() {
    ResolveResponse response = resolve(new ResolveRequest().setQuery("print the hostname").setMethod("RULE"));

    assertThat(response.getMethod()).isEqualTo("rule");
    assertThat(response.getCommand()).isEqualTo("hostname");
    assertThat(response.getConfidence()).isEqualTo(1.0);
  }

  @Test
  void unresolvedQueryCarriesNoResolutionMessage() {
    ResolveResponse response = resolve(new ResolveRequest().setQuery("xyzzy plugh"));

    assertThat(response.getStatus()).isEqualTo(ResolutionStatus.UNRESOLVED);
    assertThat(response.getErrors()).containsExactly(ResolutionArbitrator.NO_RESOLUTION_MESSAGE);
    assertThat(response.getSegments()).singleElement()
        .satisfies(segment -> assertThat(segment.isSuccess()).isFalse());
  }

  @Test
  void sanitizedQueryReportsNotices() {
    ResolveResponse response = resolve(new ResolveRequest().setQuery("list\tall files"));

    assertThat(response.getQuery()).isEqualTo("list all files");
    assertThat(response.getCommand()).isEqualTo("dir");
    assertThat(response.getNotices()).containsExactly("Control characters were replaced with spaces.");
  }

  @Test
  void rejectsBlankQueries() {
    StepVerifier.create(service.resolve(new ResolveRequest().setQuery("   ")))
        .expectError(ValidationException.class)
        .verify();
  }

  @Test
  void rejectsUnknownOsAndMethod() {
    StepVerifier.create(service.resolve(new ResolveRequest().setQuery("list all files").setOs("beos")))
        .expectErrorMatches(ex -> ex instanceof ValidationException
            && ex.getMessage().equals("Unsupported os 'beos'. Use windows or linux."))
        .verify();
    StepVerifier.create(service.resolve(new ResolveRequest().setQuery("list all files").setMethod("template")))
        .expectError(ValidationException.class)
        .verify();
  }

  @Test
  void diagnoseReturnsCuratedFixes() {
    List<DiagnosisResult> results = service.diagnose("internet not wrking", "windows").block();

    assertThat(results).extracting(DiagnosisResult::category).containsExactly("network");
  }

  @Test
  void suggestReturnsDatasetMatches() {
    List<Suggestion> suggestions = service.suggest("lst all files", "linux", 3).block();

    assertThat(suggestions).extracting(Suggestion::command).containsExactly("ls -la");
  }
}
