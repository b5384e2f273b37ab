package com.example.nl2cmd.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.nl2cmd.classifier.IntentClassifier;
import com.example.nl2cmd.config.Nl2CmdProperties;
import com.example.nl2cmd.dao.JsonCommandDatasetDao;
import com.example.nl2cmd.dao.JsonProblemCatalogDao;
import com.example.nl2cmd.matcher.ApproximateMatcher;
import com.example.nl2cmd.model.ArbitrationDecision;
import com.example.nl2cmd.model.CandidateResolution;
import com.example.nl2cmd.model.CommandRecord;
import com.example.nl2cmd.model.OsFamily;
import com.example.nl2cmd.model.ProcessedQuery;
import com.example.nl2cmd.model.ResolutionError;
import com.example.nl2cmd.model.ResolutionMethod;
import com.example.nl2cmd.model.ResolutionStatus;
import com.example.nl2cmd.model.StepLog;
import com.example.nl2cmd.model.Suggestion;
import com.example.nl2cmd.normalizer.QueryNormalizer;
import com.example.nl2cmd.strategy.ResolutionStrategy;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.junit.jupiter.api.Test;

class ResolutionArbitratorTest {

  private static final String QUERY = "show my files";

  private static CandidateResolution candidate(ResolutionMethod method, String command, double confidence) {
    return CandidateResolution.builder()
        .method(method)
        .command(command)
        .confidence(confidence)
        .success(true)
        .build();
  }

  private static ResolutionArbitrator arbitrator(ResolutionStrategy... strategies) {
    return new ResolutionArbitrator(new QueryNormalizer(), List.of(strategies),
        Optional.empty(), Optional.empty(), new Nl2CmdProperties());
  }

  @Test
  void acceptsConfidentClassifierWithoutRunningLaterStages() {
    StubStrategy ml = new StubStrategy("classifier", ResolutionMethod.ML,
        () -> candidate(ResolutionMethod.ML, "dir", 0.8));
    StubStrategy template = StubStrategy.failing("template", ResolutionMethod.TEMPLATE);

    ArbitrationDecision decision = arbitrator(ml, template).resolve(QUERY, OsFamily.WINDOWS);

    assertThat(decision.getStatus()).isEqualTo(ResolutionStatus.RESOLVED);
    assertThat(decision.getMethod()).isEqualTo(ResolutionMethod.ML);
    assertThat(decision.getCommand()).isEqualTo("dir");
    assertThat(template.calls).isZero();
  }

  @Test
  void templateWinsOverWeakClassifier() {
    StubStrategy ml = new StubStrategy("classifier", ResolutionMethod.ML,
        () -> candidate(ResolutionMethod.ML, "dir /s", 0.4));
    StubStrategy template = new StubStrategy("template", ResolutionMethod.TEMPLATE,
        () -> candidate(ResolutionMethod.TEMPLATE, "dir", 0.95));

    ArbitrationDecision decision = arbitrator(ml, template).resolve(QUERY, OsFamily.WINDOWS);

    assertThat(decision.getMethod()).isEqualTo(ResolutionMethod.TEMPLATE);
    assertThat(decision.isFallbackUsed()).isFalse();
    assertThat(decision.getRejected()).extracting(CandidateResolution::getCommand).containsExactly("dir /s");
  }

  @Test
  void promotesBestBackupWithWarningWhenNothingClearsItsThreshold() {
    StubStrategy ml = new StubStrategy("classifier", ResolutionMethod.ML,
        () -> candidate(ResolutionMethod.ML, "dir /s", 0.4));
    StubStrategy template = StubStrategy.failing("template", ResolutionMethod.TEMPLATE);
    StubStrategy fuzzy = new StubStrategy("approximate-match", ResolutionMethod.FUZZY,
        () -> candidate(ResolutionMethod.FUZZY, "dir", 0.7));
    StubStrategy rule = StubStrategy.failing("rule", ResolutionMethod.RULE);

    ArbitrationDecision decision = arbitrator(ml, template, fuzzy, rule).resolve(QUERY, OsFamily.WINDOWS);

    assertThat(decision.getStatus()).isEqualTo(ResolutionStatus.FALLBACK);
    assertThat(decision.getCommand()).isEqualTo("dir");
    assertThat(decision.getConfidence()).isEqualTo(0.7);
    assertThat(decision.getWarning()).isEqualTo("Low confidence (70.0%), please verify");
    assertThat(decision.getSteps()).extracting(StepLog::getName).last().isEqualTo("fallback");
    assertThat(rule.calls).isEqualTo(1);
  }

  @Test
  void classifierBackupWinsTies() {
    StubStrategy ml = new StubStrategy("classifier", ResolutionMethod.ML,
        () -> candidate(ResolutionMethod.ML, "tasklist", 0.5));
    StubStrategy fuzzy = new StubStrategy("approximate-match", ResolutionMethod.FUZZY,
        () -> candidate(ResolutionMethod.FUZZY, "dir", 0.5));

    ArbitrationDecision decision = arbitrator(ml, fuzzy).resolve(QUERY, OsFamily.WINDOWS);

    assertThat(decision.getMethod()).isEqualTo(ResolutionMethod.ML);
    assertThat(decision.getWarning()).isEqualTo("Low confidence (50.0%), please verify");
  }

  @Test
  void rejectedTemplateIsNeverUsedAsFallback() {
    StubStrategy template = new StubStrategy("template", ResolutionMethod.TEMPLATE,
        () -> candidate(ResolutionMethod.TEMPLATE, "mkdir x", 0.5));

    ArbitrationDecision decision = arbitrator(template).resolve(QUERY, OsFamily.LINUX);

    assertThat(decision.isSuccess()).isFalse();
    assertThat(decision.getError()).isEqualTo(ResolutionError.NO_RESOLUTION);
    assertThat(decision.getErrorMessage()).isEqualTo(ResolutionArbitrator.NO_RESOLUTION_MESSAGE);
    assertThat(decision.getConfidence()).isZero();
  }

  @Test
  void ruleResolvesWhenEarlierStagesFail() {
    StubStrategy template = StubStrategy.failing("template", ResolutionMethod.TEMPLATE);
    StubStrategy fuzzy = StubStrategy.failing("approximate-match", ResolutionMethod.FUZZY);
    StubStrategy rule = new StubStrategy("rule", ResolutionMethod.RULE,
        () -> candidate(ResolutionMethod.RULE, "ipconfig", 1.0));

    ArbitrationDecision decision = arbitrator(template, fuzzy, rule).resolve("ip address", OsFamily.WINDOWS);

    assertThat(decision.getMethod()).isEqualTo(ResolutionMethod.RULE);
    assertThat(decision.getConfidence()).isEqualTo(1.0);
  }

  @Test
  void throwingStrategyBecomesFailedCandidate() {
    StubStrategy ml = new StubStrategy("classifier", ResolutionMethod.ML, () -> {
      throw new IllegalStateException("model exploded");
    });
    StubStrategy template = new StubStrategy("template", ResolutionMethod.TEMPLATE,
        () -> candidate(ResolutionMethod.TEMPLATE, "dir", 0.95));

    ArbitrationDecision decision = arbitrator(ml, template).resolve(QUERY, OsFamily.WINDOWS);

    assertThat(decision.getMethod()).isEqualTo(ResolutionMethod.TEMPLATE);
    assertThat(decision.getRejected()).singleElement()
        .satisfies(c -> assertThat(c.getError()).isEqualTo("classifier failed: model exploded"));
    assertThat(decision.getSteps()).anySatisfy(step -> {
      assertThat(step.getName()).isEqualTo("classifier");
      assertThat(step.getNote()).startsWith("failed:");
    });
  }

  @Test
  void invalidInputRunsNoStrategy() {
    StubStrategy template = StubStrategy.failing("template", ResolutionMethod.TEMPLATE);

    ArbitrationDecision decision = arbitrator(template).resolve("the a an", OsFamily.WINDOWS);

    assertThat(decision.getError()).isEqualTo(ResolutionError.INVALID_INPUT);
    assertThat(decision.getErrorMessage()).isEqualTo(ResolutionArbitrator.INVALID_INPUT_MESSAGE);
    assertThat(template.calls).isZero();
  }

  @Test
  void forcedRuleSkipsClassifierAndApproximateMatch() {
    StubStrategy ml = StubStrategy.failing("classifier", ResolutionMethod.ML);
    StubStrategy template = StubStrategy.failing("template", ResolutionMethod.TEMPLATE);
    StubStrategy fuzzy = StubStrategy.failing("approximate-match", ResolutionMethod.FUZZY);
    StubStrategy rule = new StubStrategy("rule", ResolutionMethod.RULE,
        () -> candidate(ResolutionMethod.RULE, "ipconfig", 1.0));

    ArbitrationDecision decision = arbitrator(ml, template, fuzzy, rule)
        .resolve("ip address", OsFamily.WINDOWS, ResolutionMethod.RULE);

    assertThat(decision.getMethod()).isEqualTo(ResolutionMethod.RULE);
    assertThat(ml.calls).isZero();
    assertThat(fuzzy.calls).isZero();
    assertThat(template.calls).isEqualTo(1);
  }

  @Test
  void forcedClassifierSkipsApproximateMatchAndRule() {
    StubStrategy ml = StubStrategy.failing("classifier", ResolutionMethod.ML);
    StubStrategy fuzzy = StubStrategy.failing("approximate-match", ResolutionMethod.FUZZY);
    StubStrategy rule = StubStrategy.failing("rule", ResolutionMethod.RULE);

    ArbitrationDecision decision = arbitrator(ml, fuzzy, rule).resolve(QUERY, OsFamily.WINDOWS, ResolutionMethod.ML);

    assertThat(decision.isSuccess()).isFalse();
    assertThat(ml.calls).isEqualTo(1);
    assertThat(fuzzy.calls).isZero();
    assertThat(rule.calls).isZero();
  }

  @Test
  void unavailableStageIsLoggedAndSkipped() {
    StubStrategy ml = StubStrategy.failing("classifier", ResolutionMethod.ML);
    ml.available = false;
    StubStrategy template = new StubStrategy("template", ResolutionMethod.TEMPLATE,
        () -> candidate(ResolutionMethod.TEMPLATE, "dir", 0.95));

    ArbitrationDecision decision = arbitrator(ml, template).resolve(QUERY, OsFamily.WINDOWS);

    assertThat(ml.calls).isZero();
    assertThat(decision.getSteps()).extracting(StepLog::getName)
        .containsExactly("normalize", "ml", "template");
    assertThat(decision.getSteps().get(1).getNote()).isEqualTo("unavailable");
  }

  @Test
  void suggestionsStartWithRuleAndSkipDuplicateCommands() {
    StubStrategy rule = new StubStrategy("rule", ResolutionMethod.RULE,
        () -> candidate(ResolutionMethod.RULE, "ipconfig", 1.0));
    ApproximateMatcher matcher = new ApproximateMatcher(
        JsonCommandDatasetDao.of(Map.of(OsFamily.WINDOWS, List.of(
            new CommandRecord("get my ip address", "show_ip", "ipconfig"),
            new CommandRecord("get my ip addresses", "show_ip_all", "ipconfig /all")))),
        JsonProblemCatalogDao.of(List.of()),
        new Nl2CmdProperties());
    ResolutionArbitrator arbitrator = new ResolutionArbitrator(new QueryNormalizer(), List.of(rule),
        Optional.empty(), Optional.of(matcher), new Nl2CmdProperties());

    List<Suggestion> suggestions = arbitrator.suggestions("get my ip address", OsFamily.WINDOWS, 3);

    assertThat(suggestions).extracting(Suggestion::command).containsExactly("ipconfig", "ipconfig /all");
    assertThat(suggestions.get(0).method()).isEqualTo(ResolutionMethod.RULE);
    assertThat(suggestions.get(1).method()).isEqualTo(ResolutionMethod.FUZZY);
    assertThat(arbitrator.suggestions("get my ip address", OsFamily.WINDOWS, 1)).hasSize(1);
    assertThat(arbitrator.suggestions("the", OsFamily.WINDOWS, 3)).isEmpty();
  }

  @Test
  void confidenceStaysWithinUnitRange() {
    StubStrategy overshooting = new StubStrategy("classifier", ResolutionMethod.ML,
        () -> candidate(ResolutionMethod.ML, "dir", 1.5));
    StubStrategy notANumber = new StubStrategy("approximate-match", ResolutionMethod.FUZZY,
        () -> candidate(ResolutionMethod.FUZZY, "dir", Double.NaN));

    ArbitrationDecision high = arbitrator(overshooting).resolve(QUERY, OsFamily.WINDOWS);
    ArbitrationDecision nan = arbitrator(notANumber).resolve(QUERY, OsFamily.WINDOWS);

    assertThat(high.getMethod()).isEqualTo(ResolutionMethod.ML);
    assertThat(high.getConfidence()).isBetween(0.0, 1.0).isEqualTo(1.0);
    assertThat(nan.getConfidence()).isBetween(0.0, 1.0);
    assertThat(nan.getStatus()).isEqualTo(ResolutionStatus.FALLBACK);
  }

  @Test
  void suggestionsSkipClassifierThatThrows() {
    IntentClassifier classifier = mock(IntentClassifier.class);
    when(classifier.name()).thenReturn("tfidf");
    when(classifier.isAvailable()).thenReturn(true);
    when(classifier.topPredictions(anyString(), anyInt())).thenThrow(new IllegalStateException("model gone"));
    StubStrategy rule = new StubStrategy("rule", ResolutionMethod.RULE,
        () -> candidate(ResolutionMethod.RULE, "ipconfig", 1.0));
    ResolutionArbitrator arbitrator = new ResolutionArbitrator(new QueryNormalizer(), List.of(rule),
        Optional.of(classifier), Optional.empty(), new Nl2CmdProperties());

    List<Suggestion> suggestions = arbitrator.suggestions("get my ip address", OsFamily.WINDOWS, 3);

    assertThat(suggestions).extracting(Suggestion::command).containsExactly("ipconfig");
  }

  private static final class StubStrategy implements ResolutionStrategy {

    private final String name;
    private final ResolutionMethod method;
    private final Supplier<CandidateResolution> result;
    private boolean available = true;
    private int calls;

    StubStrategy(String name, ResolutionMethod method, Supplier<CandidateResolution> result) {
      this.name = name;
      this.method = method;
      this.result = result;
    }

    static StubStrategy failing(String name, ResolutionMethod method) {
      return new StubStrategy(name, method, () -> CandidateResolution.failed(method, "nothing"));
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public ResolutionMethod method() {
      return method;
    }

    @Override
    public boolean isAvailable() {
      return available;
    }

    @Override
    public CandidateResolution resolve(ProcessedQuery query, OsFamily os) {
      calls++;
      return result.get();
    }
  }
}
