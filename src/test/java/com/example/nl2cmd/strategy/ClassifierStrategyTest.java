package com.example.nl2cmd.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.nl2cmd.classifier.IntentClassifier;
import com.example.nl2cmd.classifier.Prediction;
import com.example.nl2cmd.config.Nl2CmdProperties;
import com.example.nl2cmd.model.CandidateResolution;
import com.example.nl2cmd.model.OsFamily;
import com.example.nl2cmd.model.ProcessedQuery;
import com.example.nl2cmd.model.ResolutionMethod;
import com.example.nl2cmd.normalizer.QueryNormalizer;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ClassifierStrategyTest {

  private final IntentClassifier classifier = mock(IntentClassifier.class);
  private final ProcessedQuery query = new QueryNormalizer().normalize("show running processes");

  private ClassifierStrategy strategy;

  @BeforeEach
  void setUp() {
    when(classifier.name()).thenReturn("tfidf");
    when(classifier.isAvailable()).thenReturn(true);
    strategy = new ClassifierStrategy(Optional.of(classifier), new Nl2CmdProperties());
  }

  @Test
  void confidentPredictionSucceeds() {
    when(classifier.predict(query.getNormalized()))
        .thenReturn(new Prediction("list_processes", Map.of("list_processes", 0.82)));
    when(classifier.labelToCommand("list_processes", OsFamily.LINUX)).thenReturn(Optional.of("ps aux"));

    CandidateResolution candidate = strategy.resolve(query, OsFamily.LINUX);

    assertThat(candidate.isSuccess()).isTrue();
    assertThat(candidate.getMethod()).isEqualTo(ResolutionMethod.ML);
    assertThat(candidate.getCommand()).isEqualTo("ps aux");
    assertThat(candidate.getIntent()).isEqualTo("list_processes");
  }

  @Test
  void weakPredictionKeepsCommandForFallback() {
    when(classifier.predict(query.getNormalized()))
        .thenReturn(new Prediction("list_processes", Map.of("list_processes", 0.41, "kill_process", 0.2)));
    when(classifier.labelToCommand("list_processes", OsFamily.LINUX)).thenReturn(Optional.of("ps aux"));

    CandidateResolution candidate = strategy.resolve(query, OsFamily.LINUX);

    assertThat(candidate.isSuccess()).isFalse();
    assertThat(candidate.hasCommand()).isTrue();
    assertThat(candidate.getCommand()).isEqualTo("ps aux");
    assertThat(candidate.getConfidence()).isEqualTo(0.41);
  }

  @Test
  void labelWithoutCommandForOsFails() {
    when(classifier.predict(query.getNormalized()))
        .thenReturn(new Prediction("list_processes", Map.of("list_processes", 0.9)));
    when(classifier.labelToCommand("list_processes", OsFamily.WINDOWS)).thenReturn(Optional.empty());

    CandidateResolution candidate = strategy.resolve(query, OsFamily.WINDOWS);

    assertThat(candidate.isSuccess()).isFalse();
    assertThat(candidate.hasCommand()).isFalse();
    assertThat(candidate.getConfidence()).isZero();
    assertThat(candidate.getError()).isEqualTo("No windows command for intent list_processes");
  }

  @Test
  void throwingClassifierYieldsFailedCandidate() {
    when(classifier.predict(query.getNormalized())).thenThrow(new IllegalStateException("vectors missing"));

    CandidateResolution candidate = strategy.resolve(query, OsFamily.LINUX);

    assertThat(candidate.isSuccess()).isFalse();
    assertThat(candidate.hasCommand()).isFalse();
    assertThat(candidate.getError()).isEqualTo("ML prediction failed: vectors missing");
  }

  @Test
  void missingClassifierIsUnavailable() {
    ClassifierStrategy none = new ClassifierStrategy(Optional.empty(), new Nl2CmdProperties());

    assertThat(none.isAvailable()).isFalse();
    assertThat(none.resolve(query, OsFamily.LINUX).isSuccess()).isFalse();
  }
}
