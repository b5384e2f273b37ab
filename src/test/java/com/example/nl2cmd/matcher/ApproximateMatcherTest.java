package com.example.nl2cmd.matcher;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.nl2cmd.config.Nl2CmdProperties;
import com.example.nl2cmd.dao.JsonCommandDatasetDao;
import com.example.nl2cmd.dao.JsonProblemCatalogDao;
import com.example.nl2cmd.model.CommandRecord;
import com.example.nl2cmd.model.DiagnosisResult;
import com.example.nl2cmd.model.MatchSource;
import com.example.nl2cmd.model.OsFamily;
import com.example.nl2cmd.model.ProblemCategory;
import com.example.nl2cmd.model.ProblemEntry;
import com.example.nl2cmd.model.SimilarityMatch;
import com.example.nl2cmd.model.SmartSearchResult;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ApproximateMatcherTest {

  private static final ProblemCategory NETWORK = new ProblemCategory(
      "network",
      List.of("network", "internet", "connection", "wifi", "lan", "not working"),
      Map.of(
          "windows", List.of(
              new ProblemEntry("internet not working",
                  "ipconfig /release && ipconfig /renew && ipconfig /flushdns",
                  "Reset network connection and flush DNS"),
              new ProblemEntry("wifi not connecting", "netsh wlan show networks",
                  "Show available WiFi networks")),
          "linux", List.of(
              new ProblemEntry("internet not working", "sudo systemctl restart NetworkManager",
                  "Restart network service"))));

  private static ApproximateMatcher newMatcher(Nl2CmdProperties properties) {
    JsonCommandDatasetDao dataset = JsonCommandDatasetDao.of(Map.of(
        OsFamily.WINDOWS, List.of(
            new CommandRecord("list all files", "list_files", "dir"),
            new CommandRecord("show system information", "system_info", "systeminfo")),
        OsFamily.LINUX, List.of(
            new CommandRecord("list all files", "list_files", "ls -la"),
            new CommandRecord("show system information", "system_info", "uname -a"),
            new CommandRecord("update packages", "update_packages", "sudo apt update"))));
    return new ApproximateMatcher(dataset, JsonProblemCatalogDao.of(List.of(NETWORK)), properties);
  }

  private final ApproximateMatcher matcher = newMatcher(new Nl2CmdProperties());

  @Test
  void searchRanksTypoMatchFirst() {
    List<SimilarityMatch> matches = matcher.search("lst all files", 60, 5, OsFamily.WINDOWS);

    assertThat(matches).isNotEmpty();
    assertThat(matches.get(0).matchedKey()).isEqualTo("list all files");
    assertThat(matches.get(0).info().commandFor(OsFamily.WINDOWS)).contains("dir");
    assertThat(matches.get(0).info().commandFor(OsFamily.LINUX)).contains("ls -la");
  }

  @Test
  void searchSkipsEntriesWithoutCommandForOs() {
    assertThat(matcher.search("update packages", 60, 5, OsFamily.WINDOWS))
        .extracting(SimilarityMatch::matchedKey)
        .doesNotContain("update packages");
    assertThat(matcher.search("update packages", 60, 5, OsFamily.LINUX))
        .extracting(SimilarityMatch::matchedKey)
        .first()
        .isEqualTo("update packages");
  }

  @Test
  void searchHonoursThresholdAndLimit() {
    assertThat(matcher.search("list all files", 101, 5)).isEmpty();
    assertThat(matcher.search("list all files", 0, 1)).hasSize(1);
    assertThat(matcher.search("list all files", 60, 0)).isEmpty();
  }

  @Test
  void raisingThresholdNeverAddsMatches() {
    int previous = Integer.MAX_VALUE;
    for (int threshold = 0; threshold <= 100; threshold += 10) {
      int size = matcher.search("show info", threshold, 10).size();
      assertThat(size).isLessThanOrEqualTo(previous);
      previous = size;
    }
  }

  @Test
  void diagnoseScoresKeywordAndProblemWordOverlap() {
    List<DiagnosisResult> results = matcher.diagnose("internet not wrking", OsFamily.WINDOWS);

    assertThat(results).extracting(DiagnosisResult::problem)
        .containsExactly("internet not working", "wifi not connecting");
    assertThat(results.get(0).relevance()).isEqualTo(3);
    assertThat(results.get(0).category()).isEqualTo("network");
    assertThat(results.get(1).relevance()).isEqualTo(2);
  }

  @Test
  void diagnoseMatchesKeywordsAsWholeWords() {
    assertThat(matcher.diagnose("plan my day", OsFamily.WINDOWS)).isEmpty();
  }

  @Test
  void smartSearchPrefersStrongDiagnosis() {
    SmartSearchResult result = matcher.smartSearch("internet not wrking", OsFamily.WINDOWS);

    assertThat(result.hasBestMatch()).isTrue();
    assertThat(result.getBestMatch().getSource()).isEqualTo(MatchSource.PROBLEM_DIAGNOSIS);
    assertThat(result.getBestMatch().getCommand()).startsWith("ipconfig /release");
    assertThat(result.getConfidence()).isEqualTo(90);
  }

  @Test
  void smartSearchUsesHighScoringSimilarityMatch() {
    SmartSearchResult result = matcher.smartSearch("lst all files", OsFamily.LINUX);

    assertThat(result.getBestMatch().getSource()).isEqualTo(MatchSource.FUZZY_MATCH);
    assertThat(result.getBestMatch().getCommand()).isEqualTo("ls -la");
    assertThat(result.getBestMatch().getIntent()).isEqualTo("list_files");
    assertThat(result.getConfidence()).isGreaterThanOrEqualTo(85);
  }

  @Test
  void smartSearchWithoutAnyMatchHasNoBestMatch() {
    SmartSearchResult result = matcher.smartSearch("xyzzy plugh", OsFamily.WINDOWS);

    assertThat(result.hasBestMatch()).isFalse();
    assertThat(result.getConfidence()).isZero();
  }

  @Test
  void disabledMatcherIsUnavailable() {
    Nl2CmdProperties properties = new Nl2CmdProperties();
    properties.getMatcher().setEnabled(false);

    ApproximateMatcher disabled = newMatcher(properties);

    assertThat(disabled.isAvailable()).isFalse();
    assertThat(disabled.search("list all files", 0, 5)).isEmpty();
  }
}
