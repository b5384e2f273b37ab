package com.example.nl2cmd.template;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.nl2cmd.model.CommandAnalysis;
import com.example.nl2cmd.model.NestedOperation;
import com.example.nl2cmd.model.ParameterNames;
import org.junit.jupiter.api.Test;

class ParameterExtractorTest {

  private final ParameterExtractor extractor = new ParameterExtractor();

  @Test
  void detectsActionTargetAndFolderName() {
    CommandAnalysis analysis = extractor.analyze("create a folder named proj");

    assertThat(analysis.getIntent()).isEqualTo("create");
    assertThat(analysis.getAction()).isEqualTo("create");
    assertThat(analysis.getTargets()).containsExactly("folder");
    assertThat(analysis.getParameters()).containsEntry(ParameterNames.FOLDERNAME, "proj");
    assertThat(analysis.getNestedOperation()).isNull();
  }

  @Test
  void versionControlGrammarWinsOverGenericVerbs() {
    CommandAnalysis status = extractor.analyze("show git status");
    CommandAnalysis branch = extractor.analyze("create a new branch named feature/login");

    assertThat(status.getIntent()).isEqualTo("git_status");
    assertThat(status.getAction()).isEqualTo("git");
    assertThat(status.isVersionControl()).isTrue();
    assertThat(branch.getIntent()).isEqualTo("git_create_branch");
    assertThat(branch.getParameters()).containsEntry(ParameterNames.BRANCHNAME, "feature/login");
  }

  @Test
  void extractsQuotedCommitMessage() {
    CommandAnalysis analysis = extractor.analyze("git commit with message \"fix login bug\"");

    assertThat(analysis.getIntent()).isEqualTo("git_commit");
    assertThat(analysis.getParameters()).containsEntry(ParameterNames.MESSAGE, "fix login bug");
  }

  @Test
  void detectsFolderWithFileNesting() {
    CommandAnalysis analysis = extractor.analyze("create folder named src with file named main.py");

    assertThat(analysis.getNestedOperation()).isEqualTo(NestedOperation.folderWithFile("src", "main.py"));
  }

  @Test
  void detectsFileInsideFolderNesting() {
    CommandAnalysis analysis = extractor.analyze("make file called app.log inside directory logs");

    assertThat(analysis.getNestedOperation()).isEqualTo(NestedOperation.folderWithFile("logs", "app.log"));
  }

  @Test
  void extractsProcessName() {
    CommandAnalysis analysis = extractor.analyze("kill process chrome");

    assertThat(analysis.getIntent()).isEqualTo("kill");
    assertThat(analysis.getTargets()).containsExactly("process");
    assertThat(analysis.getParameters()).containsEntry(ParameterNames.PROCESS, "chrome");
  }

  @Test
  void queryWithoutVerbHasNoIntent() {
    CommandAnalysis analysis = extractor.analyze("hello there");

    assertThat(analysis.getIntent()).isNull();
    assertThat(analysis.getTargets()).isEmpty();
  }
}
