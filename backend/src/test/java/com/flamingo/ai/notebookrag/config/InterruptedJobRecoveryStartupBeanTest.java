package com.flamingo.ai.notebookrag.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.notebookrag.domain.entity.Notebook;
import com.flamingo.ai.notebookrag.domain.entity.Source;
import com.flamingo.ai.notebookrag.domain.enums.AudioOverviewStatus;
import com.flamingo.ai.notebookrag.domain.enums.GenerationStatus;
import com.flamingo.ai.notebookrag.domain.enums.SourceKind;
import com.flamingo.ai.notebookrag.domain.enums.SourceStatus;
import com.flamingo.ai.notebookrag.domain.repository.NotebookRepository;
import com.flamingo.ai.notebookrag.domain.repository.SourceRepository;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

/** Recovery of jobs left running by a stopped process, against a throwaway SQLite file. */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(InterruptedJobRecoveryStartupBean.class)
@DisplayName("InterruptedJobRecoveryStartupBean")
class InterruptedJobRecoveryStartupBeanTest {

  @DynamicPropertySource
  static void sqlite(DynamicPropertyRegistry registry) throws IOException {
    Path db = Files.createTempFile("notebook-rag-recovery", ".db");
    db.toFile().deleteOnExit();
    registry.add("spring.datasource.url", () -> "jdbc:sqlite:" + db.toAbsolutePath());
  }

  @Autowired private InterruptedJobRecoveryStartupBean recovery;
  @Autowired private NotebookRepository notebookRepository;
  @Autowired private SourceRepository sourceRepository;

  private Notebook notebook(GenerationStatus generation, AudioOverviewStatus audio) {
    return notebookRepository.save(
        Notebook.builder()
            .ownerId("owner")
            .title("Research")
            .generationStatus(generation)
            .audioOverviewStatus(audio)
            .build());
  }

  private Source source(Notebook notebook, SourceStatus status) {
    return sourceRepository.save(
        Source.builder()
            .notebook(notebook)
            .kind(SourceKind.TEXT)
            .title("Notes")
            .inlineText("text")
            .status(status)
            .build());
  }

  @Test
  @DisplayName("Should fail sources left PROCESSING so they can be claimed again")
  void shouldFailInterruptedSources() {
    Notebook notebook = notebook(GenerationStatus.COMPLETED, null);
    Source interrupted = source(notebook, SourceStatus.PROCESSING);
    Source completed = source(notebook, SourceStatus.COMPLETED);
    Source pending = source(notebook, SourceStatus.PENDING);

    assertThat(recovery.recover()).isEqualTo(1);

    Source recovered = sourceRepository.findById(interrupted.getId()).orElseThrow();
    assertThat(recovered.getStatus()).isEqualTo(SourceStatus.FAILED);
    assertThat(recovered.getProcessingError())
        .isEqualTo(InterruptedJobRecoveryStartupBean.INTERRUPTED_ERROR);
    assertThat(sourceRepository.findById(completed.getId()).orElseThrow().getStatus())
        .isEqualTo(SourceStatus.COMPLETED);
    assertThat(sourceRepository.findById(pending.getId()).orElseThrow().getStatus())
        .isEqualTo(SourceStatus.PENDING);

    assertThat(
            sourceRepository.claimForProcessing(
                interrupted.getId(), EnumSet.of(SourceStatus.PENDING, SourceStatus.FAILED)))
        .isEqualTo(1);
  }

  @Test
  @DisplayName("Should fail notebook jobs left GENERATING so they can be started again")
  void shouldFailInterruptedNotebookJobs() {
    Notebook stuck = notebook(GenerationStatus.GENERATING, AudioOverviewStatus.GENERATING);
    Notebook done = notebook(GenerationStatus.COMPLETED, AudioOverviewStatus.COMPLETED);

    assertThat(recovery.recover()).isEqualTo(2);

    Notebook recovered = notebookRepository.findById(stuck.getId()).orElseThrow();
    assertThat(recovered.getGenerationStatus()).isEqualTo(GenerationStatus.FAILED);
    assertThat(recovered.getAudioOverviewStatus()).isEqualTo(AudioOverviewStatus.FAILED);
    Notebook untouched = notebookRepository.findById(done.getId()).orElseThrow();
    assertThat(untouched.getGenerationStatus()).isEqualTo(GenerationStatus.COMPLETED);
    assertThat(untouched.getAudioOverviewStatus()).isEqualTo(AudioOverviewStatus.COMPLETED);

    assertThat(notebookRepository.claimContentGeneration(stuck.getId())).isEqualTo(1);
    assertThat(notebookRepository.claimAudioGeneration(stuck.getId())).isEqualTo(1);
  }

  @Test
  @DisplayName("Should change nothing when no job was interrupted")
  void shouldDoNothing_whenNothingInterrupted() {
    Notebook notebook = notebook(GenerationStatus.PENDING, null);
    source(notebook, SourceStatus.FAILED);

    assertThat(recovery.recover()).isZero();
  }
}
