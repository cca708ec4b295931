package com.flamingo.ai.notebookrag.service.audio;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.notebookrag.config.RagConfig;
import com.flamingo.ai.notebookrag.domain.entity.Notebook;
import com.flamingo.ai.notebookrag.domain.entity.Source;
import com.flamingo.ai.notebookrag.domain.enums.AudioOverviewStatus;
import com.flamingo.ai.notebookrag.domain.enums.SourceKind;
import com.flamingo.ai.notebookrag.domain.enums.SourceStatus;
import com.flamingo.ai.notebookrag.domain.repository.NotebookRepository;
import com.flamingo.ai.notebookrag.domain.repository.SourceRepository;
import com.flamingo.ai.notebookrag.exception.AudioOverviewNotFoundException;
import com.flamingo.ai.notebookrag.exception.ProviderException;
import com.flamingo.ai.notebookrag.exception.ProviderException.Reason;
import com.flamingo.ai.notebookrag.llm.ChatOptions;
import com.flamingo.ai.notebookrag.llm.ChatTurn;
import com.flamingo.ai.notebookrag.llm.LlmResponse;
import com.flamingo.ai.notebookrag.llm.LlmService;
import com.flamingo.ai.notebookrag.service.job.BackgroundJobRunner;
import com.flamingo.ai.notebookrag.service.notebook.NotebookStateWriter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("AudioOverviewService Tests")
class AudioOverviewServiceTest {

  private static final LocalDateTime NOW = LocalDateTime.of(2026, 1, 1, 10, 0);

  @Mock private NotebookRepository notebookRepository;
  @Mock private SourceRepository sourceRepository;
  @Mock private NotebookStateWriter stateWriter;
  @Mock private LlmService llmService;
  @Mock private AudioRenderer audioRenderer;

  private AudioOverviewService service;
  private UUID notebookId;
  private Notebook notebook;

  @BeforeEach
  void setUp() {
    SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    Clock clock = Clock.fixed(Instant.parse("2026-01-01T10:00:00Z"), ZoneOffset.UTC);
    service =
        new AudioOverviewService(
            notebookRepository,
            sourceRepository,
            stateWriter,
            llmService,
            audioRenderer,
            new BackgroundJobRunner(Runnable::run, meterRegistry),
            new RagConfig(),
            meterRegistry,
            clock);

    notebookId = UUID.randomUUID();
    notebook = Notebook.builder().id(notebookId).ownerId("owner").title("Research").build();
    when(notebookRepository.findById(notebookId)).thenReturn(Optional.of(notebook));
    when(stateWriter.update(eq(notebookId), any()))
        .thenAnswer(
            inv -> {
              Consumer<Notebook> change = inv.getArgument(1);
              change.accept(notebook);
              return notebook;
            });
  }

  private Source completedSource(String summary) {
    return Source.builder()
        .id(UUID.randomUUID())
        .notebook(notebook)
        .kind(SourceKind.TEXT)
        .title("Notes")
        .status(SourceStatus.COMPLETED)
        .summary(summary)
        .extractedText("full text")
        .build();
  }

  @Nested
  @DisplayName("Generation")
  class Generation {

    @Test
    @DisplayName("Should render the script and store a URL valid for 24 hours")
    void shouldCompleteOverview() {
      when(stateWriter.claimAudioGeneration(notebookId)).thenReturn(true);
      when(sourceRepository.findByNotebookIdAndStatusOrderByCreatedAtAsc(
              notebookId, SourceStatus.COMPLETED))
          .thenReturn(List.of(completedSource("Summary of notes")));
      when(llmService.chat(anyList(), any(ChatOptions.class)))
          .thenReturn(new LlmResponse("Speaker 1: Hi\nSpeaker 2: Hello", "openai", "gpt-4o"));
      when(audioRenderer.render(eq(notebookId), any())).thenReturn("/audio/abc.mp3");

      assertThat(service.start(notebookId)).isTrue();

      assertThat(notebook.getAudioOverviewStatus()).isEqualTo(AudioOverviewStatus.COMPLETED);
      assertThat(notebook.getAudioOverviewUrl()).isEqualTo("/audio/abc.mp3");
      assertThat(notebook.getAudioUrlExpiresAt()).isEqualTo(NOW.plusHours(24));
      assertThat(notebook.getAudioOverviewScript()).startsWith("Speaker 1:");

      @SuppressWarnings("unchecked")
      ArgumentCaptor<List<ChatTurn>> captor = ArgumentCaptor.forClass(List.class);
      verify(llmService).chat(captor.capture(), any(ChatOptions.class));
      assertThat(captor.getValue().get(1).content()).contains("Summary of notes");
    }

    @Test
    @DisplayName("Should fail without completed sources and never call the LLM")
    void shouldFail_whenNoCompletedSources() {
      when(stateWriter.claimAudioGeneration(notebookId)).thenReturn(true);
      when(sourceRepository.findByNotebookIdAndStatusOrderByCreatedAtAsc(
              notebookId, SourceStatus.COMPLETED))
          .thenReturn(List.of());

      service.start(notebookId);

      assertThat(notebook.getAudioOverviewStatus()).isEqualTo(AudioOverviewStatus.FAILED);
      verify(llmService, never()).chat(anyList(), any(ChatOptions.class));
    }

    @Test
    @DisplayName("Should mark failed when the LLM call fails")
    void shouldFail_whenLlmFails() {
      when(stateWriter.claimAudioGeneration(notebookId)).thenReturn(true);
      when(sourceRepository.findByNotebookIdAndStatusOrderByCreatedAtAsc(
              notebookId, SourceStatus.COMPLETED))
          .thenReturn(List.of(completedSource("s")));
      when(llmService.chat(anyList(), any(ChatOptions.class)))
          .thenThrow(new ProviderException(Reason.NETWORK, "openai", "timeout"));

      service.start(notebookId);

      assertThat(notebook.getAudioOverviewStatus()).isEqualTo(AudioOverviewStatus.FAILED);
      verify(audioRenderer, never()).render(any(), any());
    }

    @Test
    @DisplayName("Should not start twice while generating")
    void shouldNotStartTwice() {
      when(stateWriter.claimAudioGeneration(notebookId)).thenReturn(false);

      assertThat(service.start(notebookId)).isFalse();
      verify(sourceRepository, never()).findByNotebookIdAndStatusOrderByCreatedAtAsc(any(), any());
    }
  }

  @Nested
  @DisplayName("Reading and maintenance")
  class Reading {

    @Test
    @DisplayName("Should report EXPIRED without a URL once the expiry has passed")
    void shouldReportExpired() {
      notebook.setAudioOverviewStatus(AudioOverviewStatus.COMPLETED);
      notebook.setAudioOverviewUrl("/audio/abc.mp3");
      notebook.setAudioUrlExpiresAt(NOW.minusMinutes(1));

      AudioOverview overview = service.getOverview(notebookId);

      assertThat(overview.status()).isEqualTo(AudioOverviewStatus.EXPIRED);
      assertThat(overview.url()).isNull();
      assertThat(notebook.getAudioOverviewStatus()).isEqualTo(AudioOverviewStatus.COMPLETED);
    }

    @Test
    @DisplayName("Should return the URL while it is valid")
    void shouldReturnValidUrl() {
      notebook.setAudioOverviewStatus(AudioOverviewStatus.COMPLETED);
      notebook.setAudioOverviewUrl("/audio/abc.mp3");
      notebook.setAudioUrlExpiresAt(NOW.plusHours(1));

      AudioOverview overview = service.getOverview(notebookId);

      assertThat(overview)
          .isEqualTo(
              new AudioOverview(
                  AudioOverviewStatus.COMPLETED, "/audio/abc.mp3", NOW.plusHours(1)));
    }

    @Test
    @DisplayName("Should extend expiry on refresh")
    void shouldRefreshUrl() {
      notebook.setAudioOverviewStatus(AudioOverviewStatus.COMPLETED);
      notebook.setAudioOverviewUrl("/audio/abc.mp3");
      notebook.setAudioUrlExpiresAt(NOW.minusHours(2));

      AudioOverview overview = service.refreshUrl(notebookId);

      assertThat(overview.expiresAt()).isEqualTo(NOW.plusHours(24));
      assertThat(notebook.getAudioUrlExpiresAt()).isEqualTo(NOW.plusHours(24));
    }

    @Test
    @DisplayName("Should refuse to refresh when no audio exists")
    void shouldFailRefresh_whenNoAudio() {
      assertThatThrownBy(() -> service.refreshUrl(notebookId))
          .isInstanceOf(AudioOverviewNotFoundException.class);
    }

    @Test
    @DisplayName("Should delete the asset and clear all fields")
    void shouldDeleteOverview() {
      notebook.setAudioOverviewStatus(AudioOverviewStatus.COMPLETED);
      notebook.setAudioOverviewUrl("/audio/abc.mp3");
      notebook.setAudioUrlExpiresAt(NOW.plusHours(1));
      notebook.setAudioOverviewScript("script");

      service.delete(notebookId);

      verify(audioRenderer).delete("/audio/abc.mp3");
      assertThat(notebook.getAudioOverviewUrl()).isNull();
      assertThat(notebook.getAudioOverviewStatus()).isNull();
      assertThat(notebook.getAudioOverviewScript()).isNull();
    }
  }
}
