package com.flamingo.ai.notebookrag.service.audio;

import com.flamingo.ai.notebookrag.config.RagConfig;
import com.flamingo.ai.notebookrag.domain.entity.Notebook;
import com.flamingo.ai.notebookrag.domain.entity.Source;
import com.flamingo.ai.notebookrag.domain.enums.AudioOverviewStatus;
import com.flamingo.ai.notebookrag.domain.enums.SourceStatus;
import com.flamingo.ai.notebookrag.domain.repository.NotebookRepository;
import com.flamingo.ai.notebookrag.domain.repository.SourceRepository;
import com.flamingo.ai.notebookrag.exception.AudioOverviewNotFoundException;
import com.flamingo.ai.notebookrag.exception.NotebookNotFoundException;
import com.flamingo.ai.notebookrag.llm.ChatOptions;
import com.flamingo.ai.notebookrag.llm.ChatTurn;
import com.flamingo.ai.notebookrag.llm.LlmService;
import com.flamingo.ai.notebookrag.service.job.BackgroundJobRunner;
import com.flamingo.ai.notebookrag.service.notebook.NotebookStateWriter;
import com.flamingo.ai.notebookrag.service.summary.SourceDigest;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Generates a two-speaker audio overview of a notebook's completed sources.
 *
 * <p>Status moves GENERATING to COMPLETED or FAILED. A completed overview's URL is served until
 * its expiry; after that it reads as EXPIRED, which is never stored.
 */
@Service
@Slf4j
public class AudioOverviewService {

  static final String JOB_TYPE = "audio-overview";
  private static final ChatOptions SCRIPT_OPTIONS = new ChatOptions(null, 2000);

  private static final String SCRIPT_PROMPT =
      """
      Write the script of a podcast-style conversation between two hosts about the sources below.
      Label every line with "Speaker 1:" or "Speaker 2:".
      Start with a short introduction, let the speakers alternate as they discuss the key ideas,
      and end with a conclusion.
      The conversation should last 5 to 7 minutes when read aloud, about 750 to 1000 words.
      Reply with the script only.
      """;

  private final NotebookRepository notebookRepository;
  private final SourceRepository sourceRepository;
  private final NotebookStateWriter stateWriter;
  private final LlmService llmService;
  private final AudioRenderer audioRenderer;
  private final BackgroundJobRunner jobRunner;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  @Autowired
  public AudioOverviewService(
      NotebookRepository notebookRepository,
      SourceRepository sourceRepository,
      NotebookStateWriter stateWriter,
      LlmService llmService,
      AudioRenderer audioRenderer,
      BackgroundJobRunner jobRunner,
      RagConfig ragConfig,
      MeterRegistry meterRegistry) {
    this(
        notebookRepository,
        sourceRepository,
        stateWriter,
        llmService,
        audioRenderer,
        jobRunner,
        ragConfig,
        meterRegistry,
        Clock.systemDefaultZone());
  }

  AudioOverviewService(
      NotebookRepository notebookRepository,
      SourceRepository sourceRepository,
      NotebookStateWriter stateWriter,
      LlmService llmService,
      AudioRenderer audioRenderer,
      BackgroundJobRunner jobRunner,
      RagConfig ragConfig,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.notebookRepository = notebookRepository;
    this.sourceRepository = sourceRepository;
    this.stateWriter = stateWriter;
    this.llmService = llmService;
    this.audioRenderer = audioRenderer;
    this.jobRunner = jobRunner;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  /**
   * Marks the overview as generating and schedules the job.
   *
   * @return false if a generation job for this notebook is already running
   * @throws NotebookNotFoundException if the notebook does not exist
   */
  public boolean start(UUID notebookId) {
    if (!stateWriter.claimAudioGeneration(notebookId)) {
      log.info("Audio overview for notebook {} is already generating", notebookId);
      return false;
    }
    try {
      jobRunner.submit(JOB_TYPE, notebookId, () -> generate(notebookId));
    } catch (RejectedExecutionException e) {
      log.error("Job queue full, failing audio overview for notebook {}", notebookId);
      stateWriter.update(notebookId, n -> n.setAudioOverviewStatus(AudioOverviewStatus.FAILED));
      return false;
    }
    return true;
  }

  /** Runs one claimed generation. Never throws; failures end in FAILED status. */
  void generate(UUID notebookId) {
    try {
      List<Source> sources =
          sourceRepository.findByNotebookIdAndStatusOrderByCreatedAtAsc(
              notebookId, SourceStatus.COMPLETED);
      if (sources.isEmpty()) {
        log.warn("Notebook {} has no completed sources, audio overview failed", notebookId);
        markFailed(notebookId);
        return;
      }

      String content = SourceDigest.join(sources, ragConfig.getAudio().getSourcePreviewChars());
      String script =
          llmService
              .chat(
                  List.of(ChatTurn.system(SCRIPT_PROMPT), ChatTurn.user("Sources:\n\n" + content)),
                  SCRIPT_OPTIONS)
              .text();
      String url = audioRenderer.render(notebookId, script);
      LocalDateTime expiresAt = now().plus(ragConfig.getAudio().getUrlTtl());

      Notebook previous = notebookRepository.findById(notebookId).orElse(null);
      String previousUrl = previous != null ? previous.getAudioOverviewUrl() : null;

      stateWriter.update(
          notebookId,
          notebook -> {
            notebook.setAudioOverviewStatus(AudioOverviewStatus.COMPLETED);
            notebook.setAudioOverviewUrl(url);
            notebook.setAudioUrlExpiresAt(expiresAt);
            notebook.setAudioOverviewScript(script);
          });
      if (previousUrl != null && !previousUrl.equals(url)) {
        deleteAsset(previousUrl);
      }
      meterRegistry.counter("audio.overview.success").increment();
      log.info("Generated audio overview {} for notebook {}", url, notebookId);
    } catch (RuntimeException e) {
      log.error("Audio overview failed for notebook {}: {}", notebookId, e.getMessage(), e);
      markFailed(notebookId);
    }
  }

  /** Current overview state, with an expired URL reported as EXPIRED. */
  public AudioOverview getOverview(UUID notebookId) {
    Notebook notebook =
        notebookRepository
            .findById(notebookId)
            .orElseThrow(() -> new NotebookNotFoundException(notebookId));
    AudioOverviewStatus status = notebook.getAudioOverviewStatus();
    LocalDateTime expiresAt = notebook.getAudioUrlExpiresAt();
    if (status == AudioOverviewStatus.COMPLETED
        && expiresAt != null
        && !now().isBefore(expiresAt)) {
      return new AudioOverview(AudioOverviewStatus.EXPIRED, null, expiresAt);
    }
    String url = status == AudioOverviewStatus.COMPLETED ? notebook.getAudioOverviewUrl() : null;
    return new AudioOverview(status, url, expiresAt);
  }

  /**
   * Extends the URL expiry by the configured TTL from now.
   *
   * @throws AudioOverviewNotFoundException if the notebook has no rendered audio
   */
  public AudioOverview refreshUrl(UUID notebookId) {
    LocalDateTime expiresAt = now().plus(ragConfig.getAudio().getUrlTtl());
    Notebook updated =
        stateWriter.update(
            notebookId,
            notebook -> {
              if (notebook.getAudioOverviewUrl() == null
                  || notebook.getAudioOverviewStatus() != AudioOverviewStatus.COMPLETED) {
                throw new AudioOverviewNotFoundException(notebookId);
              }
              notebook.setAudioUrlExpiresAt(expiresAt);
            });
    return new AudioOverview(
        AudioOverviewStatus.COMPLETED, updated.getAudioOverviewUrl(), expiresAt);
  }

  /** Removes the rendered asset and clears every audio field. */
  public void delete(UUID notebookId) {
    Notebook notebook =
        notebookRepository
            .findById(notebookId)
            .orElseThrow(() -> new NotebookNotFoundException(notebookId));
    String url = notebook.getAudioOverviewUrl();
    stateWriter.update(notebookId, Notebook::clearAudioOverview);
    if (url != null) {
      deleteAsset(url);
    }
    log.info("Deleted audio overview of notebook {}", notebookId);
  }

  private void deleteAsset(String url) {
    try {
      audioRenderer.delete(url);
    } catch (RuntimeException e) {
      log.warn("Could not delete audio asset {}: {}", url, e.getMessage());
    }
  }

  private void markFailed(UUID notebookId) {
    meterRegistry.counter("audio.overview.failure").increment();
    try {
      stateWriter.update(notebookId, n -> n.setAudioOverviewStatus(AudioOverviewStatus.FAILED));
    } catch (NotebookNotFoundException e) {
      log.warn("Notebook {} deleted during audio generation", notebookId);
    }
  }

  private LocalDateTime now() {
    return LocalDateTime.now(clock);
  }
}
