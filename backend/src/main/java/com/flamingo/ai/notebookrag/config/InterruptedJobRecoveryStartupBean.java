package com.flamingo.ai.notebookrag.config;

import com.flamingo.ai.notebookrag.domain.repository.NotebookRepository;
import com.flamingo.ai.notebookrag.domain.repository.SourceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Startup bean that fails background jobs interrupted by a previous shutdown or crash.
 *
 * <p>Background jobs live only in this process, so at startup no source can really be
 * PROCESSING and no notebook job can really be GENERATING. Such rows are moved to FAILED, which
 * lets a re-submission claim them again.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InterruptedJobRecoveryStartupBean implements CommandLineRunner {

  static final String INTERRUPTED_ERROR =
      "Processing was interrupted by a server restart, please resubmit the source";

  private final SourceRepository sourceRepository;
  private final NotebookRepository notebookRepository;

  @Override
  public void run(String... args) {
    try {
      recover();
    } catch (RuntimeException e) {
      // startup continues; affected rows stay stuck until the next restart
      log.error("Interrupted job recovery failed: {}", e.getMessage(), e);
    }
  }

  /**
   * Moves every interrupted job to FAILED.
   *
   * @return number of rows changed
   */
  public int recover() {
    int sources = sourceRepository.failInterruptedProcessing(INTERRUPTED_ERROR);
    int content = notebookRepository.failInterruptedContentGeneration();
    int audio = notebookRepository.failInterruptedAudioGeneration();
    if (sources + content + audio > 0) {
      log.warn(
          "Failed interrupted jobs: {} sources, {} content generations, {} audio overviews",
          sources,
          content,
          audio);
    } else {
      log.info("No interrupted background jobs found");
    }
    return sources + content + audio;
  }
}
