package com.flamingo.ai.notebookrag.service.summary;

import com.flamingo.ai.notebookrag.config.RagConfig;
import com.flamingo.ai.notebookrag.llm.ChatTurn;
import com.flamingo.ai.notebookrag.llm.LlmService;
import io.micrometer.core.annotation.Timed;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Generates the short summary shown for each ingested source. */
@Service
@RequiredArgsConstructor
@Slf4j
public class SourceSummaryService {

  private static final String SYSTEM_PROMPT =
      """
      You summarize documents for a research notebook.
      Write a concise summary of at most 200 words covering the main ideas of the text.
      Reply with the summary only.
      """;

  private final LlmService llmService;
  private final RagConfig ragConfig;

  /**
   * Summarizes the beginning of a source's text.
   *
   * @param title source title, gives the model context
   * @param text full extracted text
   * @return the summary, or the configured placeholder if generation fails
   */
  @Timed(value = "source.summary", description = "Time to generate source summary")
  public String summarize(String title, String text) {
    RagConfig.Summary summary = ragConfig.getSummary();
    if (text == null || text.isBlank()) {
      return summary.getPlaceholder();
    }
    String input =
        text.length() > summary.getMaxInputChars()
            ? text.substring(0, summary.getMaxInputChars())
            : text;
    try {
      String result =
          llmService
              .chat(
                  List.of(
                      ChatTurn.system(SYSTEM_PROMPT),
                      ChatTurn.user("Title: " + title + "\n\nText:\n" + input)))
              .text()
              .trim();
      log.debug("Generated {} char summary for '{}'", result.length(), title);
      return result;
    } catch (RuntimeException e) {
      log.warn("Summary generation failed for '{}': {}", title, e.getMessage());
      return summary.getPlaceholder();
    }
  }
}
