package com.flamingo.ai.notebookrag.service.notebook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.notebookrag.config.RagConfig;
import com.flamingo.ai.notebookrag.domain.entity.Source;
import com.flamingo.ai.notebookrag.domain.enums.GenerationStatus;
import com.flamingo.ai.notebookrag.domain.enums.SourceStatus;
import com.flamingo.ai.notebookrag.domain.repository.SourceRepository;
import com.flamingo.ai.notebookrag.exception.NotebookNotFoundException;
import com.flamingo.ai.notebookrag.exception.ProviderException;
import com.flamingo.ai.notebookrag.llm.ChatTurn;
import com.flamingo.ai.notebookrag.llm.LlmResponse;
import com.flamingo.ai.notebookrag.llm.LlmService;
import com.flamingo.ai.notebookrag.service.job.BackgroundJobRunner;
import com.flamingo.ai.notebookrag.service.summary.SourceDigest;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Generates a notebook's title, description, icon, color and example questions. */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotebookContentGenerator {

  static final String JOB_TYPE = "notebook-content";

  static final String DEFAULT_TITLE = "Untitled notebook";
  static final String DEFAULT_SUMMARY = "Could not generate a summary";
  static final String DEFAULT_ICON = "📝";
  static final String DEFAULT_COLOR = "gray";
  static final Set<String> COLORS =
      Set.of("gray", "blue", "green", "purple", "pink", "orange", "yellow", "red");
  private static final int QUESTION_COUNT = 5;

  private static final Pattern FENCED_JSON =
      Pattern.compile("```(?:json)?\\s*(\\{.*?})\\s*```", Pattern.DOTALL);

  private static final String SYSTEM_PROMPT =
      """
      You describe research notebooks from the sources they contain.
      Reply with a single JSON object and nothing else, with these fields:
      "title": a short notebook title,
      "summary": a 2 to 3 sentence overview of the sources,
      "notebook_icon": one emoji representing the topic,
      "background_color": one of gray, blue, green, purple, pink, orange, yellow, red,
      "example_questions": an array of 5 questions a reader could ask about the sources.
      """;

  private final SourceRepository sourceRepository;
  private final NotebookStateWriter stateWriter;
  private final LlmService llmService;
  private final BackgroundJobRunner jobRunner;
  private final RagConfig ragConfig;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;

  /**
   * Marks generation as running and schedules the job.
   *
   * @return false if generation for this notebook is already running
   * @throws NotebookNotFoundException if the notebook does not exist
   */
  public boolean start(UUID notebookId) {
    if (!stateWriter.claimContentGeneration(notebookId)) {
      log.info("Content generation for notebook {} is already running", notebookId);
      return false;
    }
    try {
      jobRunner.submit(JOB_TYPE, notebookId, () -> generate(notebookId));
    } catch (RejectedExecutionException e) {
      log.error("Job queue full, failing content generation for notebook {}", notebookId);
      markFailed(notebookId);
      return false;
    }
    return true;
  }

  /** Runs one claimed generation. Never throws; failures end in FAILED status. */
  void generate(UUID notebookId) {
    try {
      RagConfig.Generation generation = ragConfig.getGeneration();
      List<Source> sources =
          sourceRepository
              .findByNotebookIdAndStatusOrderByCreatedAtAsc(notebookId, SourceStatus.COMPLETED)
              .stream()
              .limit(generation.getMaxSources())
              .toList();
      if (sources.isEmpty()) {
        log.warn("Notebook {} has no completed sources, content generation failed", notebookId);
        markFailed(notebookId);
        return;
      }

      LlmResponse response =
          llmService.chat(
              List.of(
                  ChatTurn.system(SYSTEM_PROMPT),
                  ChatTurn.user(
                      SourceDigest.join(sources, generation.getSourcePreviewChars()))));
      GeneratedContent content = parse(response.text());

      stateWriter.update(
          notebookId,
          notebook -> {
            notebook.setTitle(content.title());
            notebook.setDescription(content.summary());
            notebook.setIcon(content.icon());
            notebook.setColor(content.color());
            notebook.setExampleQuestions(new ArrayList<>(content.exampleQuestions()));
            notebook.setGenerationStatus(GenerationStatus.COMPLETED);
          });
      meterRegistry.counter("notebook.content.success").increment();
      log.info("Generated content for notebook {}: '{}'", notebookId, content.title());
    } catch (RuntimeException e) {
      log.error("Content generation failed for notebook {}: {}", notebookId, e.getMessage(), e);
      markFailed(notebookId);
    }
  }

  /**
   * Reads the JSON object out of a model reply, fenced or bare, applying a fallback to every
   * missing or invalid field.
   *
   * @throws ProviderException if the reply contains no parseable JSON object
   */
  GeneratedContent parse(String reply) {
    JsonNode root = readJsonObject(reply);
    String color = text(root, "background_color", DEFAULT_COLOR).toLowerCase();
    List<String> questions = new ArrayList<>();
    JsonNode array = root.path("example_questions");
    if (array.isArray()) {
      for (JsonNode question : array) {
        if (question.isTextual() && !question.asText().isBlank()) {
          questions.add(question.asText().trim());
        }
        if (questions.size() == QUESTION_COUNT) {
          break;
        }
      }
    }
    return new GeneratedContent(
        text(root, "title", DEFAULT_TITLE),
        text(root, "summary", DEFAULT_SUMMARY),
        text(root, "notebook_icon", DEFAULT_ICON),
        COLORS.contains(color) ? color : DEFAULT_COLOR,
        List.copyOf(questions));
  }

  private JsonNode readJsonObject(String reply) {
    String candidate = null;
    Matcher fenced = FENCED_JSON.matcher(reply);
    if (fenced.find()) {
      candidate = fenced.group(1);
    } else {
      int start = reply.indexOf('{');
      int end = reply.lastIndexOf('}');
      if (start >= 0 && end > start) {
        candidate = reply.substring(start, end + 1);
      }
    }
    if (candidate == null) {
      throw invalidReply("no JSON object in reply", null);
    }
    try {
      JsonNode node = objectMapper.readTree(candidate);
      if (!node.isObject()) {
        throw invalidReply("reply JSON is not an object", null);
      }
      return node;
    } catch (JsonProcessingException e) {
      throw invalidReply("malformed JSON in reply", e);
    }
  }

  private static ProviderException invalidReply(String message, Throwable cause) {
    return new ProviderException(
        ProviderException.Reason.INVALID_RESPONSE, "unknown", message, cause);
  }

  private static String text(JsonNode root, String field, String fallback) {
    JsonNode node = root.path(field);
    return node.isTextual() && !node.asText().isBlank() ? node.asText().trim() : fallback;
  }

  private void markFailed(UUID notebookId) {
    meterRegistry.counter("notebook.content.failure").increment();
    try {
      stateWriter.update(notebookId, n -> n.setGenerationStatus(GenerationStatus.FAILED));
    } catch (NotebookNotFoundException e) {
      log.warn("Notebook {} deleted during content generation", notebookId);
    }
  }
}
