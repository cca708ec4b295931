package com.flamingo.ai.notebookrag.service.chat;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.notebookrag.config.RagConfig;
import com.flamingo.ai.notebookrag.domain.entity.ChatMessage;
import com.flamingo.ai.notebookrag.domain.entity.Notebook;
import com.flamingo.ai.notebookrag.domain.enums.MessageRole;
import com.flamingo.ai.notebookrag.domain.enums.SourceStatus;
import com.flamingo.ai.notebookrag.domain.repository.ChatMessageRepository;
import com.flamingo.ai.notebookrag.domain.repository.NotebookRepository;
import com.flamingo.ai.notebookrag.domain.repository.SourceRepository;
import com.flamingo.ai.notebookrag.elasticsearch.ScoredChunk;
import com.flamingo.ai.notebookrag.elasticsearch.VectorStore;
import com.flamingo.ai.notebookrag.exception.ChatException;
import com.flamingo.ai.notebookrag.exception.NoProcessedSourcesException;
import com.flamingo.ai.notebookrag.exception.NotebookNotFoundException;
import com.flamingo.ai.notebookrag.llm.ChatTurn;
import com.flamingo.ai.notebookrag.llm.LlmResponse;
import com.flamingo.ai.notebookrag.llm.LlmService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Default {@link ChatService}.
 *
 * <p>Runs outside a transaction so the LLM call never holds a database lock. The question is
 * stored first and survives a failed answer; the answer is stored only on success.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChatServiceImpl implements ChatService {

  static final String NO_INFORMATION_REPLY =
      "I'm sorry, I don't have information about that in my sources.";

  private static final String SYSTEM_PROMPT_TEMPLATE =
      """
      You are a research assistant answering questions about the user's notebook sources.
      Answer using only the information in the context below.
      If the context does not contain the answer, reply exactly: "%s"
      Separate paragraphs with a blank line.

      Context:
      %s
      """;

  private final NotebookRepository notebookRepository;
  private final SourceRepository sourceRepository;
  private final ChatMessageRepository chatMessageRepository;
  private final VectorStore vectorStore;
  private final LlmService llmService;
  private final CitationAssembler citationAssembler;
  private final RagConfig ragConfig;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "chat.answer", description = "Time to answer a chat question")
  public ChatExchange answer(UUID notebookId, String userMessage) {
    Notebook notebook =
        notebookRepository
            .findById(notebookId)
            .orElseThrow(() -> new NotebookNotFoundException(notebookId));

    if (sourceRepository.countByNotebookIdAndStatus(notebookId, SourceStatus.COMPLETED) == 0) {
      throw new NoProcessedSourcesException(notebookId);
    }

    ChatMessage userRecord =
        chatMessageRepository.save(
            ChatMessage.builder()
                .notebook(notebook)
                .role(MessageRole.HUMAN)
                .content(userMessage)
                .build());

    List<ScoredChunk> chunks =
        vectorStore.search(userMessage, notebookId, ragConfig.getRetrieval().getTopK());
    log.debug("Retrieved {} chunks for notebook {}", chunks.size(), notebookId);

    List<ChatTurn> turns = new ArrayList<>();
    turns.add(ChatTurn.system(buildSystemPrompt(chunks)));
    turns.addAll(loadHistory(notebookId, userRecord));

    LlmResponse response = llmService.chat(turns);
    AssembledAnswer answer = citationAssembler.assemble(response.text(), chunks);

    ChatMessage aiRecord =
        chatMessageRepository.save(
            ChatMessage.builder()
                .notebook(notebook)
                .role(MessageRole.AI)
                .content(toJson(notebookId, answer))
                .provider(response.provider())
                .model(response.model())
                .build());

    meterRegistry.counter("chat.answers", "provider", response.provider()).increment();
    log.info(
        "Answered question in notebook {} with {} segments, {} citations",
        notebookId,
        answer.segments().size(),
        answer.citations().size());
    return new ChatExchange(userRecord, aiRecord, answer);
  }

  @Override
  @Transactional(readOnly = true)
  public List<ChatMessage> history(UUID notebookId) {
    if (!notebookRepository.existsById(notebookId)) {
      throw new NotebookNotFoundException(notebookId);
    }
    return chatMessageRepository.findByNotebookIdOrderByIdAsc(notebookId);
  }

  @Override
  @Transactional
  public int clearHistory(UUID notebookId) {
    if (!notebookRepository.existsById(notebookId)) {
      throw new NotebookNotFoundException(notebookId);
    }
    int deleted = chatMessageRepository.deleteByNotebookId(notebookId);
    log.info("Cleared {} chat messages of notebook {}", deleted, notebookId);
    return deleted;
  }

  String buildSystemPrompt(List<ScoredChunk> chunks) {
    StringBuilder context = new StringBuilder();
    for (ScoredChunk scored : chunks) {
      if (context.length() > 0) {
        context.append("\n\n---\n\n");
      }
      context
          .append("[")
          .append(scored.chunk().getSourceTitle())
          .append("]\n")
          .append(scored.chunk().getContent());
    }
    return SYSTEM_PROMPT_TEMPLATE.formatted(NO_INFORMATION_REPLY, context);
  }

  /**
   * The newest persisted messages in chronological order, ending with the question just stored.
   * AI answers are reduced to their text.
   */
  private List<ChatTurn> loadHistory(UUID notebookId, ChatMessage userRecord) {
    List<ChatMessage> recent =
        new ArrayList<>(
            chatMessageRepository.findRecentUpTo(
                notebookId, userRecord.getId(), ragConfig.getChat().getHistoryWindow()));
    // the log may have been cleared between the save and this read
    if (recent.isEmpty() || !userRecord.getId().equals(recent.get(0).getId())) {
      recent.add(0, userRecord);
    }
    Collections.reverse(recent);

    List<ChatTurn> turns = new ArrayList<>(recent.size());
    for (ChatMessage message : recent) {
      if (message.getRole() == MessageRole.AI) {
        turns.add(ChatTurn.assistant(answerText(message.getContent())));
      } else {
        turns.add(ChatTurn.user(message.getContent()));
      }
    }
    return turns;
  }

  private String answerText(String storedContent) {
    try {
      AssembledAnswer stored = objectMapper.readValue(storedContent, AssembledAnswer.class);
      return stored.segments() != null ? stored.plainText() : storedContent;
    } catch (JsonProcessingException e) {
      log.debug("Stored AI message is not an assembled answer, using raw content");
      return storedContent;
    }
  }

  private String toJson(UUID notebookId, AssembledAnswer answer) {
    try {
      return objectMapper.writeValueAsString(answer);
    } catch (JsonProcessingException e) {
      throw new ChatException(
          notebookId,
          "Failed to serialize answer: " + e.getMessage(),
          "The answer could not be saved. Please try again.");
    }
  }
}
