package com.flamingo.ai.notebookrag.service.chat;

import com.flamingo.ai.notebookrag.domain.entity.ChatMessage;
import java.util.List;
import java.util.UUID;

/** Retrieval-augmented question answering over a notebook's sources. */
public interface ChatService {

  /**
   * Answers a question from the notebook's indexed chunks and stores both sides of the exchange.
   *
   * @param notebookId notebook to answer from
   * @param userMessage the question
   * @return the stored question, the stored answer and its segments and citations
   * @throws com.flamingo.ai.notebookrag.exception.NoProcessedSourcesException if the notebook has
   *     no completed source
   * @throws com.flamingo.ai.notebookrag.exception.RetrievalException if chunk search fails
   * @throws com.flamingo.ai.notebookrag.exception.ProviderException if the LLM call fails
   */
  ChatExchange answer(UUID notebookId, String userMessage);

  /** Lists the chat log of a notebook in the order it was written. */
  List<ChatMessage> history(UUID notebookId);

  /**
   * Deletes the chat log of a notebook.
   *
   * @return number of deleted messages
   */
  int clearHistory(UUID notebookId);
}
