package com.flamingo.ai.notebookrag.service.chat;

import com.flamingo.ai.notebookrag.domain.entity.ChatMessage;

/**
 * Result of one question: both persisted records and the parsed answer.
 *
 * @param userMessage the stored question
 * @param aiMessage the stored answer, its content is the JSON form of {@code answer}
 * @param answer segments and citations of the answer
 */
public record ChatExchange(ChatMessage userMessage, ChatMessage aiMessage, AssembledAnswer answer) {}
