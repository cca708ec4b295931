package com.flamingo.ai.notebookrag.service.chat;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One paragraph of an AI answer.
 *
 * @param text paragraph text
 * @param citationId id of the citation backing this paragraph, null when the answer has no
 *     retrieved context
 */
public record AnswerSegment(
    @JsonProperty("text") String text, @JsonProperty("citation_id") Integer citationId) {}
