package com.flamingo.ai.notebookrag.service.chat;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Stored form of an AI message: ordered segments and the citations they reference. */
public record AssembledAnswer(
    @JsonProperty("segments") List<AnswerSegment> segments,
    @JsonProperty("citations") List<Citation> citations) {

  /** Segment texts joined back into the plain answer. */
  public String plainText() {
    StringBuilder sb = new StringBuilder();
    for (AnswerSegment segment : segments) {
      if (sb.length() > 0) {
        sb.append("\n\n");
      }
      sb.append(segment.text());
    }
    return sb.toString();
  }
}
