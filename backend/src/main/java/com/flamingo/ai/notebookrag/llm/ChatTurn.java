package com.flamingo.ai.notebookrag.llm;

/** One message of a chat completion request. */
public record ChatTurn(ChatRole role, String content) {

  public static ChatTurn system(String content) {
    return new ChatTurn(ChatRole.SYSTEM, content);
  }

  public static ChatTurn user(String content) {
    return new ChatTurn(ChatRole.USER, content);
  }

  public static ChatTurn assistant(String content) {
    return new ChatTurn(ChatRole.ASSISTANT, content);
  }
}
