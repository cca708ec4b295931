package com.flamingo.ai.notebookrag.llm;

/**
 * Answer of a chat call with the backend that produced it.
 *
 * @param text the generated text, never blank
 * @param provider provider name of the configuration used
 * @param model model name of the configuration used
 */
public record LlmResponse(String text, String provider, String model) {}
