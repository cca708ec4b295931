package com.flamingo.ai.notebookrag.service.audio;

import java.util.UUID;

/** Turns a two-speaker script into a playable asset. */
public interface AudioRenderer {

  /**
   * Renders the script.
   *
   * @return a reference to the asset, usable as a URL path
   */
  String render(UUID notebookId, String script);

  /** Removes a previously rendered asset. No error if it is already gone. */
  void delete(String assetReference);
}
