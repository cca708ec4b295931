package com.flamingo.ai.notebookrag.service.notebook;

import com.flamingo.ai.notebookrag.domain.entity.Notebook;
import java.util.List;
import java.util.UUID;

/** Service for notebook lifecycle. */
public interface NotebookService {

  /** Creates an empty notebook owned by {@code ownerId}. */
  Notebook create(String ownerId, String title);

  /**
   * Finds a notebook.
   *
   * @throws com.flamingo.ai.notebookrag.exception.NotebookNotFoundException if it does not exist
   */
  Notebook get(UUID notebookId);

  /** Lists an owner's notebooks, most recently updated first. */
  List<Notebook> listByOwner(String ownerId);

  /** Deletes a notebook with its chunks, sources, chat log and audio asset. */
  void delete(UUID notebookId);
}
