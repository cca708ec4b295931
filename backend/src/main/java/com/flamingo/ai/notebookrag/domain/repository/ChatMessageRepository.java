package com.flamingo.ai.notebookrag.domain.repository;

import com.flamingo.ai.notebookrag.domain.entity.ChatMessage;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for ChatMessage entities. */
@Repository
public interface ChatMessageRepository extends JpaRepository<ChatMessage, Long> {

  /** Finds all messages of a notebook in the order they were written. */
  List<ChatMessage> findByNotebookIdOrderByIdAsc(UUID notebookId);

  /** Finds messages written up to and including {@code lastId}, newest first. */
  @Query(
      "SELECT m FROM ChatMessage m WHERE m.notebook.id = :notebookId AND m.id <= :lastId "
          + "ORDER BY m.id DESC")
  List<ChatMessage> findRecentUpToQuery(
      @Param("notebookId") UUID notebookId, @Param("lastId") Long lastId, Pageable pageable);

  /** Finds the newest {@code limit} messages written up to and including {@code lastId}. */
  default List<ChatMessage> findRecentUpTo(UUID notebookId, Long lastId, int limit) {
    return findRecentUpToQuery(notebookId, lastId, Pageable.ofSize(limit));
  }

  /** Deletes the whole chat log of a notebook. */
  @Modifying
  @Query("DELETE FROM ChatMessage m WHERE m.notebook.id = :notebookId")
  int deleteByNotebookId(@Param("notebookId") UUID notebookId);
}
