package com.flamingo.ai.notebookrag.domain.repository;

import com.flamingo.ai.notebookrag.domain.entity.Source;
import com.flamingo.ai.notebookrag.domain.enums.SourceStatus;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/** Repository for Source entities. */
@Repository
public interface SourceRepository extends JpaRepository<Source, UUID> {

  /** Loads a source together with its notebook, for use outside a persistence context. */
  @EntityGraph(attributePaths = "notebook")
  Optional<Source> findWithNotebookById(UUID id);

  /** Finds all sources of a notebook, newest first. */
  List<Source> findByNotebookIdOrderByCreatedAtDesc(UUID notebookId);

  /** Finds sources of a notebook in a given status, oldest first. */
  List<Source> findByNotebookIdAndStatusOrderByCreatedAtAsc(UUID notebookId, SourceStatus status);

  /** Counts sources of a notebook in a given status. */
  long countByNotebookIdAndStatus(UUID notebookId, SourceStatus status);

  /**
   * Atomically moves a source to PROCESSING if its status is one of {@code from}.
   *
   * @return 1 if the caller claimed the attempt, 0 if another attempt owns it
   */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "UPDATE Source s SET s.status = "
          + "com.flamingo.ai.notebookrag.domain.enums.SourceStatus.PROCESSING, "
          + "s.processingError = null WHERE s.id = :id AND s.status IN :from")
  int claimForProcessing(@Param("id") UUID id, @Param("from") Collection<SourceStatus> from);

  /**
   * Fails every source still marked PROCESSING. Only valid while no ingestion job can be running.
   *
   * @return number of sources moved to FAILED
   */
  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "UPDATE Source s SET s.status = "
          + "com.flamingo.ai.notebookrag.domain.enums.SourceStatus.FAILED, "
          + "s.processingError = :error WHERE s.status = "
          + "com.flamingo.ai.notebookrag.domain.enums.SourceStatus.PROCESSING")
  int failInterruptedProcessing(@Param("error") String error);
}
