package com.flamingo.ai.notebookrag.domain.repository;

import com.flamingo.ai.notebookrag.domain.entity.Notebook;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/** Repository for Notebook entities. */
@Repository
public interface NotebookRepository extends JpaRepository<Notebook, UUID> {

  /** Finds an owner's notebooks, most recently updated first. */
  List<Notebook> findByOwnerIdOrderByUpdatedAtDesc(String ownerId);

  /**
   * Moves the content generation job to GENERATING unless it is already running.
   *
   * @return 1 if this caller claimed the job, 0 otherwise
   */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "UPDATE Notebook n SET n.generationStatus = "
          + "com.flamingo.ai.notebookrag.domain.enums.GenerationStatus.GENERATING "
          + "WHERE n.id = :id AND n.generationStatus <> "
          + "com.flamingo.ai.notebookrag.domain.enums.GenerationStatus.GENERATING")
  int claimContentGeneration(@Param("id") UUID id);

  /**
   * Moves the audio overview to GENERATING unless it is already running.
   *
   * @return 1 if this caller claimed the job, 0 otherwise
   */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "UPDATE Notebook n SET n.audioOverviewStatus = "
          + "com.flamingo.ai.notebookrag.domain.enums.AudioOverviewStatus.GENERATING "
          + "WHERE n.id = :id AND (n.audioOverviewStatus IS NULL OR n.audioOverviewStatus <> "
          + "com.flamingo.ai.notebookrag.domain.enums.AudioOverviewStatus.GENERATING)")
  int claimAudioGeneration(@Param("id") UUID id);

  /** Fails content generation left GENERATING by a stopped process. */
  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "UPDATE Notebook n SET n.generationStatus = "
          + "com.flamingo.ai.notebookrag.domain.enums.GenerationStatus.FAILED "
          + "WHERE n.generationStatus = "
          + "com.flamingo.ai.notebookrag.domain.enums.GenerationStatus.GENERATING")
  int failInterruptedContentGeneration();

  /** Fails audio overviews left GENERATING by a stopped process. */
  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "UPDATE Notebook n SET n.audioOverviewStatus = "
          + "com.flamingo.ai.notebookrag.domain.enums.AudioOverviewStatus.FAILED "
          + "WHERE n.audioOverviewStatus = "
          + "com.flamingo.ai.notebookrag.domain.enums.AudioOverviewStatus.GENERATING")
  int failInterruptedAudioGeneration();
}
