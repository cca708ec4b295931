package com.flamingo.ai.notebookrag.domain.repository;

import com.flamingo.ai.notebookrag.domain.entity.ProviderConfig;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for ProviderConfig entities. */
@Repository
public interface ProviderConfigRepository extends JpaRepository<ProviderConfig, UUID> {

  /** Finds all configurations, oldest first. */
  List<ProviderConfig> findAllByOrderByCreatedAtAsc();

  /** Finds active configurations, the default one first. */
  List<ProviderConfig> findByActiveTrueOrderByDefaultConfigDescCreatedAtAsc();

  /** Finds active configurations of one provider, the default one first. */
  List<ProviderConfig> findByActiveTrueAndProviderOrderByDefaultConfigDescCreatedAtAsc(
      String provider);

  /** Clears the default flag on every configuration except {@code keepId}. */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("UPDATE ProviderConfig p SET p.defaultConfig = false WHERE p.id <> :keepId")
  int clearDefaultExcept(@Param("keepId") UUID keepId);
}
