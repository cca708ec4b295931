package com.flamingo.ai.notebookrag.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Administrator-managed connection settings for one LLM backend.
 *
 * <p>The provider is kept as its stored name so that rows written by other tools with an unknown
 * provider still load and fail at dispatch time.
 */
@Entity
@Table(name = "provider_configs")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProviderConfig {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(nullable = false)
  private String name;

  @Column(nullable = false)
  private String provider;

  @Column(nullable = false)
  private String model;

  private String apiKey;

  private String baseUrl;

  @Column(nullable = false)
  @Builder.Default
  private boolean active = true;

  @Column(name = "is_default", nullable = false)
  @Builder.Default
  private boolean defaultConfig = false;

  /** JSON object with provider-specific overrides such as temperature and max_tokens. */
  @Column(columnDefinition = "TEXT")
  private String extraConfig;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @Column(nullable = false)
  private LocalDateTime updatedAt;

  @PrePersist
  protected void onCreate() {
    LocalDateTime now = LocalDateTime.now();
    createdAt = now;
    updatedAt = now;
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = LocalDateTime.now();
  }
}
