package com.flamingo.ai.notebookrag.domain.entity;

import com.flamingo.ai.notebookrag.domain.converter.ExampleQuestionsConverter;
import com.flamingo.ai.notebookrag.domain.enums.AudioOverviewStatus;
import com.flamingo.ai.notebookrag.domain.enums.GenerationStatus;
import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A user-owned collection of sources, chat history and generated overviews. */
@Entity
@Table(name = "notebooks")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Notebook {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  /** Opaque identity issued by the authentication layer. */
  @Column(nullable = false)
  private String ownerId;

  @Column(nullable = false)
  private String title;

  @Column(columnDefinition = "TEXT")
  private String description;

  private String icon;

  private String color;

  @Convert(converter = ExampleQuestionsConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<String> exampleQuestions = new ArrayList<>();

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private GenerationStatus generationStatus = GenerationStatus.PENDING;

  private String audioOverviewUrl;

  private LocalDateTime audioUrlExpiresAt;

  @Enumerated(EnumType.STRING)
  private AudioOverviewStatus audioOverviewStatus;

  @Column(columnDefinition = "TEXT")
  private String audioOverviewScript;

  @OneToMany(mappedBy = "notebook", cascade = CascadeType.ALL, orphanRemoval = true)
  @Builder.Default
  private List<Source> sources = new ArrayList<>();

  @OneToMany(mappedBy = "notebook", cascade = CascadeType.ALL, orphanRemoval = true)
  @Builder.Default
  private List<ChatMessage> messages = new ArrayList<>();

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

  /** Clears every audio overview field. */
  public void clearAudioOverview() {
    this.audioOverviewUrl = null;
    this.audioUrlExpiresAt = null;
    this.audioOverviewStatus = null;
    this.audioOverviewScript = null;
  }
}
