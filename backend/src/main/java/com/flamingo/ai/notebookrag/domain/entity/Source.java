package com.flamingo.ai.notebookrag.domain.entity;

import com.flamingo.ai.notebookrag.domain.enums.SourceKind;
import com.flamingo.ai.notebookrag.domain.enums.SourceStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A document, URL or inline text contributing content to a notebook. */
@Entity
@Table(name = "sources")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Source {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "notebook_id", nullable = false)
  private Notebook notebook;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private SourceKind kind;

  @Column(nullable = false)
  private String title;

  /** Stored file path, relative to the file storage root. */
  private String filePath;

  @Column(length = 2048)
  private String url;

  /** Text submitted directly by the user. */
  @Column(columnDefinition = "TEXT")
  private String inlineText;

  private String mimeType;

  private Long fileSize;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private SourceStatus status = SourceStatus.PENDING;

  @Column(columnDefinition = "TEXT")
  private String extractedText;

  @Column(columnDefinition = "TEXT")
  private String summary;

  private Integer chunkCount;

  /** Error message of the last failed attempt. */
  @Column(columnDefinition = "TEXT")
  private String processingError;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  private LocalDateTime processedAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
  }

  /** Marks the source as fully ingested. */
  public void markCompleted(int chunkCount) {
    this.status = SourceStatus.COMPLETED;
    this.chunkCount = chunkCount;
    this.processingError = null;
    this.processedAt = LocalDateTime.now();
  }

  /** Marks the source as failed with an error message. */
  public void markFailed(String errorMessage) {
    this.status = SourceStatus.FAILED;
    this.processingError = errorMessage;
    this.processedAt = LocalDateTime.now();
  }
}
