package com.flamingo.ai.voicecompanion.domain.entity;

import com.flamingo.ai.voicecompanion.domain.enums.DocumentStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One upload of a document. Each upload creates a new record; identical bytes share the same
 * {@link #contentId}, which is the document id used by the knowledge store.
 */
@Entity
@Table(name = "documents")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Document {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  /** Stable id derived from the raw bytes. */
  @Column(nullable = false)
  private String contentId;

  @Column(nullable = false)
  private String fileName;

  @Column(nullable = false)
  private String mimeType;

  /** Raw byte length. */
  private Long fileSize;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private DocumentStatus status = DocumentStatus.PENDING;

  private Integer chunkCount;

  /** Error message if ingestion failed. */
  @Column(columnDefinition = "TEXT")
  private String processingError;

  @Column(nullable = false, updatable = false)
  private LocalDateTime uploadedAt;

  private LocalDateTime processedAt;

  @PrePersist
  protected void onCreate() {
    if (uploadedAt == null) {
      uploadedAt = LocalDateTime.now();
    }
  }

  /** Marks the document as merged into the knowledge store. */
  public void markProcessed(int chunkCount) {
    this.status = DocumentStatus.PROCESSED;
    this.chunkCount = chunkCount;
    this.processedAt = LocalDateTime.now();
  }

  /** Marks the document as failed with an error message. */
  public void markFailed(String errorMessage) {
    this.status = DocumentStatus.FAILED;
    this.processingError = errorMessage;
    this.processedAt = LocalDateTime.now();
  }
}
