package com.flamingo.ai.voicecompanion.api.dto.response;

import com.flamingo.ai.voicecompanion.domain.entity.Document;
import com.flamingo.ai.voicecompanion.domain.enums.DocumentStatus;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an upload record. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentResponse {

  private UUID id;
  private String documentId;
  private String fileName;
  private String mimeType;
  private Long fileSize;
  private DocumentStatus status;
  private Integer chunkCount;
  private String processingError;
  private LocalDateTime uploadedAt;
  private LocalDateTime processedAt;

  /** Creates a DocumentResponse from a Document entity. */
  public static DocumentResponse fromEntity(Document document) {
    return DocumentResponse.builder()
        .id(document.getId())
        .documentId(document.getContentId())
        .fileName(document.getFileName())
        .mimeType(document.getMimeType())
        .fileSize(document.getFileSize())
        .status(document.getStatus())
        .chunkCount(document.getChunkCount())
        .processingError(document.getProcessingError())
        .uploadedAt(document.getUploadedAt())
        .processedAt(document.getProcessedAt())
        .build();
  }
}
