package com.flamingo.ai.voicecompanion.api.dto.response;

import com.flamingo.ai.voicecompanion.service.ingestion.IngestionResult;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a processed upload. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionResponse {

  private String status;

  /** Stable document id used by the knowledge store. */
  private String documentId;

  /** Id of this upload's record. */
  private UUID uploadId;

  private String fileName;
  private int chunkCount;
  private long currentVersionId;

  public static IngestionResponse fromResult(IngestionResult result) {
    return IngestionResponse.builder()
        .status("processed")
        .documentId(result.document().getContentId())
        .uploadId(result.document().getId())
        .fileName(result.document().getFileName())
        .chunkCount(result.chunkCount())
        .currentVersionId(result.versionId())
        .build();
  }
}
