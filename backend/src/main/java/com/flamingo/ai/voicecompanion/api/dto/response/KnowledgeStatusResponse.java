package com.flamingo.ai.voicecompanion.api.dto.response;

import com.flamingo.ai.voicecompanion.service.knowledge.store.KnowledgeStoreVersion;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO describing exactly one knowledge store version. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KnowledgeStatusResponse {

  public static final String READY = "ready";
  public static final String EMPTY = "empty";
  public static final String UNKNOWN = "unknown";

  private String status;
  private long versionId;
  private int documentCount;
  private int vectorCount;
  private List<String> documentIds;
  private Instant createdAt;

  public static KnowledgeStatusResponse fromVersion(KnowledgeStoreVersion version) {
    List<String> documentIds = List.copyOf(version.getDocumentIds());
    String status;
    if (!version.isLoaded()) {
      status = UNKNOWN;
    } else if (version.isEmpty()) {
      status = EMPTY;
    } else {
      status = READY;
    }
    return KnowledgeStatusResponse.builder()
        .status(status)
        .versionId(version.getVersionId())
        .documentCount(documentIds.size())
        .vectorCount(version.getRecordCount())
        .documentIds(documentIds)
        .createdAt(version.getCreatedAt())
        .build();
  }
}
