package com.flamingo.ai.voicecompanion.api.dto.response;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** DTO for system-wide statistics. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemStats {
  private long activeSessions;
  private long totalUploads;
  private long failedUploads;
  private long knowledgeVersionId;
  private int knowledgeVectorCount;
  private int retainedVersions;
  private LocalDateTime timestamp;
}
