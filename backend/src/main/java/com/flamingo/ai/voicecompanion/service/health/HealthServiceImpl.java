package com.flamingo.ai.voicecompanion.service.health;

import com.flamingo.ai.voicecompanion.api.dto.response.SystemStats;
import com.flamingo.ai.voicecompanion.domain.enums.DocumentStatus;
import com.flamingo.ai.voicecompanion.domain.repository.DocumentRepository;
import com.flamingo.ai.voicecompanion.service.conversation.ConversationService;
import com.flamingo.ai.voicecompanion.service.knowledge.store.KnowledgeStoreManager;
import com.flamingo.ai.voicecompanion.service.knowledge.store.KnowledgeStoreVersion;
import io.micrometer.core.annotation.Timed;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of HealthService for system health checks and statistics. */
@Service
@RequiredArgsConstructor
public class HealthServiceImpl implements HealthService {

  private final ConversationService conversationService;
  private final DocumentRepository documentRepository;
  private final KnowledgeStoreManager knowledgeStoreManager;

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "health.stats", description = "Time to get system stats")
  public SystemStats getSystemStats() {
    KnowledgeStoreVersion version = knowledgeStoreManager.currentVersion();

    return SystemStats.builder()
        .activeSessions(conversationService.activeSessionCount())
        .totalUploads(documentRepository.count())
        .failedUploads(documentRepository.countByStatus(DocumentStatus.FAILED))
        .knowledgeVersionId(version.getVersionId())
        .knowledgeVectorCount(version.getRecordCount())
        .retainedVersions(knowledgeStoreManager.retainedVersionCount())
        .timestamp(LocalDateTime.now())
        .build();
  }
}
