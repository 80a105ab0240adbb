package com.flamingo.ai.voicecompanion.service.knowledge.store;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodically reloads the knowledge store when its persisted snapshot changed. */
@Component
@ConditionalOnProperty(
    name = "companion.knowledge.polling-enabled",
    havingValue = "true",
    matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class KnowledgeStoreFreshnessPoller {

  private final KnowledgeStoreManager knowledgeStoreManager;

  @Scheduled(
      fixedDelayString = "${companion.knowledge.poll-interval-ms:5000}",
      initialDelayString = "${companion.knowledge.poll-interval-ms:5000}")
  public void poll() {
    KnowledgeStoreVersion before = knowledgeStoreManager.currentVersion();
    KnowledgeStoreVersion after = knowledgeStoreManager.reloadIfStale();
    if (after != before) {
      log.info(
          "Freshness poll picked up knowledge store version {} ({} records)",
          after.getVersionId(),
          after.getRecordCount());
    }
  }
}
