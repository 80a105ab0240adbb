package com.flamingo.ai.voicecompanion.api.rest;

import com.flamingo.ai.voicecompanion.api.dto.response.KnowledgeStatusResponse;
import com.flamingo.ai.voicecompanion.service.ingestion.DocumentIngestionService;
import com.flamingo.ai.voicecompanion.service.knowledge.store.KnowledgeStoreManager;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for the knowledge store. */
@RestController
@RequestMapping("/api/knowledge")
@RequiredArgsConstructor
public class KnowledgeController {

  private final KnowledgeStoreManager knowledgeStoreManager;
  private final DocumentIngestionService documentIngestionService;

  /** Describes the current version. */
  @GetMapping("/status")
  public ResponseEntity<KnowledgeStatusResponse> status() {
    return ResponseEntity.ok(
        KnowledgeStatusResponse.fromVersion(knowledgeStoreManager.currentVersion()));
  }

  /** Empties the knowledge store and removes all uploads. */
  @PostMapping("/clear")
  public ResponseEntity<Void> clear() {
    documentIngestionService.clearAll();
    return ResponseEntity.noContent().build();
  }
}
