package com.flamingo.ai.voicecompanion.service.retrieval;

import com.flamingo.ai.voicecompanion.config.CompanionConfig;
import com.flamingo.ai.voicecompanion.service.knowledge.embedding.EmbeddingService;
import com.flamingo.ai.voicecompanion.service.knowledge.store.EmbeddingRecord;
import com.flamingo.ai.voicecompanion.service.knowledge.store.KnowledgeStoreManager;
import com.flamingo.ai.voicecompanion.service.knowledge.store.KnowledgeStoreVersion;
import com.flamingo.ai.voicecompanion.service.knowledge.store.ScoredRecord;
import com.flamingo.ai.voicecompanion.service.knowledge.store.VersionLease;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Read path of the knowledge layer. Turns a finalized utterance into at most one bounded
 * side-context block. Never throws: any failure degrades to a turn without context.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetrievalInjector {

  private static final String PASSAGE_SEPARATOR = "\n\n";

  private final RetrievalGate retrievalGate;
  private final EmbeddingService embeddingService;
  private final KnowledgeStoreManager knowledgeStoreManager;
  private final CompanionConfig companionConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Runs gate, freshness check, embedding and search for one utterance.
   *
   * @param utterance finalized utterance text
   * @return the outcome; {@link RetrievalOutcome.Status#DEGRADED} instead of an exception
   */
  @Timed(value = "retrieval.retrieve", description = "Time to retrieve context for an utterance")
  public RetrievalOutcome retrieve(String utterance) {
    CompanionConfig.Retrieval settings = companionConfig.getRetrieval();
    if (!settings.isEnabled() || !retrievalGate.shouldRetrieve(utterance)) {
      meterRegistry.counter("retrieval.outcome", "status", "skipped").increment();
      return RetrievalOutcome.skipped();
    }

    try {
      KnowledgeStoreVersion serving = knowledgeStoreManager.reloadIfStale();
      if (serving.isEmpty()) {
        log.debug("Knowledge store is empty, nothing to inject");
        meterRegistry.counter("retrieval.outcome", "status", "empty").increment();
        return RetrievalOutcome.empty();
      }

      float[] query = embeddingService.embedQuery(utterance);
      List<ScoredRecord> hits;
      long versionId;
      try (VersionLease lease = knowledgeStoreManager.acquire()) {
        hits = lease.version().search(query, settings.getTopK());
        versionId = lease.version().getVersionId();
      }
      if (hits.isEmpty()) {
        meterRegistry.counter("retrieval.outcome", "status", "empty").increment();
        return RetrievalOutcome.empty();
      }

      InjectedContext context = compose(hits, versionId, settings);
      if (context.passages().isEmpty()) {
        log.warn("Context header exceeds max-context-chars, nothing injected");
        meterRegistry.counter("retrieval.outcome", "status", "empty").increment();
        return RetrievalOutcome.empty();
      }
      log.debug(
          "Injecting {} passages ({} chars) from version {}",
          context.passages().size(),
          context.block().length(),
          versionId);
      meterRegistry.counter("retrieval.outcome", "status", "injected").increment();
      return RetrievalOutcome.injected(context);

    } catch (RuntimeException e) {
      log.warn("RetrievalDegraded: continuing without context: {}", e.getMessage());
      meterRegistry.counter("retrieval.degraded").increment();
      return RetrievalOutcome.degraded(e.getClass().getSimpleName() + ": " + e.getMessage());
    }
  }

  /** Header plus passages in score order, cut at {@code maxContextChars}. */
  InjectedContext compose(
      List<ScoredRecord> hits, long versionId, CompanionConfig.Retrieval settings) {
    int budget = settings.getMaxContextChars();
    StringBuilder block = new StringBuilder(settings.getContextHeader());
    List<ScoredRecord> used = new ArrayList<>(hits.size());

    for (ScoredRecord hit : hits) {
      int remaining = budget - block.length() - PASSAGE_SEPARATOR.length();
      if (remaining <= 0) {
        break;
      }
      String passage = format(hit.record());
      block.append(PASSAGE_SEPARATOR);
      if (passage.length() > remaining) {
        block.append(passage, 0, remaining);
        used.add(hit);
        break;
      }
      block.append(passage);
      used.add(hit);
    }
    return new InjectedContext(block.toString(), List.copyOf(used), versionId);
  }

  private static String format(EmbeddingRecord record) {
    String source = record.sourceFileName() == null ? record.documentId() : record.sourceFileName();
    return "[" + source + "] " + record.text().strip();
  }
}
