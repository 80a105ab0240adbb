package com.flamingo.ai.voicecompanion.service.knowledge.store;

import java.util.Comparator;

/**
 * A search hit.
 *
 * @param record the matched record
 * @param score similarity, higher is closer
 */
public record ScoredRecord(EmbeddingRecord record, double score) {

  /** Descending score, ties by (documentId, sequence) ascending. */
  public static final Comparator<ScoredRecord> RANKING =
      Comparator.comparingDouble(ScoredRecord::score)
          .reversed()
          .thenComparing(hit -> hit.record().documentId())
          .thenComparingInt(hit -> hit.record().sequence());
}
