package com.flamingo.ai.voicecompanion.service.knowledge.store;

import java.util.List;

/**
 * Opaque similarity-search index backing one knowledge store version. Built once from a fixed set
 * of records and never modified afterwards, so concurrent searches need no coordination.
 */
public interface VectorIndex {

  /** Number of indexed records. */
  int size();

  /**
   * Returns up to {@code maxResults} hits in no particular order.
   *
   * @param query query vector, same dimensionality as the indexed records
   * @param maxResults maximum number of hits
   * @return hits with similarity scores
   */
  List<ScoredRecord> search(float[] query, int maxResults);

  /** Drops the index contents once no reader can reach it anymore. */
  void release();
}
