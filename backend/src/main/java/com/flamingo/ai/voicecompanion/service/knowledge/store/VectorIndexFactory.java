package com.flamingo.ai.voicecompanion.service.knowledge.store;

import java.util.List;

/** Creates the {@link VectorIndex} for a new knowledge store version. */
public interface VectorIndexFactory {

  VectorIndex create(List<EmbeddingRecord> records);
}
