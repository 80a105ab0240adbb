package com.flamingo.ai.voicecompanion.service.knowledge.store;

import java.util.List;
import org.springframework.stereotype.Component;

/** Default index factory. */
@Component
public class InMemoryVectorIndexFactory implements VectorIndexFactory {

  @Override
  public VectorIndex create(List<EmbeddingRecord> records) {
    return new InMemoryVectorIndex(records);
  }
}
