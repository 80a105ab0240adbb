package com.flamingo.ai.voicecompanion.service.knowledge.store;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import java.util.ArrayList;
import java.util.List;

/** {@link VectorIndex} over LangChain4j's exact (brute-force cosine) in-memory store. */
public class InMemoryVectorIndex implements VectorIndex {

  private final InMemoryEmbeddingStore<EmbeddingRecord> store = new InMemoryEmbeddingStore<>();
  private final int size;

  public InMemoryVectorIndex(List<EmbeddingRecord> records) {
    for (EmbeddingRecord record : records) {
      store.add(record.chunkId(), Embedding.from(record.vector()), record);
    }
    this.size = records.size();
  }

  @Override
  public int size() {
    return size;
  }

  @Override
  public List<ScoredRecord> search(float[] query, int maxResults) {
    if (size == 0 || maxResults <= 0) {
      return List.of();
    }
    EmbeddingSearchRequest request =
        EmbeddingSearchRequest.builder()
            .queryEmbedding(Embedding.from(query))
            .maxResults(maxResults)
            .minScore(0.0)
            .build();

    List<EmbeddingMatch<EmbeddingRecord>> matches = store.search(request).matches();
    List<ScoredRecord> hits = new ArrayList<>(matches.size());
    for (EmbeddingMatch<EmbeddingRecord> match : matches) {
      hits.add(new ScoredRecord(match.embedded(), match.score()));
    }
    return hits;
  }

  @Override
  public void release() {
    store.removeAll();
  }
}
