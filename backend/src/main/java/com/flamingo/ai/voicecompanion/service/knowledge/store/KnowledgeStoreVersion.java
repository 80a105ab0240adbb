package com.flamingo.ai.voicecompanion.service.knowledge.store;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Immutable snapshot of the vector index. Builds always produce a new version; an existing version
 * is never changed after construction, so a reader holding one sees a complete, consistent index.
 *
 * <p>The only mutable state is the reader count used for reclamation. A count of {@code -1} means
 * the version has been reclaimed and can no longer be leased.
 */
public final class KnowledgeStoreVersion {

  private static final int RECLAIMED = -1;

  private final long versionId;
  private final List<EmbeddingRecord> records;
  private final int dimension;
  private final Instant createdAt;
  private final StoreMarker sourceMarker;
  private final boolean loaded;
  private final VectorIndex index;
  private final AtomicInteger readers;

  KnowledgeStoreVersion(
      long versionId,
      List<EmbeddingRecord> records,
      int dimension,
      Instant createdAt,
      StoreMarker sourceMarker,
      boolean loaded,
      VectorIndex index) {
    this(
        versionId,
        records,
        dimension,
        createdAt,
        sourceMarker,
        loaded,
        index,
        new AtomicInteger(0));
  }

  private KnowledgeStoreVersion(
      long versionId,
      List<EmbeddingRecord> records,
      int dimension,
      Instant createdAt,
      StoreMarker sourceMarker,
      boolean loaded,
      VectorIndex index,
      AtomicInteger readers) {
    this.versionId = versionId;
    this.records = List.copyOf(records);
    this.dimension = dimension;
    this.createdAt = createdAt;
    this.sourceMarker = sourceMarker;
    this.loaded = loaded;
    this.index = index;
    this.readers = readers;
  }

  /** Same content and id, tagged with its persisted marker. Only valid before publication. */
  KnowledgeStoreVersion persistedAs(StoreMarker marker) {
    return new KnowledgeStoreVersion(
        versionId, records, dimension, createdAt, marker, loaded, index, readers);
  }

  public long getVersionId() {
    return versionId;
  }

  public List<EmbeddingRecord> getRecords() {
    return records;
  }

  public int getRecordCount() {
    return records.size();
  }

  /** Vector dimensionality, 0 for an empty version. */
  public int getDimension() {
    return dimension;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public StoreMarker getSourceMarker() {
    return sourceMarker;
  }

  /** {@code false} only for the placeholder served while the persisted store could not be read. */
  public boolean isLoaded() {
    return loaded;
  }

  public boolean isEmpty() {
    return records.isEmpty();
  }

  /** Distinct document ids, sorted. */
  public Set<String> getDocumentIds() {
    Set<String> ids = new TreeSet<>();
    for (EmbeddingRecord record : records) {
      ids.add(record.documentId());
    }
    return ids;
  }

  public boolean containsDocument(String documentId) {
    for (EmbeddingRecord record : records) {
      if (record.documentId().equals(documentId)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Similarity search over this version only.
   *
   * @param query query vector
   * @param k maximum number of hits
   * @return hits by descending score, ties by (documentId, sequence) ascending
   */
  public List<ScoredRecord> search(float[] query, int k) {
    if (k <= 0 || records.isEmpty()) {
      return List.of();
    }
    if (query.length != dimension) {
      throw new IllegalArgumentException(
          String.format(
              "Query dimension %d does not match index dimension %d", query.length, dimension));
    }
    // Rank every record so ties at the k-th place resolve deterministically
    return index.search(query, records.size()).stream()
        .sorted(ScoredRecord.RANKING)
        .limit(k)
        .toList();
  }

  boolean tryLease() {
    while (true) {
      int current = readers.get();
      if (current == RECLAIMED) {
        return false;
      }
      if (readers.compareAndSet(current, current + 1)) {
        return true;
      }
    }
  }

  /** Returns the remaining reader count. */
  int releaseLease() {
    return readers.decrementAndGet();
  }

  boolean tryReclaim() {
    if (readers.compareAndSet(0, RECLAIMED)) {
      index.release();
      return true;
    }
    return false;
  }

  public boolean isReclaimed() {
    return readers.get() == RECLAIMED;
  }

  int activeReaders() {
    return Math.max(readers.get(), 0);
  }

  @Override
  public String toString() {
    return "KnowledgeStoreVersion{id="
        + versionId
        + ", records="
        + records.size()
        + ", dimension="
        + dimension
        + ", marker="
        + sourceMarker
        + '}';
  }
}
