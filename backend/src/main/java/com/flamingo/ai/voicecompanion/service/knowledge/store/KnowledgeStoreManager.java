package com.flamingo.ai.voicecompanion.service.knowledge.store;

import com.flamingo.ai.voicecompanion.exception.IndexBuildFailedException;
import com.flamingo.ai.voicecompanion.exception.ReloadFailedException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Owns the versioned vector index.
 *
 * <p>Exactly one {@link KnowledgeStoreVersion} is current at any time. Readers lease a version for
 * the duration of a search; swapped-out versions stay in the version table until their last lease
 * is released and are reclaimed then. Writes ({@link #commit}) and reloads of the persisted store
 * are serialized by one lock, and concurrent reload requests collapse into a single reload whose
 * result every caller adopts.
 */
@Service
@Slf4j
public class KnowledgeStoreManager {

  private static final Comparator<EmbeddingRecord> STORAGE_ORDER =
      Comparator.comparing(EmbeddingRecord::documentId)
          .thenComparingInt(EmbeddingRecord::sequence);

  private final KnowledgeStoreRepository repository;
  private final VectorIndexFactory indexFactory;
  private final MeterRegistry meterRegistry;

  private final AtomicLong versionIds = new AtomicLong();
  private final Map<Long, KnowledgeStoreVersion> versions = new ConcurrentHashMap<>();
  private final AtomicReference<KnowledgeStoreVersion> current;
  private final ReentrantLock writeLock = new ReentrantLock();
  private final AtomicReference<CompletableFuture<KnowledgeStoreVersion>> inFlightReload =
      new AtomicReference<>();
  private final AtomicReference<ReloadFailedException> lastReloadFailure = new AtomicReference<>();

  public KnowledgeStoreManager(
      KnowledgeStoreRepository repository,
      VectorIndexFactory indexFactory,
      MeterRegistry meterRegistry) {
    this.repository = repository;
    this.indexFactory = indexFactory;
    this.meterRegistry = meterRegistry;
    KnowledgeStoreVersion initial = newVersion(List.of(), 0, StoreMarker.ABSENT, true);
    this.versions.put(initial.getVersionId(), initial);
    this.current = new AtomicReference<>(initial);
  }

  /**
   * Loads the persisted snapshot at startup. A missing snapshot leaves the store empty; an
   * unreadable one installs a placeholder reported as {@code unknown} until a reload succeeds.
   */
  @PostConstruct
  public void initialize() {
    try {
      Optional<KnowledgeStoreRepository.Snapshot> snapshot = repository.load();
      if (snapshot.isEmpty()) {
        log.info("No persisted knowledge store in {}, starting empty", repository.getDirectory());
        return;
      }
      KnowledgeStoreVersion loaded = fromSnapshot(snapshot.get());
      swap(loaded);
      log.info(
          "Loaded knowledge store: {} records from {} documents",
          loaded.getRecordCount(),
          loaded.getDocumentIds().size());
    } catch (IOException | RuntimeException e) {
      log.error("Persisted knowledge store is unreadable, serving an unknown placeholder", e);
      swap(newVersion(List.of(), 0, StoreMarker.ABSENT, false));
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Version construction
  // ---------------------------------------------------------------------------------------------

  /**
   * Builds a fresh, unpublished version from scratch.
   *
   * @throws IndexBuildFailedException if the records do not share one vector dimension
   */
  public KnowledgeStoreVersion build(List<EmbeddingRecord> records) {
    List<EmbeddingRecord> deduplicated = deduplicate(records);
    int dimension = requireUniformDimension(deduplicated, 0);
    return newVersion(deduplicated, dimension, StoreMarker.ABSENT, true);
  }

  /**
   * Combines an existing version with newly embedded records into a new, unpublished version.
   * Every document present in {@code records} replaces all of its previous records; other documents
   * are carried over without re-embedding.
   *
   * @throws IndexBuildFailedException if the new records' dimension differs from a non-empty index
   */
  public KnowledgeStoreVersion merge(
      KnowledgeStoreVersion existing, List<EmbeddingRecord> records) {
    Set<String> replacedDocuments = new HashSet<>();
    for (EmbeddingRecord record : records) {
      replacedDocuments.add(record.documentId());
    }

    List<EmbeddingRecord> merged = new ArrayList<>(existing.getRecordCount() + records.size());
    for (EmbeddingRecord record : existing.getRecords()) {
      if (!replacedDocuments.contains(record.documentId())) {
        merged.add(record);
      }
    }
    merged.addAll(deduplicate(records));

    // The dimension holds while the index has records, even when every record is replaced
    int dimension = requireUniformDimension(merged, existing.getDimension());
    log.debug(
        "Merged {} new records into version {}: {} -> {} records",
        records.size(),
        existing.getVersionId(),
        existing.getRecordCount(),
        merged.size());
    return newVersion(merged, dimension, existing.getSourceMarker(), true);
  }

  /** New, unpublished version without the given document's records. */
  public KnowledgeStoreVersion remove(KnowledgeStoreVersion existing, String documentId) {
    List<EmbeddingRecord> kept = new ArrayList<>(existing.getRecordCount());
    for (EmbeddingRecord record : existing.getRecords()) {
      if (!record.documentId().equals(documentId)) {
        kept.add(record);
      }
    }
    int dimension = kept.isEmpty() ? 0 : existing.getDimension();
    return newVersion(kept, dimension, existing.getSourceMarker(), true);
  }

  // ---------------------------------------------------------------------------------------------
  // Publication and reads
  // ---------------------------------------------------------------------------------------------

  /** Atomically makes {@code next} the current version and retires the previous one. */
  public void swap(KnowledgeStoreVersion next) {
    versions.put(next.getVersionId(), next);
    KnowledgeStoreVersion previous = current.getAndSet(next);
    if (previous != next) {
      retire(previous);
      log.info(
          "Knowledge store version {} -> {} ({} records)",
          previous.getVersionId(),
          next.getVersionId(),
          next.getRecordCount());
    }
  }

  /** The current version. Never blocks. */
  public KnowledgeStoreVersion currentVersion() {
    return current.get();
  }

  /** Leases the current version. The version is not reclaimed until the lease is closed. */
  public VersionLease acquire() {
    while (true) {
      KnowledgeStoreVersion version = current.get();
      if (version.tryLease()) {
        return new VersionLease(version, this);
      }
      // Reclaimed between read and lease; the pointer has moved on
    }
  }

  /**
   * Similarity search over the current version.
   *
   * @return hits by descending score, ties by (documentId, sequence); empty for an empty store
   */
  public List<ScoredRecord> search(float[] query, int k) {
    try (VersionLease lease = acquire()) {
      return lease.version().search(query, k);
    }
  }

  /**
   * Whether the persisted store differs from what {@code lastObserved} was built from. An
   * unreadable marker counts as stale.
   */
  public boolean isStale(KnowledgeStoreVersion lastObserved) {
    try {
      return !repository.readMarker().equals(lastObserved.getSourceMarker());
    } catch (IOException | RuntimeException e) {
      log.debug("Could not read knowledge store marker, assuming stale: {}", e.getMessage());
      return true;
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Reload
  // ---------------------------------------------------------------------------------------------

  /** Reloads when the persisted store changed; otherwise returns the current version. */
  public KnowledgeStoreVersion reloadIfStale() {
    KnowledgeStoreVersion serving = current.get();
    if (!isStale(serving)) {
      return serving;
    }
    return reload();
  }

  /**
   * Rebuilds the current version from the persisted store. At most one reload runs at a time;
   * concurrent callers wait for it and receive its result. A failed reload keeps the current
   * version serving and is reported through {@link #getLastReloadFailure()}.
   */
  public KnowledgeStoreVersion reload() {
    CompletableFuture<KnowledgeStoreVersion> mine = new CompletableFuture<>();
    CompletableFuture<KnowledgeStoreVersion> winner = inFlightReload.compareAndExchange(null, mine);
    if (winner != null) {
      log.debug("Reload already in flight, adopting its result");
      return winner.join();
    }

    try {
      KnowledgeStoreVersion result;
      writeLock.lock();
      try {
        result = reloadLocked();
      } finally {
        writeLock.unlock();
      }
      mine.complete(result);
      return result;
    } catch (RuntimeException e) {
      mine.completeExceptionally(e);
      throw e;
    } finally {
      inFlightReload.compareAndSet(mine, null);
    }
  }

  private KnowledgeStoreVersion reloadLocked() {
    KnowledgeStoreVersion serving = current.get();
    if (!isStale(serving)) {
      return serving;
    }
    try {
      KnowledgeStoreVersion next =
          repository
              .load()
              .map(this::fromSnapshot)
              .orElseGet(() -> newVersion(List.of(), 0, StoreMarker.ABSENT, true));
      swap(next);
      lastReloadFailure.set(null);
      meterRegistry.counter("knowledge.reload.success").increment();
      return next;
    } catch (IOException | RuntimeException e) {
      ReloadFailedException failure =
          new ReloadFailedException("Reload of the persisted knowledge store failed", e);
      lastReloadFailure.set(failure);
      meterRegistry.counter("knowledge.reload.failure").increment();
      log.warn(
          "{}, keeping version {}: {}",
          failure.getMessage(),
          serving.getVersionId(),
          e.getMessage());
      return serving;
    }
  }

  /** The failure of the most recent reload attempt, or {@code null} if it succeeded. */
  public ReloadFailedException getLastReloadFailure() {
    return lastReloadFailure.get();
  }

  // ---------------------------------------------------------------------------------------------
  // Write path
  // ---------------------------------------------------------------------------------------------

  /**
   * Applies {@code update} to the current version, persists the result and swaps it in. Writers
   * are serialized with each other and with reloads; a stale current version is reloaded first so
   * no persisted update is overwritten. An update returning its input unchanged writes nothing.
   *
   * @throws IndexBuildFailedException if the update fails, the persisted store is unreadable, or
   *     the new snapshot cannot be written
   */
  @Timed(value = "knowledge.commit", description = "Time to persist and publish a version")
  public KnowledgeStoreVersion commit(UnaryOperator<KnowledgeStoreVersion> update) {
    return commit(update, true);
  }

  /** Drops one document's records. Returns the current version unchanged if it has none. */
  public KnowledgeStoreVersion removeDocument(String documentId) {
    return commit(
        existing ->
            existing.containsDocument(documentId) ? remove(existing, documentId) : existing);
  }

  /** Replaces the store with an empty version. Also recovers from an unreadable snapshot. */
  public KnowledgeStoreVersion clear() {
    return commit(existing -> build(List.of()), false);
  }

  private KnowledgeStoreVersion commit(
      UnaryOperator<KnowledgeStoreVersion> update, boolean requireLoaded) {
    writeLock.lock();
    try {
      KnowledgeStoreVersion base = current.get();
      if (isStale(base)) {
        base = reloadLocked();
      }
      if (requireLoaded && !base.isLoaded()) {
        throw new IndexBuildFailedException(
            "Persisted knowledge store is unreadable; refusing to overwrite it");
      }

      KnowledgeStoreVersion next = update.apply(base);
      if (next == base) {
        return base;
      }

      StoreMarker marker;
      try {
        marker = repository.write(next);
      } catch (IOException e) {
        throw new IndexBuildFailedException(
            "Could not persist knowledge store: " + e.getMessage(), e);
      }
      KnowledgeStoreVersion published = next.persistedAs(marker);
      swap(published);
      return published;
    } finally {
      writeLock.unlock();
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Reclamation
  // ---------------------------------------------------------------------------------------------

  void release(KnowledgeStoreVersion version) {
    if (version.releaseLease() == 0 && current.get() != version) {
      retire(version);
    }
  }

  private void retire(KnowledgeStoreVersion version) {
    if (version.tryReclaim()) {
      versions.remove(version.getVersionId());
      log.debug("Reclaimed knowledge store version {}", version.getVersionId());
    }
  }

  /** Versions still held in the version table: the current one plus any still leased. */
  public int retainedVersionCount() {
    return versions.size();
  }

  // ---------------------------------------------------------------------------------------------

  private KnowledgeStoreVersion fromSnapshot(KnowledgeStoreRepository.Snapshot snapshot) {
    List<EmbeddingRecord> records = snapshot.records();
    int dimension = requireUniformDimension(records, records.isEmpty() ? 0 : snapshot.dimension());
    return newVersion(records, dimension, snapshot.marker(), true);
  }

  private KnowledgeStoreVersion newVersion(
      List<EmbeddingRecord> records, int dimension, StoreMarker marker, boolean loaded) {
    List<EmbeddingRecord> ordered = new ArrayList<>(records);
    ordered.sort(STORAGE_ORDER);
    return new KnowledgeStoreVersion(
        versionIds.incrementAndGet(),
        ordered,
        dimension,
        Instant.now(),
        marker,
        loaded,
        indexFactory.create(ordered));
  }

  /** Last record wins for a repeated (documentId, sequence). */
  private static List<EmbeddingRecord> deduplicate(List<EmbeddingRecord> records) {
    Map<String, EmbeddingRecord> byChunkId = new LinkedHashMap<>();
    for (EmbeddingRecord record : records) {
      byChunkId.put(EmbeddingRecord.chunkId(record.documentId(), record.sequence()), record);
    }
    return new ArrayList<>(byChunkId.values());
  }

  private static int requireUniformDimension(List<EmbeddingRecord> records, int expected) {
    int dimension = expected;
    for (EmbeddingRecord record : records) {
      int recordDimension = record.dimension();
      if (recordDimension == 0) {
        throw new IndexBuildFailedException("Record " + record.chunkId() + " has no vector");
      }
      if (dimension == 0) {
        dimension = recordDimension;
      } else if (recordDimension != dimension) {
        throw new IndexBuildFailedException(
            String.format(
                "Record %s has dimension %d but the index uses %d",
                record.chunkId(), recordDimension, dimension));
      }
    }
    return dimension;
  }
}
