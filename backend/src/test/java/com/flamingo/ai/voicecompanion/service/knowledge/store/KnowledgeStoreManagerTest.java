package com.flamingo.ai.voicecompanion.service.knowledge.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.voicecompanion.exception.IndexBuildFailedException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("KnowledgeStoreManager Tests")
class KnowledgeStoreManagerTest {

  @TempDir Path tempDir;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private SimpleMeterRegistry meterRegistry;
  private KnowledgeStoreRepository repository;
  private KnowledgeStoreManager manager;
  private ExecutorService executor;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    repository = new KnowledgeStoreRepository(tempDir.resolve("vectorstore"), objectMapper);
    manager = newManager(repository);
    executor = Executors.newFixedThreadPool(8);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Nested
  @DisplayName("Search")
  class Search {

    @Test
    @DisplayName("Should return an empty list for an empty store")
    void shouldReturnEmptyListForEmptyStore() {
      assertThat(manager.currentVersion().isEmpty()).isTrue();
      assertThat(manager.search(new float[] {1f, 0f}, 3)).isEmpty();
    }

    @Test
    @DisplayName("Should return an empty list for k <= 0")
    void shouldReturnEmptyListForNonPositiveK() {
      manager.commit(v -> manager.build(List.of(recordOf("a", 0, 1f, 0f))));

      assertThat(manager.search(new float[] {1f, 0f}, 0)).isEmpty();
    }

    @Test
    @DisplayName("Should order hits by descending score")
    void shouldOrderByScore() {
      manager.commit(
          v ->
              manager.build(
                  List.of(
                      recordOf("far", 0, 0f, 1f),
                      recordOf("near", 0, 1f, 0.1f),
                      recordOf("mid", 0, 1f, 1f))));

      List<ScoredRecord> hits = manager.search(new float[] {1f, 0f}, 3);

      assertThat(hits)
          .extracting(hit -> hit.record().documentId())
          .containsExactly("near", "mid", "far");
      assertThat(hits.get(0).score()).isGreaterThan(hits.get(1).score());
    }

    @Test
    @DisplayName("Should break score ties by document id, then sequence")
    void shouldBreakTiesDeterministically() {
      manager.commit(
          v ->
              manager.build(
                  List.of(
                      recordOf("b", 0, 1f, 1f),
                      recordOf("a", 1, 1f, 1f),
                      recordOf("a", 0, 1f, 1f),
                      recordOf("c", 0, 1f, 1f))));

      List<ScoredRecord> hits = manager.search(new float[] {1f, 1f}, 3);

      assertThat(hits)
          .extracting(hit -> hit.record().chunkId())
          .containsExactly("a#0", "a#1", "b#0");
    }

    @Test
    @DisplayName("Should reject a query of the wrong dimension")
    void shouldRejectWrongQueryDimension() {
      manager.commit(v -> manager.build(List.of(recordOf("a", 0, 1f, 0f))));

      assertThatThrownBy(() -> manager.search(new float[] {1f, 0f, 0f}, 3))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Nested
  @DisplayName("Build and merge")
  class BuildAndMerge {

    @Test
    @DisplayName("Should produce a new version and leave the input untouched")
    void shouldNotMutateExistingVersion() {
      KnowledgeStoreVersion first = manager.build(List.of(recordOf("a", 0, 1f, 0f)));

      KnowledgeStoreVersion merged = manager.merge(first, List.of(recordOf("b", 0, 0f, 1f)));

      assertThat(first.getRecordCount()).isEqualTo(1);
      assertThat(merged.getRecordCount()).isEqualTo(2);
      assertThat(merged.getVersionId()).isGreaterThan(first.getVersionId());
    }

    @Test
    @DisplayName("Should replace all records of a re-ingested document")
    void shouldReplaceDocumentAsUnit() {
      KnowledgeStoreVersion existing =
          manager.build(
              List.of(
                  recordOf("a", 0, 1f, 0f),
                  recordOf("a", 1, 1f, 0f),
                  recordOf("a", 2, 1f, 0f),
                  recordOf("b", 0, 0f, 1f)));

      KnowledgeStoreVersion merged =
          manager.merge(
              existing, List.of(recordOf("a", 0, 0.5f, 0.5f), recordOf("a", 1, 0.5f, 0.5f)));

      assertThat(merged.getRecordCount()).isEqualTo(3);
      assertThat(merged.getRecords())
          .extracting(EmbeddingRecord::chunkId)
          .containsExactly("a#0", "a#1", "b#0");
    }

    @Test
    @DisplayName("Should keep the record count when merging the same document again")
    void shouldBeIdempotentForUnchangedDocument() {
      List<EmbeddingRecord> documentA = List.of(recordOf("a", 0, 1f, 0f), recordOf("a", 1, 0f, 1f));
      KnowledgeStoreVersion once = manager.merge(manager.build(List.of()), documentA);

      KnowledgeStoreVersion twice = manager.merge(once, documentA);

      assertThat(twice.getRecordCount()).isEqualTo(once.getRecordCount());
    }

    @Test
    @DisplayName("Should fail with IndexBuildFailed on mixed dimensions in one build")
    void shouldRejectMixedDimensionsInBuild() {
      assertThatThrownBy(
              () -> manager.build(List.of(recordOf("a", 0, 1f, 0f), recordOf("b", 0, 1f, 0f, 0f))))
          .isInstanceOf(IndexBuildFailedException.class)
          .hasMessageContaining("dimension");
    }

    @Test
    @DisplayName("Should fail a commit on dimension mismatch and keep serving the old version")
    void shouldKeepServingOnMergeFailure() {
      KnowledgeStoreVersion serving =
          manager.commit(v -> manager.merge(v, List.of(recordOf("a", 0, 1f, 0f))));

      assertThatThrownBy(
              () -> manager.commit(v -> manager.merge(v, List.of(recordOf("b", 0, 1f, 0f, 0f)))))
          .isInstanceOf(IndexBuildFailedException.class);

      assertThat(manager.currentVersion()).isSameAs(serving);
      assertThat(manager.isStale(serving)).isFalse();
    }

    @Test
    @DisplayName("Should keep the dimension when the only document is replaced")
    void shouldRejectNewDimensionWhenReplacingOnlyDocument() {
      KnowledgeStoreVersion serving =
          manager.commit(v -> manager.merge(v, List.of(recordOf("a", 0, 1f, 0f))));

      assertThatThrownBy(
              () -> manager.commit(v -> manager.merge(v, List.of(recordOf("a", 0, 1f, 0f, 0f)))))
          .isInstanceOf(IndexBuildFailedException.class)
          .hasMessageContaining("dimension");

      assertThat(manager.currentVersion()).isSameAs(serving);
      assertThat(manager.currentVersion().getDimension()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should accept a new dimension once the index has been emptied")
    void shouldAllowNewDimensionAfterIndexEmptied() {
      manager.commit(v -> manager.merge(v, List.of(recordOf("a", 0, 1f, 0f))));
      manager.clear();

      KnowledgeStoreVersion rebuilt =
          manager.commit(v -> manager.merge(v, List.of(recordOf("b", 0, 1f, 0f, 0f))));

      assertThat(rebuilt.getDimension()).isEqualTo(3);
    }
  }

  @Nested
  @DisplayName("Commit and persistence")
  class CommitAndPersistence {

    @Test
    @DisplayName("Should persist a committed version and load it at startup")
    void shouldPersistAndReload() {
      KnowledgeStoreVersion committed =
          manager.commit(
              v -> manager.merge(v, List.of(recordOf("a", 0, 1f, 0f), recordOf("b", 0, 0f, 1f))));

      KnowledgeStoreManager restarted = newManager(repository);

      assertThat(restarted.currentVersion().getRecordCount()).isEqualTo(2);
      assertThat(restarted.currentVersion().getDocumentIds()).containsExactly("a", "b");
      assertThat(restarted.currentVersion().getSourceMarker())
          .isEqualTo(committed.getSourceMarker());
      assertThat(restarted.isStale(restarted.currentVersion())).isFalse();
    }

    @Test
    @DisplayName("Should remove one document and keep the others")
    void shouldRemoveDocument() {
      manager.commit(
          v -> manager.merge(v, List.of(recordOf("a", 0, 1f, 0f), recordOf("b", 0, 0f, 1f))));

      KnowledgeStoreVersion after = manager.removeDocument("a");

      assertThat(after.getDocumentIds()).containsExactly("b");
      assertThat(newManager(repository).currentVersion().getDocumentIds()).containsExactly("b");
    }

    @Test
    @DisplayName("Should not write anything when removing an unknown document")
    void shouldSkipWriteForUnknownDocument() throws IOException {
      KnowledgeStoreVersion serving =
          manager.commit(v -> manager.merge(v, List.of(recordOf("a", 0, 1f, 0f))));
      StoreMarker before = repository.readMarker();

      KnowledgeStoreVersion after = manager.removeDocument("missing");

      assertThat(after).isSameAs(serving);
      assertThat(repository.readMarker()).isEqualTo(before);
    }

    @Test
    @DisplayName("Should clear the store")
    void shouldClear() {
      manager.commit(v -> manager.merge(v, List.of(recordOf("a", 0, 1f, 0f))));

      KnowledgeStoreVersion cleared = manager.clear();

      assertThat(cleared.isEmpty()).isTrue();
      assertThat(newManager(repository).currentVersion().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should catch up with a foreign write before committing")
    void shouldReloadBeforeCommitWhenStale() {
      KnowledgeStoreManager other = newManager(repository);
      other.commit(v -> other.merge(v, List.of(recordOf("x", 0, 1f, 0f))));

      KnowledgeStoreVersion committed =
          manager.commit(v -> manager.merge(v, List.of(recordOf("y", 0, 0f, 1f))));

      assertThat(committed.getDocumentIds()).containsExactly("x", "y");
    }
  }

  @Nested
  @DisplayName("Staleness and reload")
  class StalenessAndReload {

    @Test
    @DisplayName("Should detect a write made by another manager")
    void shouldDetectForeignWrite() {
      KnowledgeStoreVersion observed = manager.currentVersion();
      assertThat(manager.isStale(observed)).isFalse();

      KnowledgeStoreManager writer = newManager(repository);
      writer.commit(v -> writer.merge(v, List.of(recordOf("a", 0, 1f, 0f))));

      assertThat(manager.isStale(observed)).isTrue();
      KnowledgeStoreVersion reloaded = manager.reloadIfStale();
      assertThat(reloaded.getDocumentIds()).containsExactly("a");
      assertThat(manager.isStale(reloaded)).isFalse();
    }

    @Test
    @DisplayName("Should report stale when the marker cannot be read")
    void shouldReportStaleOnUnreadableMarker() throws IOException {
      manager.commit(v -> manager.merge(v, List.of(recordOf("a", 0, 1f, 0f))));
      Files.writeString(
          repository.getDirectory().resolve(KnowledgeStoreRepository.MANIFEST_FILE), "{broken");

      assertThat(manager.isStale(manager.currentVersion())).isTrue();
    }

    @Test
    @DisplayName("Should keep the current version when a reload fails")
    void shouldKeepVersionOnReloadFailure() throws IOException {
      KnowledgeStoreVersion serving =
          manager.commit(v -> manager.merge(v, List.of(recordOf("a", 0, 1f, 0f))));
      KnowledgeStoreManager writer = newManager(repository);
      writer.commit(v -> writer.merge(v, List.of(recordOf("b", 0, 0f, 1f))));
      Files.writeString(
          repository.getDirectory().resolve(KnowledgeStoreRepository.INDEX_FILE), "not json");

      KnowledgeStoreVersion result = manager.reloadIfStale();

      assertThat(result).isSameAs(serving);
      assertThat(manager.currentVersion()).isSameAs(serving);
      assertThat(manager.getLastReloadFailure()).isNotNull();
      assertThat(manager.search(new float[] {1f, 0f}, 3)).hasSize(1);
      assertThat(meterRegistry.counter("knowledge.reload.failure").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should collapse concurrent reloads into a single load")
    void shouldSingleFlightConcurrentReloads() throws Exception {
      CountDownLatch loadStarted = new CountDownLatch(1);
      CountDownLatch releaseLoad = new CountDownLatch(1);
      AtomicInteger loads = new AtomicInteger();
      AtomicBoolean blocking = new AtomicBoolean(false);
      KnowledgeStoreRepository slowRepository =
          new KnowledgeStoreRepository(repository.getDirectory(), objectMapper) {
            @Override
            public Optional<Snapshot> load() throws IOException {
              if (blocking.get()) {
                loads.incrementAndGet();
                loadStarted.countDown();
                try {
                  releaseLoad.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                  Thread.currentThread().interrupt();
                }
              }
              return super.load();
            }
          };
      KnowledgeStoreManager reader = newManager(slowRepository);
      KnowledgeStoreManager writer = newManager(repository);
      writer.commit(v -> writer.merge(v, List.of(recordOf("a", 0, 1f, 0f))));
      blocking.set(true);

      List<Future<KnowledgeStoreVersion>> results = new ArrayList<>();
      for (int i = 0; i < 6; i++) {
        results.add(executor.submit(reader::reloadIfStale));
      }
      assertThat(loadStarted.await(5, TimeUnit.SECONDS)).isTrue();
      releaseLoad.countDown();

      Set<Long> versionIds = ConcurrentHashMap.newKeySet();
      for (Future<KnowledgeStoreVersion> result : results) {
        versionIds.add(result.get(5, TimeUnit.SECONDS).getVersionId());
      }
      assertThat(loads.get()).isEqualTo(1);
      assertThat(versionIds).containsExactly(reader.currentVersion().getVersionId());
      assertThat(reader.currentVersion().getDocumentIds()).containsExactly("a");
    }
  }

  @Nested
  @DisplayName("Startup")
  class Startup {

    @Test
    @DisplayName("Should serve an unknown placeholder for an unreadable snapshot")
    void shouldServePlaceholderForCorruptSnapshot() throws IOException {
      manager.commit(v -> manager.merge(v, List.of(recordOf("a", 0, 1f, 0f))));
      Files.writeString(
          repository.getDirectory().resolve(KnowledgeStoreRepository.INDEX_FILE), "[]");

      KnowledgeStoreManager restarted = newManager(repository);

      assertThat(restarted.currentVersion().isLoaded()).isFalse();
      assertThat(restarted.search(new float[] {1f, 0f}, 3)).isEmpty();
      assertThatThrownBy(
              () -> restarted.commit(v -> restarted.merge(v, List.of(recordOf("b", 0, 1f, 0f)))))
          .isInstanceOf(IndexBuildFailedException.class);

      KnowledgeStoreVersion cleared = restarted.clear();
      assertThat(cleared.isLoaded()).isTrue();
      assertThat(cleared.isEmpty()).isTrue();
    }
  }

  @Nested
  @DisplayName("Version lifecycle")
  class VersionLifecycle {

    @Test
    @DisplayName("Should retain a swapped-out version until its last lease closes")
    void shouldReclaimOnlyAfterLastLease() {
      manager.commit(v -> manager.merge(v, List.of(recordOf("a", 0, 1f, 0f))));
      VersionLease lease = manager.acquire();
      KnowledgeStoreVersion leased = lease.version();

      manager.commit(v -> manager.merge(v, List.of(recordOf("b", 0, 0f, 1f))));

      assertThat(manager.currentVersion()).isNotSameAs(leased);
      assertThat(leased.isReclaimed()).isFalse();
      assertThat(manager.retainedVersionCount()).isEqualTo(2);
      assertThat(leased.search(new float[] {1f, 0f}, 5)).hasSize(1);

      lease.close();

      assertThat(leased.isReclaimed()).isTrue();
      assertThat(manager.retainedVersionCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reclaim an unleased version on swap")
    void shouldReclaimUnleasedVersionOnSwap() {
      KnowledgeStoreVersion first = manager.currentVersion();

      manager.commit(v -> manager.merge(v, List.of(recordOf("a", 0, 1f, 0f))));

      assertThat(first.isReclaimed()).isTrue();
      assertThat(manager.retainedVersionCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should ignore a second close of the same lease")
    void shouldIgnoreDoubleClose() {
      VersionLease lease = manager.acquire();
      lease.close();
      lease.close();

      assertThat(manager.currentVersion().isReclaimed()).isFalse();
      assertThat(manager.currentVersion().activeReaders()).isZero();
    }

    @Test
    @DisplayName("Should give concurrent readers a complete version while merges swap")
    void shouldServeConsistentVersionsUnderConcurrentMerges() throws Exception {
      manager.commit(v -> manager.merge(v, List.of(recordOf("seed", 0, 1f, 1f))));
      AtomicBoolean writing = new AtomicBoolean(true);
      AtomicInteger inconsistent = new AtomicInteger();
      AtomicInteger searches = new AtomicInteger();

      List<Future<?>> readers = new ArrayList<>();
      for (int r = 0; r < 4; r++) {
        readers.add(
            executor.submit(
                () -> {
                  while (writing.get() || searches.get() < 50) {
                    try (VersionLease lease = manager.acquire()) {
                      KnowledgeStoreVersion version = lease.version();
                      List<ScoredRecord> hits = version.search(new float[] {1f, 1f}, 10_000);
                      Set<String> hitDocuments = ConcurrentHashMap.newKeySet();
                      hits.forEach(hit -> hitDocuments.add(hit.record().documentId()));
                      if (hits.size() != version.getRecordCount()
                          || !hitDocuments.equals(version.getDocumentIds())) {
                        inconsistent.incrementAndGet();
                      }
                    }
                    searches.incrementAndGet();
                  }
                }));
      }

      for (int d = 0; d < 20; d++) {
        String documentId = "doc-" + d;
        manager.commit(
            v ->
                manager.merge(
                    v,
                    List.of(
                        recordOf(documentId, 0, 1f, 0.5f),
                        recordOf(documentId, 1, 0.5f, 1f),
                        recordOf(documentId, 2, 1f, 1f))));
      }
      writing.set(false);
      for (Future<?> reader : readers) {
        reader.get(30, TimeUnit.SECONDS);
      }

      assertThat(inconsistent.get()).isZero();
      assertThat(manager.currentVersion().getRecordCount()).isEqualTo(61);
      assertThat(manager.retainedVersionCount()).isEqualTo(1);
    }
  }

  private KnowledgeStoreManager newManager(KnowledgeStoreRepository repo) {
    KnowledgeStoreManager created =
        new KnowledgeStoreManager(repo, new InMemoryVectorIndexFactory(), meterRegistry);
    created.initialize();
    return created;
  }

  private static EmbeddingRecord recordOf(String documentId, int sequence, float... vector) {
    return new EmbeddingRecord(
        EmbeddingRecord.chunkId(documentId, sequence),
        documentId,
        sequence,
        vector,
        "text of " + documentId + " chunk " + sequence,
        sequence * 10,
        sequence * 10 + 10,
        documentId + ".pdf");
  }
}
