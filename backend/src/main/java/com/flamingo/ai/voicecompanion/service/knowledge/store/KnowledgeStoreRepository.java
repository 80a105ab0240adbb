package com.flamingo.ai.voicecompanion.service.knowledge.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.voicecompanion.config.CompanionConfig;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

/**
 * File-backed persistence of the knowledge store.
 *
 * <p>Layout under {@code {basePath}/vectorstore}: {@code index.json} holds the records, {@code
 * manifest.json} the generation and counts. Both are replaced via temp file and atomic move, index
 * first, so a manifest never points at a newer index than the one on disk. The index carries its
 * own generation; a mismatch with the manifest is reported as an unreadable snapshot.
 */
@Repository
@Slf4j
public class KnowledgeStoreRepository {

  static final String INDEX_FILE = "index.json";
  static final String MANIFEST_FILE = "manifest.json";

  private final Path directory;
  private final ObjectMapper objectMapper;

  @Autowired
  public KnowledgeStoreRepository(CompanionConfig config, ObjectMapper objectMapper) {
    this(Path.of(config.getStorage().getBasePath(), "vectorstore"), objectMapper);
  }

  public KnowledgeStoreRepository(Path directory, ObjectMapper objectMapper) {
    this.directory = directory;
    this.objectMapper = objectMapper;
  }

  /** Manifest as written next to the index. */
  public record Manifest(long generation, int dimension, int recordCount, long writtenAtMillis) {}

  /** Serialized form of {@code index.json}. */
  public record IndexFile(long generation, int dimension, List<EmbeddingRecord> records) {}

  /** A snapshot read back from disk, tagged with the marker it was read under. */
  public record Snapshot(StoreMarker marker, int dimension, List<EmbeddingRecord> records) {}

  /**
   * Reads the current modification marker. Only the small manifest is parsed.
   *
   * @return the marker, {@link StoreMarker#ABSENT} when nothing was persisted yet
   * @throws IOException if the manifest exists but cannot be read
   */
  public StoreMarker readMarker() throws IOException {
    Path manifestPath = directory.resolve(MANIFEST_FILE);
    if (!Files.exists(manifestPath)) {
      return StoreMarker.ABSENT;
    }
    Manifest manifest = objectMapper.readValue(manifestPath.toFile(), Manifest.class);
    return new StoreMarker(
        manifest.generation(), Files.getLastModifiedTime(manifestPath).toMillis());
  }

  /**
   * Loads the persisted snapshot.
   *
   * @return the snapshot, empty when nothing was persisted yet
   * @throws IOException if the files are unreadable or inconsistent
   */
  public Optional<Snapshot> load() throws IOException {
    StoreMarker marker = readMarker();
    if (marker.equals(StoreMarker.ABSENT)) {
      return Optional.empty();
    }
    IndexFile index =
        objectMapper.readValue(directory.resolve(INDEX_FILE).toFile(), IndexFile.class);
    if (index.generation() != marker.generation()) {
      throw new IOException(
          String.format(
              "Index generation %d does not match manifest generation %d",
              index.generation(), marker.generation()));
    }
    List<EmbeddingRecord> records = index.records() == null ? List.of() : index.records();
    log.debug(
        "Loaded knowledge store snapshot generation {} ({} records)",
        marker.generation(),
        records.size());
    return Optional.of(new Snapshot(marker, index.dimension(), records));
  }

  /**
   * Persists a version under the next generation.
   *
   * @param version version to persist
   * @return marker of the written snapshot
   * @throws IOException on any write failure; the previous snapshot stays in place
   */
  public StoreMarker write(KnowledgeStoreVersion version) throws IOException {
    Files.createDirectories(directory);
    long generation =
        Math.max(readMarker().generation(), version.getSourceMarker().generation()) + 1;

    IndexFile index = new IndexFile(generation, version.getDimension(), version.getRecords());
    Manifest manifest =
        new Manifest(
            generation,
            version.getDimension(),
            version.getRecordCount(),
            System.currentTimeMillis());

    replace(INDEX_FILE, objectMapper.writeValueAsBytes(index));
    replace(MANIFEST_FILE, objectMapper.writeValueAsBytes(manifest));

    log.info(
        "Persisted knowledge store generation {} ({} records, dimension {})",
        generation,
        version.getRecordCount(),
        version.getDimension());
    return readMarker();
  }

  public Path getDirectory() {
    return directory;
  }

  private void replace(String fileName, byte[] content) throws IOException {
    Path target = directory.resolve(fileName);
    Path temp = Files.createTempFile(directory, fileName, ".tmp");
    try {
      Files.write(temp, content);
      try {
        Files.move(
            temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(temp);
    }
  }
}
