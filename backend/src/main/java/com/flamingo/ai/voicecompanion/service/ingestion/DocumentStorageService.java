package com.flamingo.ai.voicecompanion.service.ingestion;

import com.flamingo.ai.voicecompanion.config.CompanionConfig;
import com.flamingo.ai.voicecompanion.exception.IngestionFailedException;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/** Stores raw uploads under a stable, content-derived id so they can be re-processed later. */
@Service
@Slf4j
public class DocumentStorageService {

  private static final String EXTENSION = ".pdf";
  private static final int CONTENT_ID_HEX_CHARS = 32;

  private final Path uploadDirectory;

  @Autowired
  public DocumentStorageService(CompanionConfig config) {
    this(Path.of(config.getStorage().getBasePath(), "uploads"));
  }

  public DocumentStorageService(Path uploadDirectory) {
    this.uploadDirectory = uploadDirectory;
  }

  /** Stable document id: a prefix of the SHA-256 of the raw bytes. */
  public String contentId(byte[] bytes) {
    try {
      byte[] digest = MessageDigest.getInstance("SHA-256").digest(bytes);
      return HexFormat.of().formatHex(digest).substring(0, CONTENT_ID_HEX_CHARS);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  /**
   * Writes the raw bytes to {@code {contentId}.pdf}, replacing an identical earlier upload.
   *
   * @return path of the stored file
   * @throws IngestionFailedException if the file cannot be written
   */
  public Path store(String contentId, byte[] bytes) {
    Path target = pathFor(contentId);
    try {
      Files.createDirectories(uploadDirectory);
      Path temp = Files.createTempFile(uploadDirectory, contentId, ".tmp");
      try {
        Files.write(temp, bytes);
        try {
          Files.move(
              temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
          Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
      } finally {
        Files.deleteIfExists(temp);
      }
    } catch (IOException e) {
      throw new IngestionFailedException(
          "Failed to store upload " + contentId + ": " + e.getMessage(),
          "The document could not be saved",
          e);
    }
    log.debug("Stored {} bytes as {}", bytes.length, target);
    return target;
  }

  /** Deletes the stored file; returns whether one existed. */
  public boolean delete(String contentId) {
    try {
      return Files.deleteIfExists(pathFor(contentId));
    } catch (IOException e) {
      log.warn("Failed to delete stored upload {}: {}", contentId, e.getMessage());
      return false;
    }
  }

  public boolean exists(String contentId) {
    return Files.exists(pathFor(contentId));
  }

  Path pathFor(String contentId) {
    return uploadDirectory.resolve(contentId + EXTENSION);
  }
}
