package com.flamingo.ai.voicecompanion.service.ingestion;

import com.flamingo.ai.voicecompanion.config.CompanionConfig;
import com.flamingo.ai.voicecompanion.domain.entity.Document;
import com.flamingo.ai.voicecompanion.domain.repository.DocumentRepository;
import com.flamingo.ai.voicecompanion.exception.DocumentNotFoundException;
import com.flamingo.ai.voicecompanion.exception.IngestionFailedException;
import com.flamingo.ai.voicecompanion.exception.UnsupportedFormatException;
import com.flamingo.ai.voicecompanion.service.knowledge.chunking.Chunk;
import com.flamingo.ai.voicecompanion.service.knowledge.chunking.DocumentChunker;
import com.flamingo.ai.voicecompanion.service.knowledge.embedding.EmbeddingService;
import com.flamingo.ai.voicecompanion.service.knowledge.store.EmbeddingRecord;
import com.flamingo.ai.voicecompanion.service.knowledge.store.KnowledgeStoreManager;
import com.flamingo.ai.voicecompanion.service.knowledge.store.KnowledgeStoreVersion;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

/**
 * Write path of the knowledge layer: validate, extract, normalize, chunk, embed, merge.
 *
 * <p>Every accepted upload gets a {@link Document} record. Failures after validation leave that
 * record in status FAILED and never touch the serving knowledge store version.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentIngestionService {

  static final String PDF_MIME_TYPE = "application/pdf";

  private static final Tika TIKA = new Tika();

  private final DocumentRepository documentRepository;
  private final DocumentStorageService documentStorageService;
  private final PdfTextExtractor pdfTextExtractor;
  private final TextNormalizer textNormalizer;
  private final DocumentChunker documentChunker;
  private final EmbeddingService embeddingService;
  private final KnowledgeStoreManager knowledgeStoreManager;
  private final CompanionConfig companionConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Ingests one uploaded document.
   *
   * @throws UnsupportedFormatException if the upload is not a PDF
   * @throws IngestionFailedException if the upload is empty, too large, corrupt or has no text
   * @throws com.flamingo.ai.voicecompanion.exception.EmbeddingUnavailableException if embedding
   *     fails
   * @throws com.flamingo.ai.voicecompanion.exception.IndexBuildFailedException if the knowledge
   *     store cannot be updated
   */
  @Timed(value = "document.ingest", description = "Time to ingest a document")
  public IngestionResult ingest(MultipartFile file) {
    String fileName = file.getOriginalFilename();
    log.info("Ingesting document {} ({} bytes)", fileName, file.getSize());

    byte[] bytes = validate(file);
    String contentId = documentStorageService.contentId(bytes);

    Document document =
        documentRepository.save(
            Document.builder()
                .contentId(contentId)
                .fileName(fileName == null ? contentId + ".pdf" : fileName)
                .mimeType(PDF_MIME_TYPE)
                .fileSize((long) bytes.length)
                .build());

    try {
      String text = textNormalizer.normalizePages(pdfTextExtractor.extractPages(bytes));
      if (text.isBlank()) {
        throw new IngestionFailedException(
            "No extractable text in " + fileName, "The document contains no readable text");
      }
      documentStorageService.store(contentId, bytes);

      List<Chunk> chunks = documentChunker.chunk(contentId, text);
      List<String> texts = new ArrayList<>(chunks.size());
      for (Chunk chunk : chunks) {
        texts.add(chunk.text());
      }
      List<float[]> vectors = embeddingService.embedAll(texts);

      List<EmbeddingRecord> records = new ArrayList<>(chunks.size());
      for (int i = 0; i < chunks.size(); i++) {
        records.add(EmbeddingRecord.of(chunks.get(i), vectors.get(i), document.getFileName()));
      }

      KnowledgeStoreVersion version =
          knowledgeStoreManager.commit(
              existing -> knowledgeStoreManager.merge(existing, records));

      document.markProcessed(chunks.size());
      Document saved = documentRepository.save(document);
      meterRegistry.counter("document.ingested", "outcome", "processed").increment();
      log.info(
          "Document {} ingested as {}: {} chunks, knowledge store version {}",
          fileName,
          contentId,
          chunks.size(),
          version.getVersionId());
      return new IngestionResult(saved, chunks.size(), version.getVersionId());

    } catch (RuntimeException e) {
      log.error("Ingestion of {} failed: {}", fileName, e.getMessage());
      document.markFailed(e.getMessage());
      documentRepository.save(document);
      meterRegistry.counter("document.ingested", "outcome", "failed").increment();
      throw e;
    }
  }

  /** All upload records, newest first. */
  public List<Document> listDocuments() {
    return documentRepository.findAllByOrderByUploadedAtDesc();
  }

  /**
   * Removes a stored document: its knowledge store records, its raw file and its upload records.
   *
   * @param contentId the document id used by the knowledge store
   * @throws DocumentNotFoundException if no upload carries that id
   */
  @Timed(value = "document.delete", description = "Time to delete a document")
  public KnowledgeStoreVersion deleteDocument(String contentId) {
    List<Document> uploads = documentRepository.findByContentId(contentId);
    if (uploads.isEmpty()) {
      throw new DocumentNotFoundException(contentId);
    }

    KnowledgeStoreVersion version = knowledgeStoreManager.removeDocument(contentId);
    documentStorageService.delete(contentId);
    documentRepository.deleteAll(uploads);
    meterRegistry.counter("document.deleted").increment();

    log.info("Deleted document {} ({} upload records)", contentId, uploads.size());
    return version;
  }

  /** Empties the knowledge store and forgets every upload. */
  public KnowledgeStoreVersion clearAll() {
    KnowledgeStoreVersion version = knowledgeStoreManager.clear();
    List<Document> uploads = documentRepository.findAll();
    for (Document upload : uploads) {
      documentStorageService.delete(upload.getContentId());
    }
    documentRepository.deleteAll(uploads);
    log.info("Cleared knowledge store and {} upload records", uploads.size());
    return version;
  }

  private byte[] validate(MultipartFile file) {
    String fileName = file.getOriginalFilename();
    if (file.isEmpty()) {
      throw new IngestionFailedException("File is empty", "Please upload a non-empty document");
    }

    long maxSize = companionConfig.getIngestion().getMaxFileSizeBytes();
    if (file.getSize() > maxSize) {
      throw new IngestionFailedException(
          "File too large: " + file.getSize(),
          String.format("Maximum file size is %d MB", maxSize / (1024 * 1024)));
    }

    String declaredType = file.getContentType();
    if (declaredType == null || !PDF_MIME_TYPE.equalsIgnoreCase(declaredType)) {
      throw new UnsupportedFormatException(declaredType, fileName);
    }
    if (fileName != null && !fileName.toLowerCase(Locale.ROOT).endsWith(".pdf")) {
      throw new UnsupportedFormatException(declaredType, fileName);
    }

    byte[] bytes;
    try {
      bytes = file.getBytes();
    } catch (IOException e) {
      throw new IngestionFailedException(
          "Failed to read upload: " + e.getMessage(), "The upload could not be read", e);
    }

    String detectedType = TIKA.detect(bytes);
    if (!PDF_MIME_TYPE.equals(detectedType)) {
      log.warn("Upload {} declared as PDF but detected as {}", fileName, detectedType);
      throw new UnsupportedFormatException(detectedType, fileName);
    }
    return bytes;
  }
}
