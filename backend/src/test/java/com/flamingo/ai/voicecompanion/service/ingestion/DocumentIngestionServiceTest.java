package com.flamingo.ai.voicecompanion.service.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.voicecompanion.config.CompanionConfig;
import com.flamingo.ai.voicecompanion.domain.entity.Document;
import com.flamingo.ai.voicecompanion.domain.enums.DocumentStatus;
import com.flamingo.ai.voicecompanion.domain.repository.DocumentRepository;
import com.flamingo.ai.voicecompanion.exception.DocumentNotFoundException;
import com.flamingo.ai.voicecompanion.exception.EmbeddingUnavailableException;
import com.flamingo.ai.voicecompanion.exception.IngestionFailedException;
import com.flamingo.ai.voicecompanion.exception.UnsupportedFormatException;
import com.flamingo.ai.voicecompanion.service.knowledge.chunking.SlidingWindowChunker;
import com.flamingo.ai.voicecompanion.service.knowledge.embedding.EmbeddingService;
import com.flamingo.ai.voicecompanion.service.knowledge.store.InMemoryVectorIndexFactory;
import com.flamingo.ai.voicecompanion.service.knowledge.store.KnowledgeStoreManager;
import com.flamingo.ai.voicecompanion.service.knowledge.store.KnowledgeStoreRepository;
import com.flamingo.ai.voicecompanion.service.knowledge.store.KnowledgeStoreVersion;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;

@ExtendWith(MockitoExtension.class)
@DisplayName("DocumentIngestionService Tests")
class DocumentIngestionServiceTest {

  private static final String SALT_FAT_ACID =
      "Salt enhances flavor and should be added early to meat.\n"
          + "Fat carries flavor and creates texture in a dish.\n"
          + "Acid balances richness; a squeeze of lemon brightens a sauce.\n"
          + "Heat transforms food: roast vegetables hot to brown them.";

  private static final String BREAD =
      "Bread dough needs time to rise in a warm kitchen.\n"
          + "Knead until the dough is smooth and springs back.";

  @TempDir Path tempDir;

  @Mock private DocumentRepository documentRepository;
  @Mock private EmbeddingService embeddingService;

  private SimpleMeterRegistry meterRegistry;
  private KnowledgeStoreManager knowledgeStoreManager;
  private DocumentStorageService documentStorageService;
  private DocumentIngestionService ingestionService;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    knowledgeStoreManager =
        new KnowledgeStoreManager(
            new KnowledgeStoreRepository(tempDir.resolve("vectorstore"), new ObjectMapper()),
            new InMemoryVectorIndexFactory(),
            meterRegistry);
    knowledgeStoreManager.initialize();
    documentStorageService = new DocumentStorageService(tempDir.resolve("uploads"));

    ingestionService =
        new DocumentIngestionService(
            documentRepository,
            documentStorageService,
            new PdfTextExtractor(),
            new TextNormalizer(),
            new SlidingWindowChunker(120, 30),
            embeddingService,
            knowledgeStoreManager,
            new CompanionConfig(),
            meterRegistry);

    lenient()
        .when(documentRepository.save(any(Document.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));
    lenient()
        .when(embeddingService.embedAll(anyList()))
        .thenAnswer(invocation -> fakeVectors(invocation.getArgument(0)));
  }

  @Nested
  @DisplayName("Successful ingestion")
  class SuccessfulIngestion {

    @Test
    @DisplayName("Should chunk, embed and merge a PDF into a new version")
    void shouldIngestPdf() {
      long before = knowledgeStoreManager.currentVersion().getVersionId();

      IngestionResult result = ingestionService.ingest(pdfUpload("cooking.pdf", SALT_FAT_ACID));

      KnowledgeStoreVersion current = knowledgeStoreManager.currentVersion();
      assertThat(result.chunkCount()).isGreaterThan(1);
      assertThat(result.versionId()).isEqualTo(current.getVersionId()).isGreaterThan(before);
      assertThat(current.getRecordCount()).isEqualTo(result.chunkCount());
      assertThat(current.getDocumentIds()).containsExactly(result.document().getContentId());
      assertThat(result.document().getStatus()).isEqualTo(DocumentStatus.PROCESSED);
      assertThat(result.document().getChunkCount()).isEqualTo(result.chunkCount());
      assertThat(documentStorageService.exists(result.document().getContentId())).isTrue();
      assertThat(
              meterRegistry.counter("document.ingested", "outcome", "processed").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should keep the vector count when identical bytes are uploaded again")
    void shouldReplaceReuploadedDocument() {
      byte[] bytesA = PdfFixtures.pdf(SALT_FAT_ACID);
      byte[] bytesC = PdfFixtures.pdf(BREAD);

      IngestionResult first = ingestionService.ingest(pdfUpload("a.pdf", bytesA));
      int countAfterA = knowledgeStoreManager.currentVersion().getRecordCount();
      IngestionResult second = ingestionService.ingest(pdfUpload("a-copy.pdf", bytesA));
      int countAfterB = knowledgeStoreManager.currentVersion().getRecordCount();
      IngestionResult third = ingestionService.ingest(pdfUpload("bread.pdf", bytesC));

      assertThat(second.document().getContentId()).isEqualTo(first.document().getContentId());
      assertThat(countAfterB).isEqualTo(countAfterA);
      assertThat(knowledgeStoreManager.currentVersion().getRecordCount())
          .isEqualTo(countAfterA + third.chunkCount());
      assertThat(knowledgeStoreManager.currentVersion().getDocumentIds()).hasSize(2);
      verify(documentRepository, times(6)).save(any(Document.class));
    }

    @Test
    @DisplayName("Should accept a PDF with an upper-case extension")
    void shouldAcceptUpperCaseExtension() {
      IngestionResult result = ingestionService.ingest(pdfUpload("NOTES.PDF", SALT_FAT_ACID));

      assertThat(result.document().getFileName()).isEqualTo("NOTES.PDF");
    }
  }

  @Nested
  @DisplayName("Rejected uploads")
  class RejectedUploads {

    @Test
    @DisplayName("Should reject a non-PDF content type without creating a record")
    void shouldRejectNonPdfContentType() {
      MockMultipartFile upload =
          new MockMultipartFile(
              "file", "notes.txt", "text/plain", "salt fat acid".getBytes(StandardCharsets.UTF_8));

      assertThatThrownBy(() -> ingestionService.ingest(upload))
          .isInstanceOf(UnsupportedFormatException.class);

      verify(documentRepository, never()).save(any(Document.class));
      verifyNoInteractions(embeddingService);
      assertThat(knowledgeStoreManager.currentVersion().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should reject text bytes declared as PDF")
    void shouldRejectMislabeledContent() {
      MockMultipartFile upload =
          new MockMultipartFile(
              "file",
              "fake.pdf",
              "application/pdf",
              "just some plain text".getBytes(StandardCharsets.UTF_8));

      assertThatThrownBy(() -> ingestionService.ingest(upload))
          .isInstanceOf(UnsupportedFormatException.class);
      verify(documentRepository, never()).save(any(Document.class));
    }

    @Test
    @DisplayName("Should reject an empty upload")
    void shouldRejectEmptyUpload() {
      MockMultipartFile upload =
          new MockMultipartFile("file", "empty.pdf", "application/pdf", new byte[0]);

      assertThatThrownBy(() -> ingestionService.ingest(upload))
          .isInstanceOf(IngestionFailedException.class);
    }

    @Test
    @DisplayName("Should reject an oversized upload")
    void shouldRejectOversizedUpload() {
      CompanionConfig config = new CompanionConfig();
      config.getIngestion().setMaxFileSizeBytes(10);
      DocumentIngestionService strict =
          new DocumentIngestionService(
              documentRepository,
              documentStorageService,
              new PdfTextExtractor(),
              new TextNormalizer(),
              new SlidingWindowChunker(120, 30),
              embeddingService,
              knowledgeStoreManager,
              config,
              meterRegistry);

      assertThatThrownBy(() -> strict.ingest(pdfUpload("big.pdf", SALT_FAT_ACID)))
          .isInstanceOf(IngestionFailedException.class)
          .hasMessageContaining("too large");
    }
  }

  @Nested
  @DisplayName("Failed ingestion")
  class FailedIngestion {

    @Test
    @DisplayName("Should mark the record FAILED and keep the store for a PDF without text")
    void shouldFailForPdfWithoutText() {
      KnowledgeStoreVersion before = knowledgeStoreManager.currentVersion();

      assertThatThrownBy(() -> ingestionService.ingest(pdfUpload("scan.pdf", "")))
          .isInstanceOf(IngestionFailedException.class);

      assertThat(lastSavedDocument().getStatus()).isEqualTo(DocumentStatus.FAILED);
      assertThat(knowledgeStoreManager.currentVersion()).isSameAs(before);
      verifyNoInteractions(embeddingService);
      assertThat(meterRegistry.counter("document.ingested", "outcome", "failed").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should surface an embedding failure and leave the store unchanged")
    void shouldFailWhenEmbeddingUnavailable() {
      ingestionService.ingest(pdfUpload("a.pdf", SALT_FAT_ACID));
      KnowledgeStoreVersion before = knowledgeStoreManager.currentVersion();
      when(embeddingService.embedAll(anyList()))
          .thenThrow(new EmbeddingUnavailableException("upstream down"));

      assertThatThrownBy(() -> ingestionService.ingest(pdfUpload("bread.pdf", BREAD)))
          .isInstanceOf(EmbeddingUnavailableException.class);

      assertThat(lastSavedDocument().getStatus()).isEqualTo(DocumentStatus.FAILED);
      assertThat(lastSavedDocument().getProcessingError()).contains("upstream down");
      assertThat(knowledgeStoreManager.currentVersion()).isSameAs(before);
    }
  }

  @Nested
  @DisplayName("Deletion")
  class Deletion {

    @Test
    @DisplayName("Should remove a document's records, file and upload records")
    void shouldDeleteDocument() {
      IngestionResult a = ingestionService.ingest(pdfUpload("a.pdf", SALT_FAT_ACID));
      IngestionResult bread = ingestionService.ingest(pdfUpload("bread.pdf", BREAD));
      String contentId = a.document().getContentId();
      when(documentRepository.findByContentId(contentId)).thenReturn(List.of(a.document()));

      KnowledgeStoreVersion after = ingestionService.deleteDocument(contentId);

      assertThat(after.getDocumentIds()).containsExactly(bread.document().getContentId());
      assertThat(documentStorageService.exists(contentId)).isFalse();
      verify(documentRepository).deleteAll(List.of(a.document()));
    }

    @Test
    @DisplayName("Should throw DocumentNotFound for an unknown id")
    void shouldThrowForUnknownDocument() {
      when(documentRepository.findByContentId("missing")).thenReturn(List.of());

      assertThatThrownBy(() -> ingestionService.deleteDocument("missing"))
          .isInstanceOf(DocumentNotFoundException.class);
    }

    @Test
    @DisplayName("Should clear the store and every upload")
    void shouldClearAll() {
      IngestionResult a = ingestionService.ingest(pdfUpload("a.pdf", SALT_FAT_ACID));
      when(documentRepository.findAll()).thenReturn(List.of(a.document()));

      KnowledgeStoreVersion cleared = ingestionService.clearAll();

      assertThat(cleared.isEmpty()).isTrue();
      assertThat(documentStorageService.exists(a.document().getContentId())).isFalse();
      verify(documentRepository).deleteAll(List.of(a.document()));
    }
  }

  private Document lastSavedDocument() {
    ArgumentCaptor<Document> captor = ArgumentCaptor.forClass(Document.class);
    verify(documentRepository, atLeastOnce()).save(captor.capture());
    List<Document> saved = captor.getAllValues();
    return saved.get(saved.size() - 1);
  }

  private static MockMultipartFile pdfUpload(String fileName, String text) {
    return pdfUpload(fileName, PdfFixtures.pdf(text));
  }

  private static MockMultipartFile pdfUpload(String fileName, byte[] bytes) {
    return new MockMultipartFile("file", fileName, "application/pdf", bytes);
  }

  private static List<float[]> fakeVectors(List<String> texts) {
    List<float[]> vectors = new ArrayList<>(texts.size());
    for (String text : texts) {
      vectors.add(new float[] {1f, text.length() % 7 + 1f, Math.floorMod(text.hashCode(), 5)});
    }
    return vectors;
  }
}
