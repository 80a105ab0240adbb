package com.flamingo.ai.voicecompanion.api.rest;

import com.flamingo.ai.voicecompanion.api.dto.response.DocumentResponse;
import com.flamingo.ai.voicecompanion.api.dto.response.IngestionResponse;
import com.flamingo.ai.voicecompanion.service.ingestion.DocumentIngestionService;
import com.flamingo.ai.voicecompanion.service.ingestion.IngestionResult;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for document ingestion and management. */
@RestController
@RequestMapping("/api/documents")
@RequiredArgsConstructor
public class DocumentController {

  private final DocumentIngestionService documentIngestionService;

  /** Ingests one document into the knowledge store. */
  @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<IngestionResponse> uploadDocument(
      @RequestParam("file") MultipartFile file) {
    IngestionResult result = documentIngestionService.ingest(file);
    return ResponseEntity.status(HttpStatus.CREATED).body(IngestionResponse.fromResult(result));
  }

  /** Lists upload records, newest first. */
  @GetMapping
  public ResponseEntity<List<DocumentResponse>> listDocuments() {
    List<DocumentResponse> responses =
        documentIngestionService.listDocuments().stream()
            .map(DocumentResponse::fromEntity)
            .toList();
    return ResponseEntity.ok(responses);
  }

  /** Removes a document from the knowledge store and storage. */
  @DeleteMapping("/{documentId}")
  public ResponseEntity<Void> deleteDocument(@PathVariable String documentId) {
    documentIngestionService.deleteDocument(documentId);
    return ResponseEntity.noContent().build();
  }
}
