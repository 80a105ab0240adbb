package com.flamingo.ai.voicecompanion.domain.repository;

import com.flamingo.ai.voicecompanion.domain.entity.Document;
import com.flamingo.ai.voicecompanion.domain.enums.DocumentStatus;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Document upload records. */
@Repository
public interface DocumentRepository extends JpaRepository<Document, UUID> {

  /** Finds all upload records, newest first. */
  List<Document> findAllByOrderByUploadedAtDesc();

  /** Finds every upload record of one stored document. */
  List<Document> findByContentId(String contentId);

  /** Counts upload records by status. */
  long countByStatus(DocumentStatus status);
}
