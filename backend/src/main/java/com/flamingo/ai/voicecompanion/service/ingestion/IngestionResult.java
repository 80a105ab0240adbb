package com.flamingo.ai.voicecompanion.service.ingestion;

import com.flamingo.ai.voicecompanion.domain.entity.Document;

/**
 * Outcome of a successful ingestion.
 *
 * @param document the processed upload record
 * @param chunkCount chunks merged into the knowledge store
 * @param versionId knowledge store version that now serves the document
 */
public record IngestionResult(Document document, int chunkCount, long versionId) {}
