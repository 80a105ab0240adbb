package com.flamingo.ai.voicecompanion.service.knowledge.chunking;

import java.util.List;

/**
 * Splits normalized document text into {@link Chunk}s ready for embedding.
 *
 * <p>Implementations must be stateless, safe for concurrent use and deterministic: the same text
 * always yields the same chunk boundaries, which keeps re-ingestion idempotent.
 */
public interface DocumentChunker {

  /**
   * Produces chunks from normalized text.
   *
   * @param documentId stable id of the document the text belongs to
   * @param text normalized document text
   * @return ordered list of chunks, empty for empty text
   */
  List<Chunk> chunk(String documentId, String text);
}
