package com.flamingo.ai.voicecompanion.service.knowledge.chunking;

/**
 * A window of document text, the unit of embedding and retrieval. Only persisted inside an
 * embedding record.
 *
 * @param documentId stable id of the owning document (non-owning back-reference)
 * @param sequence 0-based position of this chunk within the document
 * @param text the covered text, {@code fullText.substring(charStart, charEnd)}
 * @param charStart inclusive start offset in the normalized document text
 * @param charEnd exclusive end offset in the normalized document text
 */
public record Chunk(String documentId, int sequence, String text, int charStart, int charEnd) {

  public int length() {
    return charEnd - charStart;
  }
}
