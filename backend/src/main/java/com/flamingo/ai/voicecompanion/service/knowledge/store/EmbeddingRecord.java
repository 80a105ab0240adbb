package com.flamingo.ai.voicecompanion.service.knowledge.store;

import com.flamingo.ai.voicecompanion.service.knowledge.chunking.Chunk;

/**
 * An embedded chunk as stored inside a knowledge store version.
 *
 * @param chunkId {@code documentId#sequence}
 * @param documentId stable id of the source document
 * @param sequence chunk position within the document
 * @param vector embedding of the chunk text; all records of one index share its length
 * @param text chunk text, kept for retrieval-time display
 * @param charStart inclusive start offset in the normalized document text
 * @param charEnd exclusive end offset in the normalized document text
 * @param sourceFileName file name the document was uploaded as
 */
public record EmbeddingRecord(
    String chunkId,
    String documentId,
    int sequence,
    float[] vector,
    String text,
    int charStart,
    int charEnd,
    String sourceFileName) {

  public static EmbeddingRecord of(Chunk chunk, float[] vector, String sourceFileName) {
    return new EmbeddingRecord(
        chunkId(chunk.documentId(), chunk.sequence()),
        chunk.documentId(),
        chunk.sequence(),
        vector,
        chunk.text(),
        chunk.charStart(),
        chunk.charEnd(),
        sourceFileName);
  }

  public static String chunkId(String documentId, int sequence) {
    return documentId + "#" + sequence;
  }

  public int dimension() {
    return vector == null ? 0 : vector.length;
  }
}
