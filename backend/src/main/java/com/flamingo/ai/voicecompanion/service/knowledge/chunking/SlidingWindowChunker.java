package com.flamingo.ai.voicecompanion.service.knowledge.chunking;

import com.flamingo.ai.voicecompanion.config.CompanionConfig;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Fixed-size character windows with a fixed overlap.
 *
 * <p>Chunk {@code k} spans {@code [k*(W-O), min(k*(W-O)+W, L))} and windowing stops as soon as a
 * chunk ends at {@code L}. Consecutive chunks therefore share exactly {@code O} characters (only
 * the last one may be shorter), and every character of the text is covered.
 */
@Component
@Slf4j
public class SlidingWindowChunker implements DocumentChunker {

  private final int windowSize;
  private final int overlap;

  @Autowired
  public SlidingWindowChunker(CompanionConfig config) {
    this(config.getChunking().getSize(), config.getChunking().getOverlap());
  }

  public SlidingWindowChunker(int windowSize, int overlap) {
    if (overlap < 0) {
      throw new IllegalArgumentException("Chunk overlap must be >= 0, was " + overlap);
    }
    if (windowSize <= overlap) {
      throw new IllegalArgumentException(
          String.format(
              "Chunk size must be greater than overlap (size=%d, overlap=%d)",
              windowSize, overlap));
    }
    this.windowSize = windowSize;
    this.overlap = overlap;
  }

  @Override
  public List<Chunk> chunk(String documentId, String text) {
    if (text == null || text.isEmpty()) {
      return List.of();
    }

    int length = text.length();
    int stride = windowSize - overlap;
    List<Chunk> chunks = new ArrayList<>(length / stride + 1);

    for (int k = 0; ; k++) {
      int start = k * stride;
      int end = Math.min(start + windowSize, length);
      chunks.add(new Chunk(documentId, k, text.substring(start, end), start, end));
      if (end == length) {
        break;
      }
    }

    log.debug(
        "Chunked document {} ({} chars) into {} windows (size={}, overlap={})",
        documentId,
        length,
        chunks.size(),
        windowSize,
        overlap);
    return chunks;
  }

  public int getWindowSize() {
    return windowSize;
  }

  public int getOverlap() {
    return overlap;
  }
}
