package com.flamingo.ai.voicecompanion.service.knowledge.embedding;

import com.flamingo.ai.voicecompanion.exception.EmbeddingUnavailableException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Boundary to the embedding upstream.
 *
 * <p>A batch either succeeds completely, in input order and with one consistent dimensionality, or
 * fails with {@link EmbeddingUnavailableException}. Partial batches are never returned.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // text-embedding-3-small accepts 8192 tokens; stay well below for dense scripts
  private static final int MAX_CHARS_PER_EMBEDDING = 5000;

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds a batch of passages.
   *
   * @param texts passages to embed
   * @return one vector per passage, same order as the input
   * @throws EmbeddingUnavailableException if the upstream fails or returns an unusable batch
   */
  @Timed(value = "embedding.embedAll", description = "Time to embed a batch of passages")
  @CircuitBreaker(name = "embedding", fallbackMethod = "embedAllFallback")
  @Retry(name = "embedding")
  public List<float[]> embedAll(List<String> texts) {
    if (texts.isEmpty()) {
      return List.of();
    }

    List<TextSegment> segments = new ArrayList<>(texts.size());
    for (int i = 0; i < texts.size(); i++) {
      segments.add(TextSegment.from(truncate(texts.get(i), i)));
    }

    log.debug("Calling embedding API for {} passages", segments.size());
    Response<List<Embedding>> response;
    try {
      response = embeddingModel.embedAll(segments);
    } catch (RuntimeException e) {
      throw new EmbeddingUnavailableException("Embedding upstream failed: " + e.getMessage(), e);
    }

    List<float[]> vectors = toVectors(response, texts.size());
    meterRegistry.counter("embedding.requests.success", "type", "batch").increment();
    return vectors;
  }

  /**
   * Embeds a single query utterance.
   *
   * @param query the query text
   * @return the query vector
   * @throws EmbeddingUnavailableException if the upstream fails
   */
  @Timed(value = "embedding.embedQuery", description = "Time to embed query")
  @CircuitBreaker(name = "embedding", fallbackMethod = "embedQueryFallback")
  @Retry(name = "embedding")
  public float[] embedQuery(String query) {
    Response<Embedding> response;
    try {
      response = embeddingModel.embed(truncate(query, 0));
    } catch (RuntimeException e) {
      throw new EmbeddingUnavailableException("Embedding upstream failed: " + e.getMessage(), e);
    }
    if (response == null || response.content() == null) {
      throw new EmbeddingUnavailableException("Embedding upstream returned no vector");
    }
    float[] vector = response.content().vector();
    if (vector == null || vector.length == 0) {
      throw new EmbeddingUnavailableException("Embedding upstream returned an empty vector");
    }
    meterRegistry.counter("embedding.requests.success", "type", "query").increment();
    return vector;
  }

  private List<float[]> toVectors(Response<List<Embedding>> response, int expected) {
    if (response == null || response.content() == null) {
      throw new EmbeddingUnavailableException("Embedding upstream returned no content");
    }
    List<Embedding> embeddings = response.content();
    if (embeddings.size() != expected) {
      throw new EmbeddingUnavailableException(
          String.format(
              "Embedding upstream returned %d vectors for %d inputs", embeddings.size(), expected));
    }

    List<float[]> vectors = new ArrayList<>(expected);
    int dimension = -1;
    for (Embedding embedding : embeddings) {
      float[] vector = embedding == null ? null : embedding.vector();
      if (vector == null || vector.length == 0) {
        throw new EmbeddingUnavailableException("Embedding upstream returned an empty vector");
      }
      if (dimension < 0) {
        dimension = vector.length;
      } else if (vector.length != dimension) {
        throw new EmbeddingUnavailableException(
            String.format(
                "Embedding upstream mixed dimensions within one batch (%d vs %d)",
                dimension, vector.length));
      }
      vectors.add(vector);
    }
    return vectors;
  }

  private String truncate(String text, int index) {
    if (text.length() <= MAX_CHARS_PER_EMBEDDING) {
      return text;
    }
    log.warn(
        "Text {} too long for embedding, truncating from {} chars to {} chars",
        index,
        text.length(),
        MAX_CHARS_PER_EMBEDDING);
    return text.substring(0, MAX_CHARS_PER_EMBEDDING);
  }

  @SuppressWarnings("unused")
  private List<float[]> embedAllFallback(List<String> texts, Throwable t) {
    log.error("Batch embedding of {} passages failed: {}", texts.size(), t.getMessage());
    meterRegistry.counter("embedding.requests.failure", "type", "batch").increment();
    throw asUnavailable(t);
  }

  @SuppressWarnings("unused")
  private float[] embedQueryFallback(String query, Throwable t) {
    log.error("Query embedding failed: {}", t.getMessage());
    meterRegistry.counter("embedding.requests.failure", "type", "query").increment();
    throw asUnavailable(t);
  }

  private EmbeddingUnavailableException asUnavailable(Throwable t) {
    if (t instanceof EmbeddingUnavailableException unavailable) {
      return unavailable;
    }
    return new EmbeddingUnavailableException("Embedding service unavailable: " + t.getMessage(), t);
  }
}
