package com.flamingo.ai.voicecompanion.exception;

/** Exception thrown when the embedding upstream fails; no partial batch is ever returned. */
public class EmbeddingUnavailableException extends RuntimeException {

  public EmbeddingUnavailableException(String message) {
    super(message);
  }

  public EmbeddingUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }

  public String getUserMessage() {
    return "Embedding service is temporarily unavailable. Please try again later.";
  }
}
