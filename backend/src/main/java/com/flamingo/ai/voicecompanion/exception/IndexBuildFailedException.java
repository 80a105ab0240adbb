package com.flamingo.ai.voicecompanion.exception;

/** Exception thrown when a knowledge store version cannot be built or merged. */
public class IndexBuildFailedException extends RuntimeException {

  public IndexBuildFailedException(String message) {
    super(message);
  }

  public IndexBuildFailedException(String message, Throwable cause) {
    super(message, cause);
  }

  public String getUserMessage() {
    return "The knowledge base could not be updated with this document";
  }
}
