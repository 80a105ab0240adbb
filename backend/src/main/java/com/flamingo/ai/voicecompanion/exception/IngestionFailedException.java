package com.flamingo.ai.voicecompanion.exception;

/** Exception thrown when a document cannot be read, extracted or stored. */
public class IngestionFailedException extends RuntimeException {

  private final String userMessage;

  public IngestionFailedException(String message, String userMessage) {
    super(message);
    this.userMessage = userMessage;
  }

  public IngestionFailedException(String message, String userMessage, Throwable cause) {
    super(message, cause);
    this.userMessage = userMessage;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
