package com.flamingo.ai.voicecompanion.exception;

import java.util.UUID;

/** Exception thrown when a conversation session is unknown or has already ended. */
public class SessionNotFoundException extends RuntimeException {

  private final UUID sessionId;

  public SessionNotFoundException(UUID sessionId) {
    super("Conversation session not found: " + sessionId);
    this.sessionId = sessionId;
  }

  public UUID getSessionId() {
    return sessionId;
  }
}
