package com.flamingo.ai.voicecompanion.exception;

/**
 * Exception describing a failed reload of the persisted knowledge store. Reported and logged; the
 * serving version stays in place.
 */
public class ReloadFailedException extends RuntimeException {

  public ReloadFailedException(String message, Throwable cause) {
    super(message, cause);
  }
}
