package com.flamingo.ai.voicecompanion.service.transcript;

/** Recognition source an utterance event came from. */
public enum UtteranceSource {
  /** The client-local recognizer (the user's own speech). */
  LOCAL,
  /** The room-level transcription stream. */
  REMOTE
}
